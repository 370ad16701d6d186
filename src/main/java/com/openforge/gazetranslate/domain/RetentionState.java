package com.openforge.gazetranslate.domain;

import com.openforge.gazetranslate.retention.RetentionRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/** Column mapping of {@link RetentionRecord}. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Embeddable
public class RetentionState {

    @Column(name = "initial_strength", nullable = false)
    private double initialStrength;

    @Column(name = "current_strength", nullable = false)
    private double currentStrength;

    @Column(name = "last_reinforced_at", nullable = false)
    private Instant lastReinforcedAt;

    /** Null once the fragment is mastered. */
    @Column(name = "next_due_at")
    private Instant nextDueAt;

    @Column(name = "reinforce_count", nullable = false)
    private int reinforceCount;

    @Column(name = "successful_reinforce_count", nullable = false)
    private int successfulReinforceCount;

    @Column(name = "difficulty_level", nullable = false)
    private double difficultyLevel;

    public static RetentionState from(RetentionRecord record) {
        return new RetentionState(
                record.initialStrength(),
                record.currentStrength(),
                record.lastReinforcedAt(),
                record.nextDueAt(),
                record.reinforceCount(),
                record.successfulReinforceCount(),
                record.difficultyLevel());
    }

    public RetentionRecord toRecord() {
        return new RetentionRecord(initialStrength, currentStrength, lastReinforcedAt, nextDueAt,
                reinforceCount, successfulReinforceCount, difficultyLevel);
    }
}
