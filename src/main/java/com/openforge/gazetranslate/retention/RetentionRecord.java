package com.openforge.gazetranslate.retention;

import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Memory state of one fragment. Immutable; {@link RetentionModel#reinforce}
 * returns a new record.
 *
 * @param initialStrength          strength the fragment started with
 * @param currentStrength          0..1, drives the decay rate
 * @param lastReinforcedAt         decay is measured from here (creation counts as the first exposure)
 * @param nextDueAt                next scheduled review; {@code null} once mastered
 * @param reinforceCount           all reinforcements
 * @param successfulReinforceCount successful reinforcements, never above {@code reinforceCount}
 * @param difficultyLevel          1..5 in half steps, 3 is the calibration midpoint
 */
public record RetentionRecord(
        double  initialStrength,
        double  currentStrength,
        Instant lastReinforcedAt,
        @Nullable Instant nextDueAt,
        int     reinforceCount,
        int     successfulReinforceCount,
        double  difficultyLevel
) {

    public RetentionRecord {
        if (currentStrength < 0.0 || currentStrength > 1.0) {
            throw new IllegalArgumentException("currentStrength out of [0,1]: " + currentStrength);
        }
        if (successfulReinforceCount < 0 || reinforceCount < successfulReinforceCount) {
            throw new IllegalArgumentException("Invalid reinforce counters: %d total, %d successful"
                    .formatted(reinforceCount, successfulReinforceCount));
        }
    }

    /** Copy without a scheduled review, used when a fragment becomes terminal. */
    public RetentionRecord unscheduled() {
        return new RetentionRecord(initialStrength, currentStrength, lastReinforcedAt, null,
                reinforceCount, successfulReinforceCount, difficultyLevel);
    }

    public RetentionRecord withCurrentStrength(double strength) {
        return new RetentionRecord(initialStrength, strength, lastReinforcedAt, nextDueAt,
                reinforceCount, successfulReinforceCount, difficultyLevel);
    }

    public double successRate() {
        return (double) successfulReinforceCount / Math.max(reinforceCount, 1);
    }
}
