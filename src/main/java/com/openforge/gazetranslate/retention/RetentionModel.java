package com.openforge.gazetranslate.retention;

import com.openforge.gazetranslate.error.ValidationException;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Exponential forgetting curve with spaced-repetition scheduling.
 *
 * Every method is a pure function of its arguments and the configured
 * {@link RetentionProperties}; callers pass {@code now} explicitly.
 *
 *   R(h) = exp(-h / S)
 *   S    = 24 * 0.8^(difficulty - 3) / (strength * (1 + 0.2n / (1 + 0.1n)))
 *
 * where h is hours since the last reinforcement and n the reinforcement count.
 */
@Component
@EnableConfigurationProperties(RetentionProperties.class)
public class RetentionModel {

    private static final double MS_PER_HOUR = 3_600_000.0;
    private static final double[] DIFFICULTY_MULTIPLIERS = {2.0, 1.5, 1.0, 0.7, 0.5};

    private static final double MIN_DIFFICULTY = 1.0;
    private static final double MAX_DIFFICULTY = 5.0;
    private static final double DIFFICULTY_STEP = 0.5;

    private static final double SUCCESS_GROWTH = 1.3;
    private static final double FAILURE_DECAY = 0.8;
    private static final double MIN_STRENGTH = 0.1;

    private final RetentionProperties props;

    public RetentionModel(RetentionProperties props) {
        this.props = props;
    }

    // ── Curve ────────────────────────────────────────────────────────────────

    /**
     * Probability (0..1) that the fragment is still remembered.
     *
     * @param elapsedMs       time since the last reinforcement; negative values (clock skew) count as zero
     * @param initialStrength memory strength, (0..1]
     * @param reinforceCount  reinforcements so far
     * @param difficultyLevel 1..5
     */
    public double computeRetention(long elapsedMs,
                                   double initialStrength,
                                   int reinforceCount,
                                   double difficultyLevel) {
        if (!(initialStrength > 0.0) || initialStrength > 1.0) {
            throw new ValidationException("Strength must be within (0,1], got " + initialStrength);
        }
        if (reinforceCount < 0) {
            throw new ValidationException("reinforceCount must not be negative, got " + reinforceCount);
        }
        requireDifficulty(difficultyLevel);

        double hours = Math.max(0L, elapsedMs) / MS_PER_HOUR;
        double baseForgettingRate = props.baseForgettingHours() * Math.pow(0.8, difficultyLevel - 3);
        double reinforceBonus = 1 + (0.2 * reinforceCount) / (1 + 0.1 * reinforceCount);
        double adjustedRate = baseForgettingRate / (initialStrength * reinforceBonus);

        double probability = Math.exp(-hours / adjustedRate);
        return Math.max(0.0, Math.min(1.0, probability));
    }

    public boolean isRemembered(double probability) {
        return probability > props.rememberThreshold();
    }

    /** Retention of a stored record at {@code now}. */
    public double retentionAt(RetentionRecord record, Instant now) {
        return computeRetention(
                Duration.between(record.lastReinforcedAt(), now).toMillis(),
                record.currentStrength(),
                record.reinforceCount(),
                record.difficultyLevel());
    }

    public RetentionSnapshot evaluate(RetentionRecord record, Instant now) {
        long elapsed = Math.max(0L, Duration.between(record.lastReinforcedAt(), now).toMillis());
        double probability = retentionAt(record, now);
        return new RetentionSnapshot(elapsed, probability, isRemembered(probability), record.nextDueAt());
    }

    // ── Scheduling ───────────────────────────────────────────────────────────

    /**
     * Milliseconds until the next review. The table step follows the
     * reinforcement count, shifted one step back for struggling users and
     * one step forward for near-perfect ones, then scaled by difficulty.
     */
    public long nextReviewInterval(int reinforceCount, int successfulReinforceCount, double difficultyLevel) {
        requireDifficulty(difficultyLevel);

        int index = Math.min(reinforceCount, ReviewInterval.lastIndex());
        double successRate = (double) successfulReinforceCount / Math.max(reinforceCount, 1);
        if (successRate < props.lowSuccessRate()) {
            index = Math.max(0, index - 1);
        } else if (successRate > props.highSuccessRate()) {
            index = Math.min(ReviewInterval.lastIndex(), index + 1);
        }

        long baseMs = ReviewInterval.at(index).duration().toMillis();
        return Math.round(baseMs * difficultyMultiplier(difficultyLevel));
    }

    /** Record for a fragment seen for the first time at {@code now}. */
    public RetentionRecord initialRecord(@Nullable Double difficultyLevel, Instant now) {
        double difficulty = difficultyLevel != null ? difficultyLevel : props.defaultDifficulty();
        requireDifficulty(difficulty);
        long firstInterval = nextReviewInterval(0, 0, difficulty);
        return new RetentionRecord(1.0, 1.0, now, now.plusMillis(firstInterval), 0, 0, difficulty);
    }

    /**
     * Applies one review outcome.
     *
     * @param responseTimeMs     optional; nudges difficulty when no explicit value is given
     * @param explicitDifficulty optional user rating, 1..5
     */
    public RetentionRecord reinforce(RetentionRecord record,
                                     boolean wasSuccessful,
                                     @Nullable Long responseTimeMs,
                                     @Nullable Double explicitDifficulty,
                                     Instant now) {
        double strength = wasSuccessful
                ? Math.min(1.0, record.currentStrength() * SUCCESS_GROWTH)
                : Math.max(MIN_STRENGTH, record.currentStrength() * FAILURE_DECAY);

        double difficulty = record.difficultyLevel();
        if (explicitDifficulty != null) {
            requireDifficulty(explicitDifficulty);
            difficulty = explicitDifficulty;
        } else if (responseTimeMs != null) {
            if (responseTimeMs > props.slowResponseMs()) {
                difficulty = Math.min(MAX_DIFFICULTY, difficulty + DIFFICULTY_STEP);
            } else if (responseTimeMs < props.fastResponseMs()) {
                difficulty = Math.max(MIN_DIFFICULTY, difficulty - DIFFICULTY_STEP);
            }
        }

        int reinforceCount = record.reinforceCount() + 1;
        int successful = record.successfulReinforceCount() + (wasSuccessful ? 1 : 0);
        long interval = nextReviewInterval(reinforceCount, successful, difficulty);

        return new RetentionRecord(
                record.initialStrength(),
                strength,
                now,
                now.plusMillis(interval),
                reinforceCount,
                successful,
                difficulty);
    }

    /** True when a record has stayed strong across enough reviews to stop scheduling it. */
    public boolean qualifiesForMastery(RetentionRecord record) {
        return record.successfulReinforceCount() >= props.masteryMinSuccessfulReviews()
                && record.successRate() > props.highSuccessRate()
                && record.currentStrength() >= props.masteryMinStrength();
    }

    // ── Forecast ─────────────────────────────────────────────────────────────

    /** Retention expected {@code futureDays} from {@code now} without further reinforcement. */
    public List<RetentionForecast> predictRetention(RetentionRecord record, List<Integer> futureDays, Instant now) {
        List<RetentionForecast> forecasts = new ArrayList<>(futureDays.size());
        for (Integer day : futureDays) {
            if (day == null || day < 0) {
                throw new ValidationException("Forecast days must be non-negative, got " + day);
            }
            Instant at = now.plus(Duration.ofDays(day));
            forecasts.add(new RetentionForecast(day, retentionAt(record, at)));
        }
        return forecasts;
    }

    public double rememberThreshold() {
        return props.rememberThreshold();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static double difficultyMultiplier(double difficultyLevel) {
        int index = Math.max(0, Math.min(DIFFICULTY_MULTIPLIERS.length - 1, (int) Math.floor(difficultyLevel) - 1));
        return DIFFICULTY_MULTIPLIERS[index];
    }

    private static void requireDifficulty(double difficultyLevel) {
        if (Double.isNaN(difficultyLevel) || difficultyLevel < MIN_DIFFICULTY || difficultyLevel > MAX_DIFFICULTY) {
            throw new ValidationException("difficultyLevel must be within [1,5], got " + difficultyLevel);
        }
    }
}
