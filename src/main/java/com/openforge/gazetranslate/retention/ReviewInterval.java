package com.openforge.gazetranslate.retention;

import java.time.Duration;

/**
 * Spaced-repetition steps, indexed by reinforcement count. The table is
 * strictly increasing; the model clamps indices to its bounds.
 */
public enum ReviewInterval {

    TWENTY_MINUTES("20m", Duration.ofMinutes(20)),
    ONE_HOUR("1h", Duration.ofHours(1)),
    NINE_HOURS("9h", Duration.ofHours(9)),
    ONE_DAY("1d", Duration.ofDays(1)),
    TWO_DAYS("2d", Duration.ofDays(2)),
    FOUR_DAYS("4d", Duration.ofDays(4)),
    ONE_WEEK("1w", Duration.ofDays(7)),
    TWO_WEEKS("2w", Duration.ofDays(14)),
    ONE_MONTH("1mo", Duration.ofDays(30)),
    THREE_MONTHS("3mo", Duration.ofDays(90));

    private static final ReviewInterval[] STEPS = values();

    private final String label;
    private final Duration duration;

    ReviewInterval(String label, Duration duration) {
        this.label = label;
        this.duration = duration;
    }

    public String label() {
        return label;
    }

    public Duration duration() {
        return duration;
    }

    static ReviewInterval at(int index) {
        return STEPS[Math.max(0, Math.min(STEPS.length - 1, index))];
    }

    static int lastIndex() {
        return STEPS.length - 1;
    }
}
