package com.openforge.gazetranslate.retention;

import org.springframework.lang.Nullable;

import java.time.Instant;

/** Evaluation of a {@link RetentionRecord} at a given instant. */
public record RetentionSnapshot(
        long    elapsedMs,
        double  probability,
        boolean remembered,
        @Nullable Instant nextDueAt
) {}
