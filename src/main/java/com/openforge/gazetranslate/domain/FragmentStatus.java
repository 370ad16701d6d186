package com.openforge.gazetranslate.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a remembered fragment.
 *
 *   FRESH ──(translated again)──▶ LEARNING ──(strong across reviews)──▶ MASTERED
 *   LEARNING ──(failed review, strength < 0.3)──▶ FORGOTTEN ──(re-exposure)──▶ LEARNING
 *   any ──(explicit exclude)──▶ EXCLUDED
 */
public enum FragmentStatus {

    FRESH,
    LEARNING,
    MASTERED,
    FORGOTTEN,
    EXCLUDED;

    /** Never triggers a fresh translation and is never scheduled for review. */
    public boolean isTerminal() {
        return this == MASTERED || this == EXCLUDED;
    }

    /** Statuses the stale sweep may delete. */
    public static Set<FragmentStatus> purgeable() {
        return EnumSet.of(FRESH, FORGOTTEN);
    }

    public static Set<FragmentStatus> reviewable() {
        return EnumSet.of(FRESH, LEARNING, FORGOTTEN);
    }
}
