package com.openforge.gazetranslate.memory;

import com.openforge.gazetranslate.domain.FragmentStatus;

import java.util.List;
import java.util.Map;

/** Per-owner overview computed at one instant. */
public record MemoryStats(
        String                      ownerId,
        long                        totalItems,
        Map<FragmentStatus, Long>   byStatus,
        double                      averageRetention,
        long                        rememberedItems,
        long                        forgottenItems,
        long                        itemsDueForReview,
        double                      averageDifficulty,
        List<MemoryFragment>        mostAccessed,
        List<MemoryFragment>        recentlyAdded,
        List<MemoryFragment>        upcomingReviews
) {}
