package com.openforge.gazetranslate.memory;

import com.openforge.gazetranslate.domain.Fragment;
import com.openforge.gazetranslate.domain.FragmentStatus;
import com.openforge.gazetranslate.domain.FragmentType;
import com.openforge.gazetranslate.retention.RetentionRecord;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of a stored fragment. Changing a fragment always goes
 * through {@link MemoryStore}; holding one of these never aliases store state.
 */
public record MemoryFragment(
        Long            id,
        String          ownerId,
        String          sourceText,
        String          translatedText,
        String          sourceLang,
        String          targetLang,
        FragmentType    type,
        FragmentStatus  status,
        Instant         createdAt,
        Instant         lastAccessedAt,
        int             accessCount,
        RetentionRecord retention,
        List<String>    tags,
        @Nullable CaptureContext context
) {

    static MemoryFragment from(Fragment f) {
        CaptureContext context = null;
        if (f.getCaptureSessionId() != null || f.getGazeX() != null || f.getCaptureTrigger() != null
                || f.getDeviceType() != null) {
            context = new CaptureContext(f.getCaptureSessionId(), f.getGazeX(), f.getGazeY(),
                    f.getCaptureTrigger(), f.getDeviceType());
        }
        return new MemoryFragment(
                f.getId(),
                f.getOwnerId(),
                f.getSourceText(),
                f.getTranslatedText(),
                f.getSourceLang(),
                f.getTargetLang(),
                f.getType(),
                f.getStatus(),
                f.getCreateTime(),
                f.getLastAccessedAt(),
                f.getAccessCount(),
                f.getRetention().toRecord(),
                List.copyOf(f.getTags()),
                context
        );
    }
}
