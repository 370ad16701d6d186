package com.openforge.gazetranslate.session.dto;

import com.openforge.gazetranslate.error.ValidationException;
import com.openforge.gazetranslate.gaze.GazeSample;

import java.util.ArrayList;
import java.util.List;

/**
 * Inbound STOMP body for {@code /app/sessions/{id}/gaze}. Fields are boxed so
 * an absent field stays {@code null} instead of silently becoming zero.
 */
public record GazeSampleMessage(
        Double x,
        Double y,
        Long   timestampMs,
        Double confidence
) {

    /**
     * @throws ValidationException when any field is missing
     */
    public GazeSample toSample() {
        List<String> missing = new ArrayList<>();
        if (x == null)           missing.add("x");
        if (y == null)           missing.add("y");
        if (timestampMs == null) missing.add("timestamp_ms");
        if (confidence == null)  missing.add("confidence");
        if (!missing.isEmpty()) {
            throw new ValidationException("Gaze sample is missing required fields: " + String.join(", ", missing));
        }
        return new GazeSample(x, y, timestampMs, confidence);
    }
}
