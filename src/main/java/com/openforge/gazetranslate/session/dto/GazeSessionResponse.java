package com.openforge.gazetranslate.session.dto;

import com.openforge.gazetranslate.gaze.FixationConfig;
import com.openforge.gazetranslate.gaze.GazeMode;
import com.openforge.gazetranslate.session.GazeSession;
import com.openforge.gazetranslate.session.TranslateEventPublisher;

import java.time.Instant;

/**
 * Includes the STOMP paths so the client can subscribe and start streaming
 * right after opening the session.
 */
public record GazeSessionResponse(
        String         sessionId,
        String         ownerId,
        String         sourceLang,
        String         targetLang,
        GazeMode       gazeMode,
        FixationConfig fixation,
        boolean        captureInFlight,
        String         wsSubscribePath,
        String         wsSendPrefix,
        Instant        createdAt
) {

    public static GazeSessionResponse from(GazeSession session) {
        return new GazeSessionResponse(
                session.sessionId(),
                session.ownerId(),
                session.languages().sourceLang(),
                session.languages().targetLang(),
                session.mode(),
                session.detector().config(),
                session.captureInFlight(),
                TranslateEventPublisher.TOPIC_PREFIX + session.sessionId(),
                "/app/sessions/" + session.sessionId(),
                session.createdAt()
        );
    }
}
