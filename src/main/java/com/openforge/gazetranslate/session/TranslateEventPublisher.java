package com.openforge.gazetranslate.session;

import com.openforge.gazetranslate.session.event.TranslateEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Routes {@link TranslateEvent}s to {@code /topic/translate/{sessionId}}.
 * Delivery failures are logged and dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TranslateEventPublisher {

    public static final String TOPIC_PREFIX = "/topic/translate/";

    private final SimpMessagingTemplate messagingTemplate;

    public void publish(TranslateEvent event) {
        String destination = TOPIC_PREFIX + event.sessionId();
        try {
            messagingTemplate.convertAndSend(destination, event);
        } catch (Exception e) {
            log.warn("[Publisher] Failed to deliver {} event to {}: {}",
                    event.type(), destination, e.getMessage());
        }
    }
}
