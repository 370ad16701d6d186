package com.openforge.gazetranslate.session;

import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketTransportRegistration;

/**
 * STOMP over WebSocket.
 *
 * Client flow:
 *   1. POST /api/gaze/sessions, note the sessionId
 *   2. Connect to ws://host/ws (SockJS fallback at http://host/ws)
 *   3. SUBSCRIBE /topic/translate/{sessionId}
 *   4. SEND gaze samples to /app/sessions/{sessionId}/gaze, screenshots when asked
 *
 * The in-memory simple broker is enough for a single node.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic");
        registry.setApplicationDestinationPrefixes("/app");
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        // Gaze samples of one connection must reach the detector in order.
        registry.setPreserveReceiveOrder(true);
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns("*")
                .withSockJS();
    }

    @Override
    public void configureWebSocketTransport(WebSocketTransportRegistration registration) {
        // Screenshots arrive as base64 in a single frame.
        registration.setMessageSizeLimit(16 * 1024 * 1024);
        registration.setSendBufferSizeLimit(16 * 1024 * 1024);
    }
}
