package com.openforge.gazetranslate.session;

import org.junit.jupiter.api.Test;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;

import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class WebSocketConfigTest {

    @Test
    void inboundMessagesOfOneConnectionKeepTheirOrder() {
        StompEndpointRegistry registry = mock(StompEndpointRegistry.class, RETURNS_DEEP_STUBS);

        new WebSocketConfig().registerStompEndpoints(registry);

        verify(registry).setPreserveReceiveOrder(true);
        verify(registry).addEndpoint("/ws");
    }
}
