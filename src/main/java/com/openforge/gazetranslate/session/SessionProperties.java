package com.openforge.gazetranslate.session;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * app:
 *   session:
 *     capture-timeout: 30s    # a requested screenshot that never arrives stops blocking new triggers
 *     max-sessions: 1000
 */
@ConfigurationProperties(prefix = "app.session")
public record SessionProperties(
        @DefaultValue("30s")  Duration captureTimeout,
        @DefaultValue("1000") int      maxSessions
) {

    public static SessionProperties defaults() {
        return new SessionProperties(Duration.ofSeconds(30), 1000);
    }
}
