package com.eventradar.dispatch.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Downstream task dispatcher endpoint.
 */
@ConfigurationProperties(prefix = "eventradar.scheduler.dispatch")
@NoArgsConstructor
@Getter
@Setter
public class DispatchProperties {

    /** Task dispatcher URL. When blank, detected events are only logged and reported as failed actions. */
    private String url;

    private Duration timeout = Duration.ofSeconds(30);
}
