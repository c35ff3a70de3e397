package com.sandy.adpulse.monitor.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient shared by the HTTP notification senders. Targets are absolute URLs, so no base URL.
 */
@Configuration
public class NotificationClientConfig {

    @Bean
    public WebClient notificationWebClient(WebClient.Builder builder) {
        return builder
                .defaultHeader("User-Agent", "adpulse-monitor")
                .build();
    }
}
