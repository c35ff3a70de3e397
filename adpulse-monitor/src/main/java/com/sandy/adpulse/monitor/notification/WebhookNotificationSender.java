package com.sandy.adpulse.monitor.notification;

import com.sandy.adpulse.monitor.entity.ActiveAlert;
import com.sandy.adpulse.monitor.entity.NotificationChannel;
import com.sandy.adpulse.monitor.model.ChannelType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * POSTs the alert as JSON to the channel target URL.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WebhookNotificationSender implements NotificationSender {

    private final WebClient notificationWebClient;

    @Override
    public ChannelType type() {
        return ChannelType.WEBHOOK;
    }

    @Override
    public Mono<Void> send(NotificationChannel channel, ActiveAlert alert) {
        return notificationWebClient.post()
                .uri(channel.getTarget())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(AlertPayload.of(alert))
                .retrieve()
                .toBodilessEntity()
                .doOnSuccess(r -> log.debug("Webhook delivered alertId={} status={}", alert.getId(), r.getStatusCode()))
                .then();
    }
}
