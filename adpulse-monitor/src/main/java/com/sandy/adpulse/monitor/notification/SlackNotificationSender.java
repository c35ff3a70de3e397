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

import java.util.Map;

/**
 * Posts a text message to a Slack incoming-webhook URL.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SlackNotificationSender implements NotificationSender {

    private final WebClient notificationWebClient;

    @Override
    public ChannelType type() {
        return ChannelType.SLACK;
    }

    @Override
    public Mono<Void> send(NotificationChannel channel, ActiveAlert alert) {
        String text = String.format("[%s] %s", alert.getSeverity().getCode().toUpperCase(), alert.getMessage());
        return notificationWebClient.post()
                .uri(channel.getTarget())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("text", text))
                .retrieve()
                .toBodilessEntity()
                .doOnSuccess(r -> log.debug("Slack message delivered alertId={}", alert.getId()))
                .then();
    }
}
