package com.sandy.adpulse.monitor.notification;

import com.sandy.adpulse.monitor.entity.ActiveAlert;
import com.sandy.adpulse.monitor.entity.NotificationChannel;
import com.sandy.adpulse.monitor.model.ChannelType;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fans an alert out to its active channels. Delivery is fire-and-forget: {@link #dispatch} returns
 * as soon as every delivery is subscribed, and each channel fails on its own.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NotificationDispatcher {

    private final List<NotificationSender> senders;

    @Value("${notification.timeout-ms:5000}")
    private long timeoutMs;
    @Value("${notification.max-retries:2}")
    private int maxRetries;
    @Value("${notification.retry-backoff-ms:500}")
    private long retryBackoffMs;

    private final Map<ChannelType, NotificationSender> sendersByType = new EnumMap<>(ChannelType.class);

    @PostConstruct
    public void init() {
        for (NotificationSender s : senders) {
            sendersByType.put(s.type(), s);
        }
        log.info("Notification dispatcher initialized: senders={} timeoutMs={} maxRetries={} backoffMs={}",
                sendersByType.keySet(), timeoutMs, maxRetries, retryBackoffMs);
    }

    /**
     * @return number of channels a delivery was started for
     */
    public int dispatch(ActiveAlert alert, List<NotificationChannel> channels) {
        if (channels == null || channels.isEmpty()) return 0;
        int started = 0;
        for (NotificationChannel channel : channels) {
            if (!channel.isActive()) continue;
            try {
                deliver(channel, alert).subscribe();
                started++;
            } catch (Exception e) {
                log.warn("Notification dispatch failed channel={} type={} alertId={} error={}",
                        channel.getId(), channel.getType(), alert.getId(), e.getMessage());
            }
        }
        return started;
    }

    /**
     * Single-channel delivery with timeout and retry. Completes empty on failure; never errors.
     */
    public Mono<Void> deliver(NotificationChannel channel, ActiveAlert alert) {
        NotificationSender sender = channel.getType() == null ? null : sendersByType.get(channel.getType());
        if (sender == null) {
            log.warn("No notification sender for channel={} type={}", channel.getId(), channel.getType());
            return Mono.empty();
        }
        return Mono.defer(() -> sender.send(channel, alert))
                .timeout(Duration.ofMillis(timeoutMs))
                .retryWhen(Retry.backoff(maxRetries, Duration.ofMillis(retryBackoffMs)))
                .doOnSuccess(v -> log.debug("Notification delivered channel={} type={} alertId={}",
                        channel.getId(), channel.getType(), alert.getId()))
                .onErrorResume(e -> {
                    log.warn("Notification delivery failed channel={} type={} target={} alertId={} error={}",
                            channel.getId(), channel.getType(), channel.getTarget(), alert.getId(), e.getMessage());
                    return Mono.empty();
                });
    }
}
