package com.sandy.adpulse.monitor.notification;

import com.sandy.adpulse.monitor.entity.ActiveAlert;
import com.sandy.adpulse.monitor.entity.NotificationChannel;
import com.sandy.adpulse.monitor.model.ChannelType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * No mail transport is wired; the notification is written to the log.
 */
@Component
@Slf4j
public class EmailNotificationSender implements NotificationSender {

    @Override
    public ChannelType type() {
        return ChannelType.EMAIL;
    }

    @Override
    public Mono<Void> send(NotificationChannel channel, ActiveAlert alert) {
        return Mono.fromRunnable(() -> log.info("Email notification to={} alertId={} subject=[{}] {}",
                channel.getTarget(), alert.getId(), alert.getSeverity().getCode(), alert.getMessage()));
    }
}
