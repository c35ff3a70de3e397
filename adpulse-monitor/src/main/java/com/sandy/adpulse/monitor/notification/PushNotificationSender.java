package com.sandy.adpulse.monitor.notification;

import com.sandy.adpulse.monitor.entity.ActiveAlert;
import com.sandy.adpulse.monitor.entity.NotificationChannel;
import com.sandy.adpulse.monitor.model.ChannelType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
@Slf4j
public class PushNotificationSender implements NotificationSender {

    @Override
    public ChannelType type() {
        return ChannelType.PUSH;
    }

    @Override
    public Mono<Void> send(NotificationChannel channel, ActiveAlert alert) {
        return Mono.fromRunnable(() -> log.info("Push notification device={} alertId={} message={}",
                channel.getTarget(), alert.getId(), alert.getMessage()));
    }
}
