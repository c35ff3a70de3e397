package com.sandy.adpulse.monitor.notification;

import com.sandy.adpulse.monitor.entity.ActiveAlert;
import com.sandy.adpulse.monitor.entity.NotificationChannel;
import com.sandy.adpulse.monitor.model.ChannelType;
import reactor.core.publisher.Mono;

/**
 * Delivers one alert over one kind of channel. Implementations stay lazy: nothing is sent
 * until the returned {@link Mono} is subscribed.
 */
public interface NotificationSender {

    ChannelType type();

    Mono<Void> send(NotificationChannel channel, ActiveAlert alert);
}
