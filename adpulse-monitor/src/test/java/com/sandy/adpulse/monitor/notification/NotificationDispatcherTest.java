package com.sandy.adpulse.monitor.notification;

import com.sandy.adpulse.monitor.entity.ActiveAlert;
import com.sandy.adpulse.monitor.entity.NotificationChannel;
import com.sandy.adpulse.monitor.model.AlertStatus;
import com.sandy.adpulse.monitor.model.ChannelType;
import com.sandy.adpulse.monitor.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class NotificationDispatcherTest {

    private final AtomicInteger webhookAttempts = new AtomicInteger();
    private final AtomicInteger emailSent = new AtomicInteger();
    private final AtomicInteger pushAttempts = new AtomicInteger();

    private NotificationDispatcher dispatcher;
    private ActiveAlert alert;

    @BeforeEach
    void setup() {
        NotificationSender failingWebhook = new StubSender(ChannelType.WEBHOOK,
                () -> {
                    webhookAttempts.incrementAndGet();
                    return Mono.error(new IllegalStateException("connection refused"));
                });
        NotificationSender email = new StubSender(ChannelType.EMAIL,
                () -> Mono.fromRunnable(emailSent::incrementAndGet));
        NotificationSender hangingPush = new StubSender(ChannelType.PUSH,
                () -> {
                    pushAttempts.incrementAndGet();
                    return Mono.never();
                });
        dispatcher = new NotificationDispatcher(List.of(failingWebhook, email, hangingPush));
        ReflectionTestUtils.setField(dispatcher, "timeoutMs", 50L);
        ReflectionTestUtils.setField(dispatcher, "maxRetries", 2);
        ReflectionTestUtils.setField(dispatcher, "retryBackoffMs", 1L);
        dispatcher.init();
        alert = ActiveAlert.builder().id(7L).thresholdId("high-spend").metric("spend").currentValue(612)
                .thresholdValue(500).severity(Severity.HIGH).message("Spend ($612.00) exceeded threshold of $500.00")
                .status(AlertStatus.ACTIVE).triggeredAt(LocalDateTime.now()).build();
    }

    private static NotificationChannel channel(ChannelType type, boolean active) {
        return NotificationChannel.builder().type(type).target("target-" + type.getCode()).active(active).build();
    }

    @Test
    void failedDeliveryIsRetriedThenSwallowed() {
        StepVerifier.create(dispatcher.deliver(channel(ChannelType.WEBHOOK, true), alert))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
        assertEquals(3, webhookAttempts.get());
    }

    @Test
    void slowChannelTimesOut() {
        StepVerifier.create(dispatcher.deliver(channel(ChannelType.PUSH, true), alert))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
        assertEquals(3, pushAttempts.get());
    }

    @Test
    void unknownChannelTypeCompletesEmpty() {
        StepVerifier.create(dispatcher.deliver(channel(ChannelType.SLACK, true), alert))
                .verifyComplete();
    }

    @Test
    void failingChannelDoesNotBlockOthers() {
        int started = dispatcher.dispatch(alert, List.of(
                channel(ChannelType.WEBHOOK, true),
                channel(ChannelType.EMAIL, true),
                channel(ChannelType.EMAIL, false)));
        assertEquals(2, started);
        assertEquals(1, emailSent.get());
    }

    @Test
    void senderThrowingSynchronouslyIsContained() {
        NotificationSender broken = new StubSender(ChannelType.SLACK, () -> {
            throw new IllegalArgumentException("bad target");
        });
        NotificationDispatcher d = new NotificationDispatcher(List.of(broken));
        ReflectionTestUtils.setField(d, "timeoutMs", 50L);
        ReflectionTestUtils.setField(d, "maxRetries", 0);
        ReflectionTestUtils.setField(d, "retryBackoffMs", 1L);
        d.init();
        StepVerifier.create(d.deliver(channel(ChannelType.SLACK, true), alert)).verifyComplete();
    }

    @Test
    void emptyChannelListDispatchesNothing() {
        assertEquals(0, dispatcher.dispatch(alert, List.of()));
        assertEquals(0, dispatcher.dispatch(alert, null));
    }

    private static final class StubSender implements NotificationSender {
        private final ChannelType type;
        private final Supplier<Mono<Void>> behaviour;

        StubSender(ChannelType type, Supplier<Mono<Void>> behaviour) {
            this.type = type;
            this.behaviour = behaviour;
        }

        @Override
        public ChannelType type() {
            return type;
        }

        @Override
        public Mono<Void> send(NotificationChannel channel, ActiveAlert alert) {
            return behaviour.get();
        }
    }
}
