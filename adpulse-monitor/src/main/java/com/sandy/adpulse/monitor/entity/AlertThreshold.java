package com.sandy.adpulse.monitor.entity;

import com.sandy.adpulse.monitor.model.Severity;
import com.sandy.adpulse.monitor.model.ThresholdOperator;
import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * User-defined alert rule on a single metric. {@code lastTriggeredAt} and {@code triggerCount}
 * are owned by the alert engine; everything else is edited through the API.
 */
@Entity
@Table(name = "alert_thresholds")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertThreshold {
    @Id
    @Column(length = 64)
    private String id;

    private String name;

    @Column(length = 255)
    private String description;

    @Column(length = 64)
    private String metric;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private ThresholdOperator operator;

    @Column(name = "threshold_value")
    private double value;

    /** Upper bound for BETWEEN. */
    @Column(name = "max_value")
    private Double maxValue;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private Severity severity;

    private boolean active;

    private int cooldownPeriodMinutes;

    private LocalDateTime lastTriggeredAt;

    private int triggerCount;

    @OneToMany(mappedBy = "threshold", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @Builder.Default
    private List<NotificationChannel> channels = new ArrayList<>();

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    /**
     * True while a previous trigger still suppresses new ones.
     */
    public boolean inCooldown(LocalDateTime now) {
        if (lastTriggeredAt == null) return false;
        Duration since = Duration.between(lastTriggeredAt, now);
        return since.compareTo(Duration.ofMinutes(cooldownPeriodMinutes)) < 0;
    }

    public void addChannel(NotificationChannel channel) {
        channel.setThreshold(this);
        channels.add(channel);
    }
}
