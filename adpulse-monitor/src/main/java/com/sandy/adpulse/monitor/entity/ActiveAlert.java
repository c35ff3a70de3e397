package com.sandy.adpulse.monitor.entity;

import com.sandy.adpulse.monitor.model.AlertStatus;
import com.sandy.adpulse.monitor.model.Severity;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Alert raised by a threshold breach outside its cooldown.
 * Status only moves forward: active -> acknowledged -> resolved (acknowledge may be skipped).
 */
@Entity
@Table(name = "active_alerts")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActiveAlert {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 64)
    private String thresholdId;
    private String thresholdName;

    @Column(length = 64)
    private String metric;

    private double currentValue;
    private double thresholdValue;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private Severity severity;

    @Column(length = 500)
    private String message;

    private LocalDateTime triggeredAt;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private AlertStatus status;

    private LocalDateTime acknowledgedAt;
    @Column(length = 120)
    private String acknowledgedBy;
    private LocalDateTime resolvedAt;

    @Column(length = 64)
    private String campaignId;
    @Column(length = 64)
    private String adsetId;
}
