package com.sandy.adpulse.monitor.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.sandy.adpulse.monitor.model.ChannelType;
import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "notification_channels")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationChannel {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private ChannelType type;

    /** Recipient address, webhook URL or device token depending on type. */
    @Column(length = 500)
    private String target;

    private boolean active;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "threshold_id")
    @JsonIgnore
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private AlertThreshold threshold;
}
