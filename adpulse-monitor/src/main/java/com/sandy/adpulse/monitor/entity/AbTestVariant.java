package com.sandy.adpulse.monitor.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "ab_test_variants")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AbTestVariant {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @JsonIgnore
    private Long pk;

    /** Unique within its test only. */
    @Column(name = "variant_id", length = 64)
    private String id;

    private String name;

    private boolean control;

    private long impressions;
    private long clicks;
    private long conversions;
    private double spend;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "test_id")
    @JsonIgnore
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private AbTest test;

    /** Click-through rate as a fraction, impressions floored at 1. */
    public double clickRate() {
        return clicks / (double) Math.max(impressions, 1);
    }
}
