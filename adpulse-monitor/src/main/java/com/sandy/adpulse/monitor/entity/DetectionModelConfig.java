package com.sandy.adpulse.monitor.entity;

import com.sandy.adpulse.monitor.model.DetectionModelType;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Configuration of one detection model. Read by the detector at the start of every cycle,
 * so edits take effect without a restart.
 */
@Entity
@Table(name = "detection_models")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionModelConfig {

    /** Metric name matching every metric. */
    public static final String ALL_METRICS = "all";

    @Id
    @Column(length = 64)
    private String id;

    private String name;

    @Enumerated(EnumType.STRING)
    @Column(length = 32)
    private DetectionModelType type;

    @Column(length = 255)
    private String description;

    private boolean active;

    /** 0-100, informational. */
    private int sensitivity;

    /** e.g. threshold, windowSize, trendWindow, adaptiveWindow, thresholdMultiplier. */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "detection_model_parameters", joinColumns = @JoinColumn(name = "model_id"))
    @MapKeyColumn(name = "param_key", length = 64)
    @Column(name = "param_value")
    @Builder.Default
    private Map<String, Double> parameters = new HashMap<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "detection_model_metrics", joinColumns = @JoinColumn(name = "model_id"))
    @Column(name = "metric", length = 64)
    @Builder.Default
    private Set<String> applicableMetrics = new LinkedHashSet<>();

    /** Reported accuracy (%), not enforced. */
    private Double accuracy;
    /** Reported false positive rate (%), not enforced. */
    private Double falsePositiveRate;

    private LocalDateTime lastTrainedAt;
    private LocalDateTime updatedAt;

    public boolean appliesTo(String metric) {
        if (applicableMetrics == null) return false;
        return applicableMetrics.contains(metric) || applicableMetrics.contains(ALL_METRICS);
    }

    public double param(String key, double defaultValue) {
        if (parameters == null) return defaultValue;
        Double v = parameters.get(key);
        return v == null || v.isNaN() ? defaultValue : v;
    }
}
