package com.sandy.adpulse.monitor.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Cross-anomaly insight. Ids are stable per insight kind, so equality of id means "already discovered".
 */
@Value
@Builder
public class PatternInsight {
    String id;
    InsightType type;
    String title;
    String description;
    double confidence;
    List<String> metrics;
    String timeframe;
    boolean actionable;
    String recommendation;
    Impact impact;
    LocalDateTime discoveredAt;
}
