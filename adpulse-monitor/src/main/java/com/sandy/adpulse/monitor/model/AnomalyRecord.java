package com.sandy.adpulse.monitor.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Anomaly emitted by a detection model. Immutable once emitted.
 */
@Value
@Builder
public class AnomalyRecord {
    LocalDateTime timestamp;
    String metric;
    double value;
    double expectedValue;
    /** |value - expected| / expected * 100 */
    double deviationScorePct;
    AnomalyType anomalyType;
    Severity severity;
    /** 0..100 */
    double confidence;
    /** Id of the model config that produced this record. */
    String modelId;
    String campaignId;
    String adsetId;
}
