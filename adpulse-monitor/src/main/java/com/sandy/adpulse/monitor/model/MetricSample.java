package com.sandy.adpulse.monitor.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;

/**
 * A single observation of a named metric, produced by an external collector.
 */
@Value
@Builder
@Jacksonized
public class MetricSample {
    String metric;
    double value;
    LocalDateTime timestamp;
    String campaignId;
    String adsetId;
}
