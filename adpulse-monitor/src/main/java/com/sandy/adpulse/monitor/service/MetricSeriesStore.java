package com.sandy.adpulse.monitor.service;

import com.sandy.adpulse.monitor.model.MetricSample;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Retained historical series, one per metric name. Append-only.
 */
public interface MetricSeriesStore {
    boolean save(List<MetricSample> samples);
    Optional<MetricSample> findLatest(String metric);
    /** Samples with timestamp at or after {@code since}, ascending. */
    List<MetricSample> findSince(String metric, LocalDateTime since);
    /** Newest {@code limit} samples, descending. */
    List<MetricSample> findTopN(String metric, int limit);
    Set<String> metrics();
    void clear();
}
