package com.sandy.adpulse.monitor.service.impl;

import com.sandy.adpulse.monitor.detection.AnomalyHistory;
import com.sandy.adpulse.monitor.detection.DetectionModel;
import com.sandy.adpulse.monitor.detection.PatternSynthesizer;
import com.sandy.adpulse.monitor.entity.DetectionModelConfig;
import com.sandy.adpulse.monitor.model.AnomalyRecord;
import com.sandy.adpulse.monitor.model.AnomalyType;
import com.sandy.adpulse.monitor.model.DetectionModelType;
import com.sandy.adpulse.monitor.model.MetricSample;
import com.sandy.adpulse.monitor.model.PatternInsight;
import com.sandy.adpulse.monitor.model.Severity;
import com.sandy.adpulse.monitor.model.TimeRange;
import com.sandy.adpulse.monitor.repository.DetectionModelConfigRepository;
import com.sandy.adpulse.monitor.service.AnomalyListener;
import com.sandy.adpulse.monitor.service.MetricSeriesStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Runs the active detection models over the selected metrics, keeps the bounded anomaly history
 * and the discovered pattern insights.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnomalyDetectionService {

    /** Severity first (critical on top), then newest. */
    static final Comparator<AnomalyRecord> CANDIDATE_ORDER = Comparator
            .comparing((AnomalyRecord a) -> a.getSeverity().rank()).reversed()
            .thenComparing(AnomalyRecord::getTimestamp, Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()));

    private static final Comparator<AnomalyRecord> OLDEST_FIRST =
            Comparator.comparing(AnomalyRecord::getTimestamp, Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder()));

    private final DetectionModelConfigRepository modelConfigRepository;
    private final MetricSeriesStore seriesStore;
    private final List<DetectionModel> detectionModels;
    private final PatternSynthesizer patternSynthesizer;
    private final List<AnomalyListener> anomalyListeners;

    @Value("${detection.selected-metrics:spend,conversions,ctr,roas}")
    private String[] selectedMetrics;
    @Value("${detection.time-range:24h}")
    private String timeRangeCode;
    @Value("${detection.history-capacity:100}")
    private int historyCapacity;
    @Value("${detection.duplicate-window-minutes:5}")
    private int duplicateWindowMinutes;

    private final Map<DetectionModelType, DetectionModel> modelsByType = new EnumMap<>(DetectionModelType.class);
    // insight id -> insight, discovery order
    private final Map<String, PatternInsight> patterns = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private AnomalyHistory history;
    private TimeRange timeRange;
    private volatile LocalDateTime lastCycleAt;

    @PostConstruct
    public void init() {
        for (DetectionModel m : detectionModels) {
            modelsByType.put(m.type(), m);
        }
        history = new AnomalyHistory(historyCapacity);
        timeRange = TimeRange.fromCode(timeRangeCode);
        log.info("Anomaly detection initialized: models={} metrics={} timeRange={} historyCapacity={} duplicateWindowMin={}",
                modelsByType.keySet(), Arrays.toString(selectedMetrics), timeRange.getCode(), historyCapacity, duplicateWindowMinutes);
    }

    public CycleResult runCycle() {
        return runCycle(LocalDateTime.now());
    }

    /**
     * One detection pass. Never throws for a faulty model; the failure is logged and the pass goes on.
     */
    public CycleResult runCycle(LocalDateTime now) {
        lock.lock();
        try {
            List<DetectionModelConfig> configs = modelConfigRepository.findByActiveTrue();
            LocalDateTime since = now.minus(timeRange.toDuration());
            List<AnomalyRecord> candidates = new ArrayList<>();
            for (String metric : selectedMetrics) {
                List<MetricSample> series = seriesStore.findSince(metric, since);
                if (series.isEmpty()) continue;
                for (DetectionModelConfig config : configs) {
                    if (!config.appliesTo(metric)) continue;
                    candidates.addAll(evaluateSafely(config, metric, series));
                }
            }
            List<AnomalyRecord> accepted = accept(candidates);
            List<PatternInsight> discovered = synthesizePatterns(now);
            lastCycleAt = now;
            log.debug("Detection cycle done: metrics={} models={} candidates={} accepted={} patterns={}",
                    selectedMetrics.length, configs.size(), candidates.size(), accepted.size(), discovered.size());
            accepted.forEach(this::fireAnomaly);
            discovered.forEach(this::firePattern);
            return new CycleResult(now, candidates.size(), accepted, discovered);
        } finally {
            lock.unlock();
        }
    }

    private List<AnomalyRecord> evaluateSafely(DetectionModelConfig config, String metric, List<MetricSample> series) {
        DetectionModel model = config.getType() == null ? null : modelsByType.get(config.getType());
        if (model == null) {
            log.warn("No detection model for config id={} type={}, skipped", config.getId(), config.getType());
            return Collections.emptyList();
        }
        try {
            return model.evaluate(metric, series, config);
        } catch (Exception e) {
            log.error("Detection model failed id={} metric={} error={}", config.getId(), metric, e.getMessage(), e);
            return Collections.emptyList();
        }
    }

    /**
     * Drops candidates within the duplicate window of a known record, oldest candidate first, so the
     * earliest record of a cluster is the one kept. The survivors are returned in emission order.
     */
    private List<AnomalyRecord> accept(List<AnomalyRecord> candidates) {
        Duration window = Duration.ofMinutes(duplicateWindowMinutes);
        candidates.sort(OLDEST_FIRST);
        List<AnomalyRecord> accepted = new ArrayList<>();
        for (AnomalyRecord c : candidates) {
            if (history.containsNear(c, window)) continue;
            history.add(c);
            accepted.add(c);
        }
        accepted.sort(CANDIDATE_ORDER);
        return accepted;
    }

    private List<PatternInsight> synthesizePatterns(LocalDateTime now) {
        List<PatternInsight> discovered = new ArrayList<>();
        for (PatternInsight insight : patternSynthesizer.synthesize(history.snapshot(), now)) {
            if (patterns.putIfAbsent(insight.getId(), insight) == null) {
                discovered.add(insight);
            }
        }
        return discovered;
    }

    private void fireAnomaly(AnomalyRecord record) {
        for (AnomalyListener l : anomalyListeners) {
            try {
                l.onAnomalyDetected(record);
            } catch (Exception e) {
                log.warn("Anomaly listener {} failed: {}", l.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    private void firePattern(PatternInsight insight) {
        for (AnomalyListener l : anomalyListeners) {
            try {
                l.onPatternDiscovered(insight);
            } catch (Exception e) {
                log.warn("Pattern listener {} failed: {}", l.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    /**
     * History newest first, optionally filtered. {@code search} matches metric or type code, case-insensitive.
     */
    public List<AnomalyRecord> getHistory(Severity severity, AnomalyType type, String search) {
        List<AnomalyRecord> snapshot;
        lock.lock();
        try {
            snapshot = history.snapshot();
        } finally {
            lock.unlock();
        }
        String q = search == null || search.isBlank() ? null : search.trim().toLowerCase();
        return snapshot.stream()
                .filter(a -> severity == null || a.getSeverity() == severity)
                .filter(a -> type == null || a.getAnomalyType() == type)
                .filter(a -> q == null
                        || a.getMetric().toLowerCase().contains(q)
                        || a.getAnomalyType().getCode().contains(q))
                .collect(Collectors.toList());
    }

    public List<PatternInsight> getPatterns() {
        lock.lock();
        try {
            return new ArrayList<>(patterns.values());
        } finally {
            lock.unlock();
        }
    }

    public int historySize() {
        lock.lock();
        try {
            return history.size();
        } finally {
            lock.unlock();
        }
    }

    public LocalDateTime getLastCycleAt() {
        return lastCycleAt;
    }

    public void reset() {
        lock.lock();
        try {
            history.clear();
            patterns.clear();
            lastCycleAt = null;
        } finally {
            lock.unlock();
        }
    }

    public record CycleResult(LocalDateTime ranAt, int candidateCount,
                              List<AnomalyRecord> newAnomalies, List<PatternInsight> newPatterns) {
    }
}
