package com.sandy.adpulse.monitor.service.impl;

import com.sandy.adpulse.monitor.entity.ActiveAlert;
import com.sandy.adpulse.monitor.entity.AlertThreshold;
import com.sandy.adpulse.monitor.model.AlertStatus;
import com.sandy.adpulse.monitor.model.MetricSample;
import com.sandy.adpulse.monitor.model.ThresholdOperator;
import com.sandy.adpulse.monitor.notification.NotificationDispatcher;
import com.sandy.adpulse.monitor.repository.ActiveAlertRepository;
import com.sandy.adpulse.monitor.repository.AlertThresholdRepository;
import com.sandy.adpulse.monitor.service.AlertListener;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Evaluates alert thresholds against incoming samples and owns the alert lifecycle.
 * Threshold state machine: idle -> triggered -> cooldown -> idle. Breaches during cooldown are dropped.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertEngineService {

    private static final Set<String> CURRENCY_METRICS = Set.of("spend", "cpm", "cpc");
    private static final Set<String> ACRONYM_METRICS = Set.of("ctr", "cpm", "cpc", "roas");

    private final AlertThresholdRepository thresholdRepository;
    private final ActiveAlertRepository alertRepository;
    private final NotificationDispatcher notificationDispatcher;
    private final List<AlertListener> alertListeners;

    @Value("${alert.enabled:true}")
    private boolean enabled;
    @Value("${alert.equals-tolerance:0.01}")
    private double equalsTolerance;
    @Value("${alert.max-pending:5000}")
    private int maxPending;

    // samples waiting for the next alert loop tick, oldest first
    private final Queue<MetricSample> pending = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pendingSize = new AtomicInteger();
    private final ReentrantLock lock = new ReentrantLock();

    @PostConstruct
    public void init() {
        log.info("Alert engine initialized: enabled={} equalsTolerance={} maxPending={}", enabled, equalsTolerance, maxPending);
    }

    /**
     * Queues samples for the alert loop. Nothing is queued while alerting is disabled; beyond
     * {@code alert.max-pending} the oldest queued samples are dropped.
     */
    public void enqueue(List<MetricSample> samples) {
        if (!enabled || samples == null) return;
        int dropped = 0;
        for (MetricSample s : samples) {
            pending.add(s);
            if (pendingSize.incrementAndGet() > maxPending && poll() != null) dropped++;
        }
        if (dropped > 0) {
            log.warn("Alert queue full (max={}), dropped {} oldest samples", maxPending, dropped);
        }
    }

    public int pendingCount() {
        return pendingSize.get();
    }

    /**
     * Evaluates every queued sample. With alerting disabled the queue is emptied without evaluation.
     * @return alerts created
     */
    public List<ActiveAlert> drainPending() {
        List<ActiveAlert> created = new ArrayList<>();
        if (!enabled) {
            discardPending();
            return created;
        }
        MetricSample s;
        while ((s = poll()) != null) {
            created.addAll(evaluate(s));
        }
        return created;
    }

    /**
     * Empties the queue without evaluating it.
     * @return number of samples discarded
     */
    public int discardPending() {
        int discarded = 0;
        while (poll() != null) discarded++;
        if (discarded > 0) log.info("Discarded {} queued samples", discarded);
        return discarded;
    }

    private MetricSample poll() {
        MetricSample s = pending.poll();
        if (s != null) pendingSize.decrementAndGet();
        return s;
    }

    public List<ActiveAlert> evaluate(MetricSample sample) {
        return evaluate(sample, LocalDateTime.now());
    }

    /**
     * Runs all active thresholds of the sample's metric. A faulty threshold is logged and skipped.
     */
    public List<ActiveAlert> evaluate(MetricSample sample, LocalDateTime now) {
        List<ActiveAlert> created = new ArrayList<>();
        if (sample == null || sample.getMetric() == null) return created;
        lock.lock();
        try {
            for (AlertThreshold threshold : thresholdRepository.findByActiveTrueAndMetric(sample.getMetric())) {
                try {
                    ActiveAlert alert = evaluateThreshold(threshold, sample, now);
                    if (alert != null) created.add(alert);
                } catch (Exception e) {
                    log.error("Threshold evaluation failed id={} metric={} error={}", threshold.getId(), sample.getMetric(), e.getMessage(), e);
                }
            }
        } finally {
            lock.unlock();
        }
        created.forEach(this::fireTriggered);
        return created;
    }

    private ActiveAlert evaluateThreshold(AlertThreshold threshold, MetricSample sample, LocalDateTime now) {
        ThresholdOperator op = threshold.getOperator();
        if (op == null) {
            log.warn("Threshold id={} has no operator, skipped", threshold.getId());
            return null;
        }
        if (!op.matches(sample.getValue(), threshold.getValue(), threshold.getMaxValue(), equalsTolerance)) return null;
        if (threshold.inCooldown(now)) {
            log.debug("Breach suppressed by cooldown threshold={} value={} lastTriggeredAt={}",
                    threshold.getId(), sample.getValue(), threshold.getLastTriggeredAt());
            return null;
        }
        ActiveAlert alert = ActiveAlert.builder()
                .thresholdId(threshold.getId())
                .thresholdName(threshold.getName())
                .metric(sample.getMetric())
                .currentValue(sample.getValue())
                .thresholdValue(threshold.getValue())
                .severity(threshold.getSeverity())
                .message(formatMessage(threshold, sample.getValue()))
                .triggeredAt(now)
                .status(AlertStatus.ACTIVE)
                .campaignId(sample.getCampaignId())
                .adsetId(sample.getAdsetId())
                .build();
        alertRepository.save(alert);
        threshold.setTriggerCount(threshold.getTriggerCount() + 1);
        threshold.setLastTriggeredAt(now);
        thresholdRepository.save(threshold);
        log.info("Created alert id={} threshold={} metric={} value={} severity={}",
                alert.getId(), threshold.getId(), sample.getMetric(), sample.getValue(), threshold.getSeverity());
        // alert is persisted before any delivery is attempted
        try {
            notificationDispatcher.dispatch(alert, threshold.getChannels());
        } catch (Exception e) {
            log.warn("Notification dispatch failed alertId={} threshold={} error={}", alert.getId(), threshold.getId(), e.getMessage());
        }
        return alert;
    }

    static String formatMessage(AlertThreshold threshold, double current) {
        String metric = threshold.getMetric();
        String label = metricLabel(metric);
        String value = formatValue(metric, current);
        String thr = formatValue(metric, threshold.getValue());
        switch (threshold.getOperator()) {
            case GT:
                return String.format("%s (%s) exceeded threshold of %s", label, value, thr);
            case LT:
                return String.format("%s (%s) fell below threshold of %s", label, value, thr);
            case EQ:
                return String.format("%s (%s) equals threshold of %s", label, value, thr);
            default:
                return String.format("%s threshold condition met: %s", label, value);
        }
    }

    static String metricLabel(String metric) {
        if (metric.isEmpty()) return metric;
        if (ACRONYM_METRICS.contains(metric)) return metric.toUpperCase(Locale.ROOT);
        return metric.substring(0, 1).toUpperCase(Locale.ROOT) + metric.substring(1);
    }

    static String formatValue(String metric, double v) {
        String n = String.format(Locale.ROOT, "%.2f", v);
        if (CURRENCY_METRICS.contains(metric)) return "$" + n;
        if ("ctr".equals(metric)) return n + "%";
        if ("roas".equals(metric)) return n + "x";
        return n;
    }

    public ActiveAlert acknowledge(Long id, String by) {
        lock.lock();
        try {
            ActiveAlert alert = alertRepository.findById(id).orElse(null);
            if (alert == null) return null;
            if (alert.getStatus() != AlertStatus.ACTIVE) {
                throw new IllegalStateException("Alert " + id + " is " + alert.getStatus().getCode() + ", cannot acknowledge");
            }
            alert.setStatus(AlertStatus.ACKNOWLEDGED);
            alert.setAcknowledgedAt(LocalDateTime.now());
            alert.setAcknowledgedBy(by);
            return alertRepository.save(alert);
        } finally {
            lock.unlock();
        }
    }

    public ActiveAlert resolve(Long id) {
        ActiveAlert resolved;
        lock.lock();
        try {
            ActiveAlert alert = alertRepository.findById(id).orElse(null);
            if (alert == null) return null;
            if (alert.getStatus() == AlertStatus.RESOLVED) {
                throw new IllegalStateException("Alert " + id + " is already resolved");
            }
            alert.setStatus(AlertStatus.RESOLVED);
            alert.setResolvedAt(LocalDateTime.now());
            resolved = alertRepository.save(alert);
        } finally {
            lock.unlock();
        }
        fireResolved(resolved);
        return resolved;
    }

    private void fireTriggered(ActiveAlert alert) {
        for (AlertListener l : alertListeners) {
            try {
                l.onAlertTriggered(alert);
            } catch (Exception e) {
                log.warn("Alert listener {} failed: {}", l.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    private void fireResolved(ActiveAlert alert) {
        for (AlertListener l : alertListeners) {
            try {
                l.onAlertResolved(alert);
            } catch (Exception e) {
                log.warn("Alert listener {} failed: {}", l.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
