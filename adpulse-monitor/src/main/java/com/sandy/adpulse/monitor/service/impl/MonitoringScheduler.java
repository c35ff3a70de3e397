package com.sandy.adpulse.monitor.service.impl;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives the detection, alert and retraining loops. All three tick on fixed delays but only do work
 * while monitoring is running; {@link #stop()} lets an in-flight tick finish.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MonitoringScheduler {

    private final AnomalyDetectionService anomalyDetectionService;
    private final AlertEngineService alertEngineService;

    @Value("${detection.enabled:true}")
    private boolean detectionEnabled;
    @Value("${detection.auto-start:false}")
    private boolean autoStart;
    @Value("${detection.auto-retrain:true}")
    private boolean autoRetrain;
    @Value("${alert.enabled:true}")
    private boolean alertEnabled;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile LocalDateTime startedAt;
    private volatile LocalDateTime lastRetrainAt;

    @PostConstruct
    public void init() {
        log.info("Monitoring scheduler initialized: detectionEnabled={} alertEnabled={} autoStart={} autoRetrain={}",
                detectionEnabled, alertEnabled, autoStart, autoRetrain);
        if (autoStart) start();
    }

    public boolean start() {
        if (!running.compareAndSet(false, true)) return false;
        startedAt = LocalDateTime.now();
        // samples queued while stopped would be judged against the current time
        int stale = alertEngineService.discardPending();
        log.info("Monitoring started at {}, discarded {} samples queued while stopped", startedAt, stale);
        return true;
    }

    public boolean stop() {
        if (!running.compareAndSet(true, false)) return false;
        log.info("Monitoring stopped, was running since {}", startedAt);
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    @Scheduled(fixedDelayString = "${detection.interval-ms:30000}", initialDelayString = "${detection.interval-ms:30000}")
    public void scheduledDetection() {
        if (!detectionEnabled || !running.get()) return;
        try {
            anomalyDetectionService.runCycle();
        } catch (Exception e) {
            log.error("Scheduled detection cycle failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "${alert.scan-interval-ms:10000}")
    public void scheduledAlertScan() {
        if (!alertEnabled || !running.get()) return;
        try {
            List<?> created = alertEngineService.drainPending();
            if (!created.isEmpty()) log.debug("Alert scan created {} alerts", created.size());
        } catch (Exception e) {
            log.error("Scheduled alert scan failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Placeholder: records the tick, models are left unchanged.
     */
    @Scheduled(fixedDelayString = "${detection.retrain-interval-ms:3600000}", initialDelayString = "${detection.retrain-interval-ms:3600000}")
    public void scheduledRetrain() {
        if (!autoRetrain || !running.get()) return;
        lastRetrainAt = LocalDateTime.now();
        log.info("Retraining tick at {}: no trainable models, configs unchanged", lastRetrainAt);
    }

    public Status status() {
        return new Status(running.get(), startedAt, anomalyDetectionService.getLastCycleAt(), lastRetrainAt,
                anomalyDetectionService.historySize(), anomalyDetectionService.getPatterns().size(),
                alertEngineService.pendingCount());
    }

    public record Status(boolean active, LocalDateTime startedAt, LocalDateTime lastCycleAt, LocalDateTime lastRetrainAt,
                         int historySize, int patternCount, int pendingSamples) {
    }
}
