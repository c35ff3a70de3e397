package com.sandy.adpulse.monitor.service.impl;

import com.sandy.adpulse.monitor.entity.ActiveAlert;
import com.sandy.adpulse.monitor.model.AnomalyRecord;
import com.sandy.adpulse.monitor.model.PatternInsight;
import com.sandy.adpulse.monitor.service.AlertListener;
import com.sandy.adpulse.monitor.service.AnomalyListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes detector and alert engine outputs to the application log.
 */
@Component
@Slf4j
public class LoggingMonitorListener implements AnomalyListener, AlertListener {

    @Override
    public void onAnomalyDetected(AnomalyRecord a) {
        log.info("Anomaly detected metric={} type={} severity={} value={} expected={} deviationPct={} model={} ts={}",
                a.getMetric(), a.getAnomalyType(), a.getSeverity(), a.getValue(),
                String.format("%.2f", a.getExpectedValue()), String.format("%.2f", a.getDeviationScorePct()),
                a.getModelId(), a.getTimestamp());
    }

    @Override
    public void onPatternDiscovered(PatternInsight insight) {
        log.info("Pattern discovered id={} type={} confidence={} title={}",
                insight.getId(), insight.getType(), insight.getConfidence(), insight.getTitle());
    }

    @Override
    public void onAlertTriggered(ActiveAlert alert) {
        log.info("Alert triggered id={} threshold={} severity={} message={}",
                alert.getId(), alert.getThresholdId(), alert.getSeverity(), alert.getMessage());
    }

    @Override
    public void onAlertResolved(ActiveAlert alert) {
        log.info("Alert resolved id={} threshold={} resolvedAt={}", alert.getId(), alert.getThresholdId(), alert.getResolvedAt());
    }
}
