package com.sandy.adpulse.monitor.service;

import com.sandy.adpulse.monitor.model.AnomalyRecord;
import com.sandy.adpulse.monitor.model.PatternInsight;

/**
 * Receives every newly accepted anomaly and newly discovered insight, once each.
 * Called on the detection thread; implementations must not block.
 */
public interface AnomalyListener {

    default void onAnomalyDetected(AnomalyRecord anomaly) {
    }

    default void onPatternDiscovered(PatternInsight insight) {
    }
}
