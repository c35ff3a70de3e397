package com.sandy.adpulse.monitor.detection;

import com.sandy.adpulse.monitor.entity.DetectionModelConfig;
import com.sandy.adpulse.monitor.model.AnomalyRecord;
import com.sandy.adpulse.monitor.model.DetectionModelType;
import com.sandy.adpulse.monitor.model.MetricSample;

import java.util.List;

/**
 * One anomaly detection strategy. Implementations are stateless; everything they need
 * comes from the series and the config parameters.
 */
public interface DetectionModel {

    /** The config type this model evaluates. */
    DetectionModelType type();

    /**
     * @param metric metric name the series belongs to
     * @param series samples in ascending timestamp order
     * @param config the model config, read for its parameters only
     * @return anomaly candidates, possibly empty, never null
     */
    List<AnomalyRecord> evaluate(String metric, List<MetricSample> series, DetectionModelConfig config);
}
