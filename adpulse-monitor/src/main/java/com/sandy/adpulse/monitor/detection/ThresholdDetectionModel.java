package com.sandy.adpulse.monitor.detection;

import com.sandy.adpulse.monitor.entity.DetectionModelConfig;
import com.sandy.adpulse.monitor.model.AnomalyRecord;
import com.sandy.adpulse.monitor.model.AnomalyType;
import com.sandy.adpulse.monitor.model.DetectionModelType;
import com.sandy.adpulse.monitor.model.MetricSample;
import com.sandy.adpulse.monitor.model.Severity;
import com.sandy.adpulse.monitor.tools.StatSupport;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Adaptive band around the trailing moving average: a point is an outlier when it leaves
 * {@code movingAvg * (1 ± thresholdMultiplier)}.
 */
@Component
public class ThresholdDetectionModel implements DetectionModel {

    private static final int DEFAULT_WINDOW = 14;
    private static final double DEFAULT_MULTIPLIER = 1.5;

    @Override
    public DetectionModelType type() {
        return DetectionModelType.THRESHOLD;
    }

    @Override
    public List<AnomalyRecord> evaluate(String metric, List<MetricSample> series, DetectionModelConfig config) {
        double[] values = SeriesSupport.values(series);
        int window = (int) config.param("adaptiveWindow", DEFAULT_WINDOW);
        double multiplier = config.param("thresholdMultiplier", DEFAULT_MULTIPLIER);
        double[] movingAvg = StatSupport.movingAverage(values, window);
        List<AnomalyRecord> out = new ArrayList<>();
        for (int i = Math.max(window, 0); i < values.length; i++) {
            double avg = movingAvg[i];
            double distance = Math.abs(values[i] - avg);
            if (distance <= avg * multiplier) continue;
            double deviation = StatSupport.deviationPercent(values[i], avg);
            MetricSample sample = series.get(i);
            out.add(AnomalyRecord.builder()
                    .timestamp(sample.getTimestamp())
                    .metric(metric)
                    .value(values[i])
                    .expectedValue(avg)
                    .deviationScorePct(deviation)
                    .anomalyType(AnomalyType.OUTLIER)
                    .severity(deviation > 40 ? Severity.HIGH : Severity.MEDIUM)
                    .confidence(70)
                    .modelId(config.getId())
                    .campaignId(sample.getCampaignId())
                    .adsetId(sample.getAdsetId())
                    .build());
        }
        return out;
    }
}
