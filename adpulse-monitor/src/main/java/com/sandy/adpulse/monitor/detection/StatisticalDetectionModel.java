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
 * Z-score outliers over the whole series. The expected value of a flagged point is the
 * mean of the {@value #CONTEXT_POINTS} points before it.
 */
@Component
public class StatisticalDetectionModel implements DetectionModel {

    static final int CONTEXT_POINTS = 10;
    private static final double DEFAULT_THRESHOLD = 2.5;

    @Override
    public DetectionModelType type() {
        return DetectionModelType.STATISTICAL;
    }

    @Override
    public List<AnomalyRecord> evaluate(String metric, List<MetricSample> series, DetectionModelConfig config) {
        double[] values = SeriesSupport.values(series);
        boolean[] outliers = StatSupport.detectOutliers(values, config.param("threshold", DEFAULT_THRESHOLD));
        List<AnomalyRecord> out = new ArrayList<>();
        // first CONTEXT_POINTS + 1 points are warm-up
        for (int i = CONTEXT_POINTS + 1; i < values.length; i++) {
            if (!outliers[i]) continue;
            double current = values[i];
            double expected = 0d;
            for (int j = i - CONTEXT_POINTS; j < i; j++) expected += values[j];
            expected /= CONTEXT_POINTS;
            double deviation = StatSupport.deviationPercent(current, expected);
            MetricSample sample = series.get(i);
            out.add(AnomalyRecord.builder()
                    .timestamp(sample.getTimestamp())
                    .metric(metric)
                    .value(current)
                    .expectedValue(expected)
                    .deviationScorePct(deviation)
                    .anomalyType(current > expected ? AnomalyType.SPIKE : AnomalyType.DROP)
                    .severity(severityOf(deviation))
                    .confidence(Math.min(95, 60 + (deviation / 100) * 35))
                    .modelId(config.getId())
                    .campaignId(sample.getCampaignId())
                    .adsetId(sample.getAdsetId())
                    .build());
        }
        return out;
    }

    static Severity severityOf(double deviationPct) {
        if (deviationPct > 50) return Severity.CRITICAL;
        if (deviationPct > 30) return Severity.HIGH;
        if (deviationPct > 15) return Severity.MEDIUM;
        return Severity.LOW;
    }
}
