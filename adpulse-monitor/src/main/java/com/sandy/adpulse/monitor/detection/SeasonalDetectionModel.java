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
 * Trend changes of the moving average; each change point is compared with the point before it.
 */
@Component
public class SeasonalDetectionModel implements DetectionModel {

    private static final int DEFAULT_TREND_WINDOW = 10;

    @Override
    public DetectionModelType type() {
        return DetectionModelType.SEASONAL;
    }

    @Override
    public List<AnomalyRecord> evaluate(String metric, List<MetricSample> series, DetectionModelConfig config) {
        double[] values = SeriesSupport.values(series);
        int window = (int) config.param("trendWindow", DEFAULT_TREND_WINDOW);
        StatSupport.TrendChanges changes = StatSupport.detectTrendChange(values, window);
        List<AnomalyRecord> out = new ArrayList<>();
        for (int point : changes.changePoints()) {
            if (point <= 0 || point >= values.length - 1) continue;
            double current = values[point];
            double expected = values[point - 1];
            double deviation = StatSupport.deviationPercent(current, expected);
            MetricSample sample = series.get(point);
            out.add(AnomalyRecord.builder()
                    .timestamp(sample.getTimestamp())
                    .metric(metric)
                    .value(current)
                    .expectedValue(expected)
                    .deviationScorePct(deviation)
                    .anomalyType(AnomalyType.TREND_CHANGE)
                    .severity(deviation > 25 ? Severity.HIGH : Severity.MEDIUM)
                    .confidence(75)
                    .modelId(config.getId())
                    .campaignId(sample.getCampaignId())
                    .adsetId(sample.getAdsetId())
                    .build());
        }
        return out;
    }
}
