package com.sandy.adpulse.monitor.detection;

import com.sandy.adpulse.monitor.model.AnomalyRecord;
import com.sandy.adpulse.monitor.model.Impact;
import com.sandy.adpulse.monitor.model.InsightType;
import com.sandy.adpulse.monitor.model.PatternInsight;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives cross-anomaly insights from an anomaly window. Stateless: callers decide which
 * insights are new by comparing ids.
 */
@Component
public class PatternSynthesizer {

    public static final String RECURRING_HOUR_ID = "recurring-hour";
    public static final String SPEND_CONVERSION_ID = "spend-conversion-correlation";
    public static final String WEEKEND_ID = "weekend-pattern";

    private static final Duration CORRELATION_WINDOW = Duration.ofHours(1);

    public List<PatternInsight> synthesize(List<AnomalyRecord> anomalies, LocalDateTime now) {
        List<PatternInsight> insights = new ArrayList<>();
        if (anomalies == null || anomalies.isEmpty()) return insights;
        PatternInsight recurring = recurringHour(anomalies, now);
        if (recurring != null) insights.add(recurring);
        PatternInsight correlation = spendConversionCorrelation(anomalies, now);
        if (correlation != null) insights.add(correlation);
        PatternInsight weekend = weekendPattern(anomalies, now);
        if (weekend != null) insights.add(weekend);
        return insights;
    }

    PatternInsight recurringHour(List<AnomalyRecord> anomalies, LocalDateTime now) {
        Map<Integer, Integer> byHour = new TreeMap<>();
        for (AnomalyRecord a : anomalies) {
            if (a.getTimestamp() == null) continue;
            byHour.merge(a.getTimestamp().getHour(), 1, Integer::sum);
        }
        int peakHour = -1;
        int peakCount = 0;
        // strict '>' keeps the earliest hour on ties
        for (Map.Entry<Integer, Integer> e : byHour.entrySet()) {
            if (e.getValue() > peakCount) {
                peakHour = e.getKey();
                peakCount = e.getValue();
            }
        }
        if (peakCount <= 2) return null;
        LinkedHashSet<String> metrics = new LinkedHashSet<>();
        for (AnomalyRecord a : anomalies) {
            if (a.getTimestamp() != null && a.getTimestamp().getHour() == peakHour) metrics.add(a.getMetric());
        }
        return PatternInsight.builder()
                .id(RECURRING_HOUR_ID)
                .type(InsightType.RECURRING_ANOMALY)
                .title(String.format("Recurring Anomalies at %d:00", peakHour))
                .description(String.format("%d anomalies detected consistently around %d:00. This suggests a systematic issue or external factor.", peakCount, peakHour))
                .confidence(85)
                .metrics(new ArrayList<>(metrics))
                .timeframe("Hourly pattern")
                .actionable(true)
                .recommendation("Review campaign scheduling and bid adjustments for this time period.")
                .impact(Impact.NEGATIVE)
                .discoveredAt(now)
                .build();
    }

    PatternInsight spendConversionCorrelation(List<AnomalyRecord> anomalies, LocalDateTime now) {
        List<AnomalyRecord> spend = new ArrayList<>();
        List<AnomalyRecord> conversions = new ArrayList<>();
        for (AnomalyRecord a : anomalies) {
            if (a.getTimestamp() == null) continue;
            if ("spend".equals(a.getMetric())) spend.add(a);
            else if ("conversions".equals(a.getMetric())) conversions.add(a);
        }
        if (spend.isEmpty() || conversions.isEmpty()) return null;
        int correlated = 0;
        for (AnomalyRecord s : spend) {
            for (AnomalyRecord c : conversions) {
                if (Duration.between(s.getTimestamp(), c.getTimestamp()).abs().compareTo(CORRELATION_WINDOW) < 0) {
                    correlated++;
                    break;
                }
            }
        }
        if (correlated < 2) return null;
        return PatternInsight.builder()
                .id(SPEND_CONVERSION_ID)
                .type(InsightType.PERFORMANCE_CORRELATION)
                .title("Spend-Conversion Correlation Detected")
                .description(String.format("%d instances where spend and conversion anomalies occurred simultaneously.", correlated))
                .confidence(75)
                .metrics(List.of("spend", "conversions"))
                .timeframe("Concurrent events")
                .actionable(true)
                .recommendation("Investigate budget allocation and conversion tracking during anomaly periods.")
                .impact(Impact.NEGATIVE)
                .discoveredAt(now)
                .build();
    }

    PatternInsight weekendPattern(List<AnomalyRecord> anomalies, LocalDateTime now) {
        LinkedHashSet<String> metrics = new LinkedHashSet<>();
        int weekend = 0;
        for (AnomalyRecord a : anomalies) {
            if (a.getTimestamp() == null) continue;
            DayOfWeek day = a.getTimestamp().getDayOfWeek();
            if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
                weekend++;
                metrics.add(a.getMetric());
            }
        }
        if (weekend <= anomalies.size() * 0.4) return null;
        return PatternInsight.builder()
                .id(WEEKEND_ID)
                .type(InsightType.SEASONAL_PATTERN)
                .title("Weekend Performance Pattern")
                .description(String.format("%d%% of anomalies occur on weekends.", Math.round(weekend * 100.0 / anomalies.size())))
                .confidence(80)
                .metrics(new ArrayList<>(metrics))
                .timeframe("Weekly pattern")
                .actionable(true)
                .recommendation("Consider separate bidding strategies for weekdays vs weekends.")
                .impact(Impact.NEUTRAL)
                .discoveredAt(now)
                .build();
    }
}
