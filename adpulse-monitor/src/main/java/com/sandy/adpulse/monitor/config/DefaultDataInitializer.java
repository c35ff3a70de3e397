package com.sandy.adpulse.monitor.config;

import com.sandy.adpulse.monitor.entity.AlertThreshold;
import com.sandy.adpulse.monitor.entity.DetectionModelConfig;
import com.sandy.adpulse.monitor.entity.NotificationChannel;
import com.sandy.adpulse.monitor.model.ChannelType;
import com.sandy.adpulse.monitor.model.DetectionModelType;
import com.sandy.adpulse.monitor.model.Severity;
import com.sandy.adpulse.monitor.model.ThresholdOperator;
import com.sandy.adpulse.monitor.repository.AlertThresholdRepository;
import com.sandy.adpulse.monitor.repository.DetectionModelConfigRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Seeds the stock detection models and alert thresholds into an empty database.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DefaultDataInitializer {

    private final DetectionModelConfigRepository modelConfigRepository;
    private final AlertThresholdRepository thresholdRepository;

    @Value("${seed.defaults:true}")
    private boolean seedDefaults;

    @PostConstruct
    public void init() {
        if (!seedDefaults) return;
        if (modelConfigRepository.count() == 0) {
            List<DetectionModelConfig> models = defaultModels();
            modelConfigRepository.saveAll(models);
            log.info("Seeded {} default detection models", models.size());
        }
        if (thresholdRepository.count() == 0) {
            List<AlertThreshold> thresholds = defaultThresholds();
            thresholdRepository.saveAll(thresholds);
            log.info("Seeded {} default alert thresholds", thresholds.size());
        }
    }

    static List<DetectionModelConfig> defaultModels() {
        LocalDateTime now = LocalDateTime.now();
        return List.of(
                model("statistical-zscore", "Statistical Z-Score", DetectionModelType.STATISTICAL,
                        "Detects anomalies using statistical z-score analysis", true, 75,
                        Map.of("threshold", 2.5, "windowSize", 20.0),
                        List.of("spend", "conversions", "ctr", "roas"), 85, 12, now),
                model("seasonal-arima", "Seasonal ARIMA", DetectionModelType.SEASONAL,
                        "Detects seasonal anomalies and trend changes", true, 80,
                        Map.of("seasonality", 24.0, "trendWindow", 7.0),
                        List.of("impressions", "clicks", "spend"), 78, 15, now),
                // no evaluator is registered for this type; kept so it can be listed and toggled
                model("ml-isolation-forest", "Isolation Forest", DetectionModelType.MACHINE_LEARNING,
                        "ML-based outlier detection using isolation forest", false, 85,
                        Map.of("contamination", 0.1, "nEstimators", 100.0),
                        List.of(DetectionModelConfig.ALL_METRICS), 88, 8, now),
                model("threshold-based", "Dynamic Thresholds", DetectionModelType.THRESHOLD,
                        "Adaptive threshold-based anomaly detection", true, 65,
                        Map.of("adaptiveWindow", 14.0, "thresholdMultiplier", 1.5),
                        List.of("cpm", "cpc", "frequency"), 72, 20, now));
    }

    private static DetectionModelConfig model(String id, String name, DetectionModelType type, String description,
                                              boolean active, int sensitivity, Map<String, Double> params,
                                              List<String> metrics, double accuracy, double fpr, LocalDateTime now) {
        return DetectionModelConfig.builder()
                .id(id)
                .name(name)
                .type(type)
                .description(description)
                .active(active)
                .sensitivity(sensitivity)
                .parameters(new HashMap<>(params))
                .applicableMetrics(new LinkedHashSet<>(metrics))
                .accuracy(accuracy)
                .falsePositiveRate(fpr)
                .lastTrainedAt(now)
                .updatedAt(now)
                .build();
    }

    static List<AlertThreshold> defaultThresholds() {
        LocalDateTime now = LocalDateTime.now();
        AlertThreshold highSpend = threshold("high-spend", "High Daily Spend",
                "Alert when daily spend exceeds budget threshold", "spend", ThresholdOperator.GT, 500,
                Severity.HIGH, 60, now);
        highSpend.addChannel(NotificationChannel.builder()
                .type(ChannelType.EMAIL)
                .target("manager@company.com")
                .active(true)
                .build());
        AlertThreshold lowCtr = threshold("low-ctr", "Low Click-Through Rate",
                "Alert when CTR drops below acceptable threshold", "ctr", ThresholdOperator.LT, 1.0,
                Severity.MEDIUM, 30, now);
        AlertThreshold lowRoas = threshold("low-roas", "Low Return on Ad Spend",
                "Alert when ROAS falls below profitability threshold", "roas", ThresholdOperator.LT, 2.0,
                Severity.CRITICAL, 15, now);
        return List.of(highSpend, lowCtr, lowRoas);
    }

    private static AlertThreshold threshold(String id, String name, String description, String metric,
                                            ThresholdOperator op, double value, Severity severity,
                                            int cooldownMinutes, LocalDateTime now) {
        return AlertThreshold.builder()
                .id(id)
                .name(name)
                .description(description)
                .metric(metric)
                .operator(op)
                .value(value)
                .severity(severity)
                .active(true)
                .cooldownPeriodMinutes(cooldownMinutes)
                .triggerCount(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
