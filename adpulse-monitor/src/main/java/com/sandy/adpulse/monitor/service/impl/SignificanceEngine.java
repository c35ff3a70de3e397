package com.sandy.adpulse.monitor.service.impl;

import com.sandy.adpulse.monitor.entity.AbTest;
import com.sandy.adpulse.monitor.entity.AbTestVariant;
import com.sandy.adpulse.monitor.model.AbTestAlert;
import com.sandy.adpulse.monitor.model.AbTestStatus;
import com.sandy.adpulse.monitor.model.SignificanceResult;
import com.sandy.adpulse.monitor.tools.StatSupport;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Two-variant click-through significance. Stateless; every call recomputes from the raw counts,
 * so identical inputs give identical results.
 */
@Component
public class SignificanceEngine {

    /** Relative CTR drop of the treatment, in percent, that raises a performance alert. */
    static final double PERFORMANCE_DROP_PCT = 20;

    public SignificanceResult evaluate(AbTest test) {
        SignificanceResult.SignificanceResultBuilder base = SignificanceResult.builder()
                .confidence(test.getConfidence())
                .power(test.getPower())
                .minDetectableEffectPct(test.getMinDetectableEffectPct())
                .requiredSampleSize(test.getRequiredSampleSize())
                .significant(false);
        List<AbTestVariant> variants = test.getVariants() == null ? List.of() : test.getVariants();
        AbTestVariant control = controlOf(variants);
        AbTestVariant treatment = treatmentOf(variants);
        if (control == null || treatment == null) {
            long total = variants.stream().mapToLong(AbTestVariant::getImpressions).sum();
            return base.currentSampleSize(total).build();
        }
        StatSupport.ZTestResult z = StatSupport.twoProportionZTest(
                control.getClicks(), control.getImpressions(), treatment.getClicks(), treatment.getImpressions());
        boolean significant = z.pValue() < (1 - test.getConfidence() / 100.0);
        String winner = null;
        if (significant) {
            winner = treatment.clickRate() > control.clickRate() ? treatment.getId() : control.getId();
        }
        return base
                .currentPValue(z.pValue())
                .zScore(z.zScore())
                .significant(significant)
                .winningVariantId(winner)
                .currentSampleSize(control.getImpressions() + treatment.getImpressions())
                .build();
    }

    /**
     * Exactly one control is required; anything else has no defined control.
     */
    static AbTestVariant controlOf(List<AbTestVariant> variants) {
        List<AbTestVariant> controls = variants.stream().filter(AbTestVariant::isControl).collect(Collectors.toList());
        return controls.size() == 1 ? controls.get(0) : null;
    }

    /** First non-control by id. */
    static AbTestVariant treatmentOf(List<AbTestVariant> variants) {
        return variants.stream()
                .filter(v -> !v.isControl())
                .min(Comparator.comparing(AbTestVariant::getId, Comparator.nullsLast(Comparator.<String>naturalOrder())))
                .orElse(null);
    }

    public List<AbTestAlert> alerts(AbTest test, SignificanceResult result, LocalDateTime now) {
        List<AbTestAlert> alerts = new ArrayList<>();
        if (result.isSignificant() && test.getStatus() == AbTestStatus.RUNNING) {
            alerts.add(AbTestAlert.builder()
                    .kind(AbTestAlert.Kind.SIGNIFICANCE)
                    .level(AbTestAlert.Level.INFO)
                    .message("Test has reached statistical significance! Winning variant: " + result.getWinningVariantId())
                    .timestamp(now)
                    .build());
        }
        if (!result.isSignificant() && result.getCurrentSampleSize() >= result.getRequiredSampleSize()) {
            alerts.add(AbTestAlert.builder()
                    .kind(AbTestAlert.Kind.SAMPLE_SIZE)
                    .level(AbTestAlert.Level.WARNING)
                    .message("Required sample size reached but no significant difference detected")
                    .timestamp(now)
                    .build());
        }
        List<AbTestVariant> variants = test.getVariants() == null ? List.of() : test.getVariants();
        AbTestVariant control = controlOf(variants);
        AbTestVariant treatment = treatmentOf(variants);
        if (control != null && treatment != null) {
            double controlCtr = control.clickRate();
            double treatCtr = treatment.clickRate();
            double dropPct = controlCtr > 0 ? (controlCtr - treatCtr) / controlCtr * 100 : 0;
            if (dropPct > PERFORMANCE_DROP_PCT) {
                alerts.add(AbTestAlert.builder()
                        .kind(AbTestAlert.Kind.PERFORMANCE)
                        .level(AbTestAlert.Level.CRITICAL)
                        .message(String.format(Locale.ROOT, "Treatment variant showing %.1f%% performance drop", dropPct))
                        .timestamp(now)
                        .build());
            }
        }
        return alerts;
    }
}
