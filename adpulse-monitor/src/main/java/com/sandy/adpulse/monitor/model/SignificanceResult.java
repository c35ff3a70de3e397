package com.sandy.adpulse.monitor.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a two-variant significance evaluation. Derived on demand, never stored.
 */
@Value
@Builder(toBuilder = true)
public class SignificanceResult {
    double confidence;
    double power;
    double minDetectableEffectPct;
    /** Null until both a control and a treatment are present. */
    Double currentPValue;
    Double zScore;
    boolean significant;
    /** Only set when {@link #significant}. */
    String winningVariantId;
    long requiredSampleSize;
    long currentSampleSize;

    public double getSampleProgressPct() {
        return requiredSampleSize <= 0 ? 0 : (currentSampleSize * 100.0) / requiredSampleSize;
    }
}
