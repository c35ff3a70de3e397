package com.sandy.adpulse.monitor.detection;

import com.sandy.adpulse.monitor.model.AnomalyRecord;
import com.sandy.adpulse.monitor.model.AnomalyType;
import com.sandy.adpulse.monitor.model.Impact;
import com.sandy.adpulse.monitor.model.InsightType;
import com.sandy.adpulse.monitor.model.PatternInsight;
import com.sandy.adpulse.monitor.model.Severity;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PatternSynthesizerTest {

    // 2024-03-04 is a Monday
    private static final LocalDateTime MONDAY = LocalDateTime.of(2024, 3, 4, 0, 0);
    private static final LocalDateTime SATURDAY = LocalDateTime.of(2024, 3, 9, 0, 0);

    private final PatternSynthesizer synthesizer = new PatternSynthesizer();

    private static AnomalyRecord at(String metric, LocalDateTime ts) {
        return AnomalyRecord.builder().metric(metric).timestamp(ts).anomalyType(AnomalyType.SPIKE).severity(Severity.HIGH).build();
    }

    private static Optional<PatternInsight> byId(List<PatternInsight> insights, String id) {
        return insights.stream().filter(i -> id.equals(i.getId())).findFirst();
    }

    @Test
    void recurringHourNeedsMoreThanTwo() {
        List<AnomalyRecord> two = List.of(at("spend", MONDAY.withHour(14)), at("ctr", MONDAY.plusDays(1).withHour(14)));
        assertTrue(byId(synthesizer.synthesize(two, MONDAY), PatternSynthesizer.RECURRING_HOUR_ID).isEmpty());

        List<AnomalyRecord> three = List.of(
                at("spend", MONDAY.withHour(14).withMinute(5)),
                at("ctr", MONDAY.plusDays(1).withHour(14).withMinute(30)),
                at("spend", MONDAY.plusDays(2).withHour(14)),
                at("roas", MONDAY.withHour(9)));
        PatternInsight p = byId(synthesizer.synthesize(three, MONDAY), PatternSynthesizer.RECURRING_HOUR_ID).orElseThrow();
        assertEquals(InsightType.RECURRING_ANOMALY, p.getType());
        assertEquals(85d, p.getConfidence());
        assertEquals("Recurring Anomalies at 14:00", p.getTitle());
        assertEquals(List.of("spend", "ctr"), p.getMetrics());
        assertEquals(Impact.NEGATIVE, p.getImpact());
    }

    @Test
    void spendConversionPairsWithinAnHour() {
        List<AnomalyRecord> anomalies = List.of(
                at("spend", MONDAY.withHour(8)),
                at("conversions", MONDAY.withHour(8).withMinute(40)),
                at("spend", MONDAY.withHour(18)),
                at("conversions", MONDAY.withHour(17).withMinute(30)));
        PatternInsight p = byId(synthesizer.synthesize(anomalies, MONDAY), PatternSynthesizer.SPEND_CONVERSION_ID).orElseThrow();
        assertEquals(InsightType.PERFORMANCE_CORRELATION, p.getType());
        assertEquals(75d, p.getConfidence());
    }

    @Test
    void singleSpendConversionPairIsNotEnough() {
        List<AnomalyRecord> anomalies = List.of(
                at("spend", MONDAY.withHour(8)),
                at("conversions", MONDAY.withHour(8).withMinute(40)),
                at("spend", MONDAY.withHour(18)));
        assertTrue(byId(synthesizer.synthesize(anomalies, MONDAY), PatternSynthesizer.SPEND_CONVERSION_ID).isEmpty());
    }

    @Test
    void weekendShareAboveFortyPercent() {
        List<AnomalyRecord> anomalies = List.of(
                at("spend", SATURDAY.withHour(1)),
                at("ctr", SATURDAY.plusDays(1).withHour(2)),
                at("spend", MONDAY.withHour(3)),
                at("roas", MONDAY.withHour(4)),
                at("spend", MONDAY.withHour(5)));
        assertTrue(byId(synthesizer.synthesize(anomalies, MONDAY), PatternSynthesizer.WEEKEND_ID).isEmpty(), "exactly 40% is not enough");

        List<AnomalyRecord> more = List.of(
                at("spend", SATURDAY.withHour(1)),
                at("ctr", SATURDAY.plusDays(1).withHour(2)),
                at("spend", SATURDAY.withHour(6)),
                at("roas", MONDAY.withHour(4)),
                at("spend", MONDAY.withHour(5)));
        PatternInsight p = byId(synthesizer.synthesize(more, MONDAY), PatternSynthesizer.WEEKEND_ID).orElseThrow();
        assertEquals(InsightType.SEASONAL_PATTERN, p.getType());
        assertEquals(80d, p.getConfidence());
        assertEquals("60% of anomalies occur on weekends.", p.getDescription());
    }

    @Test
    void emptyHistoryYieldsNothing() {
        assertTrue(synthesizer.synthesize(List.of(), MONDAY).isEmpty());
    }
}
