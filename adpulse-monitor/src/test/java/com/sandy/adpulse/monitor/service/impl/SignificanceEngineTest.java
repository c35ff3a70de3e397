package com.sandy.adpulse.monitor.service.impl;

import com.sandy.adpulse.monitor.entity.AbTest;
import com.sandy.adpulse.monitor.entity.AbTestVariant;
import com.sandy.adpulse.monitor.model.AbTestAlert;
import com.sandy.adpulse.monitor.model.AbTestStatus;
import com.sandy.adpulse.monitor.model.SignificanceResult;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SignificanceEngineTest {

    private final SignificanceEngine engine = new SignificanceEngine();

    private static AbTest test(AbTestStatus status, AbTestVariant... variants) {
        AbTest t = AbTest.builder().id("t1").name("Headline test").status(status).build();
        for (AbTestVariant v : variants) t.addVariant(v);
        return t;
    }

    private static AbTestVariant variant(String id, boolean control, long impressions, long clicks) {
        return AbTestVariant.builder().id(id).name(id).control(control).impressions(impressions).clicks(clicks).build();
    }

    @Test
    void significantDifferencePicksHigherRate() {
        AbTest t = test(AbTestStatus.RUNNING, variant("a", true, 1000, 50), variant("b", false, 1000, 80));
        SignificanceResult r = engine.evaluate(t);
        assertTrue(r.isSignificant());
        assertEquals("b", r.getWinningVariantId());
        assertNotNull(r.getCurrentPValue());
        assertTrue(r.getCurrentPValue() < 0.05);
        assertEquals(2000, r.getCurrentSampleSize());
        assertEquals(1000, r.getRequiredSampleSize());
        assertEquals(200d, r.getSampleProgressPct(), 1e-9);
        assertEquals(95d, r.getConfidence());
    }

    @Test
    void identicalInputsGiveIdenticalResults() {
        AbTest t = test(AbTestStatus.RUNNING, variant("a", true, 1234, 61), variant("b", false, 1190, 75));
        SignificanceResult first = engine.evaluate(t);
        SignificanceResult second = engine.evaluate(t);
        assertEquals(first, second);
        assertEquals(Double.doubleToLongBits(first.getCurrentPValue()), Double.doubleToLongBits(second.getCurrentPValue()));
    }

    @Test
    void insignificantResultHasNoWinner() {
        SignificanceResult r = engine.evaluate(test(AbTestStatus.RUNNING, variant("a", true, 1000, 50), variant("b", false, 1000, 52)));
        assertFalse(r.isSignificant());
        assertNull(r.getWinningVariantId());
        assertNotNull(r.getCurrentPValue());
    }

    @Test
    void ambiguousControlGivesDefaultResult() {
        SignificanceResult twoControls = engine.evaluate(test(AbTestStatus.RUNNING, variant("a", true, 100, 5), variant("b", true, 100, 9)));
        assertFalse(twoControls.isSignificant());
        assertNull(twoControls.getCurrentPValue());

        SignificanceResult single = engine.evaluate(test(AbTestStatus.RUNNING, variant("a", true, 100, 5)));
        assertNull(single.getCurrentPValue());
        assertEquals(100, single.getCurrentSampleSize());
    }

    @Test
    void alertsFollowResult() {
        LocalDateTime now = LocalDateTime.of(2024, 3, 4, 12, 0);
        AbTest losing = test(AbTestStatus.RUNNING, variant("a", true, 1000, 100), variant("b", false, 1000, 50));
        List<AbTestAlert> alerts = engine.alerts(losing, engine.evaluate(losing), now);
        assertTrue(alerts.stream().anyMatch(a -> a.getKind() == AbTestAlert.Kind.SIGNIFICANCE && a.getLevel() == AbTestAlert.Level.INFO
                && a.getMessage().endsWith("Winning variant: a")));
        AbTestAlert perf = alerts.stream().filter(a -> a.getKind() == AbTestAlert.Kind.PERFORMANCE).findFirst().orElseThrow();
        assertEquals(AbTestAlert.Level.CRITICAL, perf.getLevel());
        assertEquals("Treatment variant showing 50.0% performance drop", perf.getMessage());

        AbTest flat = test(AbTestStatus.RUNNING, variant("a", true, 1000, 50), variant("b", false, 1000, 52));
        List<AbTestAlert> flatAlerts = engine.alerts(flat, engine.evaluate(flat), now);
        assertEquals(1, flatAlerts.size());
        assertEquals(AbTestAlert.Kind.SAMPLE_SIZE, flatAlerts.get(0).getKind());
        assertEquals(AbTestAlert.Level.WARNING, flatAlerts.get(0).getLevel());
    }

    @Test
    void pausedTestGetsNoSignificanceAlert() {
        AbTest t = test(AbTestStatus.PAUSED, variant("a", true, 1000, 50), variant("b", false, 1000, 80));
        assertTrue(engine.alerts(t, engine.evaluate(t), LocalDateTime.now()).isEmpty());
    }
}
