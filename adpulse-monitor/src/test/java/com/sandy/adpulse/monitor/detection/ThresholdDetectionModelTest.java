package com.sandy.adpulse.monitor.detection;

import com.sandy.adpulse.monitor.entity.DetectionModelConfig;
import com.sandy.adpulse.monitor.model.AnomalyRecord;
import com.sandy.adpulse.monitor.model.AnomalyType;
import com.sandy.adpulse.monitor.model.DetectionModelType;
import com.sandy.adpulse.monitor.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.sandy.adpulse.monitor.detection.SeriesFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ThresholdDetectionModelTest {

    private final ThresholdDetectionModel model = new ThresholdDetectionModel();
    private final DetectionModelConfig config = config("threshold-based", DetectionModelType.THRESHOLD,
            Map.of("adaptiveWindow", 14.0, "thresholdMultiplier", 1.5), "cpm");

    @Test
    void pointFarAboveMovingAverageIsOutlier() {
        List<AnomalyRecord> out = model.evaluate("cpm", hourly("cpm", START, flatThen(20, 10, 100)), config);
        assertEquals(1, out.size());
        AnomalyRecord a = out.get(0);
        assertEquals(AnomalyType.OUTLIER, a.getAnomalyType());
        assertEquals((13 * 10 + 100) / 14.0, a.getExpectedValue(), 1e-9);
        assertEquals(Severity.HIGH, a.getSeverity());
        assertEquals(70d, a.getConfidence());
    }

    @Test
    void pointsBeforeFullWindowAreSkipped() {
        double[] values = flatThen(20, 10);
        values[3] = 500;
        assertTrue(model.evaluate("cpm", hourly("cpm", START, values), config).isEmpty());
    }

    @Test
    void modestSwingStaysInsideBand() {
        assertTrue(model.evaluate("cpm", hourly("cpm", START, flatThen(20, 10, 20)), config).isEmpty());
    }
}
