package com.sandy.adpulse.monitor.detection;

import com.sandy.adpulse.monitor.model.MetricSample;

import java.util.List;

final class SeriesSupport {

    private SeriesSupport() {
    }

    static double[] values(List<MetricSample> series) {
        double[] values = new double[series.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = series.get(i).getValue();
        }
        return values;
    }
}
