package com.sandy.adpulse.monitor.service.impl;

import com.sandy.adpulse.monitor.model.MetricSample;
import com.sandy.adpulse.monitor.service.MetricSeriesStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for externally produced samples: appends them to the series store and queues them
 * for the alert loop.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MetricIngestionService {

    private final MetricSeriesStore seriesStore;
    private final AlertEngineService alertEngineService;

    /**
     * Samples without a metric name or with a non-finite value are dropped; a missing timestamp
     * becomes "now".
     * @return number of samples accepted
     */
    public int ingest(List<MetricSample> samples) {
        if (samples == null || samples.isEmpty()) return 0;
        LocalDateTime now = LocalDateTime.now();
        List<MetricSample> accepted = new ArrayList<>(samples.size());
        for (MetricSample s : samples) {
            if (s == null || s.getMetric() == null || s.getMetric().isBlank() || !Double.isFinite(s.getValue())) {
                log.debug("Dropped malformed metric sample {}", s);
                continue;
            }
            accepted.add(s.getTimestamp() != null ? s : MetricSample.builder()
                    .metric(s.getMetric())
                    .value(s.getValue())
                    .timestamp(now)
                    .campaignId(s.getCampaignId())
                    .adsetId(s.getAdsetId())
                    .build());
        }
        if (accepted.isEmpty()) return 0;
        seriesStore.save(accepted);
        alertEngineService.enqueue(accepted);
        log.debug("Ingested {} of {} metric samples", accepted.size(), samples.size());
        return accepted.size();
    }
}
