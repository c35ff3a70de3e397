package com.sandy.adpulse.monitor.controller;

import com.sandy.adpulse.monitor.model.MetricSample;
import com.sandy.adpulse.monitor.service.MetricSeriesStore;
import com.sandy.adpulse.monitor.service.impl.MetricIngestionService;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Metric ingestion and series read-out.
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricController {

    private final MetricIngestionService ingestionService;
    private final MetricSeriesStore seriesStore;

    @PostMapping
    public ResponseEntity<IngestResp> ingest(@RequestBody List<MetricSample> samples) {
        IngestResp r = new IngestResp();
        r.setReceived(samples == null ? 0 : samples.size());
        r.setAccepted(ingestionService.ingest(samples));
        return ResponseEntity.ok(r);
    }

    @GetMapping
    public Set<String> metrics() {
        return seriesStore.metrics();
    }

    /**
     * @param since optional lower bound (ISO local date-time); without it the newest {@code limit} points, oldest first
     */
    @GetMapping("/{metric}")
    public List<MetricSample> series(@PathVariable String metric,
                                     @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime since,
                                     @RequestParam(defaultValue = "500") int limit) {
        if (since != null) return seriesStore.findSince(metric, since);
        List<MetricSample> top = new ArrayList<>(seriesStore.findTopN(metric, Math.max(limit, 1)));
        Collections.reverse(top);
        return top;
    }

    @Data
    public static class IngestResp {
        private int received;
        private int accepted;
    }
}
