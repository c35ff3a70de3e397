package com.sandy.adpulse.monitor.controller;

import com.sandy.adpulse.monitor.entity.AbTest;
import com.sandy.adpulse.monitor.model.AbTestStatus;
import com.sandy.adpulse.monitor.service.impl.AbTestService;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/ab-tests")
@RequiredArgsConstructor
public class AbTestController {

    private final AbTestService abTestService;

    @GetMapping
    public List<AbTest> list(@RequestParam(required = false) String status) {
        return abTestService.list(status == null || status.isBlank() ? null : AbTestStatus.fromCode(status));
    }

    @PostMapping
    public ResponseEntity<AbTest> create(@RequestBody AbTest test) {
        return ResponseEntity.status(HttpStatus.CREATED).body(abTestService.create(test));
    }

    @GetMapping("/{id}")
    public AbTest get(@PathVariable String id) {
        return abTestService.find(id).orElseThrow(() -> notFound(id));
    }

    @PostMapping("/{id}/status")
    public AbTest updateStatus(@PathVariable String id, @RequestBody StatusReq req) {
        if (req.getStatus() == null) throw new IllegalArgumentException("status is required");
        return abTestService.updateStatus(id, req.getStatus()).orElseThrow(() -> notFound(id));
    }

    /**
     * Replaces the variant counters and returns the recomputed significance.
     */
    @PutMapping("/{id}/variants/{variantId}/metrics")
    public AbTestService.Evaluation updateVariantMetrics(@PathVariable String id, @PathVariable String variantId,
                                                         @RequestBody VariantMetricsReq req) {
        return abTestService.updateVariantMetrics(id, variantId, req.getImpressions(), req.getClicks(),
                        req.getConversions(), req.getSpend())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Test or variant not found: " + id + "/" + variantId));
    }

    @GetMapping("/{id}/significance")
    public AbTestService.Evaluation significance(@PathVariable String id) {
        return abTestService.significance(id).orElseThrow(() -> notFound(id));
    }

    private ResponseStatusException notFound(String id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "A/B test not found: " + id);
    }

    @Data
    public static class VariantMetricsReq {
        private long impressions;
        private long clicks;
        private long conversions;
        private double spend;
    }

    @Data
    public static class StatusReq {
        private AbTestStatus status;
    }
}
