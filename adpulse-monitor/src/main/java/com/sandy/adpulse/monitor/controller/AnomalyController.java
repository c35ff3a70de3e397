package com.sandy.adpulse.monitor.controller;

import com.sandy.adpulse.monitor.entity.DetectionModelConfig;
import com.sandy.adpulse.monitor.model.AnomalyRecord;
import com.sandy.adpulse.monitor.model.AnomalyType;
import com.sandy.adpulse.monitor.model.PatternInsight;
import com.sandy.adpulse.monitor.model.Severity;
import com.sandy.adpulse.monitor.service.impl.AnomalyDetectionService;
import com.sandy.adpulse.monitor.service.impl.DetectionModelService;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/api/anomalies")
@RequiredArgsConstructor
public class AnomalyController {

    private final AnomalyDetectionService anomalyDetectionService;
    private final DetectionModelService detectionModelService;

    @GetMapping
    public List<AnomalyRecord> list(@RequestParam(required = false) String severity,
                                    @RequestParam(required = false) String type,
                                    @RequestParam(required = false) String search) {
        Severity sev = severity == null || severity.isBlank() || "all".equalsIgnoreCase(severity) ? null : Severity.fromCode(severity);
        AnomalyType at = type == null || type.isBlank() || "all".equalsIgnoreCase(type) ? null : AnomalyType.fromCode(type);
        return anomalyDetectionService.getHistory(sev, at, search);
    }

    @GetMapping("/patterns")
    public List<PatternInsight> patterns() {
        return anomalyDetectionService.getPatterns();
    }

    /**
     * Runs one detection cycle immediately, whether or not monitoring is started.
     */
    @PostMapping("/scan")
    public ScanResp scan() {
        AnomalyDetectionService.CycleResult r = anomalyDetectionService.runCycle();
        ScanResp resp = new ScanResp();
        resp.setRanAt(r.ranAt());
        resp.setCandidates(r.candidateCount());
        resp.setNewAnomalies(r.newAnomalies());
        resp.setNewPatterns(r.newPatterns());
        return resp;
    }

    @GetMapping("/models")
    public List<DetectionModelConfig> models() {
        return detectionModelService.list();
    }

    @PutMapping("/models/{id}")
    public DetectionModelConfig updateModel(@PathVariable String id, @RequestBody ModelUpdateReq req) {
        return detectionModelService.update(id, req.getActive(), req.getSensitivity(), req.getParameters(), req.getApplicableMetrics())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Model not found: " + id));
    }

    @PostMapping("/models/{id}/toggle")
    public DetectionModelConfig toggleModel(@PathVariable String id) {
        return detectionModelService.toggle(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Model not found: " + id));
    }

    @Data
    public static class ScanResp {
        private LocalDateTime ranAt;
        private int candidates;
        private List<AnomalyRecord> newAnomalies;
        private List<PatternInsight> newPatterns;
    }

    @Data
    public static class ModelUpdateReq {
        private Boolean active;
        private Integer sensitivity;
        private Map<String, Double> parameters;
        private Set<String> applicableMetrics;
    }
}
