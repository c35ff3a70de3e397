package com.sandy.adpulse.monitor.controller;

import com.sandy.adpulse.monitor.entity.ActiveAlert;
import com.sandy.adpulse.monitor.entity.AlertThreshold;
import com.sandy.adpulse.monitor.model.AlertStatus;
import com.sandy.adpulse.monitor.model.Severity;
import com.sandy.adpulse.monitor.repository.ActiveAlertRepository;
import com.sandy.adpulse.monitor.repository.AlertThresholdRepository;
import com.sandy.adpulse.monitor.service.impl.AlertEngineService;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Alert listing, lifecycle actions and statistics.
 */
@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
public class AlertController {

    private final ActiveAlertRepository alertRepository;
    private final AlertThresholdRepository thresholdRepository;
    private final AlertEngineService alertEngineService;

    /**
     * Without {@code status}: every alert not yet resolved, newest first.
     */
    @GetMapping
    public List<ActiveAlert> list(@RequestParam(required = false) String status) {
        if (status == null || status.isBlank()) {
            return alertRepository.findByStatusNotOrderByTriggeredAtDesc(AlertStatus.RESOLVED);
        }
        return alertRepository.findByStatusOrderByTriggeredAtDesc(AlertStatus.fromCode(status));
    }

    @GetMapping("/recent")
    public List<ActiveAlert> recent() {
        return alertRepository.findTop50ByOrderByTriggeredAtDesc();
    }

    @GetMapping("/stats")
    public Stats stats() {
        Stats s = new Stats();
        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (AlertStatus st : AlertStatus.values()) {
            byStatus.put(st.getCode(), alertRepository.countByStatus(st));
        }
        s.setByStatus(byStatus);
        List<ActiveAlert> open = alertRepository.findByStatusNotOrderByTriggeredAtDesc(AlertStatus.RESOLVED);
        s.setSeverityOpen(countBySeverity(open));
        List<ActiveAlert> recent = alertRepository.findByTriggeredAtAfterOrderByTriggeredAtAsc(LocalDateTime.now().minusHours(24));
        s.setRecent24hCount(recent.size());
        s.setTotalTriggerCount(thresholdRepository.findAll().stream().mapToLong(AlertThreshold::getTriggerCount).sum());
        return s;
    }

    private Map<String, Integer> countBySeverity(List<ActiveAlert> alerts) {
        Map<String, Integer> map = new LinkedHashMap<>();
        for (Severity sev : Severity.values()) map.put(sev.getCode(), 0);
        for (ActiveAlert a : alerts) {
            if (a.getSeverity() == null) continue;
            map.merge(a.getSeverity().getCode(), 1, Integer::sum);
        }
        return map;
    }

    @GetMapping("/{id}")
    public ActiveAlert get(@PathVariable Long id) {
        return alertRepository.findById(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Alert not found: " + id));
    }

    @PostMapping("/{id}/ack")
    public ActiveAlert acknowledge(@PathVariable Long id, @RequestBody(required = false) AckReq req) {
        String by = req == null ? null : req.getAcknowledgedBy();
        ActiveAlert a = alertEngineService.acknowledge(id, by);
        if (a == null) throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Alert not found: " + id);
        return a;
    }

    @PostMapping("/{id}/resolve")
    public ActiveAlert resolve(@PathVariable Long id) {
        ActiveAlert a = alertEngineService.resolve(id);
        if (a == null) throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Alert not found: " + id);
        return a;
    }

    /**
     * Evaluates the queued samples now instead of waiting for the alert loop.
     */
    @PostMapping("/scan")
    public ResponseEntity<ActionResp> manualScan() {
        List<ActiveAlert> created = alertEngineService.drainPending();
        return ResponseEntity.ok(ActionResp.ok("created " + created.size() + " alerts"));
    }

    @Data
    public static class AckReq {
        private String acknowledgedBy;
    }

    @Data
    public static class Stats {
        private Map<String, Long> byStatus;
        private Map<String, Integer> severityOpen;
        private int recent24hCount;
        private long totalTriggerCount;
    }
}
