package com.sandy.adpulse.monitor.controller;

import com.sandy.adpulse.monitor.service.impl.MonitoringScheduler;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/monitoring")
@RequiredArgsConstructor
public class MonitoringController {

    private final MonitoringScheduler monitoringScheduler;

    @GetMapping("/status")
    public MonitoringScheduler.Status status() {
        return monitoringScheduler.status();
    }

    @PostMapping("/start")
    public ResponseEntity<ActionResp> start() {
        return ResponseEntity.ok(monitoringScheduler.start() ? ActionResp.ok("started") : ActionResp.ok("already running"));
    }

    @PostMapping("/stop")
    public ResponseEntity<ActionResp> stop() {
        return ResponseEntity.ok(monitoringScheduler.stop() ? ActionResp.ok("stopped") : ActionResp.ok("not running"));
    }
}
