package com.sandy.adpulse.monitor.controller;

import com.sandy.adpulse.monitor.entity.AlertThreshold;
import com.sandy.adpulse.monitor.service.impl.ThresholdService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * Alert threshold CRUD. Invalid definitions are rejected with 400 by {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/api/thresholds")
@RequiredArgsConstructor
public class ThresholdController {

    private final ThresholdService thresholdService;

    @GetMapping
    public List<AlertThreshold> list() {
        return thresholdService.list();
    }

    @GetMapping("/{id}")
    public AlertThreshold get(@PathVariable String id) {
        return thresholdService.find(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Threshold not found: " + id));
    }

    @PostMapping
    public ResponseEntity<AlertThreshold> create(@RequestBody AlertThreshold threshold) {
        return ResponseEntity.status(HttpStatus.CREATED).body(thresholdService.create(threshold));
    }

    @PutMapping("/{id}")
    public AlertThreshold update(@PathVariable String id, @RequestBody AlertThreshold threshold) {
        return thresholdService.update(id, threshold)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Threshold not found: " + id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ActionResp> delete(@PathVariable String id) {
        if (!thresholdService.delete(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Threshold not found: " + id);
        }
        return ResponseEntity.ok(ActionResp.ok());
    }
}
