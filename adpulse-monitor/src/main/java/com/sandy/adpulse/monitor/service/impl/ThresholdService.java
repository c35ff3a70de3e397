package com.sandy.adpulse.monitor.service.impl;

import com.sandy.adpulse.monitor.entity.AlertThreshold;
import com.sandy.adpulse.monitor.entity.NotificationChannel;
import com.sandy.adpulse.monitor.model.ThresholdOperator;
import com.sandy.adpulse.monitor.repository.AlertThresholdRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD for alert thresholds. Trigger bookkeeping ({@code lastTriggeredAt}, {@code triggerCount})
 * belongs to the alert engine and is never taken from client input.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ThresholdService {

    private final AlertThresholdRepository thresholdRepository;

    public List<AlertThreshold> list() {
        return thresholdRepository.findAllByOrderByCreatedAtAsc();
    }

    public Optional<AlertThreshold> find(String id) {
        return thresholdRepository.findById(id);
    }

    @Transactional
    public AlertThreshold create(AlertThreshold t) {
        validate(t);
        if (t.getId() == null || t.getId().isBlank()) {
            t.setId("thr-" + UUID.randomUUID().toString().substring(0, 8));
        } else if (thresholdRepository.existsById(t.getId())) {
            throw new IllegalArgumentException("Threshold already exists: " + t.getId());
        }
        LocalDateTime now = LocalDateTime.now();
        t.setTriggerCount(0);
        t.setLastTriggeredAt(null);
        t.setCreatedAt(now);
        t.setUpdatedAt(now);
        List<NotificationChannel> channels = t.getChannels() == null ? List.of() : new ArrayList<>(t.getChannels());
        t.setChannels(new ArrayList<>());
        channels.forEach(c -> {
            c.setId(null);
            t.addChannel(c);
        });
        AlertThreshold saved = thresholdRepository.save(t);
        log.info("Created threshold id={} metric={} operator={} value={} maxValue={} cooldownMin={}",
                saved.getId(), saved.getMetric(), saved.getOperator(), saved.getValue(), saved.getMaxValue(), saved.getCooldownPeriodMinutes());
        return saved;
    }

    @Transactional
    public Optional<AlertThreshold> update(String id, AlertThreshold changes) {
        validate(changes);
        return thresholdRepository.findById(id).map(existing -> {
            existing.setName(changes.getName());
            existing.setDescription(changes.getDescription());
            existing.setMetric(changes.getMetric());
            existing.setOperator(changes.getOperator());
            existing.setValue(changes.getValue());
            existing.setMaxValue(changes.getMaxValue());
            existing.setSeverity(changes.getSeverity());
            existing.setActive(changes.isActive());
            existing.setCooldownPeriodMinutes(changes.getCooldownPeriodMinutes());
            if (changes.getChannels() != null) {
                existing.getChannels().clear();
                changes.getChannels().forEach(c -> {
                    c.setId(null);
                    existing.addChannel(c);
                });
            }
            existing.setUpdatedAt(LocalDateTime.now());
            log.info("Updated threshold id={}", id);
            return thresholdRepository.save(existing);
        });
    }

    @Transactional
    public boolean delete(String id) {
        if (!thresholdRepository.existsById(id)) return false;
        thresholdRepository.deleteById(id);
        log.info("Deleted threshold id={}", id);
        return true;
    }

    /**
     * @throws IllegalArgumentException for a definition the engine could never evaluate as intended
     */
    static void validate(AlertThreshold t) {
        if (t.getMetric() == null || t.getMetric().isBlank()) throw new IllegalArgumentException("metric is required");
        if (t.getOperator() == null) throw new IllegalArgumentException("operator is required");
        if (t.getSeverity() == null) throw new IllegalArgumentException("severity is required");
        if (t.getCooldownPeriodMinutes() < 0) throw new IllegalArgumentException("cooldownPeriodMinutes must not be negative");
        if (t.getOperator() == ThresholdOperator.BETWEEN) {
            if (t.getMaxValue() == null) throw new IllegalArgumentException("between requires maxValue");
            if (t.getMaxValue() < t.getValue()) {
                throw new IllegalArgumentException("maxValue (" + t.getMaxValue() + ") must be >= value (" + t.getValue() + ")");
            }
        }
    }
}
