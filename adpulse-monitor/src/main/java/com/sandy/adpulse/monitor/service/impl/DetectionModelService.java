package com.sandy.adpulse.monitor.service.impl;

import com.sandy.adpulse.monitor.entity.DetectionModelConfig;
import com.sandy.adpulse.monitor.repository.DetectionModelConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Enable/disable and parameter edits for detection model configs. Changes are picked up by the
 * next detection cycle.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DetectionModelService {

    private final DetectionModelConfigRepository modelConfigRepository;

    public List<DetectionModelConfig> list() {
        return modelConfigRepository.findAll().stream()
                .sorted(Comparator.comparing(DetectionModelConfig::getId))
                .collect(Collectors.toList());
    }

    @Transactional
    public Optional<DetectionModelConfig> toggle(String id) {
        return modelConfigRepository.findById(id).map(m -> {
            m.setActive(!m.isActive());
            m.setUpdatedAt(LocalDateTime.now());
            log.info("Detection model id={} active -> {}", id, m.isActive());
            return modelConfigRepository.save(m);
        });
    }

    /**
     * Partial update: null arguments leave the field unchanged; parameters are merged key by key.
     */
    @Transactional
    public Optional<DetectionModelConfig> update(String id, Boolean active, Integer sensitivity,
                                                 Map<String, Double> parameters, Set<String> applicableMetrics) {
        if (sensitivity != null && (sensitivity < 0 || sensitivity > 100)) {
            throw new IllegalArgumentException("sensitivity must be within 0..100: " + sensitivity);
        }
        return modelConfigRepository.findById(id).map(m -> {
            if (active != null) m.setActive(active);
            if (sensitivity != null) m.setSensitivity(sensitivity);
            if (parameters != null) m.getParameters().putAll(parameters);
            if (applicableMetrics != null) m.setApplicableMetrics(new LinkedHashSet<>(applicableMetrics));
            m.setUpdatedAt(LocalDateTime.now());
            log.info("Detection model id={} updated active={} sensitivity={} parameters={}", id, m.isActive(), m.getSensitivity(), m.getParameters());
            return modelConfigRepository.save(m);
        });
    }
}
