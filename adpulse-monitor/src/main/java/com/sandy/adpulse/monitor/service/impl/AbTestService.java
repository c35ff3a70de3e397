package com.sandy.adpulse.monitor.service.impl;

import com.sandy.adpulse.monitor.entity.AbTest;
import com.sandy.adpulse.monitor.entity.AbTestVariant;
import com.sandy.adpulse.monitor.model.AbTestAlert;
import com.sandy.adpulse.monitor.model.AbTestStatus;
import com.sandy.adpulse.monitor.model.SignificanceResult;
import com.sandy.adpulse.monitor.repository.AbTestRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Experiment bookkeeping. The significance result is derived from the stored variant counts
 * whenever it is read.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AbTestService {

    private final AbTestRepository abTestRepository;
    private final SignificanceEngine significanceEngine;

    /**
     * @param status optional filter, null lists every test
     */
    public List<AbTest> list(AbTestStatus status) {
        return status == null ? abTestRepository.findAll() : abTestRepository.findByStatus(status);
    }

    public Optional<AbTest> find(String id) {
        return abTestRepository.findById(id);
    }

    @Transactional
    public AbTest create(AbTest test) {
        if (test.getName() == null || test.getName().isBlank()) {
            throw new IllegalArgumentException("Test name is required");
        }
        if (test.getConfidence() <= 0 || test.getConfidence() >= 100) {
            throw new IllegalArgumentException("confidence must be between 0 and 100: " + test.getConfidence());
        }
        if (test.getId() == null || test.getId().isBlank()) {
            test.setId("ab-" + UUID.randomUUID().toString().substring(0, 8));
        }
        if (test.getStatus() == null) test.setStatus(AbTestStatus.DRAFT);
        if (test.getStatus() == AbTestStatus.RUNNING && test.getStartDate() == null) {
            test.setStartDate(LocalDateTime.now());
        }
        if (test.getVariants() == null) test.setVariants(new ArrayList<>());
        Set<String> ids = new HashSet<>();
        int idx = 0;
        for (AbTestVariant v : test.getVariants()) {
            if (v.getId() == null || v.getId().isBlank()) v.setId(test.getId() + "-v" + idx);
            if (!ids.add(v.getId())) throw new IllegalArgumentException("Duplicate variant id: " + v.getId());
            v.setTest(test);
            idx++;
        }
        test.setLastUpdate(LocalDateTime.now());
        AbTest saved = abTestRepository.save(test);
        log.info("Created A/B test id={} name={} variants={} status={}", saved.getId(), saved.getName(),
                saved.getVariants().size(), saved.getStatus());
        return saved;
    }

    @Transactional
    public Optional<AbTest> updateStatus(String id, AbTestStatus status) {
        return abTestRepository.findById(id).map(t -> {
            t.setStatus(status);
            if (status == AbTestStatus.RUNNING && t.getStartDate() == null) t.setStartDate(LocalDateTime.now());
            t.setLastUpdate(LocalDateTime.now());
            log.info("A/B test id={} status -> {}", id, status);
            return abTestRepository.save(t);
        });
    }

    /**
     * Replaces the variant's counters with the given snapshot.
     * @return empty when the test or the variant does not exist
     */
    @Transactional
    public Optional<Evaluation> updateVariantMetrics(String testId, String variantId,
                                                     long impressions, long clicks, long conversions, double spend) {
        if (impressions < 0 || clicks < 0 || conversions < 0 || spend < 0) {
            throw new IllegalArgumentException("Variant metrics must not be negative");
        }
        Optional<AbTest> opt = abTestRepository.findById(testId);
        if (opt.isEmpty()) return Optional.empty();
        AbTest test = opt.get();
        Optional<AbTestVariant> variant = test.getVariants().stream().filter(v -> v.getId().equals(variantId)).findFirst();
        if (variant.isEmpty()) return Optional.empty();
        AbTestVariant v = variant.get();
        v.setImpressions(impressions);
        v.setClicks(clicks);
        v.setConversions(conversions);
        v.setSpend(spend);
        test.setLastUpdate(LocalDateTime.now());
        AbTest saved = abTestRepository.save(test);
        Evaluation eval = evaluate(saved);
        log.debug("Variant metrics updated test={} variant={} pValue={} significant={}", testId, variantId,
                eval.getResult().getCurrentPValue(), eval.getResult().isSignificant());
        return Optional.of(eval);
    }

    public Optional<Evaluation> significance(String testId) {
        return abTestRepository.findById(testId).map(this::evaluate);
    }

    private Evaluation evaluate(AbTest test) {
        SignificanceResult result = significanceEngine.evaluate(test);
        List<AbTestAlert> alerts = significanceEngine.alerts(test, result, LocalDateTime.now());
        return new Evaluation(test.getId(), result, alerts);
    }

    @lombok.Value
    public static class Evaluation {
        String testId;
        SignificanceResult result;
        List<AbTestAlert> alerts;
    }
}
