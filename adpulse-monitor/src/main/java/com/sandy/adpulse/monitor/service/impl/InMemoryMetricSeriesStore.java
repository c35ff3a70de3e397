package com.sandy.adpulse.monitor.service.impl;

import com.sandy.adpulse.monitor.model.MetricSample;
import com.sandy.adpulse.monitor.service.MetricSeriesStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Keeps the newest {@code metrics.store.max-points-per-metric} samples of each metric in memory.
 */
@Service
@Slf4j
public class InMemoryMetricSeriesStore implements MetricSeriesStore {

    private static final Comparator<MetricSample> BY_TIME = Comparator.comparing(MetricSample::getTimestamp);

    // metric -> samples, oldest first
    private final Map<String, Deque<MetricSample>> store = new ConcurrentHashMap<>();

    @Value("${metrics.store.max-points-per-metric:5000}")
    private int maxPointsPerMetric;

    @Override
    public boolean save(List<MetricSample> samples) {
        if (samples == null || samples.isEmpty()) return false;
        for (MetricSample s : samples) {
            Deque<MetricSample> q = store.computeIfAbsent(s.getMetric(), k -> new ArrayDeque<>());
            synchronized (q) {
                MetricSample last = q.peekLast();
                if (last != null && s.getTimestamp().isBefore(last.getTimestamp())) {
                    // late arrival: keep the deque in time order
                    List<MetricSample> sorted = new ArrayList<>(q);
                    sorted.add(s);
                    sorted.sort(BY_TIME);
                    q.clear();
                    q.addAll(sorted);
                } else {
                    q.addLast(s);
                }
                while (q.size() > maxPointsPerMetric) q.pollFirst();
            }
        }
        log.debug("Stored {} metric samples", samples.size());
        return true;
    }

    @Override
    public Optional<MetricSample> findLatest(String metric) {
        Deque<MetricSample> q = store.get(metric);
        if (q == null) return Optional.empty();
        synchronized (q) {
            return Optional.ofNullable(q.peekLast());
        }
    }

    @Override
    public List<MetricSample> findSince(String metric, LocalDateTime since) {
        Deque<MetricSample> q = store.get(metric);
        if (q == null) return Collections.emptyList();
        synchronized (q) {
            return q.stream()
                    .filter(s -> since == null || !s.getTimestamp().isBefore(since))
                    .collect(Collectors.toList());
        }
    }

    /**
     * Newest first; a non-positive {@code limit} yields an empty list.
     */
    @Override
    public List<MetricSample> findTopN(String metric, int limit) {
        Deque<MetricSample> q = store.get(metric);
        if (q == null || limit <= 0) return Collections.emptyList();
        synchronized (q) {
            List<MetricSample> out = new ArrayList<>(Math.min(limit, q.size()));
            Iterator<MetricSample> it = q.descendingIterator();
            while (it.hasNext() && out.size() < limit) out.add(it.next());
            return out;
        }
    }

    @Override
    public Set<String> metrics() {
        return new TreeSet<>(store.keySet());
    }

    @Override
    public void clear() {
        store.clear();
    }
}
