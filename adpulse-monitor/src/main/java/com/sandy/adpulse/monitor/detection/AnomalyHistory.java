package com.sandy.adpulse.monitor.detection;

import com.sandy.adpulse.monitor.model.AnomalyRecord;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fixed-capacity ring buffer of accepted anomalies. Adding to a full buffer overwrites the oldest entry.
 * Not thread-safe; the owning service serializes access.
 */
public class AnomalyHistory {

    private final AnomalyRecord[] slots;
    /** Index of the next write. */
    private int head;
    private int size;

    public AnomalyHistory(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive: " + capacity);
        this.slots = new AnomalyRecord[capacity];
    }

    public void add(AnomalyRecord record) {
        slots[head] = record;
        head = (head + 1) % slots.length;
        if (size < slots.length) size++;
    }

    /** Newest first. */
    public List<AnomalyRecord> snapshot() {
        List<AnomalyRecord> out = new ArrayList<>(size);
        for (int i = 1; i <= size; i++) {
            out.add(slots[Math.floorMod(head - i, slots.length)]);
        }
        return out;
    }

    /**
     * True when a record for the same metric lies strictly within {@code window} of the candidate.
     */
    public boolean containsNear(AnomalyRecord candidate, Duration window) {
        for (int i = 1; i <= size; i++) {
            AnomalyRecord existing = slots[Math.floorMod(head - i, slots.length)];
            if (isNear(existing, candidate, window)) return true;
        }
        return false;
    }

    static boolean isNear(AnomalyRecord a, AnomalyRecord b, Duration window) {
        if (!a.getMetric().equals(b.getMetric())) return false;
        if (a.getTimestamp() == null || b.getTimestamp() == null) return false;
        return Duration.between(a.getTimestamp(), b.getTimestamp()).abs().compareTo(window) < 0;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return slots.length;
    }

    public void clear() {
        Arrays.fill(slots, null);
        head = 0;
        size = 0;
    }
}
