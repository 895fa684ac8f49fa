package com.sifinder.service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out monotonically increasing request generations per slot. Only the latest generation of
 * a slot is current; anything older has been superseded.
 */
public class GenerationTracker {
    private final ConcurrentMap<String, AtomicLong> latest = new ConcurrentHashMap<>();

    public long next(String slot) {
        return latest.computeIfAbsent(slot, unused -> new AtomicLong()).incrementAndGet();
    }

    public long current(String slot) {
        AtomicLong generation = latest.get(slot);
        return generation == null ? 0L : generation.get();
    }

    public boolean isCurrent(String slot, long generation) {
        return generation > 0 && current(slot) == generation;
    }
}
