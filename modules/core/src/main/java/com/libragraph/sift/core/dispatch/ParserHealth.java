package com.libragraph.sift.core.dispatch;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-session fault counters and the set of poisoned variants.
 * A poisoned variant is skipped for the rest of the session.
 */
public final class ParserHealth {

    private final int poisonThreshold;
    private final Map<String, AtomicInteger> faults = new ConcurrentHashMap<>();
    private final Set<String> poisoned = ConcurrentHashMap.newKeySet();

    public ParserHealth(int poisonThreshold) {
        if (poisonThreshold < 1) {
            throw new IllegalArgumentException("poisonThreshold must be at least 1");
        }
        this.poisonThreshold = poisonThreshold;
    }

    public boolean isPoisoned(String parserId) {
        return poisoned.contains(parserId);
    }

    /**
     * Counts one unexpected fault.
     *
     * @return true if this fault crossed the threshold and poisoned the variant
     */
    public boolean recordFault(String parserId) {
        int count = faults.computeIfAbsent(parserId, id -> new AtomicInteger()).incrementAndGet();
        return count >= poisonThreshold && poisoned.add(parserId);
    }

    /**
     * Poisons immediately.
     *
     * @return true if the variant was not poisoned before
     */
    public boolean poison(String parserId) {
        return poisoned.add(parserId);
    }

    public int faultCount(String parserId) {
        AtomicInteger count = faults.get(parserId);
        return count == null ? 0 : count.get();
    }

    public SortedSet<String> poisoned() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(poisoned));
    }
}
