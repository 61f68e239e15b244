package com.libragraph.sift.core.ledger;

import com.libragraph.sift.util.buffer.ByteRegion;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Disjoint claims over one scan scope.
 *
 * <p>A scope is the region of one scan task; gap tasks spawned from it share its ledger,
 * so claims are serialized on this instance. Distinct scopes never share a ledger.
 * Claims and {@link #unclaimedGaps()} together cover the scope exactly once.
 */
public final class ClaimLedger {

    private final ByteRegion scope;
    private final TreeMap<Long, Interval> claims = new TreeMap<>();

    public ClaimLedger(ByteRegion scope) {
        this.scope = scope;
    }

    public ByteRegion scope() {
        return scope;
    }

    /**
     * Claims {@code region} if it overlaps no earlier claim.
     *
     * @return false on overlap; the ledger is unchanged
     * @throws IllegalArgumentException if the region is empty or outside the scope
     */
    public synchronized boolean tryClaim(ByteRegion region) {
        if (region.isEmpty() || !scope.contains(region)) {
            throw new IllegalArgumentException(region + " is empty or outside scope " + scope);
        }
        Interval wanted = new Interval(region.offset(), region.end());

        Map.Entry<Long, Interval> before = claims.floorEntry(wanted.start());
        if (before != null && before.getValue().overlaps(wanted)) {
            return false;
        }
        Map.Entry<Long, Interval> after = claims.ceilingEntry(wanted.start());
        if (after != null && after.getValue().overlaps(wanted)) {
            return false;
        }
        claims.put(wanted.start(), wanted);
        return true;
    }

    /**
     * Claimed intervals in ascending order.
     */
    public synchronized List<Interval> claimed() {
        return List.copyOf(claims.values());
    }

    /**
     * Complement of the claims within the scope, in ascending order.
     */
    public List<Interval> unclaimedGaps() {
        return unclaimedGaps(scope);
    }

    /**
     * Complement of the claims within {@code window}, which must lie inside the scope.
     * Gap tasks use this to see only their own part of a shared ledger.
     */
    public synchronized List<Interval> unclaimedGaps(ByteRegion window) {
        if (!scope.contains(window)) {
            throw new IllegalArgumentException(window + " is outside scope " + scope);
        }
        List<Interval> gaps = new ArrayList<>();
        long cursor = window.offset();
        Map.Entry<Long, Interval> straddling = claims.lowerEntry(window.offset());
        if (straddling != null) {
            cursor = Math.max(cursor, straddling.getValue().end());
        }
        for (Interval claim : claims.subMap(window.offset(), true, window.end(), false).values()) {
            if (claim.start() > cursor) {
                gaps.add(new Interval(cursor, claim.start()));
            }
            cursor = Math.max(cursor, claim.end());
        }
        if (cursor < window.end()) {
            gaps.add(new Interval(cursor, window.end()));
        }
        return gaps;
    }

    /**
     * Unclaimed parts of {@code window} as regions over the scope's data.
     */
    public List<ByteRegion> unclaimedRegions(ByteRegion window) {
        List<ByteRegion> regions = new ArrayList<>();
        for (Interval gap : unclaimedGaps(window)) {
            regions.add(new ByteRegion(scope.data(), gap.start(), gap.length()));
        }
        return regions;
    }
}
