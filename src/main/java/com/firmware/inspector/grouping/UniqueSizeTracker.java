package com.firmware.inspector.grouping;

import java.util.HashMap;
import java.util.Map;

/**
 * Sums sizes once per memory location.
 *
 * Aliased symbols (same section and address) may be reported with slightly different sizes;
 * the largest size seen for a location is the one that counts.
 */
public class UniqueSizeTracker {

    private final Map<String, Long> maxSizeByLocation = new HashMap<>();

    public void add(String locationKey, long size) {
        maxSizeByLocation.merge(locationKey, size, Math::max);
    }

    public long total() {
        long total = 0;
        for (long size : maxSizeByLocation.values()) {
            total += size;
        }
        return total;
    }

    public int locationCount() {
        return maxSizeByLocation.size();
    }
}
