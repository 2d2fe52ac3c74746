package org.evgrid.spatial;

import lombok.Builder;
import lombok.Value;

/**
 * Node-capacity configuration for {@link StationRTree}.
 */
@Value
@Builder
public class IndexConfig {
    public static final int DEFAULT_MAX_ENTRIES = 16;
    static final int MIN_MAX_ENTRIES = 4;

    private static final String PROP_MAX_ENTRIES = "evgrid.index.maxEntries";

    /**
     * Maximum children (internal) or entries (leaf) per node before a split.
     */
    int maxEntries;

    /**
     * Default capacity, overridable through {@code -Devgrid.index.maxEntries}.
     */
    public static IndexConfig defaults() {
        return IndexConfig.builder()
                .maxEntries(readMaxEntries())
                .build();
    }

    /**
     * Minimum fill for non-root nodes after deletes: 40% of capacity, at least two.
     */
    public int minEntries() {
        return Math.max(2, (int) Math.floor(maxEntries * 0.4d));
    }

    void validate() {
        if (maxEntries < MIN_MAX_ENTRIES) {
            throw new IllegalArgumentException(
                    "maxEntries must be >= " + MIN_MAX_ENTRIES + ", got " + maxEntries);
        }
    }

    private static int readMaxEntries() {
        String raw = System.getProperty(PROP_MAX_ENTRIES);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_MAX_ENTRIES;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return DEFAULT_MAX_ENTRIES;
        }
    }
}
