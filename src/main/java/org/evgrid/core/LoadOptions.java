package org.evgrid.core;

import lombok.Builder;
import lombok.Value;

/**
 * Bulk-load behavior.
 */
@Value
@Builder
public class LoadOptions {

    /**
     * Failure handling across the batch.
     */
    public enum LoadMode {
        /** First invalid record aborts the batch; nothing is committed. */
        ATOMIC,
        /** Invalid records are reported in {@link LoadReport#getFailures()}; the rest is committed. */
        COLLECT_FAILURES
    }

    /**
     * Treatment of ids that already exist in the catalog.
     */
    public enum WriteMode {
        /** Existing stations are fully replaced. */
        UPSERT,
        /** Existing ids are rejected with {@code DUPLICATE_ID}. */
        INSERT_ONLY
    }

    @Builder.Default
    LoadMode mode = LoadMode.ATOMIC;

    @Builder.Default
    WriteMode writeMode = WriteMode.UPSERT;

    public static LoadOptions defaults() {
        return LoadOptions.builder().build();
    }

    public static LoadOptions collectFailures() {
        return LoadOptions.builder().mode(LoadMode.COLLECT_FAILURES).build();
    }
}
