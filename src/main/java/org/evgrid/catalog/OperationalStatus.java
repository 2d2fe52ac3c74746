package org.evgrid.catalog;

/**
 * Tri-state operational flag of a station.
 */
public enum OperationalStatus {
    OPERATIONAL,
    NON_OPERATIONAL,
    /** Source record did not say. */
    UNKNOWN;

    /**
     * Maps a nullable source flag onto the tri-state.
     */
    public static OperationalStatus fromFlag(Boolean operational) {
        if (operational == null) {
            return UNKNOWN;
        }
        return operational ? OPERATIONAL : NON_OPERATIONAL;
    }
}
