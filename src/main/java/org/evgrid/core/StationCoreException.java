package org.evgrid.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Station-core contract exception with deterministic reason codes.
 *
 * <p>Load failures additionally carry the batch index and station id of the
 * offending record ({@code -1} / {@code null} when not applicable).</p>
 */
@Getter
public final class StationCoreException extends RuntimeException {
    public static final String REASON_INVALID_COORDINATE = "INVALID_COORDINATE";
    public static final String REASON_MALFORMED_RECORD = "MALFORMED_RECORD";
    public static final String REASON_DUPLICATE_ID = "DUPLICATE_ID";
    public static final String REASON_TIMEOUT = "TIMEOUT";
    public static final String REASON_INTERNAL_INCONSISTENCY = "INTERNAL_INCONSISTENCY";

    private final String reasonCode;
    private final int recordIndex;
    private final Long stationId;

    /**
     * Creates a reason-coded failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public StationCoreException(String reasonCode, String message) {
        this(reasonCode, message, -1, null, null);
    }

    /**
     * Creates a reason-coded failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public StationCoreException(String reasonCode, String message, Throwable cause) {
        this(reasonCode, message, -1, null, cause);
    }

    private StationCoreException(String reasonCode, String message, int recordIndex, Long stationId, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
        this.recordIndex = recordIndex;
        this.stationId = stationId;
    }

    /**
     * Re-throws a record-level failure annotated with its position in a load batch.
     *
     * @param recordIndex zero-based index of the record in the batch.
     * @param stationId id of the failing record, or null when unknown.
     * @param failure record-level failure.
     */
    public static StationCoreException atRecord(int recordIndex, Long stationId, StationCoreException failure) {
        Objects.requireNonNull(failure, "failure");
        String detail = "record[" + recordIndex + "] id=" + stationId + ": " + stripPrefix(failure);
        return new StationCoreException(failure.getReasonCode(), detail, recordIndex, stationId, failure);
    }

    private static String stripPrefix(StationCoreException failure) {
        String message = failure.getMessage();
        String prefix = "[" + failure.getReasonCode() + "] ";
        return message.startsWith(prefix) ? message.substring(prefix.length()) : message;
    }

    /**
     * Formats exception message with deterministic reason-code prefix.
     */
    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
