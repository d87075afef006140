package org.disasterops.allocation.fitness;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Reason-coded failure of an allocation problem or assignment contract.
 */
@Getter
@Accessors(fluent = true)
public final class AllocationException extends RuntimeException {
    public static final String REASON_NO_CENTERS = "ALLOC_NO_CENTERS";
    public static final String REASON_NO_ZONES = "ALLOC_NO_ZONES";
    public static final String REASON_DUPLICATE_ID = "ALLOC_DUPLICATE_ID";
    public static final String REASON_INCOMPLETE_ASSIGNMENT = "ALLOC_INCOMPLETE_ASSIGNMENT";
    public static final String REASON_UNKNOWN_ZONE = "ALLOC_UNKNOWN_ZONE";
    public static final String REASON_UNKNOWN_CENTER = "ALLOC_UNKNOWN_CENTER";
    public static final String REASON_INVALID_WEIGHTS = "ALLOC_INVALID_WEIGHTS";

    private final String reasonCode;

    public AllocationException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    public AllocationException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

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
