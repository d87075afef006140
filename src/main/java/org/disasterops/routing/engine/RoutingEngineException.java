package org.disasterops.routing.engine;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Reason-coded failure of a routing engine contract (invalid arguments or configuration).
 *
 * <p>Unknown locations and segments are not failures; queries report them as empty
 * results.</p>
 */
@Getter
@Accessors(fluent = true)
public final class RoutingEngineException extends RuntimeException {
    public static final String REASON_INVALID_ARGUMENT = "ENGINE_INVALID_ARGUMENT";
    public static final String REASON_INVALID_CONFIG = "ENGINE_INVALID_CONFIG";

    private final String reasonCode;

    public RoutingEngineException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    public RoutingEngineException(String reasonCode, String message, Throwable cause) {
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
