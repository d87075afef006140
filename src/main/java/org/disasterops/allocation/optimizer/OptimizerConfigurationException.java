package org.disasterops.allocation.optimizer;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Reason-coded rejection of an optimizer configuration.
 */
@Getter
@Accessors(fluent = true)
public final class OptimizerConfigurationException extends RuntimeException {
    public static final String REASON_INVALID_POPULATION = "OPT_INVALID_POPULATION";
    public static final String REASON_INVALID_GENERATIONS = "OPT_INVALID_GENERATIONS";
    public static final String REASON_INVALID_RATE = "OPT_INVALID_RATE";
    public static final String REASON_INVALID_TOURNAMENT = "OPT_INVALID_TOURNAMENT";
    public static final String REASON_INVALID_TEMPERATURE = "OPT_INVALID_TEMPERATURE";
    public static final String REASON_INVALID_PENALTY = "OPT_INVALID_PENALTY";
    public static final String REASON_INVALID_WEIGHTS = "OPT_INVALID_WEIGHTS";
    public static final String REASON_CONFIG_REQUIRED = "OPT_CONFIG_REQUIRED";

    private final String reasonCode;

    public OptimizerConfigurationException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
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
