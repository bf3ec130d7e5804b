package org.Aayush.pathfinding.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Query contract failure with a deterministic reason code.
 * <p>
 * Raised for malformed queries only. An infeasible query is answered with an empty response.
 * </p>
 */
@Getter
public final class PathfindingCoreException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded query failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public PathfindingCoreException(String reasonCode, String message) {
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
