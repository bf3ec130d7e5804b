package org.Aayush.pathfinding.graph;

import lombok.Getter;

import java.util.Objects;

/**
 * Reason-coded graph mutation failure.
 * <p>
 * Raised for events that are malformed or arrive out of order. Callers on the ingestion side
 * log and drop them; they are never fatal.
 * </p>
 */
@Getter
public final class NetworkGraphException extends RuntimeException {
    public static final String REASON_DUPLICATE_CHANNEL = "GRAPH_DUPLICATE_CHANNEL";
    public static final String REASON_UNKNOWN_CHANNEL = "GRAPH_UNKNOWN_CHANNEL";
    public static final String REASON_UNAUTHORIZED_FEE_UPDATE = "GRAPH_UNAUTHORIZED_FEE_UPDATE";
    public static final String REASON_NOT_A_PARTICIPANT = "GRAPH_NOT_A_PARTICIPANT";
    public static final String REASON_INVALID_CHANNEL = "GRAPH_INVALID_CHANNEL";
    public static final String REASON_INVALID_CAPACITY = "GRAPH_INVALID_CAPACITY";

    private final String reasonCode;

    /**
     * Creates a reason-coded graph failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public NetworkGraphException(String reasonCode, String message) {
        super("[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message"));
        this.reasonCode = reasonCode;
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
