package org.cranes.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Crane-unloading contract exception with deterministic reason codes.
 *
 * <p>Every failure raised by the grid, path, and solver layers is a programming
 * error (bad precondition or broken invariant), never a recoverable runtime
 * condition. The reason code identifies the violated contract.</p>
 */
@Getter
public final class CraneUnloadingException extends RuntimeException {
    public static final String REASON_GRID_REQUIRED = "CU_GRID_REQUIRED";
    public static final String REASON_ALGORITHM_REQUIRED = "CU_ALGORITHM_REQUIRED";
    public static final String REASON_GRID_EMPTY = "CU_GRID_EMPTY";
    public static final String REASON_START_BLOCKED = "CU_START_BLOCKED";
    public static final String REASON_GRID_TOO_LARGE = "CU_GRID_TOO_LARGE";
    public static final String REASON_INVALID_STEP = "CU_INVALID_STEP";
    public static final String REASON_TABLE_INCONSISTENT = "CU_TABLE_INCONSISTENT";

    private final String reasonCode;

    /**
     * Creates a reason-coded contract failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public CraneUnloadingException(String reasonCode, String message) {
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
