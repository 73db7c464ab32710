package com.servealert.exception;

import java.util.Map;
import java.util.Optional;
import lombok.Getter;

/**
 * Root of the service's own failures.
 *
 * <p>The {@link ErrorCode} tells the recovery service whether the failure can be routed
 * to a recovery action. The context map carries the identifiers needed to log or act on
 * it, such as the alert id or the storage key.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    public static final String ALERT_ID = "alertId";

    private final ErrorCode errorCode;
    private final Map<String, String> context;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, Map.of(), cause);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, String> context) {
        this(errorCode, message, context, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, String> context, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.context = context != null ? Map.copyOf(context) : Map.of();
    }

    /** The alert the failure concerns, when there is one. */
    public Optional<String> getAlertId() {
        return Optional.ofNullable(context.get(ALERT_ID));
    }

    public boolean isRecoverable() {
        return errorCode.isRecoverable();
    }
}
