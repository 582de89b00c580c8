package com.pharmanio.common.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.Map;

@Getter
public class IngestionFailureException extends RuntimeException {

    private final IngestionFailureReason reason;
    private final String errorCode;
    private final Map<String, Object> details;

    public IngestionFailureException(String message, IngestionFailureReason reason, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.reason = (reason == null) ? IngestionFailureReason.FETCH_FAILED : reason;
        this.errorCode = this.reason.name();
        this.details = (details == null) ? Collections.emptyMap() : details;
    }

    public IngestionFailureException(String message, IngestionFailureReason reason, Map<String, Object> details) {
        this(message, reason, details, null);
    }

    public IngestionFailureException(String message, IngestionFailureReason reason) {
        this(message, reason, null, null);
    }

    public static IngestionFailureException fetchFailed(String message, Map<String, Object> details) {
        return new IngestionFailureException(message, IngestionFailureReason.FETCH_FAILED, details);
    }

    public static IngestionFailureException fetchFailed(String message, Map<String, Object> details, Throwable cause) {
        return new IngestionFailureException(message, IngestionFailureReason.FETCH_FAILED, details, cause);
    }

    public static IngestionFailureException fetchFailed(String message, Throwable cause) {
        return new IngestionFailureException(message, IngestionFailureReason.FETCH_FAILED, null, cause);
    }

    public static IngestionFailureException reconcileFailed(String message, Throwable cause) {
        return new IngestionFailureException(message, IngestionFailureReason.RECONCILE_FAILED, null, cause);
    }
}
