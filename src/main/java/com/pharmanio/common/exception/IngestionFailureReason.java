package com.pharmanio.common.exception;

public enum IngestionFailureReason {
    FETCH_FAILED,
    RECONCILE_FAILED
}
