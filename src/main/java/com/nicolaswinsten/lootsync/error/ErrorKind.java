package com.nicolaswinsten.lootsync.error;

import com.fasterxml.jackson.annotation.JsonValue;

/** The error categories reported to HTTP and WebSocket callers. */
public enum ErrorKind {
    NOT_FOUND("not_found"),
    CONFLICT("conflict"),
    VALIDATION_ERROR("validation_error"),
    TRANSIENT_STORAGE_BUSY("transient_storage_busy");

    private final String value;

    ErrorKind(String value) { this.value = value; }

    @JsonValue
    public String getValue() { return value; }
}
