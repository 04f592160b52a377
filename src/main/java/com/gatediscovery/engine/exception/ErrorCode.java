package com.gatediscovery.engine.exception;

import org.springframework.http.HttpStatus;

/**
 * Error codes returned to API clients, each paired with its HTTP status.
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "Invalid input"),
    CONFLICT(HttpStatus.CONFLICT, "C002", "Conflicting concurrent write"),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C003", "Internal server error"),

    // Sessions (Sxxx)
    SESSION_NOT_FOUND(HttpStatus.NOT_FOUND, "S001", "Venue session not found"),
    SESSION_INACTIVE(HttpStatus.CONFLICT, "S002", "Venue session is inactive"),
    SESSION_BUSY(HttpStatus.CONFLICT, "S003", "A cycle is running for this session, retry shortly"),
    INVALID_THRESHOLD_CONFIG(HttpStatus.BAD_REQUEST, "S004", "Invalid threshold configuration"),

    // Gates (Gxxx)
    GATE_NOT_FOUND(HttpStatus.NOT_FOUND, "G001", "Gate not found"),
    BINDING_NOT_FOUND(HttpStatus.NOT_FOUND, "G002", "Category binding not found"),
    INVALID_BINDING_TRANSITION(HttpStatus.CONFLICT, "G003", "Binding cannot make this transition"),

    // Merges (Mxxx)
    MERGE_SUGGESTION_NOT_FOUND(HttpStatus.NOT_FOUND, "M001", "Merge suggestion not found"),
    STALE_MERGE_STATE(HttpStatus.CONFLICT, "M002", "Merge no longer applies to the current gate state");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
