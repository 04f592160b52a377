package com.gatediscovery.engine.exception;

import lombok.Getter;

/**
 * Base of every expected failure. The handler turns the carried {@link ErrorCode}
 * into the HTTP status and body.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }
}
