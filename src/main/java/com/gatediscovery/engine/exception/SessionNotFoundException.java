package com.gatediscovery.engine.exception;

public class SessionNotFoundException extends BusinessException {

    public SessionNotFoundException(Long sessionId) {
        super(ErrorCode.SESSION_NOT_FOUND, "Venue session not found: " + sessionId);
    }
}
