package com.gatediscovery.engine.exception;

public class SessionBusyException extends BusinessException {

    public SessionBusyException(Long sessionId) {
        super(ErrorCode.SESSION_BUSY, "Session " + sessionId + " is running a cycle, retry shortly");
    }
}
