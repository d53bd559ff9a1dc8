package com.tradecontrol.exception;

import java.util.Map;

public class SessionNotFoundException extends BaseException {

    public SessionNotFoundException(String sessionId) {
        super(ErrorCode.SESSION_NOT_FOUND, "No control session for: " + sessionId, Map.of("sessionId", sessionId));
    }
}
