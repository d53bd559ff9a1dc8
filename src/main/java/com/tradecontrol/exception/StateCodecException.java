package com.tradecontrol.exception;

public class StateCodecException extends BaseException {

    public StateCodecException(String message, Throwable cause) {
        super(ErrorCode.STATE_CODEC_ERROR, message, cause);
    }
}
