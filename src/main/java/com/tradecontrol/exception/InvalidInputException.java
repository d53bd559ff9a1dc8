package com.tradecontrol.exception;

public class InvalidInputException extends BaseException {

    public InvalidInputException(String message) {
        super(ErrorCode.INVALID_INPUT, message);
    }
}
