package com.tradecontrol.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INVALID_CONFIGURATION("INVALID_CONFIGURATION"),
    INVALID_INPUT("INVALID_INPUT"),
    SESSION_NOT_FOUND("SESSION_NOT_FOUND"),
    STATE_CODEC_ERROR("STATE_CODEC_ERROR");

    private final String code;
}
