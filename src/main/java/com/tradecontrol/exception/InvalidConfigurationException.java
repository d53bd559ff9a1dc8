package com.tradecontrol.exception;

import java.util.Map;

/**
 * Thrown when a component is constructed or reconfigured with settings that could
 * never produce a meaningful result (non-positive multiplier, negative caps, an
 * enabled ladder with zero orders, ...).
 */
public class InvalidConfigurationException extends BaseException {

    public InvalidConfigurationException(String message) {
        super(ErrorCode.INVALID_CONFIGURATION, message);
    }

    public InvalidConfigurationException(String field, Object value, String rule) {
        super(
                ErrorCode.INVALID_CONFIGURATION,
                field + " " + rule + " (was " + value + ")",
                Map.of("field", field, "value", String.valueOf(value)));
    }
}
