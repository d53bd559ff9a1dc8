package com.tradecontrol.exception;

import java.util.Map;
import java.util.Optional;
import lombok.Getter;

/**
 * Root of the control core's unchecked faults: bad configuration, bad caller input,
 * unknown sessions and unreadable snapshots. Risk rejections are never thrown; they
 * come back as {@code RiskDecision}.
 *
 * <p>{@code details} carries the offending field, value or session id as strings so
 * callers can log or report them without parsing the message.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, String> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, String> details) {
        this(errorCode, message, details, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, Map.of(), cause);
    }

    private BaseException(ErrorCode errorCode, String message, Map<String, String> details, Throwable cause) {
        super("[" + errorCode.getCode() + "] " + message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    public Optional<String> getDetail(String key) {
        return Optional.ofNullable(details.get(key));
    }
}
