package com.tastream.exception;

import java.util.Map;

/**
 * Raised when an indicator is constructed with a parameter outside its documented domain
 * (zero period, negative multiplier, fast period not below slow period).
 *
 * <p>Construction is the only fallible step of an indicator's lifecycle. A constructor that
 * throws this exception leaves no usable instance behind.
 */
public class InvalidParameterException extends BaseException {

    public InvalidParameterException(String message) {
        super(ErrorCode.INVALID_PARAMETER, message);
    }

    public InvalidParameterException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_PARAMETER, message, details);
    }

    public InvalidParameterException(String message, Throwable cause) {
        super(ErrorCode.INVALID_PARAMETER, message, cause);
    }
}
