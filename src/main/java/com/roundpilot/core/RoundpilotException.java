package com.roundpilot.core;

/**
 * Base type for all roundpilot failures.
 */
public class RoundpilotException extends RuntimeException {

    public RoundpilotException(String message) {
        super(message);
    }

    public RoundpilotException(String message, Throwable cause) {
        super(message, cause);
    }
}
