package com.roundpilot.core.screen;

import com.roundpilot.core.RoundpilotException;

/**
 * A screen reading failed or produced an unusable value. Transient: the poll cycle is retried.
 */
public class ReadException extends RoundpilotException {

    public ReadException(String message) {
        super(message);
    }

    public ReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
