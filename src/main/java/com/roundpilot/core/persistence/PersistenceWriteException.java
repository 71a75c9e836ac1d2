package com.roundpilot.core.persistence;

import com.roundpilot.core.RoundpilotException;

/**
 * A write to the durable store failed as a whole (e.g. the connection or transaction was lost).
 */
public class PersistenceWriteException extends RoundpilotException {

    public PersistenceWriteException(String message) {
        super(message);
    }

    public PersistenceWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
