package com.roundpilot.core.actuator;

import com.roundpilot.core.RoundpilotException;

/**
 * An action was aborted partway, e.g. by the fail-safe corner or an interrupt.
 */
public class ActuatorAbortedException extends RoundpilotException {

    public ActuatorAbortedException(String message) {
        super(message);
    }

    public ActuatorAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
