package com.roundpilot.core.phase;

import com.roundpilot.core.RoundpilotException;

/**
 * The phase model artifact is missing or unreadable. Fatal at startup.
 */
public class ModelLoadException extends RoundpilotException {

    public ModelLoadException(String message) {
        super(message);
    }

    public ModelLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
