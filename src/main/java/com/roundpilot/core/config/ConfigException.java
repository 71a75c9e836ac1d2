package com.roundpilot.core.config;

import com.roundpilot.core.RoundpilotException;

/**
 * Invalid or inconsistent configuration. Fatal at startup.
 */
public class ConfigException extends RoundpilotException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
