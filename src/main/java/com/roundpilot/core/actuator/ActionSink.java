package com.roundpilot.core.actuator;

import com.roundpilot.core.model.ActionRequest;

import java.time.Duration;

/**
 * Producer side of the action channel.
 */
@FunctionalInterface
public interface ActionSink {

    /**
     * Enqueues a request, waiting at most {@code timeout} for space.
     *
     * @return false if the channel stayed full (the request is not queued)
     */
    boolean submit(ActionRequest request, Duration timeout);
}
