package com.roundpilot.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the runtime, used for the live console feed.
 *
 * @param eventType event type (e.g. "phase.changed", "bet.requested", "round.ended")
 * @param sourceId  the source this event belongs to
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record RoundEvent(
    String eventType,
    String sourceId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String SOURCE_STARTED = "source.started";
    public static final String SOURCE_STOPPED = "source.stopped";
    public static final String PHASE_CHANGED = "phase.changed";
    public static final String BET_REQUESTED = "bet.requested";
    public static final String BET_DROPPED = "bet.dropped";
    public static final String ROUND_ENDED = "round.ended";
    public static final String RECORD_DROPPED = "record.dropped";
    public static final String TARGET_REACHED = "target.reached";

    public static RoundEvent of(String eventType, String sourceId, Map<String, Object> payload) {
        return new RoundEvent(eventType, sourceId, payload, Instant.now());
    }
}
