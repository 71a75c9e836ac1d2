package com.roundpilot.core.model;

import java.time.Instant;

/**
 * A betting action for the input actuator. Consumed exactly once.
 *
 * @param sourceId    the source that asked for the bet
 * @param stake       amount to type into the stake field
 * @param amountField click point of the stake field
 * @param playButton  click point of the play control
 * @param requestId   unique id, used for log correlation
 * @param timestamp   when the worker decided to bet
 */
public record ActionRequest(
        String sourceId,
        int stake,
        ScreenPoint amountField,
        ScreenPoint playButton,
        String requestId,
        Instant timestamp
) {}
