package com.roundpilot.core.persistence;

import com.roundpilot.core.model.RoundRecord;

/**
 * Producer side of the record channel. Never blocks.
 */
@FunctionalInterface
public interface RecordSink {

    /**
     * @return false if the channel is full and the record was not accepted
     */
    boolean offer(RoundRecord record);
}
