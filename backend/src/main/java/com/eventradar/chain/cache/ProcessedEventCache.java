package com.eventradar.chain.cache;

import java.util.Optional;

/**
 * Remembers which events and block ranges a job has already handled, so a re-scan after a reschedule or a
 * restart does not dispatch the same log twice. Entries expire; a miss never means "not processed" for certain.
 * Backend failures surface as runtime exceptions.
 */
public interface ProcessedEventCache {

    String EVENT_KEY_PREFIX = "event_";
    String RANGE_KEY_PREFIX = "events_";

    /**
     * @return when the event was first seen, while it is still inside the duplicate window
     */
    Optional<String> processedAt(String eventKey);

    void markProcessed(String eventKey, String processedAt);

    boolean isRangeProcessed(String rangeKey);

    void markRangeProcessed(String rangeKey, int eventsFound);

    /** {@code event_<jobId>_<txHash>_<logIndex>} */
    static String eventKey(long jobId, String txHash, long logIndex) {
        return EVENT_KEY_PREFIX + jobId + "_" + txHash + "_" + logIndex;
    }

    /** {@code events_<jobId>_<fromBlock>_<toBlock>} */
    static String rangeKey(long jobId, long fromBlock, long toBlock) {
        return RANGE_KEY_PREFIX + jobId + "_" + fromBlock + "_" + toBlock;
    }
}
