package com.eventradar.chain.cache;

import java.util.Optional;

/** Used when caching is disabled: nothing is remembered, every event is dispatched. */
public class NoOpProcessedEventCache implements ProcessedEventCache {

    @Override
    public Optional<String> processedAt(String eventKey) {
        return Optional.empty();
    }

    @Override
    public void markProcessed(String eventKey, String processedAt) {
        // disabled
    }

    @Override
    public boolean isRangeProcessed(String rangeKey) {
        return false;
    }

    @Override
    public void markRangeProcessed(String rangeKey, int eventsFound) {
        // disabled
    }
}
