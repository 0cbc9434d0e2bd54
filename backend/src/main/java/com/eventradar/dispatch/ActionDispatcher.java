package com.eventradar.dispatch;

/**
 * Invokes the downstream action for a detected event. Never throws: failures are reported in the result.
 */
public interface ActionDispatcher {

    DispatchResult dispatch(DispatchRequest request);
}
