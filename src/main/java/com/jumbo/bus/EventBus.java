package com.jumbo.bus;

import com.jumbo.contract.EventEnvelope;

/**
 * Publish/subscribe dispatch of stored envelopes to projection handlers.
 *
 * <p>Callers append to the {@link EventStore} first and publish only what was appended.
 * Implementations differ in dispatch strategy, not in contract:
 * {@link ConcurrentEventBus} for interactive use, {@link SequentialReplayEventBus} for replay.
 */
public interface EventBus {

    void subscribe(String eventType, EventHandler handler);

    /**
     * Dispatches the envelope to every handler subscribed to its type and returns once
     * they have all finished.
     *
     * @throws EventDispatchException when one or more handlers failed
     */
    void publish(EventEnvelope event);
}
