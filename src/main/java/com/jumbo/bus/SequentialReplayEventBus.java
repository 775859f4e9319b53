package com.jumbo.bus;

import com.jumbo.contract.EventEnvelope;

import java.util.List;

/**
 * Runs handlers one after another on the publishing thread, in registration order.
 * Every handler of envelope N has finished before envelope N+1 can be published, so
 * cross-projection reads during replay see fully applied predecessors.
 * The first failing handler aborts dispatch.
 */
public class SequentialReplayEventBus extends AbstractEventBus {

    public SequentialReplayEventBus() {
        this(new HandlerRegistry());
    }

    public SequentialReplayEventBus(HandlerRegistry registry) {
        super(registry);
    }

    @Override
    protected void dispatch(EventEnvelope event, List<EventHandler> handlers) {
        for (EventHandler handler : handlers) {
            try {
                handler.handle(event);
            } catch (RuntimeException ex) {
                throw new EventDispatchException(event, List.of(ex));
            }
        }
    }
}
