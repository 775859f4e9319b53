package com.jumbo.bus;

import com.jumbo.contract.EventEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs all handlers of an envelope on the executor at once and waits for every one of them.
 * Handlers have no defined relative order. A failing handler does not stop its siblings;
 * all failures are reported together once the last handler finished.
 */
public class ConcurrentEventBus extends AbstractEventBus {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentEventBus.class);

    private final Executor executor;

    public ConcurrentEventBus(Executor executor) {
        this(new HandlerRegistry(), executor);
    }

    public ConcurrentEventBus(HandlerRegistry registry, Executor executor) {
        super(registry);
        this.executor = executor;
    }

    @Override
    protected void dispatch(EventEnvelope event, List<EventHandler> handlers) {
        List<CompletableFuture<Void>> running = new ArrayList<>(handlers.size());
        for (EventHandler handler : handlers) {
            running.add(CompletableFuture.runAsync(() -> handler.handle(event), executor));
        }

        List<Throwable> failures = new ArrayList<>();
        for (CompletableFuture<Void> future : running) {
            try {
                future.join();
            } catch (CompletionException ex) {
                Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                log.warn("Handler failed for {} on {}: {}", event.type(), event.aggregateId(), cause.getMessage());
                failures.add(cause);
            }
        }

        if (!failures.isEmpty()) {
            throw new EventDispatchException(event, failures);
        }
    }
}
