package com.jumbo.bus;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.jumbo.TestEvents.event;
import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    @Nested
    @DisplayName("Concurrent dispatch")
    class Concurrent {

        private ExecutorService executor;
        private ConcurrentEventBus bus;

        @BeforeEach
        void setUp() {
            executor = Executors.newFixedThreadPool(4);
            bus = new ConcurrentEventBus(executor);
        }

        @AfterEach
        void tearDown() {
            executor.shutdownNow();
        }

        @Test
        void handlersOfTheSameEvent_runAtTheSameTime() {
            CyclicBarrier bothRunning = new CyclicBarrier(2);
            AtomicInteger completed = new AtomicInteger();
            EventHandler waitsForSibling = event -> {
                try {
                    bothRunning.await(5, TimeUnit.SECONDS);
                } catch (Exception ex) {
                    throw new IllegalStateException("sibling handler never ran", ex);
                }
                completed.incrementAndGet();
            };
            bus.subscribe("GoalAddedEvent", waitsForSibling);
            bus.subscribe("GoalAddedEvent", waitsForSibling);

            bus.publish(event("GoalAddedEvent", "goal_1", 1, 0));

            assertEquals(2, completed.get());
        }

        @Test
        void publish_returnsOnlyAfterEveryHandlerFinished() {
            AtomicInteger completed = new AtomicInteger();
            for (int i = 0; i < 3; i++) {
                bus.subscribe("GoalAddedEvent", event -> {
                    sleep(50);
                    completed.incrementAndGet();
                });
            }

            bus.publish(event("GoalAddedEvent", "goal_1", 1, 0));

            assertEquals(3, completed.get());
        }

        @Test
        void failingHandler_doesNotStopSiblings() {
            AtomicInteger completed = new AtomicInteger();
            bus.subscribe("GoalAddedEvent", event -> completed.incrementAndGet());
            bus.subscribe("GoalAddedEvent", event -> {
                throw new IllegalStateException("projection broken");
            });
            bus.subscribe("GoalAddedEvent", event -> {
                sleep(50);
                completed.incrementAndGet();
            });

            EventDispatchException ex = assertThrows(EventDispatchException.class,
                () -> bus.publish(event("GoalAddedEvent", "goal_1", 1, 0)));

            assertEquals(2, completed.get());
            assertEquals(1, ex.getFailureCount());
            assertInstanceOf(IllegalStateException.class, ex.getCause());
            assertEquals("goal_1", ex.getEvent().aggregateId());
        }

        @Test
        void multipleFailures_areAggregatedIntoOne() {
            bus.subscribe("GoalAddedEvent", event -> {
                throw new IllegalStateException("first");
            });
            bus.subscribe("GoalAddedEvent", event -> {
                throw new IllegalArgumentException("second");
            });

            EventDispatchException ex = assertThrows(EventDispatchException.class,
                () -> bus.publish(event("GoalAddedEvent", "goal_1", 1, 0)));

            assertEquals(2, ex.getFailureCount());
            assertEquals(1, ex.getSuppressed().length);
        }

        @Test
        void eventWithoutSubscribers_isIgnored() {
            assertDoesNotThrow(() -> bus.publish(event("UnknownEvent", "x_1", 1, 0)));
        }
    }

    @Nested
    @DisplayName("Sequential replay dispatch")
    class Sequential {

        private SequentialReplayEventBus bus;

        @BeforeEach
        void setUp() {
            bus = new SequentialReplayEventBus();
        }

        @Test
        void handlersRunInRegistrationOrder_onThePublishingThread() {
            List<String> calls = Collections.synchronizedList(new ArrayList<>());
            Thread publisher = Thread.currentThread();
            bus.subscribe("GoalCompletedEvent", event -> {
                assertSame(publisher, Thread.currentThread());
                calls.add("goals");
            });
            bus.subscribe("GoalCompletedEvent", event -> calls.add("summary"));

            bus.publish(event("GoalCompletedEvent", "goal_1", 3, 0));

            assertEquals(List.of("goals", "summary"), calls);
        }

        @Test
        void everyHandlerOfOneEvent_finishesBeforeTheNextEvent() {
            List<String> calls = new ArrayList<>();
            bus.subscribe("SessionStartedEvent", event -> {
                sleep(20);
                calls.add("session:" + event.version());
            });
            bus.subscribe("GoalAddedEvent", event -> calls.add("goal:" + event.version()));

            bus.publish(event("SessionStartedEvent", "session_1", 1, 0));
            bus.publish(event("GoalAddedEvent", "goal_1", 1, 1));

            assertEquals(List.of("session:1", "goal:1"), calls);
        }

        @Test
        void firstFailure_abortsRemainingHandlers() {
            AtomicInteger laterHandlerRuns = new AtomicInteger();
            bus.subscribe("GoalAddedEvent", event -> {
                throw new IllegalStateException("boom");
            });
            bus.subscribe("GoalAddedEvent", event -> laterHandlerRuns.incrementAndGet());

            EventDispatchException ex = assertThrows(EventDispatchException.class,
                () -> bus.publish(event("GoalAddedEvent", "goal_1", 1, 0)));

            assertEquals(0, laterHandlerRuns.get());
            assertEquals("boom", ex.getCause().getMessage());
        }

        @Test
        void eachBusHasItsOwnRegistry() {
            AtomicInteger calls = new AtomicInteger();
            bus.subscribe("GoalAddedEvent", event -> calls.incrementAndGet());

            SequentialReplayEventBus fresh = new SequentialReplayEventBus();
            fresh.publish(event("GoalAddedEvent", "goal_1", 1, 0));

            assertEquals(0, calls.get());
            assertEquals(0, fresh.getRegistry().handlerCount());
            assertEquals(1, bus.getRegistry().handlerCount());
        }
    }

    @Test
    void registry_rejectsBlankEventType() {
        HandlerRegistry registry = new HandlerRegistry();
        assertThrows(IllegalArgumentException.class, () -> registry.register(" ", event -> { }));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(ex);
        }
    }
}
