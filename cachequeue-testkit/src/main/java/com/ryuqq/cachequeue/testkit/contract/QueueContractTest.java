package com.ryuqq.cachequeue.testkit.contract;

import com.ryuqq.cachequeue.core.model.Message;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the stream queue.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>appended messages reach the registered handler with the assigned id</li>
 *   <li>a handler that fails once sees the message exactly twice, same id</li>
 *   <li>two registrations on one stream split the work (no broadcast)</li>
 *   <li>appends from one thread arrive in call order</li>
 *   <li>run() blocks until shutdown()</li>
 * </ul>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public abstract class QueueContractTest extends AbstractAdapterContractTest {

    protected static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Test
    void testAppend_DeliveredToHandlerWithAssignedId() {
        // Given
        List<Message> received = new CopyOnWriteArrayList<>();
        adapter.register("orders", received::add);

        // When
        String id = adapter.append(Message.of("orders", Map.of("orderId", "A-1")));

        // Then
        awaitCondition(() -> received.size() == 1, TIMEOUT, "one delivery");
        Message delivered = received.get(0);
        assertNotNull(id);
        assertEquals(id, delivered.id());
        assertEquals("orders", delivered.stream());
        assertEquals("A-1", String.valueOf(delivered.values().get("orderId")));
    }

    @Test
    void testAppend_BeforeRegister_DeliveredLater() {
        // Given
        adapter.append(Message.of("late", Map.of("n", "1")));
        List<Message> received = new CopyOnWriteArrayList<>();

        // When
        adapter.register("late", received::add);

        // Then
        awaitCondition(() -> received.size() == 1, TIMEOUT, "buffered message delivered");
    }

    @Test
    void testFailingOnce_DeliveredExactlyTwiceWithSameId() {
        // Given
        List<String> attempts = new CopyOnWriteArrayList<>();
        AtomicInteger failures = new AtomicInteger();
        adapter.register("payments", message -> {
            attempts.add(message.id());
            if (failures.getAndIncrement() == 0) {
                throw new IllegalStateException("transient failure");
            }
        });

        // When
        String id = adapter.append(Message.of("payments", Map.of("amount", "10")));

        // Then
        awaitCondition(() -> attempts.size() == 2, TIMEOUT, "redelivery after failure");
        sleep(200);
        assertEquals(List.of(id, id), attempts, "Message must be delivered exactly twice with the same id");
    }

    @Test
    void testTwoRegistrations_ShareWork() {
        // Given
        int total = 100;
        Set<String> seen = ConcurrentHashMap.newKeySet();
        AtomicInteger duplicates = new AtomicInteger();
        AtomicInteger first = new AtomicInteger();
        AtomicInteger second = new AtomicInteger();
        adapter.register("jobs", message -> {
            first.incrementAndGet();
            if (!seen.add(message.id())) {
                duplicates.incrementAndGet();
            }
            TimeUnit.MILLISECONDS.sleep(5);
        });
        adapter.register("jobs", message -> {
            second.incrementAndGet();
            if (!seen.add(message.id())) {
                duplicates.incrementAndGet();
            }
            TimeUnit.MILLISECONDS.sleep(5);
        });

        // When
        for (int i = 0; i < total; i++) {
            adapter.append(Message.of("jobs", Map.of("n", Integer.toString(i))));
        }

        // Then
        awaitCondition(() -> seen.size() == total, TIMEOUT, "all jobs handled");
        assertEquals(0, duplicates.get(), "Each message goes to exactly one consumer");
        assertEquals(total, first.get() + second.get());
        assertTrue(first.get() > 0 && second.get() > 0,
            "Both consumers should take part (first=" + first.get() + ", second=" + second.get() + ")");
    }

    @Test
    void testSameProducer_OrderPreserved() {
        // Given
        List<String> order = Collections.synchronizedList(new ArrayList<>());
        adapter.register("events", message -> order.add(String.valueOf(message.values().get("seq"))));

        // When
        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            expected.add(Integer.toString(i));
            adapter.append(Message.of("events", Map.of("seq", Integer.toString(i))));
        }

        // Then
        awaitCondition(() -> order.size() == expected.size(), TIMEOUT, "all events handled");
        assertEquals(expected, new ArrayList<>(order));
    }

    @Test
    void testRun_BlocksUntilShutdown() throws Exception {
        // Given
        Thread runner = new Thread(adapter::run, "contract-run");
        runner.start();

        // When
        sleep(100);
        assertTrue(runner.isAlive(), "run() must block while the adapter is active");
        adapter.shutdown();

        // Then
        runner.join(TIMEOUT.toMillis());
        assertFalse(runner.isAlive(), "run() must return after shutdown()");
    }

    @Test
    void testShutdown_Idempotent() {
        // When & Then
        assertDoesNotThrow(() -> {
            adapter.shutdown();
            adapter.shutdown();
        });
    }

    @Test
    void testAppend_AfterShutdown_Rejected() {
        // Given
        adapter.register("closed", message -> { });
        adapter.shutdown();

        // When & Then
        assertThrows(IllegalStateException.class,
            () -> adapter.append(Message.of("closed", Map.of("n", "1"))));
    }
}
