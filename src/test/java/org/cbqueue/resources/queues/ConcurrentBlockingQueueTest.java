package org.cbqueue.resources.queues;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.cbqueue.api.queues.QueueStatus;
import org.cbqueue.api.resources.IResource;
import org.cbqueue.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Single-threaded behavior of {@link ConcurrentBlockingQueue}. Blocking interplay between
 * threads is covered by {@link ConcurrentBlockingQueueConcurrencyTest}.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class ConcurrentBlockingQueueTest {

    private ConcurrentBlockingQueue<String> queue;

    @BeforeEach
    void setUp() {
        queue = new ConcurrentBlockingQueue<>();
    }

    @Test
    void newQueueIsEmptyWithoutTimeout() {
        assertTrue(queue.isEmpty());
        assertEquals(0, queue.size());
        assertTrue(queue.getTimeoutDuration().isEmpty());
        assertFalse(queue.isInterrupted());
        assertEquals(ConcurrentBlockingQueue.DEFAULT_NAME, queue.getResourceName());
    }

    @Test
    void popsInPushOrder() {
        queue.pushOne("a");
        queue.pushBatch(List.of("b", "c"));
        queue.pushOne("d");

        List<String> popped = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            assertEquals(QueueStatus.SUCCESS, queue.popOne(popped::add, false));
        }
        assertEquals(List.of("a", "b", "c", "d"), popped);
        assertTrue(queue.isEmpty());
    }

    @Test
    @DisplayName("Batch pop appends the front elements to the destination")
    void popBatchAppendsToDestination() {
        queue.pushBatch(List.of("1", "2", "3", "4", "5"));
        List<String> destination = new ArrayList<>(List.of("existing"));

        assertEquals(QueueStatus.SUCCESS, queue.popBatch(destination, 3, false));

        assertEquals(List.of("existing", "1", "2", "3"), destination);
        assertEquals(List.of("4", "5"), queue.toList());
    }

    @Test
    void popBatchOfEntireContentsEmptiesQueue() {
        queue.pushBatch(List.of("x", "y"));
        List<String> destination = new ArrayList<>();

        assertEquals(QueueStatus.SUCCESS, queue.popBatch(destination, 2, false));

        assertEquals(List.of("x", "y"), destination);
        assertTrue(queue.isEmpty());
    }

    @Test
    void nonBlockingPopOnEmptyQueueReportsInsufficientElements() {
        AtomicReference<String> output = new AtomicReference<>();

        assertEquals(QueueStatus.INSUFFICIENT_ELEMENTS, queue.popOne(output::set, false));
        assertNull(output.get());
    }

    @Test
    void nonBlockingPopBatchLargerThanSizeLeavesQueueUntouched() {
        queue.pushBatch(List.of("a", "b"));
        List<String> destination = new ArrayList<>();

        assertEquals(QueueStatus.INSUFFICIENT_ELEMENTS, queue.popBatch(destination, 3, false));

        assertTrue(destination.isEmpty());
        assertEquals(List.of("a", "b"), queue.toList());
    }

    @Test
    void getFrontDoesNotRemove() {
        queue.pushBatch(List.of("first", "second"));
        AtomicReference<String> front = new AtomicReference<>();

        assertEquals(QueueStatus.SUCCESS, queue.getFront(front::set, false));
        assertEquals(QueueStatus.SUCCESS, queue.getFront(front::set, false));

        assertEquals("first", front.get());
        assertEquals(2, queue.size());
    }

    @Test
    void getFrontBatchCopiesFrontWithoutRemoving() {
        queue.pushBatch(List.of("a", "b", "c"));
        List<String> peeked = new ArrayList<>();

        assertEquals(QueueStatus.SUCCESS, queue.getFrontBatch(peeked, 2, false));

        assertEquals(List.of("a", "b"), peeked);
        assertEquals(List.of("a", "b", "c"), queue.toList());
    }

    @Test
    void getFrontReturnsSameReference() {
        StringBuilder element = new StringBuilder("mutable");
        ConcurrentBlockingQueue<StringBuilder> builders = ConcurrentBlockingQueue.of(element);
        AtomicReference<StringBuilder> front = new AtomicReference<>();

        builders.getFront(front::set, false);

        assertSame(element, front.get());
    }

    @Test
    void nonBlockingPeekOnTooFewElementsReportsInsufficientElements() {
        queue.pushOne("only");
        List<String> peeked = new ArrayList<>();

        assertEquals(QueueStatus.INSUFFICIENT_ELEMENTS, queue.getFrontBatch(peeked, 2, false));
        assertTrue(peeked.isEmpty());
    }

    @Test
    void zeroCountOperationsSucceedWithoutEffect() {
        queue.pushOne("a");
        List<String> destination = new ArrayList<>();

        assertEquals(QueueStatus.SUCCESS, queue.popBatch(destination, 0, true));
        assertEquals(QueueStatus.SUCCESS, queue.getFrontBatch(destination, 0, true));

        assertTrue(destination.isEmpty());
        assertEquals(1, queue.size());
    }

    @Test
    void zeroCountAndEmptyBatchSucceedEvenWhenInterrupted() {
        queue.setInterrupted(true);

        assertEquals(QueueStatus.SUCCESS, queue.popBatch(new ArrayList<>(), 0, true));
        assertEquals(QueueStatus.SUCCESS, queue.pushBatch(List.of()));
    }

    @Test
    void emptyPushBatchIsNoOp() {
        assertEquals(QueueStatus.SUCCESS, queue.pushBatch(List.of()));
        assertTrue(queue.isEmpty());
        assertEquals(0L, queue.getMetrics().get("elements_pushed").longValue());
    }

    @Test
    void interruptedQueueRejectsPushesAndKeepsContents() {
        queue.pushOne("kept");
        queue.setInterrupted(true);

        assertEquals(QueueStatus.INTERRUPTED, queue.pushOne("rejected"));
        assertEquals(QueueStatus.INTERRUPTED, queue.pushBatch(List.of("r1", "r2")));

        assertEquals(List.of("kept"), queue.toList());
    }

    @Test
    void interruptTakesPriorityOverAvailableData() {
        queue.pushBatch(List.of("a", "b"));
        queue.setInterrupted(true);
        List<String> destination = new ArrayList<>();

        assertEquals(QueueStatus.INTERRUPTED, queue.popOne(destination::add, false));
        assertEquals(QueueStatus.INTERRUPTED, queue.popBatch(destination, 2, true));
        assertEquals(QueueStatus.INTERRUPTED, queue.getFront(destination::add, true));
        assertEquals(QueueStatus.INTERRUPTED, queue.getFrontBatch(destination, 1, false));

        assertTrue(destination.isEmpty());
        assertEquals(2, queue.size());
    }

    @Test
    void clearingInterruptRestoresNormalOperation() {
        queue.setInterrupted(true);
        queue.setInterrupted(false);

        assertEquals(QueueStatus.SUCCESS, queue.pushOne("a"));
        AtomicReference<String> output = new AtomicReference<>();
        assertEquals(QueueStatus.SUCCESS, queue.popOne(output::set, false));
        assertEquals("a", output.get());
    }

    @Test
    void clearRemovesAllElementsAndKeepsFlags() {
        queue.pushBatch(List.of("a", "b", "c"));
        queue.setTimeoutDuration(Duration.ofMillis(50));
        queue.setInterrupted(true);

        queue.clear();

        assertTrue(queue.isEmpty());
        assertTrue(queue.isInterrupted());
        assertEquals(Duration.ofMillis(50), queue.getTimeoutDuration().orElseThrow());
    }

    @Test
    void timeoutCanBeSetAndRemoved() {
        queue.setTimeoutDuration(Duration.ofSeconds(2));
        assertEquals(Duration.ofSeconds(2), queue.getTimeoutDuration().orElseThrow());

        queue.setTimeoutDuration(null);
        assertTrue(queue.getTimeoutDuration().isEmpty());
    }

    @Test
    void zeroTimeoutTimesOutImmediately() {
        queue.setTimeoutDuration(Duration.ZERO);

        assertEquals(QueueStatus.TIMEOUT, queue.popOne(e -> { }, true));
        assertEquals(1L, queue.getMetrics().get("timeouts").longValue());
    }

    @Test
    void blockingPopWithSatisfiedPredicateDoesNotWait() {
        queue.setTimeoutDuration(Duration.ZERO);
        queue.pushOne("ready");
        AtomicReference<String> output = new AtomicReference<>();

        assertEquals(QueueStatus.SUCCESS, queue.popOne(output::set));
        assertEquals("ready", output.get());
    }

    @Test
    void rejectsInvalidArguments() {
        assertThrows(NullPointerException.class, () -> queue.pushOne(null));
        assertThrows(NullPointerException.class, () -> queue.pushBatch(null));
        assertThrows(NullPointerException.class, () -> queue.pushBatch(Arrays.asList("a", null)));
        assertThrows(NullPointerException.class, () -> queue.popOne(null, false));
        assertThrows(NullPointerException.class, () -> queue.popBatch(null, 1, false));
        assertThrows(NullPointerException.class, () -> queue.getFront(null, false));
        assertThrows(IllegalArgumentException.class, () -> queue.popBatch(new ArrayList<>(), -1, false));
        assertThrows(IllegalArgumentException.class, () -> queue.getFrontBatch(new ArrayList<>(), -1, false));
        assertThrows(IllegalArgumentException.class, () -> queue.setTimeoutDuration(Duration.ofMillis(-1)));
    }

    @Test
    void batchWithNullElementIsRejectedAtomically() {
        queue.pushOne("before");

        assertThrows(NullPointerException.class, () -> queue.pushBatch(Arrays.asList("x", null, "y")));

        assertEquals(List.of("before"), queue.toList());
    }

    @Test
    void failingSinkLeavesQueueUnchanged() {
        queue.pushBatch(List.of("a", "b"));
        List<String> rejecting = List.of();

        assertThrows(UnsupportedOperationException.class, () -> queue.popBatch(rejecting, 2, false));

        assertEquals(List.of("a", "b"), queue.toList());
        assertEquals(0L, queue.getMetrics().get("elements_popped").longValue());
    }

    @Test
    void constructsFromValuesCopiesAndFill() {
        assertEquals(List.of("a", "b", "c"), ConcurrentBlockingQueue.of("a", "b", "c").toList());
        assertEquals(List.of("z", "z", "z"), ConcurrentBlockingQueue.withCopies(3, "z").toList());
        assertTrue(ConcurrentBlockingQueue.withCopies(0, "z").isEmpty());
        assertEquals(List.of(1, 2), ConcurrentBlockingQueue.copyOf(List.of(1, 2)).toList());

        assertThrows(IllegalArgumentException.class, () -> ConcurrentBlockingQueue.withCopies(-1, "z"));
        assertThrows(NullPointerException.class, () -> ConcurrentBlockingQueue.withCopies(1, null));
    }

    @Test
    void copyIsIndependentOfSource() {
        ConcurrentBlockingQueue<String> source = ConcurrentBlockingQueue.of("a", "b");
        source.setInterrupted(true);
        source.setTimeoutDuration(Duration.ofSeconds(1));

        ConcurrentBlockingQueue<String> copy = ConcurrentBlockingQueue.copyOf(source);
        copy.pushOne("c");

        assertEquals(List.of("a", "b", "c"), copy.toList());
        assertEquals(List.of("a", "b"), source.toList());
        assertFalse(copy.isInterrupted());
        assertTrue(copy.getTimeoutDuration().isEmpty());
    }

    @Test
    void moveTakesAllElementsAndEmptiesSource() {
        ConcurrentBlockingQueue<String> source = ConcurrentBlockingQueue.of("a", "b", "c");

        ConcurrentBlockingQueue<String> moved = ConcurrentBlockingQueue.moveFrom(source);

        assertEquals(List.of("a", "b", "c"), moved.toList());
        assertTrue(source.isEmpty());
        assertEquals(QueueStatus.SUCCESS, source.pushOne("still usable"));
    }

    @Test
    void readsTimeoutAndWindowFromOptions() {
        Config options = ConfigFactory.parseMap(Map.of("timeout", "150ms", "metricsWindowSeconds", 10));

        ConcurrentBlockingQueue<String> configured = new ConcurrentBlockingQueue<>("configured", options);

        assertEquals(Duration.ofMillis(150), configured.getTimeoutDuration().orElseThrow());
        assertEquals("configured", configured.getResourceName());
        assertEquals("150ms", configured.getOptions().getString("timeout"));
    }

    @Test
    void rejectsInvalidOptions() {
        assertThatThrownBy(() -> new ConcurrentBlockingQueue<String>("bad", ConfigFactory.parseMap(Map.of("timeout", "soon"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bad");
        assertThatThrownBy(() -> new ConcurrentBlockingQueue<String>("bad", ConfigFactory.parseString("timeout = -5s")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ConcurrentBlockingQueue<String>("bad", ConfigFactory.parseMap(Map.of("metricsWindowSeconds", 0))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromConfigReadsNamedSection() {
        Config root = ConfigFactory.parseString("cbqueue.queues.events { timeout = 2s }");

        ConcurrentBlockingQueue<String> events = ConcurrentBlockingQueue.fromConfig("events", root);
        ConcurrentBlockingQueue<String> other = ConcurrentBlockingQueue.fromConfig("other", root);

        assertEquals("events", events.getResourceName());
        assertEquals(Duration.ofSeconds(2), events.getTimeoutDuration().orElseThrow());
        assertTrue(other.getTimeoutDuration().isEmpty());
    }

    @Test
    void fromConfigQuotesNamesContainingDots() {
        Config root = ConfigFactory.parseString(
                "cbqueue.queues { \"events.v2\" { timeout = 300ms }, events { v2 { timeout = 9s } } }");

        ConcurrentBlockingQueue<String> versioned = ConcurrentBlockingQueue.fromConfig("events.v2", root);

        assertEquals("events.v2", versioned.getResourceName());
        assertEquals(Duration.ofMillis(300), versioned.getTimeoutDuration().orElseThrow());
        assertTrue(versioned.getOptions().hasPath("timeout"));
    }

    @Test
    void stateFollowsContentsAndInterrupt() {
        assertEquals(IResource.ResourceState.WAITING, queue.getState());
        assertTrue(queue.isHealthy());

        queue.pushOne("a");
        assertEquals(IResource.ResourceState.ACTIVE, queue.getState());

        queue.setInterrupted(true);
        assertEquals(IResource.ResourceState.INTERRUPTED, queue.getState());
        assertFalse(queue.isHealthy());
    }

    @Test
    void metricsCountTraffic() {
        queue.pushBatch(List.of("a", "b", "c"));
        queue.popBatch(new ArrayList<>(), 2, false);
        queue.getFront(e -> { }, false);
        queue.setInterrupted(true);
        queue.pushOne("rejected");

        Map<String, Number> metrics = queue.getMetrics();

        assertThat(metrics).containsKeys("current_size", "elements_pushed", "elements_popped", "timeouts",
                "rejected_while_interrupted", "interrupted", "push_throughput_per_sec", "pop_throughput_per_sec");
        assertEquals(1, metrics.get("current_size").intValue());
        assertEquals(3L, metrics.get("elements_pushed").longValue());
        assertEquals(2L, metrics.get("elements_popped").longValue());
        assertEquals(1L, metrics.get("rejected_while_interrupted").longValue());
        assertEquals(1, metrics.get("interrupted").intValue());
        assertThat(metrics.get("push_throughput_per_sec").doubleValue()).isGreaterThan(0.0);
    }
}
