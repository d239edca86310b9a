package org.cbqueue.resources.queues;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigUtil;
import org.cbqueue.api.queues.IBatchQueue;
import org.cbqueue.api.queues.QueueStatus;
import org.cbqueue.resources.AbstractResource;
import org.cbqueue.utils.monitoring.SlidingWindowCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * A thread-safe, unbounded, in-memory FIFO queue with single and batch operations, a
 * queue-wide timeout for blocking waits and a sticky interrupted flag.
 * <p>
 * One {@link ReentrantLock} guards the elements, the interrupted flag and the timeout. Blocked
 * consumers wait on a single {@link Condition} with the predicate
 * {@code size >= requested || interrupted}. Waiting for the full batch size, rather than for
 * any element, is what makes batch pops atomic: once the predicate holds under the lock, the
 * whole batch is extracted before another consumer can run.
 * <p>
 * Every successful push and every transition into the interrupted state calls
 * {@link Condition#signalAll()}. Waiters block on different batch sizes, so a single
 * {@code signal()} could wake one whose predicate is still false while a satisfiable waiter
 * keeps sleeping.
 * <p>
 * Callers must set the interrupted flag before abandoning a queue that other threads may still
 * be blocked on; nothing else wakes them.
 *
 * <h3>Configuration Options:</h3>
 * <ul>
 *   <li><b>timeout</b>: Duration applied to every blocking wait, e.g. {@code 100ms} (default: none).</li>
 *   <li><b>metricsWindowSeconds</b>: Window for the throughput metrics (default: 5).</li>
 * </ul>
 *
 * @param <T> The type of elements held in this queue.
 */
public class ConcurrentBlockingQueue<T> extends AbstractResource implements IBatchQueue<T> {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentBlockingQueue.class);

    /**
     * Name given to queues that are not created from configuration.
     */
    public static final String DEFAULT_NAME = "blocking-queue";

    /**
     * Root path of the per-queue sections read by {@link #fromConfig(String, Config)}.
     */
    public static final String QUEUES_CONFIG_PATH = "cbqueue.queues";

    private enum Extraction { CONSUME, PEEK }

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final ArrayDeque<T> elements;
    private boolean interrupted = false;
    private Duration timeoutDuration;

    private final int metricsWindowSeconds;
    private final AtomicLong elementsPushed = new AtomicLong(0);
    private final AtomicLong elementsPopped = new AtomicLong(0);
    private final AtomicLong timeouts = new AtomicLong(0);
    private final AtomicLong rejectedWhileInterrupted = new AtomicLong(0);
    private final SlidingWindowCounter pushThroughput;
    private final SlidingWindowCounter popThroughput;

    /**
     * Creates an empty queue with default options: no timeout, not interrupted.
     */
    public ConcurrentBlockingQueue() {
        this(DEFAULT_NAME, ConfigFactory.empty());
    }

    /**
     * Creates an empty queue with the specified name and configuration.
     *
     * @param name    The name of the queue.
     * @param options The options, see the class documentation for supported keys.
     * @throws IllegalArgumentException if the configuration is invalid.
     */
    public ConcurrentBlockingQueue(String name, Config options) {
        this(name, options, new ArrayDeque<>());
    }

    private ConcurrentBlockingQueue(String name, Config options, ArrayDeque<T> initialElements) {
        super(name, options);
        Config defaults = ConfigFactory.parseMap(Map.of(
                "metricsWindowSeconds", 5
        ));
        Config finalConfig = options.withFallback(defaults);

        try {
            this.metricsWindowSeconds = finalConfig.getInt("metricsWindowSeconds");
            if (metricsWindowSeconds <= 0) {
                throw new IllegalArgumentException("metricsWindowSeconds must be positive for queue '" + name + "'.");
            }
            // hasPath is false for "timeout = null", which also means no timeout
            if (finalConfig.hasPath("timeout")) {
                Duration configured = finalConfig.getDuration("timeout");
                if (configured.isNegative()) {
                    throw new IllegalArgumentException("timeout cannot be negative for queue '" + name + "'.");
                }
                this.timeoutDuration = configured;
            }
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for ConcurrentBlockingQueue '" + name + "'", e);
        }

        this.pushThroughput = new SlidingWindowCounter(metricsWindowSeconds);
        this.popThroughput = new SlidingWindowCounter(metricsWindowSeconds);
        this.elements = initialElements;
        log.debug("Created queue '{}' with {} elements (timeout={}, metricsWindowSeconds={})",
                name, initialElements.size(), timeoutDuration, metricsWindowSeconds);
    }

    // ----------------------------------------------------------------------------------------
    // Construction from existing data
    // ----------------------------------------------------------------------------------------

    /**
     * Creates a queue holding the given values in order.
     *
     * @throws NullPointerException if any value is null.
     */
    @SafeVarargs
    public static <T> ConcurrentBlockingQueue<T> of(T... values) {
        return copyOf(Arrays.asList(values));
    }

    /**
     * Creates a queue holding {@code count} references to {@code value}.
     *
     * @throws IllegalArgumentException if {@code count} is negative.
     * @throws NullPointerException     if {@code value} is null.
     */
    public static <T> ConcurrentBlockingQueue<T> withCopies(int count, T value) {
        requireNonNegative(count);
        Objects.requireNonNull(value, "value cannot be null");
        return copyOf(Collections.nCopies(count, value));
    }

    /**
     * Creates a queue holding the elements of {@code source} in iteration order.
     *
     * @throws NullPointerException if {@code source} is null or contains a null element.
     */
    public static <T> ConcurrentBlockingQueue<T> copyOf(Iterable<? extends T> source) {
        return new ConcurrentBlockingQueue<>(DEFAULT_NAME, ConfigFactory.empty(), new ArrayDeque<>(stage(source)));
    }

    /**
     * Creates a queue holding a snapshot of the elements of {@code other}. Only the elements are
     * copied: the new queue has its own lock, default options and a cleared interrupted flag.
     */
    public static <T> ConcurrentBlockingQueue<T> copyOf(ConcurrentBlockingQueue<? extends T> other) {
        Objects.requireNonNull(other, "other queue cannot be null");
        return new ConcurrentBlockingQueue<>(DEFAULT_NAME, ConfigFactory.empty(), new ArrayDeque<>(other.toList()));
    }

    /**
     * Creates a queue that takes over all elements of {@code other}, leaving it empty. Waiters
     * on {@code other} are not woken.
     */
    public static <T> ConcurrentBlockingQueue<T> moveFrom(ConcurrentBlockingQueue<? extends T> other) {
        Objects.requireNonNull(other, "other queue cannot be null");
        return new ConcurrentBlockingQueue<>(DEFAULT_NAME, ConfigFactory.empty(), new ArrayDeque<>(other.removeAll()));
    }

    /**
     * Creates a queue from the section {@code cbqueue.queues.<name>} of a root configuration,
     * typically one returned by {@link org.cbqueue.config.ConfigLoader#load()}. A missing section
     * yields a queue with default options.
     *
     * @param name The queue name, also the key of its configuration section.
     * @param root The root configuration.
     * @throws IllegalArgumentException if the section is invalid.
     */
    public static <T> ConcurrentBlockingQueue<T> fromConfig(String name, Config root) {
        Objects.requireNonNull(name, "Resource name cannot be null");
        String path = QUEUES_CONFIG_PATH + "." + ConfigUtil.joinPath(name);
        Config options;
        try {
            options = root.hasPath(path) ? root.getConfig(path) : ConfigFactory.empty();
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration section '" + path + "' for queue '" + name + "'", e);
        }
        return new ConcurrentBlockingQueue<>(name, options);
    }

    // ----------------------------------------------------------------------------------------
    // Push
    // ----------------------------------------------------------------------------------------

    @Override
    public QueueStatus pushOne(T value) {
        Objects.requireNonNull(value, "value cannot be null");
        return insert(Collections.singletonList(value));
    }

    @Override
    public QueueStatus pushBatch(Iterable<? extends T> values) {
        List<T> staged = stage(values);
        if (staged.isEmpty()) {
            return QueueStatus.SUCCESS;
        }
        return insert(staged);
    }

    // ----------------------------------------------------------------------------------------
    // Pop / peek
    // ----------------------------------------------------------------------------------------

    @Override
    public QueueStatus popOne(Consumer<? super T> output, boolean blocking) {
        Objects.requireNonNull(output, "output cannot be null");
        return awaitAndExtract(1, Extraction.CONSUME, blocking, batch -> output.accept(batch.get(0)));
    }

    @Override
    public QueueStatus popBatch(Collection<? super T> destination, int count, boolean blocking) {
        Objects.requireNonNull(destination, "destination cannot be null");
        requireNonNegative(count);
        if (count == 0) {
            return QueueStatus.SUCCESS;
        }
        return awaitAndExtract(count, Extraction.CONSUME, blocking, destination::addAll);
    }

    @Override
    public QueueStatus getFront(Consumer<? super T> output, boolean blocking) {
        Objects.requireNonNull(output, "output cannot be null");
        return awaitAndExtract(1, Extraction.PEEK, blocking, batch -> output.accept(batch.get(0)));
    }

    @Override
    public QueueStatus getFrontBatch(Collection<? super T> destination, int count, boolean blocking) {
        Objects.requireNonNull(destination, "destination cannot be null");
        requireNonNegative(count);
        if (count == 0) {
            return QueueStatus.SUCCESS;
        }
        return awaitAndExtract(count, Extraction.PEEK, blocking, destination::addAll);
    }

    // ----------------------------------------------------------------------------------------
    // Settings and introspection
    // ----------------------------------------------------------------------------------------

    @Override
    public Optional<Duration> getTimeoutDuration() {
        lock.lock();
        try {
            return Optional.ofNullable(timeoutDuration);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setTimeoutDuration(Duration duration) {
        if (duration != null && duration.isNegative()) {
            throw new IllegalArgumentException("Timeout cannot be negative, got: " + duration);
        }
        lock.lock();
        try {
            this.timeoutDuration = duration;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isInterrupted() {
        lock.lock();
        try {
            return interrupted;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setInterrupted(boolean value) {
        lock.lock();
        try {
            if (interrupted == value) {
                return;
            }
            interrupted = value;
            if (value) {
                log.debug("Queue '{}' interrupted, releasing all waiters", resourceName);
                changed.signalAll();
            } else {
                log.debug("Queue '{}' interrupt cleared", resourceName);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return elements.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isEmpty() {
        lock.lock();
        try {
            return elements.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            elements.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a snapshot of the current elements, front first.
     *
     * @return A new mutable list; later queue operations do not affect it.
     */
    public List<T> toList() {
        lock.lock();
        try {
            return new ArrayList<>(elements);
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     * INTERRUPTED takes precedence; otherwise WAITING while empty and ACTIVE while elements are held.
     */
    @Override
    public ResourceState getState() {
        lock.lock();
        try {
            if (interrupted) {
                return ResourceState.INTERRUPTED;
            }
            return elements.isEmpty() ? ResourceState.WAITING : ResourceState.ACTIVE;
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     * A queue is unhealthy while it is interrupted.
     */
    @Override
    public boolean isHealthy() {
        return !isInterrupted();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        int currentSize;
        int waiting;
        boolean currentlyInterrupted;
        lock.lock();
        try {
            currentSize = elements.size();
            waiting = lock.getWaitQueueLength(changed);
            currentlyInterrupted = interrupted;
        } finally {
            lock.unlock();
        }
        metrics.put("current_size", currentSize);
        metrics.put("waiting_consumers", waiting);
        metrics.put("elements_pushed", elementsPushed.get());
        metrics.put("elements_popped", elementsPopped.get());
        metrics.put("timeouts", timeouts.get());
        metrics.put("rejected_while_interrupted", rejectedWhileInterrupted.get());
        metrics.put("interrupted", currentlyInterrupted ? 1 : 0);
        metrics.put("push_throughput_per_sec", pushThroughput.getRate());
        metrics.put("pop_throughput_per_sec", popThroughput.getRate());
    }

    /**
     * @return An estimate of the number of threads blocked in a pop or peek on this queue.
     */
    public int getWaitingConsumerCount() {
        lock.lock();
        try {
            return lock.getWaitQueueLength(changed);
        } finally {
            lock.unlock();
        }
    }

    // ----------------------------------------------------------------------------------------
    // Internals
    // ----------------------------------------------------------------------------------------

    private QueueStatus insert(List<? extends T> staged) {
        lock.lock();
        try {
            if (interrupted) {
                rejectedWhileInterrupted.incrementAndGet();
                return QueueStatus.INTERRUPTED;
            }
            elements.addAll(staged);
            elementsPushed.addAndGet(staged.size());
            pushThroughput.recordSum(staged.size());
            changed.signalAll();
            return QueueStatus.SUCCESS;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Shared path of all pop and peek operations: waits (if requested) until {@code count}
     * elements are available or the queue is interrupted, then resolves interruption first,
     * sufficiency second and only then hands the front elements to {@code sink}.
     */
    private QueueStatus awaitAndExtract(int count, Extraction extraction, boolean blocking, Consumer<List<T>> sink) {
        lock.lock();
        try {
            if (blocking && !awaitAvailable(count)) {
                timeouts.incrementAndGet();
                return QueueStatus.TIMEOUT;
            }
            if (interrupted) {
                rejectedWhileInterrupted.incrementAndGet();
                return QueueStatus.INTERRUPTED;
            }
            if (elements.size() < count) {
                return QueueStatus.INSUFFICIENT_ELEMENTS;
            }
            extract(count, extraction, sink);
            return QueueStatus.SUCCESS;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Thread '{}' interrupted while waiting on queue '{}'", Thread.currentThread().getName(), resourceName);
            return QueueStatus.INTERRUPTED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits on the condition until the predicate holds. The timeout is sampled once on entry.
     *
     * @return false if the timeout elapsed with the predicate still unsatisfied.
     */
    private boolean awaitAvailable(int count) throws InterruptedException {
        Duration sampledTimeout = timeoutDuration;
        if (sampledTimeout == null) {
            while (!isSatisfied(count)) {
                changed.await();
            }
            return true;
        }

        long remainingNanos = toNanosSaturated(sampledTimeout);
        while (!isSatisfied(count)) {
            if (remainingNanos <= 0L) {
                return false;
            }
            remainingNanos = changed.awaitNanos(remainingNanos);
        }
        return true;
    }

    private boolean isSatisfied(int count) {
        return interrupted || elements.size() >= count;
    }

    /**
     * Stages the front elements before delivering them, and removes them only after the sink
     * returned, so a failing sink leaves the queue unchanged.
     */
    private void extract(int count, Extraction extraction, Consumer<List<T>> sink) {
        List<T> staged = new ArrayList<>(count);
        Iterator<T> iterator = elements.iterator();
        for (int i = 0; i < count; i++) {
            staged.add(iterator.next());
        }

        sink.accept(staged);

        if (extraction == Extraction.CONSUME) {
            for (int i = 0; i < count; i++) {
                elements.pollFirst();
            }
            elementsPopped.addAndGet(count);
            popThroughput.recordSum(count);
        }
    }

    private List<T> removeAll() {
        lock.lock();
        try {
            List<T> taken = new ArrayList<>(elements);
            elements.clear();
            return taken;
        } finally {
            lock.unlock();
        }
    }

    private static <T> List<T> stage(Iterable<? extends T> values) {
        Objects.requireNonNull(values, "values cannot be null");
        List<T> staged = values instanceof Collection<?> c ? new ArrayList<>(c.size()) : new ArrayList<>();
        for (T value : values) {
            staged.add(Objects.requireNonNull(value, "batch cannot contain null elements"));
        }
        return staged;
    }

    private static void requireNonNegative(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Count cannot be negative, got: " + count);
        }
    }

    private static long toNanosSaturated(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
