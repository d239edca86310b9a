package org.cbqueue.services;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.cbqueue.api.queues.IBatchQueue;
import org.cbqueue.api.queues.QueueStatus;
import org.cbqueue.api.services.IBatchHandler;
import org.cbqueue.utils.monitoring.SlidingWindowCounter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Consumes an {@link IBatchQueue} on its own thread and hands batches to an {@link IBatchHandler}.
 * <p>
 * The worker blocks for a full batch. When the queue's timeout elapses first, whatever is
 * available (up to {@code batchSize}) is flushed unless {@code flushPartialBatches} is off.
 * The loop ends when the queue reports {@link QueueStatus#INTERRUPTED}, either because the
 * queue flag was set or because {@link #stop()} interrupted the worker thread.
 * <p>
 * A batch popped after {@link #pause()} is held until {@link #resume()} and dropped if the
 * worker is stopped while paused.
 *
 * <h3>Configuration Options:</h3>
 * <ul>
 *   <li><b>batchSize</b>: Elements per handler call (default: 1).</li>
 *   <li><b>flushPartialBatches</b>: Hand over partial batches on timeout (default: true).</li>
 *   <li><b>metricsWindowSeconds</b>: Window for the throughput metric (default: 5).</li>
 * </ul>
 *
 * @param <T> The element type of the consumed queue.
 */
public class QueueWorker<T> extends AbstractService {

    /**
     * Section read by {@link #fromConfig(String, Config, IBatchQueue, IBatchHandler)}.
     */
    public static final String WORKER_CONFIG_PATH = "cbqueue.worker";

    private final IBatchQueue<T> queue;
    private final IBatchHandler<T> handler;
    private final int batchSize;
    private final boolean flushPartialBatches;

    private final AtomicLong batchesProcessed = new AtomicLong(0);
    private final AtomicLong elementsProcessed = new AtomicLong(0);
    private final AtomicLong batchesFailed = new AtomicLong(0);
    private final AtomicLong timeouts = new AtomicLong(0);
    private final SlidingWindowCounter throughput;

    /**
     * @param name    The service name, also used as the worker thread name.
     * @param options The worker options, see the class documentation.
     * @param queue   The queue to consume.
     * @param handler Receives every non-empty batch.
     * @throws IllegalArgumentException if the options are invalid.
     */
    public QueueWorker(String name, Config options, IBatchQueue<T> queue, IBatchHandler<T> handler) {
        super(name, options);
        this.queue = Objects.requireNonNull(queue, "queue cannot be null");
        this.handler = Objects.requireNonNull(handler, "handler cannot be null");

        Config defaults = ConfigFactory.parseMap(Map.of(
                "batchSize", 1,
                "flushPartialBatches", true,
                "metricsWindowSeconds", 5
        ));
        Config finalConfig = options.withFallback(defaults);

        try {
            this.batchSize = finalConfig.getInt("batchSize");
            this.flushPartialBatches = finalConfig.getBoolean("flushPartialBatches");
            int metricsWindowSeconds = finalConfig.getInt("metricsWindowSeconds");
            if (batchSize < 1) {
                throw new IllegalArgumentException("batchSize must be at least 1 for worker '" + name + "'.");
            }
            if (metricsWindowSeconds <= 0) {
                throw new IllegalArgumentException("metricsWindowSeconds must be positive for worker '" + name + "'.");
            }
            this.throughput = new SlidingWindowCounter(metricsWindowSeconds);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for QueueWorker '" + name + "'", e);
        }
    }

    /**
     * Creates a worker from the {@code cbqueue.worker} section of a root configuration, such as
     * one returned by {@link org.cbqueue.config.ConfigLoader#load()}.
     *
     * @throws IllegalArgumentException if the section is invalid.
     */
    public static <T> QueueWorker<T> fromConfig(String name, Config root, IBatchQueue<T> queue, IBatchHandler<T> handler) {
        Config options;
        try {
            options = root.hasPath(WORKER_CONFIG_PATH) ? root.getConfig(WORKER_CONFIG_PATH) : ConfigFactory.empty();
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration section '" + WORKER_CONFIG_PATH + "' for worker '" + name + "'", e);
        }
        return new QueueWorker<>(name, options, queue, handler);
    }

    @Override
    protected void logStarted() {
        log.info("QueueWorker '{}' started (batchSize={}, flushPartialBatches={})", serviceName, batchSize, flushPartialBatches);
    }

    @Override
    protected void run() throws InterruptedException {
        List<T> batch = new ArrayList<>(batchSize);
        while (!Thread.currentThread().isInterrupted()) {
            checkPause();

            batch.clear();
            QueueStatus status = queue.popBatch(batch, batchSize, true);
            switch (status) {
                case SUCCESS:
                    checkPause();
                    process(batch);
                    break;
                case TIMEOUT:
                    timeouts.incrementAndGet();
                    if (flushPartialBatches) {
                        flushAvailable(batch);
                    }
                    break;
                case INSUFFICIENT_ELEMENTS:
                    break;
                case INTERRUPTED:
                    log.debug("Queue interrupted, worker '{}' is shutting down", serviceName);
                    return;
                default:
                    throw new IllegalStateException("Unexpected queue status: " + status);
            }
        }
    }

    private void flushAvailable(List<T> batch) throws InterruptedException {
        int available = Math.min(queue.size(), batchSize);
        if (available == 0) {
            return;
        }
        batch.clear();
        // Another consumer may have drained the queue since size(); that is not an error
        if (queue.popBatch(batch, available, false) == QueueStatus.SUCCESS) {
            checkPause();
            process(batch);
        }
    }

    private void process(List<T> batch) throws InterruptedException {
        List<T> delivered = List.copyOf(batch);
        try {
            handler.handle(delivered);
            batchesProcessed.incrementAndGet();
            elementsProcessed.addAndGet(delivered.size());
            throughput.recordSum(delivered.size());
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            batchesFailed.incrementAndGet();
            log.warn("Handler failed for batch of {} elements in worker '{}': {}", delivered.size(), serviceName, e.getMessage());
            recordError("HANDLER_FAILED", "Batch handler threw " + e.getClass().getSimpleName(),
                    "Batch size: " + delivered.size() + ", message: " + e.getMessage());
        }
    }

    public int getBatchSize() {
        return batchSize;
    }

    public boolean isFlushPartialBatches() {
        return flushPartialBatches;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("batches_processed", batchesProcessed.get());
        metrics.put("elements_processed", elementsProcessed.get());
        metrics.put("batches_failed", batchesFailed.get());
        metrics.put("timeouts", timeouts.get());
        metrics.put("throughput_per_sec", throughput.getRate());
    }
}
