package com.relaychat.socket.accumulator;

import com.relaychat.core.error.FlushExhaustedException;
import com.relaychat.core.error.IngestException;
import com.relaychat.core.metrics.MetricsNames;
import com.relaychat.core.model.ChatEvent;
import com.relaychat.core.model.PersistedRecord;
import com.relaychat.socket.config.SocketConfig;
import com.relaychat.socket.metrics.MetricsService;
import com.relaychat.socket.store.MessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Size-or-time batching in front of the message store.
 * <p>
 * Events go into an active FIFO buffer. A flush swaps that buffer for an empty one under the
 * buffer lock, so {@link #ingest(ChatEvent)} never waits for the store, then writes the swapped
 * batch in one transaction. Flushes are triggered by:
 * <ul>
 *   <li>the buffer reaching {@code BATCH_SIZE}</li>
 *   <li>a timer every {@code FLUSH_INTERVAL_MS}</li>
 *   <li>{@link #flush()} and {@link #close()}</li>
 * </ul>
 * All flushes run on a single flush worker and hold the flush lock, so batches reach the store
 * in ingestion order.
 * </p>
 * <p>
 * A failed write is retried with exponential backoff. When retries run out the batch is
 * escalated as a {@link FlushExhaustedException}; the accumulator keeps accepting events.
 * </p>
 */
public class BatchAccumulator implements IBatchAccumulator {
    private static final Logger log = LoggerFactory.getLogger(BatchAccumulator.class);

    private final SocketConfig config;
    private final MessageStore store;
    private final MetricsService metricsService;

    private final Object bufferLock = new Object();
    private final ReentrantLock flushLock = new ReentrantLock();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicBoolean sizeFlushPending = new AtomicBoolean(false);
    private final Scheduler flushScheduler;
    private final Disposable timer;

    private List<PersistedRecord> buffer = new ArrayList<>();
    private volatile boolean closed;
    private volatile Consumer<FlushExhaustedException> exhaustedListener = failure -> { };

    public BatchAccumulator(SocketConfig config, MessageStore store, MetricsService metricsService) {
        this.config = config;
        this.store = store;
        this.metricsService = metricsService;
        this.flushScheduler = Schedulers.newBoundedElastic(1, Integer.MAX_VALUE, "flush", 60, true);

        long intervalMs = config.getFlushInterval().toMillis();
        this.timer = flushScheduler.schedulePeriodically(this::timedFlush, intervalMs, intervalMs, TimeUnit.MILLISECONDS);

        metricsService.gauge(MetricsNames.BUFFERED, this::pending);
    }

    @Override
    public void ingest(ChatEvent event) {
        boolean sizeReached;
        synchronized (bufferLock) {
            if (closed) {
                metricsService.recordIngestRejected(false);
                throw IngestException.closed();
            }
            int pending = buffer.size() + inFlight.get();
            if (pending >= config.getMaxBufferedRecords()) {
                metricsService.recordIngestRejected(true);
                throw IngestException.bufferFull(pending, config.getMaxBufferedRecords());
            }
            buffer.add(PersistedRecord.fromEvent(event));
            sizeReached = buffer.size() >= config.getBatchSize();
        }
        metricsService.recordIngested();

        if (sizeReached && sizeFlushPending.compareAndSet(false, true)) {
            flushScheduler.schedule(this::flushNow);
        }
    }

    @Override
    public Mono<Void> flush() {
        return Mono.fromRunnable(this::flushNow)
            .subscribeOn(flushScheduler)
            .then();
    }

    @Override
    public void onFlushExhausted(Consumer<FlushExhaustedException> listener) {
        this.exhaustedListener = listener;
    }

    @Override
    public void close() {
        synchronized (bufferLock) {
            if (closed) {
                return;
            }
            closed = true;
        }
        timer.dispose();
        log.info("Closing accumulator, flushing remaining records");

        flush().block();
        flushScheduler.dispose();
        log.info("Accumulator closed");
    }

    private void timedFlush() {
        if (pending() > 0) {
            log.debug("Flush interval elapsed");
        }
        flushNow();
    }

    private void flushNow() {
        flushLock.lock();
        try {
            List<PersistedRecord> batch;
            synchronized (bufferLock) {
                sizeFlushPending.set(false);
                if (buffer.isEmpty()) {
                    return;
                }
                batch = buffer;
                buffer = new ArrayList<>();
                inFlight.set(batch.size());
            }
            write(batch);
        } finally {
            inFlight.set(0);
            flushLock.unlock();
        }
    }

    private void write(List<PersistedRecord> batch) {
        long startNanos = System.nanoTime();
        AtomicInteger attempts = new AtomicInteger();

        try {
            Integer inserted = Mono.fromCallable(() -> {
                    attempts.incrementAndGet();
                    return store.insertBatch(batch);
                })
                .retryWhen(Retry.backoff(config.getFlushMaxRetries(), config.getFlushBackoffBase())
                    .maxBackoff(config.getFlushBackoffMax())
                    .doBeforeRetry(signal -> {
                        metricsService.recordFlushRetry();
                        log.warn("Flush of {} records failed (attempt {}), retrying: {}",
                            batch.size(), signal.totalRetries() + 1, signal.failure().getMessage());
                    })
                    .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                .block();

            metricsService.recordFlushOk(inserted != null ? inserted : 0, startNanos);
            log.debug("Flushed {} records ({} inserted, {} attempt(s))", batch.size(), inserted, attempts.get());
        } catch (RuntimeException e) {
            FlushExhaustedException failure = new FlushExhaustedException(batch, attempts.get(), e);
            metricsService.recordFlushExhausted(startNanos);
            log.error(failure.getMessage(), e);
            try {
                exhaustedListener.accept(failure);
            } catch (RuntimeException listenerError) {
                log.error("Flush failure listener threw", listenerError);
            }
        }
    }

    private int pending() {
        synchronized (bufferLock) {
            return buffer.size() + inFlight.get();
        }
    }
}
