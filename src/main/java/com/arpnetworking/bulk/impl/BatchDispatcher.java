/*
 * Copyright 2017 Inscope Metrics, Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.arpnetworking.bulk.impl;

import com.arpnetworking.bulk.BulkRecordException;
import com.arpnetworking.bulk.BulkSink;
import com.arpnetworking.bulk.Dispatcher;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nullable;

/**
 * Buffers records in the line-delimited bulk format and hands each batch to
 * a {@link BulkSink} once it reaches the batch size or once the flush
 * interval has elapsed since its first record.
 *
 * All buffer state is guarded by a single lock. Serialization happens before
 * the lock is taken and delivery happens on a worker thread after it is
 * released, so producers never wait on the sink.
 *
 * Each flush increments a generation counter. The interval timer armed for a
 * batch remembers the generation it was armed in and does nothing if a flush
 * has happened since. Timers run on their own thread and only detach the
 * batch; the sink is always invoked on a delivery thread.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot io)
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot io)
 */
public final class BatchDispatcher implements Dispatcher {

    @Override
    public void push(@Nullable final String routingKey, @Nullable final Object record) throws BulkRecordException {
        final byte[] unit;
        try {
            unit = _framing.frame(routingKey, record);
        } catch (final BulkRecordException e) {
            _rejectedRecordLogger.getLogger().warn(
                    String.format("Rejected record; routingKey=%s", routingKey),
                    e);
            _eventHandler.ifPresent(eh -> eh.recordRejected(routingKey, e));
            throw e;
        }

        _lock.lock();
        try {
            if (_closed) {
                throw new IllegalStateException("Dispatcher is closed");
            }
            _pending.write(unit, 0, unit.length);
            ++_pendingCount;

            if (_pendingCount >= _batchSize) {
                final Batch batch = detach();
                _deliveryExecutor.execute(() -> deliver(batch, FlushTrigger.SIZE));
            } else if (_pendingCount == 1) {
                final long generation = _generation;
                _scheduledFlush = _timerExecutor.schedule(
                        () -> flush(generation),
                        _flushInterval.toNanos(),
                        TimeUnit.NANOSECONDS);
            }
        } finally {
            _lock.unlock();
        }
    }

    @Override
    public void close() {
        if (shutdown()) {
            try {
                Runtime.getRuntime().removeShutdownHook(_shutdownHook);
            } catch (final IllegalStateException e) {
                // The virtual machine is already shutting down
                _logger.debug("Unable to remove shutdown hook", e);
            }
        }
    }

    /**
     * Flush the pending batch if no flush has happened since the given
     * generation.
     *
     * @param generation the generation observed when the flush was scheduled
     */
    /* package private */ void flush(final long generation) {
        _lock.lock();
        try {
            if (_closed || generation != _generation || _pendingCount == 0) {
                return;
            }
            _scheduledFlush = null;
            final Batch batch = detach();
            _deliveryExecutor.execute(() -> deliver(batch, FlushTrigger.INTERVAL));
        } finally {
            _lock.unlock();
        }
    }

    /* package private */ int getPendingCount() {
        _lock.lock();
        try {
            return _pendingCount;
        } finally {
            _lock.unlock();
        }
    }

    /* package private */ long getGeneration() {
        _lock.lock();
        try {
            return _generation;
        } finally {
            _lock.unlock();
        }
    }

    /**
     * Stop accepting records, flush what is buffered and wait for in-flight
     * deliveries.
     *
     * @return {@code true} if this call closed the dispatcher
     */
    /* package private */ boolean shutdown() {
        _lock.lock();
        try {
            if (_closed) {
                return false;
            }
            _closed = true;
            if (_pendingCount > 0) {
                final Batch batch = detach();
                _deliveryExecutor.execute(() -> deliver(batch, FlushTrigger.CLOSE));
            } else {
                cancelScheduledFlush();
            }
        } finally {
            _lock.unlock();
        }

        // Timers fired from here on find the dispatcher closed
        _timerExecutor.shutdown();
        _deliveryExecutor.shutdown();
        try {
            if (!_deliveryExecutor.awaitTermination(_shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                _logger.warn(String.format(
                        "Timed out waiting for in-flight batches; shutdownTimeout=%s",
                        _shutdownTimeout));
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            _logger.warn("Interrupted waiting for in-flight batches", e);
        }

        if (_sink instanceof AutoCloseable) {
            try {
                ((AutoCloseable) _sink).close();
                // CHECKSTYLE.OFF: IllegalCatch - AutoCloseable throws Exception
            } catch (final Exception e) {
                // CHECKSTYLE.ON: IllegalCatch
                _logger.warn("Failed to close sink", e);
            }
        }
        return true;
    }

    // Requires _lock
    private Batch detach() {
        final Batch batch = new Batch(_pending.toByteArray(), _pendingCount);
        _pending.reset();
        _pendingCount = 0;
        ++_generation;
        cancelScheduledFlush();
        return batch;
    }

    // Requires _lock
    private void cancelScheduledFlush() {
        if (_scheduledFlush != null) {
            _scheduledFlush.cancel(false);
            _scheduledFlush = null;
        }
    }

    private void deliver(final Batch batch, final FlushTrigger trigger) {
        try {
            _sink.send(batch.getPayload(), batch.getRecords());
            // CHECKSTYLE.OFF: IllegalCatch - Sink failures must not reach the worker threads
        } catch (final RuntimeException e) {
            // CHECKSTYLE.ON: IllegalCatch
            _dispatchErrorLogger.getLogger().error(
                    String.format(
                            "Sink failed to accept batch; records=%d, bytes=%d, trigger=%s",
                            batch.getRecords(),
                            batch.getPayload().length,
                            trigger),
                    e);
        } finally {
            _eventHandler.ifPresent(eh -> eh.batchFlushed(batch.getRecords(), batch.getPayload().length, trigger));
        }
    }

    private BatchDispatcher(final Builder builder) {
        this(builder, LOGGER);
    }

    /* package private */ BatchDispatcher(final Builder builder, final Logger logger) {
        _batchSize = builder._batchSize;
        _flushInterval = builder._flushInterval;
        _shutdownTimeout = builder._shutdownTimeout;
        _sink = builder._sink;
        _framing = new BulkFraming(builder._objectMapper);
        _eventHandler = Optional.ofNullable(builder._eventHandler);
        _logger = logger;
        _rejectedRecordLogger = new RateLimitedLogger(
                "RejectedRecordLogger",
                logger,
                builder._rejectedRecordLoggingInterval);
        _dispatchErrorLogger = new RateLimitedLogger(
                "DispatchErrorLogger",
                logger,
                builder._dispatchErrorLoggingInterval);

        _deliveryExecutor = Executors.newFixedThreadPool(
                builder._parallelism,
                runnable -> {
                    final Thread thread = new Thread(runnable, "BulkDispatcherWorker");
                    thread.setDaemon(true);
                    return thread;
                });
        _timerExecutor = new ScheduledThreadPoolExecutor(
                1,
                runnable -> {
                    final Thread thread = new Thread(runnable, "BulkDispatcherTimer");
                    thread.setDaemon(true);
                    return thread;
                });
        _timerExecutor.setRemoveOnCancelPolicy(true);
        _timerExecutor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);

        _shutdownHook = new ShutdownHookThread(this);
        Runtime.getRuntime().addShutdownHook(_shutdownHook);
    }

    private final int _batchSize;
    private final Duration _flushInterval;
    private final Duration _shutdownTimeout;
    private final BulkSink _sink;
    private final BulkFraming _framing;
    private final Optional<BatchDispatcherEventHandler> _eventHandler;
    private final Logger _logger;
    private final RateLimitedLogger _rejectedRecordLogger;
    private final RateLimitedLogger _dispatchErrorLogger;
    private final ExecutorService _deliveryExecutor;
    private final ScheduledThreadPoolExecutor _timerExecutor;
    private final Thread _shutdownHook;

    private final Lock _lock = new ReentrantLock();
    private final ByteArrayOutputStream _pending = new ByteArrayOutputStream();
    private int _pendingCount = 0;
    private long _generation = 0;
    private boolean _closed = false;
    @Nullable
    private ScheduledFuture<?> _scheduledFlush;

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchDispatcher.class);

    private static final class Batch {

        /* package private */ Batch(final byte[] payload, final int records) {
            _payload = payload;
            _records = records;
        }

        public byte[] getPayload() {
            return _payload;
        }

        public int getRecords() {
            return _records;
        }

        private final byte[] _payload;
        private final int _records;
    }

    private static final class ShutdownHookThread extends Thread {

        /* package private */ ShutdownHookThread(final BatchDispatcher dispatcher) {
            super("BulkDispatcherShutdownHook");
            _dispatcher = dispatcher;
        }

        @Override
        public void run() {
            _dispatcher.shutdown();
        }

        private final BatchDispatcher _dispatcher;
    }

    /**
     * Builder for {@link BatchDispatcher}.
     */
    public static final class Builder {

        /**
         * Set the batch size in number of records. A batch is flushed as soon
         * as it holds this many records. Optional; default is 1,000.
         *
         * @param value The number of records per batch.
         * @return This {@link Builder} instance.
         */
        public Builder setBatchSize(@Nullable final Integer value) {
            _batchSize = value;
            return this;
        }

        /**
         * Set the flush interval. A non-empty batch is flushed at most this
         * long after its first record was pushed. Optional; default is 1
         * second.
         *
         * @param value The flush interval.
         * @return This {@link Builder} instance.
         */
        public Builder setFlushInterval(@Nullable final Duration value) {
            _flushInterval = value;
            return this;
        }

        /**
         * Set the sink that receives each flushed batch. The dispatcher closes
         * the sink on shutdown if it is {@link AutoCloseable}. Optional;
         * default is an {@link ApacheHttpBulkSink} with its default settings.
         *
         * @param value The sink.
         * @return This {@link Builder} instance.
         */
        public Builder setSink(@Nullable final BulkSink value) {
            _sink = value;
            return this;
        }

        /**
         * Set the {@code ObjectMapper} used to serialize records. Indentation
         * is always disabled. Optional; default serializes {@code java.time}
         * types as ISO-8601 strings.
         *
         * @param value The object mapper.
         * @return This {@link Builder} instance.
         */
        public Builder setObjectMapper(@Nullable final ObjectMapper value) {
            _objectMapper = value;
            return this;
        }

        /**
         * Set the number of worker threads delivering batches. With more than
         * one worker batches may reach the sink out of order. Optional;
         * default is 1.
         *
         * @param value The number of workers.
         * @return This {@link Builder} instance.
         */
        public Builder setParallelism(@Nullable final Integer value) {
            _parallelism = value;
            return this;
        }

        /**
         * Set how long {@link BatchDispatcher#close()} waits for in-flight
         * batches. Optional; default is 5 seconds.
         *
         * @param value The shutdown timeout.
         * @return This {@link Builder} instance.
         */
        public Builder setShutdownTimeout(@Nullable final Duration value) {
            _shutdownTimeout = value;
            return this;
        }

        /**
         * Set the event handler. Optional; default is {@code null}.
         *
         * @param value The event handler.
         * @return This {@link Builder} instance.
         */
        public Builder setEventHandler(@Nullable final BatchDispatcherEventHandler value) {
            _eventHandler = value;
            return this;
        }

        /**
         * Set the rejected record logging interval. Rejected record notices
         * are logged at most once per interval. Optional; default is 1
         * minute.
         *
         * @param value The logging interval.
         * @return This {@link Builder} instance.
         */
        public Builder setRejectedRecordLoggingInterval(@Nullable final Duration value) {
            _rejectedRecordLoggingInterval = value;
            return this;
        }

        /**
         * Set the dispatch error logging interval. Sink failures are logged
         * at most once per interval. Optional; default is 1 minute.
         *
         * @param value The logging interval.
         * @return This {@link Builder} instance.
         */
        public Builder setDispatchErrorLoggingInterval(@Nullable final Duration value) {
            _dispatchErrorLoggingInterval = value;
            return this;
        }

        /**
         * Create an instance of {@link Dispatcher}.
         *
         * @return Instance of {@link Dispatcher}.
         */
        public Dispatcher build() {
            // Defaults
            applyDefaults();

            // Validate
            final List<String> failures = new ArrayList<>();
            validate(failures);

            // Fallback
            if (!failures.isEmpty()) {
                LOGGER.warn(String.format(
                        "Unable to construct %s, dispatcher disabled; failures=%s",
                        this.getClass().getEnclosingClass().getSimpleName(),
                        failures));
                return new WarningDispatcher(failures);
            }

            // The default sink owns a connection pool; only create it for a dispatcher that will close it
            if (_sink == null) {
                _sink = new ApacheHttpBulkSink.Builder().build();
                LOGGER.info(String.format(
                        "Defaulted null sink; sink=%s",
                        _sink));
            }

            return new BatchDispatcher(this);
        }

        @Nullable
        /* package private */ BulkSink getSink() {
            return _sink;
        }

        private void applyDefaults() {
            if (_batchSize == null) {
                _batchSize = DEFAULT_BATCH_SIZE;
                LOGGER.info(String.format(
                        "Defaulted null batch size; batchSize=%s",
                        _batchSize));
            }
            if (_flushInterval == null) {
                _flushInterval = DEFAULT_FLUSH_INTERVAL;
                LOGGER.info(String.format(
                        "Defaulted null flush interval; flushInterval=%s",
                        _flushInterval));
            }
            if (_objectMapper == null) {
                _objectMapper = DEFAULT_OBJECT_MAPPER;
                LOGGER.info("Defaulted null object mapper");
            }
            if (_parallelism == null) {
                _parallelism = DEFAULT_PARALLELISM;
                LOGGER.info(String.format(
                        "Defaulted null parallelism; parallelism=%s",
                        _parallelism));
            }
            if (_shutdownTimeout == null) {
                _shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
                LOGGER.info(String.format(
                        "Defaulted null shutdown timeout; shutdownTimeout=%s",
                        _shutdownTimeout));
            }
            if (_rejectedRecordLoggingInterval == null) {
                _rejectedRecordLoggingInterval = DEFAULT_REJECTED_RECORD_LOGGING_INTERVAL;
                LOGGER.info(String.format(
                        "Defaulted null rejected record logging interval; rejectedRecordLoggingInterval=%s",
                        _rejectedRecordLoggingInterval));
            }
            if (_dispatchErrorLoggingInterval == null) {
                _dispatchErrorLoggingInterval = DEFAULT_DISPATCH_ERROR_LOGGING_INTERVAL;
                LOGGER.info(String.format(
                        "Defaulted null dispatch error logging interval; dispatchErrorLoggingInterval=%s",
                        _dispatchErrorLoggingInterval));
            }
        }

        private void validate(final List<String> failures) {
            if (_batchSize <= 0) {
                failures.add(String.format("Batch size must be positive; batchSize=%s", _batchSize));
            }
            if (_flushInterval.isNegative() || _flushInterval.isZero()) {
                failures.add(String.format("Flush interval must be positive; flushInterval=%s", _flushInterval));
            }
            if (_parallelism <= 0) {
                failures.add(String.format("Parallelism must be positive; parallelism=%s", _parallelism));
            }
            if (_shutdownTimeout.isNegative()) {
                failures.add(String.format("Shutdown timeout must not be negative; shutdownTimeout=%s", _shutdownTimeout));
            }
        }

        private Integer _batchSize = DEFAULT_BATCH_SIZE;
        private Duration _flushInterval = DEFAULT_FLUSH_INTERVAL;
        private @Nullable BulkSink _sink;
        private ObjectMapper _objectMapper = DEFAULT_OBJECT_MAPPER;
        private Integer _parallelism = DEFAULT_PARALLELISM;
        private Duration _shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
        private @Nullable BatchDispatcherEventHandler _eventHandler;
        private Duration _rejectedRecordLoggingInterval = DEFAULT_REJECTED_RECORD_LOGGING_INTERVAL;
        private Duration _dispatchErrorLoggingInterval = DEFAULT_DISPATCH_ERROR_LOGGING_INTERVAL;

        private static final Integer DEFAULT_BATCH_SIZE = 1000;
        private static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(1);
        private static final Integer DEFAULT_PARALLELISM = 1;
        private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
        private static final Duration DEFAULT_REJECTED_RECORD_LOGGING_INTERVAL = Duration.ofMinutes(1);
        private static final Duration DEFAULT_DISPATCH_ERROR_LOGGING_INTERVAL = Duration.ofMinutes(1);
        private static final ObjectMapper DEFAULT_OBJECT_MAPPER = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
