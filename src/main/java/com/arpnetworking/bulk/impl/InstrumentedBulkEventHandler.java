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
import com.arpnetworking.bulk.InvalidRoutingKeyException;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;

/**
 * Records {@link BatchDispatcher} and {@link ApacheHttpBulkSink} events as
 * Micrometer meters. Although you cannot extend it through inheritance
 * because it is final, you can extend it by encapsulating it within your own
 * event handler implementation.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class InstrumentedBulkEventHandler
        implements BatchDispatcherEventHandler, ApacheHttpBulkSinkEventHandler {

    @Override
    public void batchFlushed(final long records, final long bytes, final FlushTrigger trigger) {
        final String triggerTag = trigger.name().toLowerCase(Locale.ROOT);
        _registry.counter("bulk.dispatcher.batches", "trigger", triggerTag).increment();
        _registry.counter("bulk.dispatcher.records", "trigger", triggerTag).increment(records);
        _registry.counter("bulk.dispatcher.bytes", "trigger", triggerTag).increment(bytes);
    }

    @Override
    public void recordRejected(@Nullable final String routingKey, final BulkRecordException reason) {
        final String reasonTag = reason instanceof InvalidRoutingKeyException
                ? "invalid_routing_key"
                : "serialization";
        _registry.counter("bulk.dispatcher.rejected", "reason", reasonTag).increment();
    }

    @Override
    public void attemptComplete(
            final long records,
            final long bytes,
            final boolean success,
            final long elapsedTime,
            final TimeUnit elapsedTimeUnit) {
        _registry.counter("bulk.sink.attempts", "outcome", success ? "success" : "failure").increment();
        _registry.counter("bulk.sink.records").increment(records);
        _registry.counter("bulk.sink.bytes").increment(bytes);
        _registry.timer("bulk.sink.latency").record(elapsedTime, elapsedTimeUnit);
    }

    /**
     * Public constructor.
     *
     * @param registry the registry to record meters in
     */
    public InstrumentedBulkEventHandler(final MeterRegistry registry) {
        _registry = registry;
    }

    private final MeterRegistry _registry;
}
