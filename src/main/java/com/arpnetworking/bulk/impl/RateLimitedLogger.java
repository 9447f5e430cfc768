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

import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Rate limited {@code Logger} wrapper. Hands out the wrapped logger at most
 * once per interval and a no-op logger otherwise.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
/* package private */ final class RateLimitedLogger {

    /* package private */ RateLimitedLogger(
            final String name,
            final Logger logger,
            final Duration interval) {
        this(name, logger, interval, Clock.systemUTC());
    }

    /* package private */ RateLimitedLogger(
            final String name,
            final Logger logger,
            final Duration interval,
            final Clock clock) {
        _name = name;
        _logger = logger;
        _interval = interval;
        _clock = clock;
    }

    /* package private */ Logger getLogger() {
        final Instant now = _clock.instant();
        final Instant lastLogTime = _lastLogTime.get();
        if (lastLogTime != null && !lastLogTime.plus(_interval).isBefore(now)) {
            _skipped.incrementAndGet();
            return NOPLogger.NOP_LOGGER;
        }
        if (!_lastLogTime.compareAndSet(lastLogTime, now)) {
            // Another thread claimed this interval
            _skipped.incrementAndGet();
            return NOPLogger.NOP_LOGGER;
        }

        final int skipped = _skipped.getAndSet(0);
        if (skipped > 0) {
            _logger.info(
                    String.format(
                            "Skipped %d messages on logger '%s' since %s",
                            skipped,
                            _name,
                            lastLogTime));
        }
        return _logger;
    }

    private final String _name;
    private final Logger _logger;
    private final Duration _interval;
    private final Clock _clock;
    private final AtomicReference<Instant> _lastLogTime = new AtomicReference<>();
    private final AtomicInteger _skipped = new AtomicInteger(0);
}
