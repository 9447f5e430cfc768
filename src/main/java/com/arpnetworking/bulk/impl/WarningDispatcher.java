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

import com.arpnetworking.bulk.Dispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Stand-in returned when a {@link BatchDispatcher} cannot be built. Accepts
 * and discards every record, logging why at most once per minute.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot io)
 */
/* package private */ final class WarningDispatcher implements Dispatcher {

    @Override
    public void push(@Nullable final String routingKey, @Nullable final Object record) {
        _warningLogger.getLogger().warn(String.format(
                "Dispatcher disabled, dropping record; routingKey=%s, reasons=%s",
                routingKey,
                _reasons));
    }

    @Override
    public void close() {
        // Nothing is buffered
    }

    /* package private */ List<String> getReasons() {
        return _reasons;
    }

    /* package private */ WarningDispatcher(final List<String> reasons) {
        this(reasons, LOGGER);
    }

    /* package private */ WarningDispatcher(final List<String> reasons, final Logger logger) {
        _reasons = Collections.unmodifiableList(new ArrayList<>(reasons));
        _warningLogger = new RateLimitedLogger("WarningDispatcherLogger", logger, WARNING_LOGGING_INTERVAL);
    }

    private final List<String> _reasons;
    private final RateLimitedLogger _warningLogger;

    private static final Logger LOGGER = LoggerFactory.getLogger(WarningDispatcher.class);
    private static final Duration WARNING_LOGGING_INTERVAL = Duration.ofMinutes(1);
}
