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

import com.arpnetworking.bulk.BulkSink;
import org.apache.http.Header;
import org.apache.http.HttpHeaders;
import org.apache.http.HttpStatus;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.message.BasicHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;

/**
 * {@link BulkSink} that posts each batch to a bulk endpoint using the Apache
 * HTTP library. Failed requests are logged and reported to the event handler;
 * they are not retried.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot io)
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot io)
 */
public final class ApacheHttpBulkSink implements BulkSink, Closeable {

    @Override
    public void send(final byte[] payload, final int records) {
        final ByteArrayEntity entity = new ByteArrayEntity(payload);
        final HttpPost post = new HttpPost(_uri);
        post.setHeader(CONTENT_TYPE_HEADER);
        post.setEntity(entity);

        final long startNanos = System.nanoTime();
        boolean success = false;

        try (CloseableHttpResponse response = _httpClient.execute(post)) {
            final int statusCode = response.getStatusLine().getStatusCode();
            if (statusCode == HttpStatus.SC_NOT_FOUND) {
                // The server may be up without the bulk endpoint being
                // routable yet; treat it the same as the server being down.
                throw new RuntimeException("Endpoint not available");
            }
            if ((statusCode / 100) != 2) {
                _dispatchErrorLogger.getLogger().error(
                        String.format(
                                "Received failure response when sending batch to bulk endpoint; uri=%s, status=%s",
                                _uri,
                                statusCode));
            } else {
                success = true;
            }
            // CHECKSTYLE.OFF: IllegalCatch - Prevent leaking exceptions into the dispatcher workers
        } catch (final RuntimeException | IOException e) {
            // CHECKSTYLE.ON: IllegalCatch
            _dispatchErrorLogger.getLogger().error(
                    String.format(
                            "Encountered failure when sending batch to bulk endpoint; uri=%s",
                            _uri),
                    e);
        } finally {
            final long elapsedNanos = System.nanoTime() - startNanos;
            if (_eventHandler.isPresent()) {
                _eventHandler.get().attemptComplete(
                        records,
                        entity.getContentLength(),
                        success,
                        elapsedNanos,
                        TimeUnit.NANOSECONDS);
            }
        }
    }

    @Override
    public void close() throws IOException {
        _httpClient.close();
    }

    @Override
    public String toString() {
        return String.format("ApacheHttpBulkSink{uri=%s}", _uri);
    }

    private ApacheHttpBulkSink(final Builder builder) {
        this(builder, createHttpClient(builder._parallelism), LOGGER);
    }

    /* package private */ ApacheHttpBulkSink(
            final Builder builder,
            final CloseableHttpClient httpClient,
            final Logger logger) {
        _uri = builder._uri;
        _httpClient = httpClient;
        _eventHandler = Optional.ofNullable(builder._eventHandler);
        _dispatchErrorLogger = new RateLimitedLogger(
                "DispatchErrorLogger",
                logger,
                builder._dispatchErrorLoggingInterval);
    }

    private static CloseableHttpClient createHttpClient(final int parallelism) {
        final PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
        connectionManager.setDefaultMaxPerRoute(parallelism);
        connectionManager.setMaxTotal(parallelism);
        return HttpClients.custom()
                .setConnectionManager(connectionManager)
                .build();
    }

    private final URI _uri;
    private final CloseableHttpClient _httpClient;
    private final Optional<ApacheHttpBulkSinkEventHandler> _eventHandler;
    private final RateLimitedLogger _dispatchErrorLogger;

    private static final Logger LOGGER = LoggerFactory.getLogger(ApacheHttpBulkSink.class);
    private static final Header CONTENT_TYPE_HEADER = new BasicHeader(HttpHeaders.CONTENT_TYPE, "application/x-ndjson");

    /**
     * Builder for {@link ApacheHttpBulkSink}.
     */
    public static final class Builder {

        /**
         * Set the URI of the bulk endpoint. Optional; default is
         * {@code http://localhost:9200/_bulk}.
         *
         * @param value The uri of the bulk endpoint.
         * @return This {@link Builder} instance.
         */
        public Builder setUri(@Nullable final URI value) {
            _uri = value;
            return this;
        }

        /**
         * Set the maximum number of concurrent connections. Optional; default
         * is 2.
         *
         * @param value The number of connections.
         * @return This {@link Builder} instance.
         */
        public Builder setParallelism(@Nullable final Integer value) {
            _parallelism = value;
            return this;
        }

        /**
         * Set the dispatch error logging interval. Any dispatch errors will be
         * logged at most once per interval. Optional; default is 1 minute.
         *
         * @param value The logging interval.
         * @return This {@link Builder} instance.
         */
        public Builder setDispatchErrorLoggingInterval(@Nullable final Duration value) {
            _dispatchErrorLoggingInterval = value;
            return this;
        }

        /**
         * Set the event handler. Optional; default is {@code null}.
         *
         * @param value The event handler.
         * @return This {@link Builder} instance.
         */
        public Builder setEventHandler(@Nullable final ApacheHttpBulkSinkEventHandler value) {
            _eventHandler = value;
            return this;
        }

        /**
         * Create an instance of {@link BulkSink}.
         *
         * @return Instance of {@link BulkSink}.
         */
        public BulkSink build() {
            // Defaults
            applyDefaults();

            // Validate
            final List<String> failures = new ArrayList<>();
            validate(failures);

            // Fallback
            if (!failures.isEmpty()) {
                LOGGER.warn(String.format(
                        "Unable to construct %s, sink disabled; failures=%s",
                        this.getClass().getEnclosingClass().getSimpleName(),
                        failures));
                final RateLimitedLogger warningLogger = new RateLimitedLogger(
                        "DisabledSinkLogger",
                        LOGGER,
                        _dispatchErrorLoggingInterval);
                return (payload, records) -> warningLogger.getLogger().warn(String.format(
                        "Sink disabled, dropping batch; records=%d, failures=%s",
                        records,
                        failures));
            }

            return new ApacheHttpBulkSink(this);
        }

        private void applyDefaults() {
            if (_uri == null) {
                _uri = DEFAULT_URI;
                LOGGER.info(String.format(
                        "Defaulted null uri; uri=%s",
                        _uri));
            }
            if (_parallelism == null) {
                _parallelism = DEFAULT_PARALLELISM;
                LOGGER.info(String.format(
                        "Defaulted null parallelism; parallelism=%s",
                        _parallelism));
            }
            if (_dispatchErrorLoggingInterval == null) {
                _dispatchErrorLoggingInterval = DEFAULT_DISPATCH_ERROR_LOGGING_INTERVAL;
                LOGGER.info(String.format(
                        "Defaulted null dispatch error logging interval; dispatchErrorLoggingInterval=%s",
                        _dispatchErrorLoggingInterval));
            }
        }

        private void validate(final List<String> failures) {
            if (!"http".equalsIgnoreCase(_uri.getScheme()) && !"https".equalsIgnoreCase(_uri.getScheme())) {
                failures.add(String.format("URI must be an http(s) URI; uri=%s", _uri));
            }
            if (_parallelism <= 0) {
                failures.add(String.format("Parallelism must be positive; parallelism=%s", _parallelism));
            }
        }

        private URI _uri = DEFAULT_URI;
        private Integer _parallelism = DEFAULT_PARALLELISM;
        private Duration _dispatchErrorLoggingInterval = DEFAULT_DISPATCH_ERROR_LOGGING_INTERVAL;
        private @Nullable ApacheHttpBulkSinkEventHandler _eventHandler;

        private static final URI DEFAULT_URI = URI.create("http://localhost:9200/_bulk");
        private static final Integer DEFAULT_PARALLELISM = 2;
        private static final Duration DEFAULT_DISPATCH_ERROR_LOGGING_INTERVAL = Duration.ofMinutes(1);
    }
}
