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
import com.arpnetworking.bulk.Dispatcher;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.github.tomakehurst.wiremock.junit.WireMockRule;
import com.github.tomakehurst.wiremock.matching.RequestPatternBuilder;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.impl.client.CloseableHttpClient;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.mockito.Mockito;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.concurrent.TimeUnit;

/**
 * Tests for {@link ApacheHttpBulkSink}.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot io)
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot io)
 */
public final class ApacheHttpBulkSinkTest {

    @Test
    public void testBuilderWithDefaults() throws IOException {
        final BulkSink sink = new ApacheHttpBulkSink.Builder().build();
        Assert.assertNotNull(sink);
        Assert.assertEquals(ApacheHttpBulkSink.class, sink.getClass());
        ((Closeable) sink).close();
    }

    @Test
    public void testBuilderWithNulls() throws IOException {
        final ApacheHttpBulkSink.Builder builder = new ApacheHttpBulkSink.Builder();
        builder.setUri(null);
        builder.setParallelism(null);
        builder.setDispatchErrorLoggingInterval(null);
        builder.setEventHandler(null);
        final BulkSink sink = builder.build();
        Assert.assertEquals(ApacheHttpBulkSink.class, sink.getClass());
        ((Closeable) sink).close();
    }

    @Test
    public void testBuilderWithHttpsUri() throws IOException {
        final BulkSink sink = new ApacheHttpBulkSink.Builder()
                .setUri(URI.create("https://secure.example.com/_bulk"))
                .build();
        Assert.assertEquals(ApacheHttpBulkSink.class, sink.getClass());
        ((Closeable) sink).close();
    }

    @Test
    public void testBuilderWithNotHttpUri() {
        final BulkSink sink = new ApacheHttpBulkSink.Builder()
                .setUri(URI.create("ftp://ftp.example.com"))
                .build();
        Assert.assertNotNull(sink);
        Assert.assertNotEquals(ApacheHttpBulkSink.class, sink.getClass());

        // The disabled sink discards batches
        sink.send(PAYLOAD, 1);
    }

    @Test
    public void testPostSuccess() throws IOException {
        _wireMockRule.stubFor(
                WireMock.post(WireMock.urlEqualTo(PATH))
                        .willReturn(WireMock.aResponse()
                                .withStatus(200)
                                .withBody("{\"took\":3,\"errors\":false,\"items\":[]}")));

        final ApacheHttpBulkSinkEventHandler handler = Mockito.mock(ApacheHttpBulkSinkEventHandler.class);
        final BulkSink sink = new ApacheHttpBulkSink.Builder()
                .setUri(URI.create("http://localhost:" + _wireMockRule.port() + PATH))
                .setEventHandler(handler)
                .build();

        sink.send(PAYLOAD, 1);

        Mockito.verify(handler).attemptComplete(
                Mockito.eq(1L),
                Mockito.eq((long) PAYLOAD.length),
                Mockito.eq(true),
                Mockito.anyLong(),
                Mockito.eq(TimeUnit.NANOSECONDS));

        _wireMockRule.verify(1, bulkRequest()
                .withRequestBody(WireMock.equalTo(new String(PAYLOAD, StandardCharsets.UTF_8))));
        Assert.assertTrue(_wireMockRule.findUnmatchedRequests().getRequests().isEmpty());
        ((Closeable) sink).close();
    }

    @Test
    public void testPostFailure() throws IOException {
        _wireMockRule.stubFor(
                WireMock.post(WireMock.urlEqualTo(PATH))
                        .willReturn(WireMock.aResponse()
                                .withStatus(400)));

        final org.slf4j.Logger logger = Mockito.mock(org.slf4j.Logger.class);
        final ApacheHttpBulkSinkEventHandler handler = Mockito.mock(ApacheHttpBulkSinkEventHandler.class);
        final ApacheHttpBulkSink sink = createSink(handler, logger);

        sink.send(PAYLOAD, 1);

        Mockito.verify(handler).attemptComplete(
                Mockito.eq(1L),
                Mockito.eq((long) PAYLOAD.length),
                Mockito.eq(false),
                Mockito.anyLong(),
                Mockito.eq(TimeUnit.NANOSECONDS));
        Mockito.verify(logger).error(
                Mockito.startsWith("Received failure response when sending batch to bulk endpoint; uri="));
        _wireMockRule.verify(1, bulkRequest());
        sink.close();
    }

    @Test
    public void testEndpointNotAvailable() throws IOException {
        _wireMockRule.stubFor(
                WireMock.post(WireMock.urlEqualTo(PATH))
                        .willReturn(WireMock.aResponse()
                                .withStatus(404)));

        final org.slf4j.Logger logger = Mockito.mock(org.slf4j.Logger.class);
        final ApacheHttpBulkSinkEventHandler handler = Mockito.mock(ApacheHttpBulkSinkEventHandler.class);
        final ApacheHttpBulkSink sink = createSink(handler, logger);

        sink.send(PAYLOAD, 1);

        Mockito.verify(handler).attemptComplete(
                Mockito.eq(1L),
                Mockito.anyLong(),
                Mockito.eq(false),
                Mockito.anyLong(),
                Mockito.eq(TimeUnit.NANOSECONDS));
        Mockito.verify(logger).error(
                Mockito.startsWith("Encountered failure when sending batch to bulk endpoint; uri="),
                Mockito.any(RuntimeException.class));
        sink.close();
    }

    @Test
    public void testPostConnectionRefused() throws IOException {
        final org.slf4j.Logger logger = Mockito.mock(org.slf4j.Logger.class);
        final ApacheHttpBulkSinkEventHandler handler = Mockito.mock(ApacheHttpBulkSinkEventHandler.class);
        final ApacheHttpBulkSink.Builder builder = new ApacheHttpBulkSink.Builder()
                .setUri(URI.create("http://localhost:1" + PATH))
                .setEventHandler(handler);
        final ApacheHttpBulkSink sink = new ApacheHttpBulkSink(builder, createHttpClient(), logger);

        sink.send(PAYLOAD, 1);

        Mockito.verify(handler).attemptComplete(
                Mockito.eq(1L),
                Mockito.anyLong(),
                Mockito.eq(false),
                Mockito.anyLong(),
                Mockito.eq(TimeUnit.NANOSECONDS));
        Mockito.verify(logger).error(
                Mockito.startsWith("Encountered failure when sending batch to bulk endpoint; uri="),
                Mockito.any(IOException.class));
        sink.close();
    }

    @Test
    public void testHttpClientExecuteException() throws IOException {
        final CloseableHttpClient httpClient = Mockito.mock(
                CloseableHttpClient.class,
                invocationOnMock -> {
                    throw new NullPointerException("Throw by default");
                });

        final org.slf4j.Logger logger = Mockito.mock(org.slf4j.Logger.class);
        final ApacheHttpBulkSinkEventHandler handler = Mockito.mock(ApacheHttpBulkSinkEventHandler.class);
        final ApacheHttpBulkSink sink = new ApacheHttpBulkSink(
                new ApacheHttpBulkSink.Builder()
                        .setUri(URI.create("http://localhost:" + _wireMockRule.port() + PATH))
                        .setEventHandler(handler),
                httpClient,
                logger);

        sink.send(PAYLOAD, 1);

        Mockito.verify(handler).attemptComplete(
                Mockito.eq(1L),
                Mockito.anyLong(),
                Mockito.eq(false),
                Mockito.anyLong(),
                Mockito.eq(TimeUnit.NANOSECONDS));
        Mockito.verify(logger).error(
                Mockito.startsWith("Encountered failure when sending batch to bulk endpoint; uri="),
                Mockito.any(NullPointerException.class));
        _wireMockRule.verify(0, bulkRequest());
    }

    @Test
    public void testHttpClientResponseException() throws IOException {
        final CloseableHttpClient httpClient = Mockito.mock(CloseableHttpClient.class);
        final CloseableHttpResponse httpResponse = Mockito.mock(CloseableHttpResponse.class);
        Mockito.doReturn(httpResponse).when(httpClient).execute(Mockito.any(HttpPost.class));
        Mockito.doThrow(new NullPointerException("Throw by default")).when(httpResponse).getStatusLine();

        final org.slf4j.Logger logger = Mockito.mock(org.slf4j.Logger.class);
        final ApacheHttpBulkSink sink = new ApacheHttpBulkSink(
                new ApacheHttpBulkSink.Builder()
                        .setUri(URI.create("http://localhost:" + _wireMockRule.port() + PATH)),
                httpClient,
                logger);

        sink.send(PAYLOAD, 1);

        Mockito.verify(httpClient).execute(Mockito.any(HttpPost.class));
        Mockito.verifyNoMoreInteractions(httpClient);
        Mockito.verify(httpResponse).getStatusLine();
        Mockito.verify(httpResponse).close();
        Mockito.verifyNoMoreInteractions(httpResponse);
        Mockito.verify(logger).error(
                Mockito.startsWith("Encountered failure when sending batch to bulk endpoint; uri="),
                Mockito.any(NullPointerException.class));
    }

    @Test
    public void testClose() throws IOException {
        final CloseableHttpClient httpClient = Mockito.mock(CloseableHttpClient.class);
        final ApacheHttpBulkSink sink = new ApacheHttpBulkSink(
                new ApacheHttpBulkSink.Builder(),
                httpClient,
                Mockito.mock(org.slf4j.Logger.class));
        sink.close();
        Mockito.verify(httpClient).close();
    }

    @Test
    public void testDispatcherPostsBatches() throws Exception {
        _wireMockRule.stubFor(
                WireMock.post(WireMock.urlEqualTo(PATH))
                        .willReturn(WireMock.aResponse()
                                .withStatus(200)));

        final ApacheHttpBulkSinkEventHandler handler = Mockito.mock(ApacheHttpBulkSinkEventHandler.class);
        final Dispatcher dispatcher = new BatchDispatcher.Builder()
                .setBatchSize(2)
                .setFlushInterval(Duration.ofMillis(200))
                .setSink(new ApacheHttpBulkSink.Builder()
                        .setUri(URI.create("http://localhost:" + _wireMockRule.port() + PATH))
                        .setEventHandler(handler)
                        .build())
                .build();
        try {
            dispatcher.push("falco", Collections.singletonMap("rule", "a"));
            dispatcher.push("falco", Collections.singletonMap("rule", "b"));
            dispatcher.push("falco", Collections.singletonMap("rule", "c"));

            Mockito.verify(handler, Mockito.timeout(5000).times(2)).attemptComplete(
                    Mockito.anyLong(),
                    Mockito.anyLong(),
                    Mockito.eq(true),
                    Mockito.anyLong(),
                    Mockito.eq(TimeUnit.NANOSECONDS));
        } finally {
            dispatcher.close();
        }

        _wireMockRule.verify(1, bulkRequest().withRequestBody(WireMock.equalTo(
                "{\"create\":{\"_index\":\"falco\"}}\n{\"rule\":\"a\"}\n"
                        + "{\"create\":{\"_index\":\"falco\"}}\n{\"rule\":\"b\"}\n")));
        _wireMockRule.verify(1, bulkRequest().withRequestBody(WireMock.equalTo(
                "{\"create\":{\"_index\":\"falco\"}}\n{\"rule\":\"c\"}\n")));
        Mockito.verify(handler).attemptComplete(
                Mockito.eq(2L),
                Mockito.anyLong(),
                Mockito.eq(true),
                Mockito.anyLong(),
                Mockito.eq(TimeUnit.NANOSECONDS));
        Mockito.verify(handler).attemptComplete(
                Mockito.eq(1L),
                Mockito.anyLong(),
                Mockito.eq(true),
                Mockito.anyLong(),
                Mockito.eq(TimeUnit.NANOSECONDS));
    }

    private ApacheHttpBulkSink createSink(
            final ApacheHttpBulkSinkEventHandler handler,
            final org.slf4j.Logger logger) {
        return new ApacheHttpBulkSink(
                new ApacheHttpBulkSink.Builder()
                        .setUri(URI.create("http://localhost:" + _wireMockRule.port() + PATH))
                        .setEventHandler(handler),
                createHttpClient(),
                logger);
    }

    private static CloseableHttpClient createHttpClient() {
        return org.apache.http.impl.client.HttpClients.createDefault();
    }

    private static RequestPatternBuilder bulkRequest() {
        return WireMock.postRequestedFor(WireMock.urlEqualTo(PATH))
                .withHeader("Content-Type", WireMock.equalTo("application/x-ndjson"));
    }

    @Rule
    public WireMockRule _wireMockRule = new WireMockRule(WireMockConfiguration.wireMockConfig().dynamicPort());

    private static final String PATH = "/_bulk";
    private static final byte[] PAYLOAD =
            "{\"create\":{\"_index\":\"test\"}}\n{\"a\":1}\n".getBytes(StandardCharsets.UTF_8);
}
