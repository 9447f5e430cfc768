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

import com.arpnetworking.bulk.InvalidRoutingKeyException;
import com.arpnetworking.bulk.RecordSerializationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.Assert;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tests for {@link BulkFraming}.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot io)
 */
public final class BulkFramingTest {

    @Test
    public void testFrame() throws Exception {
        final byte[] unit = _framing.frame("test", Collections.singletonMap("a", 1));
        Assert.assertEquals(
                "{\"create\":{\"_index\":\"test\"}}\n{\"a\":1}\n",
                new String(unit, StandardCharsets.UTF_8));
    }

    @Test
    public void testFrameIgnoresIndentation() throws Exception {
        final BulkFraming framing = new BulkFraming(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
        final Map<String, Object> record = new LinkedHashMap<>();
        record.put("rule", "Terminal shell in container");
        record.put("priority", "Warning");
        Assert.assertEquals(
                "{\"create\":{\"_index\":\"falco\"}}\n{\"rule\":\"Terminal shell in container\",\"priority\":\"Warning\"}\n",
                new String(framing.frame("falco", record), StandardCharsets.UTF_8));
    }

    @Test
    public void testFrameEscapesNewlinesInRecord() throws Exception {
        final String framed = new String(
                _framing.frame("test", Collections.singletonMap("output", "line1\nline2")),
                StandardCharsets.UTF_8);
        Assert.assertEquals(2, framed.split("\n").length);
        Assert.assertTrue(framed.contains("line1\\nline2"));
    }

    @Test
    public void testFrameTimestamp() throws Exception {
        final BulkFraming framing = new BulkFraming(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
        final byte[] unit = framing.frame(
                "test",
                Collections.singletonMap("@timestamp", Instant.parse("2023-01-02T03:04:05Z")));
        Assert.assertEquals(
                "{\"create\":{\"_index\":\"test\"}}\n{\"@timestamp\":\"2023-01-02T03:04:05Z\"}\n",
                new String(unit, StandardCharsets.UTF_8));
    }

    @Test
    public void testValidRoutingKeys() {
        Assert.assertTrue(BulkFraming.isValidRoutingKey("test"));
        Assert.assertTrue(BulkFraming.isValidRoutingKey("falco-2023.01.02"));
    }

    @Test
    public void testInvalidRoutingKeys() {
        Assert.assertFalse(BulkFraming.isValidRoutingKey(null));
        Assert.assertFalse(BulkFraming.isValidRoutingKey(""));
        Assert.assertFalse(BulkFraming.isValidRoutingKey("te\"st"));
        Assert.assertFalse(BulkFraming.isValidRoutingKey("te\\st"));
        Assert.assertFalse(BulkFraming.isValidRoutingKey("te\nst"));
        Assert.assertFalse(BulkFraming.isValidRoutingKey("te\rst"));
    }

    @Test(expected = InvalidRoutingKeyException.class)
    public void testFrameInvalidRoutingKey() throws Exception {
        _framing.frame("\"", Collections.singletonMap("a", 1));
    }

    @Test(expected = RecordSerializationException.class)
    public void testFrameNullRecord() throws Exception {
        _framing.frame("test", null);
    }

    @Test
    public void testFrameUnserializableRecord() {
        try {
            _framing.frame("test", new Object());
            Assert.fail("Expected exception not thrown");
        } catch (final RecordSerializationException e) {
            Assert.assertTrue(e.getMessage().contains("java.lang.Object"));
            Assert.assertNotNull(e.getCause());
            // CHECKSTYLE.OFF: IllegalCatch - Any other exception fails the test
        } catch (final Exception e) {
            // CHECKSTYLE.ON: IllegalCatch
            Assert.fail("Unexpected exception: " + e);
        }
    }

    private final BulkFraming _framing = new BulkFraming(new ObjectMapper());
}
