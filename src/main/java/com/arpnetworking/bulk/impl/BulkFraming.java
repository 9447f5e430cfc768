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
import com.arpnetworking.bulk.RecordSerializationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import javax.annotation.Nullable;

/**
 * Frames a record as one bulk create operation: an action line naming the
 * target index followed by the document on its own line.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot io)
 */
/* package private */ final class BulkFraming {

    /* package private */ BulkFraming(final ObjectMapper objectMapper) {
        // Each document must occupy exactly one line
        _writer = objectMapper.writer().without(SerializationFeature.INDENT_OUTPUT);
    }

    /* package private */ byte[] frame(@Nullable final String routingKey, @Nullable final Object record)
            throws BulkRecordException {
        if (!isValidRoutingKey(routingKey)) {
            throw new InvalidRoutingKeyException(routingKey);
        }
        if (record == null) {
            throw new RecordSerializationException("Record must not be null");
        }

        final byte[] body;
        try {
            body = _writer.writeValueAsBytes(record);
        } catch (final JsonProcessingException e) {
            throw new RecordSerializationException(record.getClass(), e);
        }

        final byte[] action = (ACTION_PREFIX + routingKey + ACTION_SUFFIX).getBytes(StandardCharsets.UTF_8);
        final byte[] unit = new byte[action.length + body.length + 1];
        System.arraycopy(action, 0, unit, 0, action.length);
        System.arraycopy(body, 0, unit, action.length, body.length);
        unit[unit.length - 1] = NEWLINE;
        return unit;
    }

    /* package private */ static boolean isValidRoutingKey(@Nullable final String routingKey) {
        if (routingKey == null || routingKey.isEmpty()) {
            return false;
        }
        for (int i = 0; i < routingKey.length(); ++i) {
            if (FORBIDDEN_ROUTING_KEY_CHARACTERS.indexOf(routingKey.charAt(i)) >= 0) {
                return false;
            }
        }
        return true;
    }

    private final ObjectWriter _writer;

    private static final String ACTION_PREFIX = "{\"create\":{\"_index\":\"";
    private static final String ACTION_SUFFIX = "\"}}\n";
    private static final String FORBIDDEN_ROUTING_KEY_CHARACTERS = "\"\\\r\n";
    private static final byte NEWLINE = '\n';
}
