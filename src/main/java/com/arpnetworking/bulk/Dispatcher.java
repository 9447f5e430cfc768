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
package com.arpnetworking.bulk;

/**
 * Accepts records from producers and groups them into bulk requests.
 *
 * Implementations are thread safe. A successful {@link #push(String, Object)}
 * means the record is buffered; delivery happens later and its outcome is
 * never reported back to the producer.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot io)
 */
public interface Dispatcher extends AutoCloseable {

    /**
     * Buffer a record for delivery to the index named by the routing key.
     *
     * @param routingKey the target index name
     * @param record the record to serialize
     * @throws InvalidRoutingKeyException if the routing key cannot be framed
     * @throws RecordSerializationException if the record cannot be serialized
     * @throws IllegalStateException if the dispatcher has been closed
     */
    void push(String routingKey, Object record) throws BulkRecordException;

    /**
     * Flush any buffered records and release background resources.
     */
    @Override
    void close();
}
