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

import javax.annotation.Nullable;

/**
 * Interface for callbacks from {@link BatchDispatcher}.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public interface BatchDispatcherEventHandler {

    /**
     * Callback invoked after a batch has been handed to the sink.
     *
     * @param records the number of records in the batch
     * @param bytes the size of the payload in bytes
     * @param trigger what caused the flush
     */
    void batchFlushed(long records, long bytes, FlushTrigger trigger);

    /**
     * Callback invoked when a pushed record is rejected.
     *
     * @param routingKey the routing key supplied with the record
     * @param reason why the record was rejected
     */
    void recordRejected(@Nullable String routingKey, BulkRecordException reason);
}
