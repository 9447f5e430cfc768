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
 * Delivers a completed batch. Implementations own retry, authentication and
 * failure reporting; the dispatcher does not observe the outcome.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot io)
 */
@FunctionalInterface
public interface BulkSink {

    /**
     * Deliver one batch.
     *
     * @param payload the line-delimited bulk payload; owned by the sink
     * @param records the number of records in the payload
     */
    void send(byte[] payload, int records);
}
