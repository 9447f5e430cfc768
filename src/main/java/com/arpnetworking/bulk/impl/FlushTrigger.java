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

/**
 * The condition that caused a batch to be flushed.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot io)
 */
public enum FlushTrigger {
    /**
     * The batch reached the configured batch size.
     */
    SIZE,
    /**
     * The flush interval elapsed since the first record of the batch.
     */
    INTERVAL,
    /**
     * The dispatcher was closed with records still buffered.
     */
    CLOSE
}
