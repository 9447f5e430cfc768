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
 * Base class for failures that cause a single record to be rejected by
 * {@link Dispatcher#push(String, Object)}. The rejected record is never
 * buffered.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot io)
 */
public class BulkRecordException extends Exception {

    /**
     * Protected constructor.
     *
     * @param message the detail message
     */
    protected BulkRecordException(final String message) {
        super(message);
    }

    /**
     * Protected constructor.
     *
     * @param message the detail message
     * @param cause the underlying failure
     */
    protected BulkRecordException(final String message, final Throwable cause) {
        super(message, cause);
    }

    private static final long serialVersionUID = 1L;
}
