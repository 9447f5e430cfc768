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
 * Thrown when a record cannot be serialized into a bulk document.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot io)
 */
public final class RecordSerializationException extends BulkRecordException {

    /**
     * Public constructor.
     *
     * @param recordType the class of the record that failed
     * @param cause the serializer failure
     */
    public RecordSerializationException(final Class<?> recordType, final Throwable cause) {
        super(String.format("Unable to serialize record; type=%s", recordType.getName()), cause);
    }

    /**
     * Public constructor.
     *
     * @param message the detail message
     */
    public RecordSerializationException(final String message) {
        super(message);
    }

    private static final long serialVersionUID = 1L;
}
