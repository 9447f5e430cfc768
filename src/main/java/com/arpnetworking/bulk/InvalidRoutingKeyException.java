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

import javax.annotation.Nullable;

/**
 * Thrown when a routing key contains characters that would corrupt the
 * line-delimited bulk framing.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot io)
 */
public final class InvalidRoutingKeyException extends BulkRecordException {

    /**
     * Public constructor.
     *
     * @param routingKey the rejected routing key
     */
    public InvalidRoutingKeyException(@Nullable final String routingKey) {
        super(String.format("Invalid routing key; routingKey=%s", routingKey));
        _routingKey = routingKey;
    }

    @Nullable
    public String getRoutingKey() {
        return _routingKey;
    }

    @Nullable
    private final String _routingKey;

    private static final long serialVersionUID = 1L;
}
