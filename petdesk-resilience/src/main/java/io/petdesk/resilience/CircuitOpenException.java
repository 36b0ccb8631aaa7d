/*
 * Copyright 2014-2025 Real Logic Limited.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.petdesk.resilience;

/**
 * Call rejected by a {@link CircuitBreaker} without reaching the dependency.
 */
public class CircuitOpenException extends SyncException
{
    private static final long serialVersionUID = 7718020347395014662L;

    private final String circuitName;

    public CircuitOpenException(final String circuitName, final String message)
    {
        super(message, Category.CIRCUIT_OPEN);
        this.circuitName = circuitName;
    }

    /**
     * Name of the breaker that rejected the call.
     *
     * @return breaker name
     */
    public String circuitName()
    {
        return circuitName;
    }
}
