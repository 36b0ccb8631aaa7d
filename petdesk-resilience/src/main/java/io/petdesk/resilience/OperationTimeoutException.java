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
 * No answer arrived before the deadline.
 */
public class OperationTimeoutException extends SyncException
{
    private static final long serialVersionUID = 6020311844163985214L;

    private final long timeoutMs;

    public OperationTimeoutException(final String message, final long timeoutMs)
    {
        super(message, Category.TIMEOUT);
        this.timeoutMs = timeoutMs;
    }

    public long timeoutMs()
    {
        return timeoutMs;
    }
}
