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
 * Every attempt allowed by a {@link RetryPolicy} failed with a retryable error.
 * <p>
 * The last underlying error is available as the cause.
 */
public class RetryExhaustedException extends SyncException
{
    private static final long serialVersionUID = 1609427702345583385L;

    private final int attempts;

    public RetryExhaustedException(final Throwable lastError, final int attempts)
    {
        super("failed after " + attempts + " attempts: " + lastError.getMessage(), lastError, Category.EXHAUSTED);
        this.attempts = attempts;
    }

    /**
     * Number of attempts made before giving up.
     *
     * @return attempt count
     */
    public int attempts()
    {
        return attempts;
    }
}
