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

import java.util.concurrent.CompletableFuture;

/**
 * An asynchronous call to a remote dependency.
 * <p>
 * Implementations should abandon work when the token is cancelled, but callers do not rely on it:
 * {@link RetryExecutor} and {@link CircuitBreaker} complete their own futures on cancellation
 * without waiting for the call.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface RemoteCall<T>
{
    /**
     * Start the call.
     *
     * @param token cancellation signal for the call
     * @return future completed with the result or the failure
     */
    CompletableFuture<T> invoke(CancellationToken token);
}
