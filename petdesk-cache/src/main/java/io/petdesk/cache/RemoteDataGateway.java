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
package io.petdesk.cache;

import io.petdesk.cache.realtime.ChangeListener;
import io.petdesk.resilience.CancellationToken;

import java.util.concurrent.CompletableFuture;

/**
 * Boundary to the managed backend.
 * <p>
 * Failures are reported by completing futures exceptionally: transient failures with
 * {@link io.petdesk.resilience.TransientNetworkException} or a network-class JDK exception, rejected
 * requests with {@link io.petdesk.resilience.FatalRequestException}, stale-version writes with
 * {@link io.petdesk.resilience.ConflictException}. Any of them may instead be a
 * {@link io.petdesk.resilience.RequestStatusException} carrying the status code.
 */
public interface RemoteDataGateway
{
    /**
     * Read the current value of a query.
     *
     * @param key   what to read
     * @param token cancellation signal
     * @return future of the value
     */
    CompletableFuture<Object> read(QueryKey key, CancellationToken token);

    /**
     * Apply a write.
     *
     * @param mutation what to write
     * @param token    cancellation signal
     * @return future of the backend's answer
     */
    CompletableFuture<WriteResult<Object>> write(MutationDescriptor mutation, CancellationToken token);

    /**
     * Subscribe to change events for a session or tenant scope.
     *
     * @param scope    e.g. the organisation id
     * @param listener receives change events and connection state changes, on any thread
     * @return handle closed to unsubscribe
     */
    Subscription subscribe(String scope, ChangeListener listener);
}
