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

import io.petdesk.resilience.CancellationToken;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A reusable mutation bound to its writer, affected keys and optimistic value function.
 *
 * @param <V> variables of the mutation
 * @param <T> canonical value type
 */
public final class MutationHandle<V, T>
{
    private final MutationCoordinator coordinator;
    private final MutationWriter<V, T> writer;
    private final Set<QueryKey> affectedKeys;
    private final OptimisticValueFunction<V> optimisticValueFn;
    private final CanonicalMerge merge;
    private final MutationListener<T> listener;
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private volatile Throwable error;
    private volatile WriteResult<T> lastResult;

    MutationHandle(
        final MutationCoordinator coordinator,
        final MutationWriter<V, T> writer,
        final Set<QueryKey> affectedKeys,
        final OptimisticValueFunction<V> optimisticValueFn,
        final CanonicalMerge merge,
        final MutationListener<T> listener)
    {
        this.coordinator = coordinator;
        this.writer = writer;
        this.affectedKeys = Set.copyOf(affectedKeys);
        this.optimisticValueFn = optimisticValueFn;
        this.merge = merge;
        this.listener = listener;
    }

    /**
     * Run the mutation. The optimistic values are visible when this returns.
     *
     * @param variables the mutation's variables
     * @return future of the write result
     */
    public CompletableFuture<WriteResult<T>> mutate(final V variables)
    {
        return mutate(variables, CancellationToken.NONE);
    }

    /**
     * Run the mutation under a cancellation token. Cancelling rolls back at once.
     *
     * @param variables the mutation's variables
     * @param token     cancellation signal
     * @return future of the write result
     */
    public CompletableFuture<WriteResult<T>> mutate(final V variables, final CancellationToken token)
    {
        inFlight.incrementAndGet();
        error = null;

        return coordinator.mutate(
            (writeToken) -> writer.write(variables, writeToken),
            affectedKeys,
            (key, currentValue) -> optimisticValueFn.apply(key, currentValue, variables),
            merge,
            listener,
            token)
            .whenComplete((result, failure) ->
            {
                if (null == failure)
                {
                    lastResult = result;
                }
                else
                {
                    error = failure;
                }
                inFlight.decrementAndGet();
            });
    }

    /**
     * Is any mutation of this handle awaiting its outcome.
     *
     * @return true if pending
     */
    public boolean isPending()
    {
        return inFlight.get() > 0;
    }

    /**
     * Failure of the most recent mutation, cleared when the next one starts.
     *
     * @return the error, or null
     */
    public Throwable error()
    {
        return error;
    }

    public WriteResult<T> lastResult()
    {
        return lastResult;
    }

    public Set<QueryKey> affectedKeys()
    {
        return affectedKeys;
    }

    /**
     * Forget the last error and result.
     */
    public void reset()
    {
        error = null;
        lastResult = null;
    }
}
