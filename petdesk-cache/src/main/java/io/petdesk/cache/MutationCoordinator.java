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
import io.petdesk.resilience.CancelledException;
import io.petdesk.resilience.CircuitBreaker;
import io.petdesk.resilience.FailureClassifier;
import io.petdesk.resilience.FatalRequestException;
import io.petdesk.resilience.RemoteCall;
import io.petdesk.resilience.RetryExecutor;
import io.petdesk.resilience.RetryPolicy;
import org.agrona.ErrorHandler;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs writes optimistically against a {@link QueryCache}.
 * <ol>
 *   <li>snapshot every affected entry and apply the optimistic values, all before {@code mutate} returns</li>
 *   <li>submit the write through {@code RetryExecutor -> CircuitBreaker}</li>
 *   <li>commit every key with the server's canonical value, or the optimistic one when none came back</li>
 *   <li>or, on any terminal failure, cancellation or timeout, restore every key from the snapshot, flag
 *   it {@link CacheEntry.Status#ERROR} and refetch it; a key whose snapshot holds the overlay of a mutation
 *   still pending gets that overlay back and is refetched once it settles</li>
 * </ol>
 * A mutation settles exactly once and always across all of its keys together.
 * <p>
 * A mutation touching a key that already carries another mutation's overlay snapshots that overlay, so
 * its rollback lands on the earlier speculative value rather than the last confirmed one.
 */
public final class MutationCoordinator
{
    private final QueryCache cache;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy writePolicy;
    private final CircuitBreaker writeBreaker;
    private final ScheduledExecutorService scheduler;
    private final ErrorHandler errorHandler;
    private final long mutationTimeoutMs;
    private final AtomicLong nextMutationId = new AtomicLong(1);
    private final Map<Long, PendingMutation> pendingById = new ConcurrentHashMap<>();

    private final AtomicLong submittedMutations = new AtomicLong(0);
    private final AtomicLong committedMutations = new AtomicLong(0);
    private final AtomicLong rolledBackMutations = new AtomicLong(0);
    private final AtomicLong timedOutMutations = new AtomicLong(0);

    /**
     * Create a coordinator.
     *
     * @param cache             cache holding the affected entries
     * @param retryExecutor     executor retrying writes
     * @param writePolicy       retry policy for writes
     * @param writeBreaker      breaker guarding the write endpoint
     * @param scheduler         scheduler for the timeout guard
     * @param errorHandler      receives failures of mutation listeners
     * @param mutationTimeoutMs time after which an unacknowledged mutation is rolled back, 0 for none
     */
    public MutationCoordinator(
        final QueryCache cache,
        final RetryExecutor retryExecutor,
        final RetryPolicy writePolicy,
        final CircuitBreaker writeBreaker,
        final ScheduledExecutorService scheduler,
        final ErrorHandler errorHandler,
        final long mutationTimeoutMs)
    {
        this.cache = cache;
        this.retryExecutor = retryExecutor;
        this.writePolicy = writePolicy;
        this.writeBreaker = writeBreaker;
        this.scheduler = scheduler;
        this.errorHandler = errorHandler;
        this.mutationTimeoutMs = mutationTimeoutMs;
    }

    /**
     * Run a mutation whose canonical value replaces the optimistic one.
     *
     * @param write        the remote write
     * @param affectedKeys keys the write changes
     * @param update       computes each key's optimistic value from its current value
     * @param token        cancellation signal, cancelling rolls back at once
     * @param <T>          canonical value type
     * @return future of the write result
     */
    public <T> CompletableFuture<WriteResult<T>> mutate(
        final RemoteCall<WriteResult<T>> write,
        final Set<QueryKey> affectedKeys,
        final OptimisticUpdate update,
        final CancellationToken token)
    {
        return mutate(write, affectedKeys, update, CanonicalMerge.REPLACE, null, token);
    }

    /**
     * Run a mutation.
     * <p>
     * The optimistic values are visible to readers when this method returns. If computing any of them
     * throws, nothing is applied and the returned future fails with that exception.
     *
     * @param write        the remote write
     * @param affectedKeys keys the write changes
     * @param update       computes each key's optimistic value from its current value
     * @param merge        lands the canonical value in each key
     * @param listener     lifecycle callbacks, may be null
     * @param token        cancellation signal, cancelling rolls back at once
     * @param <T>          canonical value type
     * @return future of the write result
     */
    public <T> CompletableFuture<WriteResult<T>> mutate(
        final RemoteCall<WriteResult<T>> write,
        final Set<QueryKey> affectedKeys,
        final OptimisticUpdate update,
        final CanonicalMerge merge,
        final MutationListener<T> listener,
        final CancellationToken token)
    {
        if (token.isCancelled())
        {
            return CompletableFuture.failedFuture(token.toException());
        }

        final long mutationId = nextMutationId.getAndIncrement();
        final PendingMutation mutation;
        try
        {
            mutation = cache.beginMutation(mutationId, new LinkedHashSet<>(affectedKeys), update);
        }
        catch (final RuntimeException ex)
        {
            return CompletableFuture.failedFuture(ex);
        }

        submittedMutations.incrementAndGet();
        pendingById.put(mutationId, mutation);

        final Settlement<T> settlement = new Settlement<>(mutation, merge, listener, token.child());
        settlement.registration = token.onCancel(() -> settlement.rollBack(token.toException()));
        if (mutationTimeoutMs > 0)
        {
            try
            {
                settlement.timer = scheduler.schedule(
                    () -> settlement.timeOut(new MutationTimeoutException(mutationId, mutationTimeoutMs)),
                    mutationTimeoutMs,
                    TimeUnit.MILLISECONDS);
            }
            catch (final RejectedExecutionException ex)
            {
                settlement.rollBack(new CancelledException("mutation scheduler closed: mutation " + mutationId));
                return settlement.result;
            }
        }

        retryExecutor.execute(writeBreaker.wrap(write), writePolicy, settlement.writeToken)
            .whenComplete(settlement::onWriteComplete);

        return settlement.result;
    }

    /**
     * Mutations applied but not yet settled.
     *
     * @return snapshot of the pending mutations
     */
    public Collection<PendingMutation> pendingMutations()
    {
        return new ArrayList<>(pendingById.values());
    }

    public int pendingCount()
    {
        return pendingById.size();
    }

    public long submittedMutations()
    {
        return submittedMutations.get();
    }

    public long committedMutations()
    {
        return committedMutations.get();
    }

    public long rolledBackMutations()
    {
        return rolledBackMutations.get();
    }

    public long timedOutMutations()
    {
        return timedOutMutations.get();
    }

    public long mutationTimeoutMs()
    {
        return mutationTimeoutMs;
    }

    public String toString()
    {
        return "MutationCoordinator{" +
            "pending=" + pendingById.size() +
            ", submitted=" + submittedMutations.get() +
            ", committed=" + committedMutations.get() +
            ", rolledBack=" + rolledBackMutations.get() +
            ", timedOut=" + timedOutMutations.get() +
            '}';
    }

    private final class Settlement<T>
    {
        final CompletableFuture<WriteResult<T>> result = new CompletableFuture<>();
        final PendingMutation mutation;
        final CanonicalMerge merge;
        final MutationListener<T> listener;
        final CancellationToken writeToken;
        volatile CancellationToken.Registration registration;
        volatile ScheduledFuture<?> timer;

        Settlement(
            final PendingMutation mutation,
            final CanonicalMerge merge,
            final MutationListener<T> listener,
            final CancellationToken writeToken)
        {
            this.mutation = mutation;
            this.merge = merge;
            this.listener = listener;
            this.writeToken = writeToken;
        }

        void onWriteComplete(final WriteResult<T> writeResult, final Throwable error)
        {
            if (null != error)
            {
                rollBack(FailureClassifier.unwrap(error));
            }
            else if (!writeResult.accepted())
            {
                rollBack(new FatalRequestException("write rejected for mutation " + mutation.id()));
            }
            else
            {
                commit(writeResult);
            }
        }

        void timeOut(final MutationTimeoutException error)
        {
            if (PendingMutation.State.PENDING == mutation.state())
            {
                timedOutMutations.incrementAndGet();
            }

            rollBack(error);
        }

        void commit(final WriteResult<T> writeResult)
        {
            final Map<QueryKey, Object> committedValues = new LinkedHashMap<>();
            try
            {
                for (final Map.Entry<QueryKey, Object> entry : mutation.optimisticValues().entrySet())
                {
                    final QueryKey key = entry.getKey();
                    committedValues.put(
                        key,
                        writeResult.hasCanonicalValue() ?
                            merge.merge(key, entry.getValue(), writeResult.canonicalValue()) : entry.getValue());
                }
            }
            catch (final RuntimeException ex)
            {
                rollBack(ex);
                return;
            }

            if (!mutation.settle(PendingMutation.State.COMMITTED))
            {
                return;
            }

            release();
            committedMutations.incrementAndGet();
            cache.commitMutation(mutation, committedValues);

            if (null != listener)
            {
                try
                {
                    listener.onSuccess(writeResult);
                    listener.onSettled(writeResult, null);
                }
                catch (final Exception ex)
                {
                    errorHandler.onError(ex);
                }
            }

            result.complete(writeResult);
        }

        void rollBack(final Throwable error)
        {
            if (!mutation.settle(PendingMutation.State.ROLLED_BACK))
            {
                return;
            }

            release();
            writeToken.cancel("mutation " + mutation.id() + " rolled back");
            rolledBackMutations.incrementAndGet();
            cache.rollbackMutation(mutation, error);

            System.out.println("[MutationCoordinator] mutation " + mutation.id() + " on " + mutation.affectedKeys() +
                " rolled back: " + error.getMessage());

            if (null != listener)
            {
                try
                {
                    listener.onError(error);
                    listener.onSettled(null, error);
                }
                catch (final Exception ex)
                {
                    errorHandler.onError(ex);
                }
            }

            result.completeExceptionally(error);
        }

        private void release()
        {
            pendingById.remove(mutation.id());
            writeToken.close();

            final ScheduledFuture<?> timer = this.timer;
            if (null != timer)
            {
                timer.cancel(false);
            }

            final CancellationToken.Registration registration = this.registration;
            if (null != registration)
            {
                registration.close();
            }
        }
    }
}
