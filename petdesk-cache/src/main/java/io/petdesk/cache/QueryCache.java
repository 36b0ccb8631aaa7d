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
import io.petdesk.resilience.CircuitBreaker;
import io.petdesk.resilience.FailureClassifier;
import io.petdesk.resilience.RemoteCall;
import io.petdesk.resilience.RetryExecutor;
import io.petdesk.resilience.RetryPolicy;
import org.agrona.ErrorHandler;
import org.agrona.collections.LongHashSet;
import org.agrona.collections.Object2ObjectHashMap;
import org.agrona.concurrent.EpochClock;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keyed store of last-known-good values and optimistic overlays, with stale-while-revalidate reads.
 * <p>
 * Reads go through {@code RetryExecutor -> CircuitBreaker -> fetcher}. At most one fetch per key is in
 * flight: concurrent readers of the same key share its outcome. A fetched value is stamped with the time
 * the fetch was issued and is dropped if the entry already holds something newer, so a slow fetch never
 * clobbers a later write. A failed fetch keeps the last value and flags {@link CacheEntry.Status#ERROR}.
 * <p>
 * While a key carries a pending overlay its fetch results are discarded and any requested refetch is
 * deferred until the owning mutation settles.
 * <p>
 * State is guarded by the instance monitor. Remote calls are started and listeners notified outside it.
 */
public final class QueryCache
{
    private static final class InFlight
    {
        final CompletableFuture<Object> promise = new CompletableFuture<>();
        final CancellationToken token;
        final long issuedAtMs;
        final long invalidations;

        InFlight(final CancellationToken token, final long issuedAtMs, final long invalidations)
        {
            this.token = token;
            this.issuedAtMs = issuedAtMs;
            this.invalidations = invalidations;
        }
    }

    private static final class Slot
    {
        final List<CacheListener> listeners = new CopyOnWriteArrayList<>();
        CacheEntry entry = CacheEntry.empty();
        RemoteCall<?> fetcher;
        long staleTimeMs;
        InFlight inFlight;
        long invalidations;
        boolean refetchOnSettle;
    }

    private static final class Update
    {
        final QueryKey key;
        final CacheEntry entry;
        final List<CacheListener> listeners;

        Update(final QueryKey key, final Slot slot)
        {
            this.key = key;
            this.entry = slot.entry;
            this.listeners = slot.listeners;
        }
    }

    private final Object2ObjectHashMap<QueryKey, Slot> slots = new Object2ObjectHashMap<>();
    private final LongHashSet liveMutations = new LongHashSet();
    private final RetryExecutor retryExecutor;
    private final RetryPolicy readPolicy;
    private final CircuitBreaker readBreaker;
    private final EpochClock epochClock;
    private final ErrorHandler errorHandler;
    private final long defaultStaleTimeMs;

    /**
     * Create a cache.
     *
     * @param retryExecutor      executor retrying fetches
     * @param readPolicy         retry policy for fetches
     * @param readBreaker        breaker guarding the read endpoint
     * @param epochClock         source of time for staleness and write ordering
     * @param errorHandler       receives listener failures
     * @param defaultStaleTimeMs stale time for reads that do not give one
     */
    public QueryCache(
        final RetryExecutor retryExecutor,
        final RetryPolicy readPolicy,
        final CircuitBreaker readBreaker,
        final EpochClock epochClock,
        final ErrorHandler errorHandler,
        final long defaultStaleTimeMs)
    {
        this.retryExecutor = retryExecutor;
        this.readPolicy = readPolicy;
        this.readBreaker = readBreaker;
        this.epochClock = epochClock;
        this.errorHandler = errorHandler;
        this.defaultStaleTimeMs = defaultStaleTimeMs;
    }

    /**
     * Read a key with the default stale time.
     *
     * @param key     the key
     * @param fetcher loads the value from the backend
     * @param token   cancellation signal of this reader
     * @param <T>     value type
     * @return future of the value
     * @see #get(QueryKey, RemoteCall, long, CancellationToken)
     */
    public <T> CompletableFuture<T> get(final QueryKey key, final RemoteCall<T> fetcher, final CancellationToken token)
    {
        return get(key, fetcher, defaultStaleTimeMs, token);
    }

    /**
     * Read a key.
     * <ul>
     *   <li>fresh or pending entry: completes at once, no network call</li>
     *   <li>stale or failed entry with a value: completes at once with it, refetches in the background</li>
     *   <li>no value: completes with the outcome of a fetch, shared with concurrent readers</li>
     * </ul>
     * Cancelling {@code token} fails this reader's future only; the shared fetch carries on.
     *
     * @param key         the key
     * @param fetcher     loads the value from the backend, remembered for later refetches
     * @param staleTimeMs how long a fetched value stays fresh
     * @param token       cancellation signal of this reader
     * @param <T>         value type
     * @return future of the value
     */
    public <T> CompletableFuture<T> get(
        final QueryKey key, final RemoteCall<T> fetcher, final long staleTimeMs, final CancellationToken token)
    {
        final long nowMs = epochClock.time();
        final CacheEntry entry;
        final InFlight toLaunch;
        final InFlight attachTo;

        synchronized (this)
        {
            final Slot slot = slotFor(key);
            slot.fetcher = fetcher;
            slot.staleTimeMs = staleTimeMs;
            entry = slot.entry;

            if (entry.hasData() && !entry.isStale(nowMs, staleTimeMs))
            {
                return CompletableFuture.completedFuture(entry.data());
            }

            toLaunch = null == slot.inFlight ? newInFlight(slot, nowMs) : null;
            attachTo = entry.hasData() ? null : slot.inFlight;
        }

        if (null != toLaunch)
        {
            launch(key, toLaunch, fetcher);
        }

        if (null == attachTo)
        {
            return CompletableFuture.completedFuture(entry.data());
        }

        return attach(attachTo.promise, token);
    }

    /**
     * Current entry without side effects.
     *
     * @param key the key
     * @return the entry, or null if the key was never read or written
     */
    public synchronized CacheEntry peek(final QueryKey key)
    {
        final Slot slot = slots.get(key);
        return null == slot ? null : slot.entry;
    }

    /**
     * Store a value stamped with the current time.
     *
     * @param key   the key
     * @param value the value
     */
    public void set(final QueryKey key, final Object value)
    {
        set(key, value, epochClock.time());
    }

    /**
     * Store a value unless the entry already holds a newer one.
     *
     * @param key         the key
     * @param value       the value
     * @param timestampMs time the value was current on the backend
     * @return true if applied
     */
    public boolean set(final QueryKey key, final Object value, final long timestampMs)
    {
        final Update update;
        synchronized (this)
        {
            final Slot slot = slotFor(key);
            if (timestampMs < slot.entry.lastUpdatedMs())
            {
                return false;
            }

            slot.entry = slot.entry.withValue(value, timestampMs);
            update = new Update(key, slot);
        }

        fire(List.of(update));
        return true;
    }

    /**
     * Mark a key untrustworthy and refetch it if a fetcher is known.
     * <p>
     * A key with a pending overlay keeps it; its refetch happens once the mutation settles.
     *
     * @param key the key
     * @return true if the key was cached
     */
    public boolean invalidate(final QueryKey key)
    {
        final InFlight toLaunch;
        final RemoteCall<?> fetcher;
        final Update update;

        synchronized (this)
        {
            final Slot slot = slots.get(key);
            if (null == slot)
            {
                return false;
            }

            slot.invalidations++;
            if (slot.entry.isOptimistic())
            {
                slot.refetchOnSettle = true;
                return true;
            }

            slot.entry = slot.entry.withStatus(CacheEntry.Status.STALE);
            update = new Update(key, slot);
            fetcher = slot.fetcher;
            toLaunch = null != fetcher && null == slot.inFlight ? newInFlight(slot, epochClock.time()) : null;
        }

        fire(List.of(update));
        if (null != toLaunch)
        {
            launch(key, toLaunch, fetcher);
        }

        return true;
    }

    /**
     * Invalidate every cached key falling under a filter.
     *
     * @param filter key used as a filter, see {@link QueryKey#matches(QueryKey)}
     * @return number of keys invalidated
     */
    public int invalidateMatching(final QueryKey filter)
    {
        final List<QueryKey> matched = new ArrayList<>();
        synchronized (this)
        {
            slots.forEach((key, slot) ->
            {
                if (key.matches(filter))
                {
                    matched.add(key);
                }
            });
        }

        int count = 0;
        for (final QueryKey key : matched)
        {
            if (invalidate(key))
            {
                count++;
            }
        }

        return count;
    }

    /**
     * Subscribe to changes of a key's entry.
     *
     * @param key      the key
     * @param listener notified on every change, outside the cache's lock
     * @return subscription closed to stop notifications
     */
    public Subscription subscribe(final QueryKey key, final CacheListener listener)
    {
        final List<CacheListener> listeners;
        synchronized (this)
        {
            listeners = slotFor(key).listeners;
        }

        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Abort the fetch in flight for a key. Its result is discarded and the entry left untouched.
     *
     * @param key the key
     * @return true if a fetch was in flight
     */
    public boolean cancel(final QueryKey key)
    {
        final InFlight inFlight;
        synchronized (this)
        {
            final Slot slot = slots.get(key);
            inFlight = null == slot ? null : slot.inFlight;
        }

        return null != inFlight && inFlight.token.cancel("query " + key + " cancelled");
    }

    /**
     * Fetch a key now, regardless of staleness, joining a fetch already in flight.
     *
     * @param key the key
     * @return future of the fetched value, or of the current value if no fetch can run
     */
    public CompletableFuture<Object> refetch(final QueryKey key)
    {
        final InFlight toLaunch;
        final RemoteCall<?> fetcher;

        synchronized (this)
        {
            final Slot slot = slots.get(key);
            if (null == slot)
            {
                return CompletableFuture.completedFuture(null);
            }

            if (slot.entry.isOptimistic())
            {
                slot.refetchOnSettle = true;
                return CompletableFuture.completedFuture(slot.entry.data());
            }

            if (null != slot.inFlight)
            {
                return slot.inFlight.promise;
            }

            fetcher = slot.fetcher;
            if (null == fetcher)
            {
                return CompletableFuture.completedFuture(slot.entry.data());
            }

            toLaunch = newInFlight(slot, epochClock.time());
        }

        launch(key, toLaunch, fetcher);
        return toLaunch.promise;
    }

    /**
     * Refetch every key that has subscribers and a known fetcher.
     *
     * @return number of keys refetched
     */
    public int refetchActive()
    {
        final Set<QueryKey> keys = activeKeys();
        for (final QueryKey key : keys)
        {
            refetch(key);
        }

        return keys.size();
    }

    /**
     * Keys with at least one subscriber and a known fetcher.
     *
     * @return snapshot of the active keys
     */
    public synchronized Set<QueryKey> activeKeys()
    {
        final Set<QueryKey> keys = new HashSet<>();
        slots.forEach((key, slot) ->
        {
            if (!slot.listeners.isEmpty() && null != slot.fetcher)
            {
                keys.add(key);
            }
        });

        return keys;
    }

    /**
     * Is a fetch in flight for the key.
     *
     * @param key the key
     * @return true if fetching
     */
    public synchronized boolean isFetching(final QueryKey key)
    {
        final Slot slot = slots.get(key);
        return null != slot && null != slot.inFlight;
    }

    /**
     * Stale time last used to read a key.
     *
     * @param key the key
     * @return stale time, or the default if the key was never read
     */
    public synchronized long staleTimeMs(final QueryKey key)
    {
        final Slot slot = slots.get(key);
        return null == slot || null == slot.fetcher ? defaultStaleTimeMs : slot.staleTimeMs;
    }

    public long defaultStaleTimeMs()
    {
        return defaultStaleTimeMs;
    }

    EpochClock epochClock()
    {
        return epochClock;
    }

    PendingMutation beginMutation(final long mutationId, final Set<QueryKey> keys, final OptimisticUpdate update)
    {
        final List<Update> updates = new ArrayList<>(keys.size());
        final PendingMutation mutation;

        synchronized (this)
        {
            final Map<QueryKey, CacheEntry> snapshot = new LinkedHashMap<>();
            final Map<QueryKey, Object> optimisticValues = new LinkedHashMap<>();
            for (final QueryKey key : keys)
            {
                final Slot slot = slots.get(key);
                final CacheEntry current = null == slot ? CacheEntry.empty() : slot.entry;
                snapshot.put(key, current);
                optimisticValues.put(key, update.apply(key, current.hasData() ? current.data() : null));
            }

            for (final QueryKey key : keys)
            {
                final Slot slot = slotFor(key);
                slot.entry = slot.entry.withOverlay(optimisticValues.get(key), mutationId);
                updates.add(new Update(key, slot));
            }

            mutation = new PendingMutation(mutationId, keys, snapshot, optimisticValues, epochClock.time());
            liveMutations.add(mutationId);
        }

        fire(updates);
        return mutation;
    }

    void commitMutation(final PendingMutation mutation, final Map<QueryKey, Object> committedValues)
    {
        final List<Update> updates = new ArrayList<>();
        final List<QueryKey> deferred = new ArrayList<>();

        synchronized (this)
        {
            liveMutations.remove(mutation.id());
            final long nowMs = epochClock.time();
            for (final QueryKey key : mutation.affectedKeys())
            {
                final Slot slot = slotFor(key);
                final Object value = committedValues.get(key);
                if (mutation.id() == slot.entry.mutationId())
                {
                    slot.entry = CacheEntry.fresh(value, nowMs);
                    if (slot.refetchOnSettle)
                    {
                        slot.refetchOnSettle = false;
                        deferred.add(key);
                    }
                }
                else
                {
                    slot.entry = slot.entry.withValue(value, nowMs);
                }
                updates.add(new Update(key, slot));
            }
        }

        fire(updates);
        deferred.forEach(this::refetch);
    }

    void rollbackMutation(final PendingMutation mutation, final Throwable error)
    {
        final List<Update> updates = new ArrayList<>();
        final List<QueryKey> restored = new ArrayList<>();

        synchronized (this)
        {
            liveMutations.remove(mutation.id());
            for (final QueryKey key : mutation.affectedKeys())
            {
                final Slot slot = slotFor(key);
                if (mutation.id() == slot.entry.mutationId())
                {
                    final CacheEntry previous = mutation.snapshot().get(key);
                    if (previous.isOptimistic() && liveMutations.contains(previous.mutationId()))
                    {
                        // earlier mutation still in flight, its overlay returns and the refetch waits for it
                        slot.entry = slot.entry.withOverlay(previous.optimisticValue(), previous.mutationId());
                        slot.refetchOnSettle = true;
                    }
                    else
                    {
                        slot.entry = slot.entry.withoutOverlay(error);
                        slot.refetchOnSettle = false;
                        restored.add(key);
                    }
                    updates.add(new Update(key, slot));
                }
                else
                {
                    slot.refetchOnSettle = true;
                }
            }
        }

        fire(updates);
        restored.forEach(this::refetch);
    }

    private Slot slotFor(final QueryKey key)
    {
        Slot slot = slots.get(key);
        if (null == slot)
        {
            slot = new Slot();
            slots.put(key, slot);
        }

        return slot;
    }

    private InFlight newInFlight(final Slot slot, final long nowMs)
    {
        final InFlight inFlight = new InFlight(CancellationToken.create(errorHandler), nowMs, slot.invalidations);
        slot.inFlight = inFlight;
        return inFlight;
    }

    @SuppressWarnings("unchecked")
    private void launch(final QueryKey key, final InFlight inFlight, final RemoteCall<?> fetcher)
    {
        final RemoteCall<Object> call = (RemoteCall<Object>)fetcher;
        retryExecutor.execute(readBreaker.wrap(call), readPolicy, inFlight.token)
            .whenComplete((value, error) -> onFetchComplete(key, inFlight, value, error));
    }

    private void onFetchComplete(final QueryKey key, final InFlight inFlight, final Object value, final Throwable error)
    {
        Update update = null;
        boolean refetch = false;
        Object resultValue = value;
        Throwable resultError = null;

        synchronized (this)
        {
            final Slot slot = slots.get(key);
            if (slot.inFlight == inFlight)
            {
                slot.inFlight = null;
            }

            final CacheEntry entry = slot.entry;
            if (inFlight.token.isCancelled())
            {
                resultError = inFlight.token.toException();
            }
            else if (null != error)
            {
                resultError = FailureClassifier.unwrap(error);
                if (!entry.isOptimistic() && inFlight.issuedAtMs >= entry.lastUpdatedMs())
                {
                    slot.entry = entry.withError(resultError);
                    update = new Update(key, slot);
                }
            }
            else if (entry.isOptimistic())
            {
                slot.refetchOnSettle = true;
                resultValue = entry.data();
            }
            else if (inFlight.issuedAtMs < entry.lastUpdatedMs())
            {
                resultValue = entry.data();
            }
            else
            {
                final boolean invalidatedMeanwhile = slot.invalidations != inFlight.invalidations;
                slot.entry = entry.withFetched(
                    value,
                    inFlight.issuedAtMs,
                    invalidatedMeanwhile ? CacheEntry.Status.STALE : CacheEntry.Status.FRESH);
                update = new Update(key, slot);
                refetch = invalidatedMeanwhile && null != slot.fetcher;
            }
        }

        if (null != update)
        {
            fire(List.of(update));
        }

        if (refetch)
        {
            refetch(key);
        }

        if (null != resultError)
        {
            inFlight.promise.completeExceptionally(resultError);
        }
        else
        {
            inFlight.promise.complete(resultValue);
        }
    }

    @SuppressWarnings("unchecked")
    private <T> CompletableFuture<T> attach(final CompletableFuture<Object> promise, final CancellationToken token)
    {
        final CompletableFuture<T> result = new CompletableFuture<>();
        final CancellationToken.Registration registration =
            token.onCancel(() -> result.completeExceptionally(token.toException()));

        promise.whenComplete((value, error) ->
        {
            registration.close();
            if (null == error)
            {
                result.complete((T)value);
            }
            else
            {
                result.completeExceptionally(FailureClassifier.unwrap(error));
            }
        });

        return result;
    }

    private void fire(final List<Update> updates)
    {
        for (final Update update : updates)
        {
            for (final CacheListener listener : update.listeners)
            {
                try
                {
                    listener.onUpdate(update.key, update.entry);
                }
                catch (final Exception ex)
                {
                    errorHandler.onError(ex);
                }
            }
        }
    }

    public synchronized String toString()
    {
        return "QueryCache{keys=" + slots.size() + '}';
    }
}
