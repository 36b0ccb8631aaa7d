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
import io.petdesk.resilience.RemoteCall;
import org.agrona.ErrorHandler;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * A subscribed view of one query, kept current by the cache.
 * <p>
 * Opening the observer issues the initial read; the key then counts as active for polling and reconnect
 * refetches until the observer is closed.
 *
 * @param <T> value type
 */
public final class QueryObserver<T> implements AutoCloseable
{
    private final QueryCache cache;
    private final QueryKey key;
    private final RemoteCall<T> fetcher;
    private final long staleTimeMs;
    private final ErrorHandler errorHandler;
    private final CancellationToken token;
    private final Subscription subscription;
    private final CompletableFuture<T> initialLoad;
    private volatile Consumer<QueryResult<T>> onResult;

    QueryObserver(
        final QueryCache cache,
        final QueryKey key,
        final RemoteCall<T> fetcher,
        final long staleTimeMs,
        final ErrorHandler errorHandler)
    {
        this.cache = cache;
        this.key = key;
        this.fetcher = fetcher;
        this.staleTimeMs = staleTimeMs;
        this.errorHandler = errorHandler;
        this.token = CancellationToken.create(errorHandler);
        this.subscription = cache.subscribe(key, (updatedKey, entry) -> publish());
        this.initialLoad = cache.get(key, fetcher, staleTimeMs, token);
    }

    /**
     * Current state of the query.
     *
     * @return the result
     */
    public QueryResult<T> result()
    {
        return QueryResult.of(cache.peek(key), cache.epochClock().time(), staleTimeMs, cache.isFetching(key));
    }

    /**
     * Callback receiving every new result, on the thread that changed the entry.
     *
     * @param onResult the callback, null to stop
     * @return this for chaining
     */
    public QueryObserver<T> onResult(final Consumer<QueryResult<T>> onResult)
    {
        this.onResult = onResult;
        return this;
    }

    /**
     * Outcome of the read issued when the observer opened.
     *
     * @return future of the first value
     */
    public CompletableFuture<T> initialLoad()
    {
        return initialLoad;
    }

    /**
     * Read again, serving the cached value if still fresh.
     *
     * @return future of the value
     */
    public CompletableFuture<T> get()
    {
        return cache.get(key, fetcher, staleTimeMs, token);
    }

    /**
     * Fetch now regardless of staleness.
     *
     * @return future of the fetched value
     */
    @SuppressWarnings("unchecked")
    public CompletableFuture<T> refetch()
    {
        return cache.refetch(key).thenApply((value) -> (T)value);
    }

    public QueryKey key()
    {
        return key;
    }

    /**
     * Stop receiving updates and detach from the pending initial read.
     */
    public void close()
    {
        subscription.close();
        token.cancel("observer of " + key + " closed");
    }

    private void publish()
    {
        final Consumer<QueryResult<T>> onResult = this.onResult;
        if (null != onResult)
        {
            try
            {
                onResult.accept(result());
            }
            catch (final Exception ex)
            {
                errorHandler.onError(ex);
            }
        }
    }
}
