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

/**
 * What a UI component renders for one query at one instant.
 *
 * @param <T> value type
 */
public final class QueryResult<T>
{
    private final T data;
    private final boolean optimistic;
    private final boolean stale;
    private final boolean fetching;
    private final Throwable error;
    private final CacheEntry.Status status;

    QueryResult(
        final T data,
        final boolean optimistic,
        final boolean stale,
        final boolean fetching,
        final Throwable error,
        final CacheEntry.Status status)
    {
        this.data = data;
        this.optimistic = optimistic;
        this.stale = stale;
        this.fetching = fetching;
        this.error = error;
        this.status = status;
    }

    static <T> QueryResult<T> of(
        final CacheEntry entry, final long nowMs, final long staleTimeMs, final boolean fetching)
    {
        if (null == entry)
        {
            return new QueryResult<>(null, false, true, fetching, null, CacheEntry.Status.STALE);
        }

        final T data = entry.hasData() ? entry.data() : null;
        return new QueryResult<>(
            data,
            entry.isOptimistic(),
            entry.isStale(nowMs, staleTimeMs),
            fetching,
            CacheEntry.Status.ERROR == entry.status() ? entry.error() : null,
            entry.status());
    }

    /**
     * Value to render: the optimistic overlay while a mutation is pending, else the last known good value.
     *
     * @return the data, or null if nothing has loaded
     */
    public T data()
    {
        return data;
    }

    public boolean isOptimistic()
    {
        return optimistic;
    }

    public boolean isStale()
    {
        return stale;
    }

    public boolean isFetching()
    {
        return fetching;
    }

    /**
     * Nothing to render yet and a fetch is under way.
     *
     * @return true if loading
     */
    public boolean isLoading()
    {
        return null == data && fetching;
    }

    /**
     * Failure of the last fetch or the rollback cause, shown next to {@link #data()}.
     *
     * @return the error, or null
     */
    public Throwable error()
    {
        return error;
    }

    public CacheEntry.Status status()
    {
        return status;
    }

    public String toString()
    {
        return "QueryResult{" +
            "data=" + data +
            ", status=" + status +
            ", optimistic=" + optimistic +
            ", stale=" + stale +
            ", fetching=" + fetching +
            (null != error ? ", error=" + error.getMessage() : "") +
            '}';
    }
}
