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
 * Immutable state of one cached query.
 * <p>
 * An entry holds the last value confirmed by the backend and at most one optimistic overlay, owned by
 * the mutation identified by {@link #mutationId()}. Readers see the overlay while it is present.
 */
public final class CacheEntry
{
    /**
     * Entry status.
     */
    public enum Status
    {
        /** Value confirmed and within its stale time */
        FRESH,
        /** Value untrustworthy, refetch due */
        STALE,
        /** Optimistic overlay awaiting the backend's answer */
        PENDING,
        /** Last fetch or mutation failed, last good value kept */
        ERROR
    }

    /**
     * Mutation id of an entry without overlay.
     */
    public static final long NO_MUTATION = 0;

    private static final CacheEntry EMPTY = new CacheEntry(null, false, null, NO_MUTATION, Status.STALE, 0, null);

    private final Object value;
    private final boolean hasValue;
    private final Object optimisticValue;
    private final long mutationId;
    private final Status status;
    private final long lastUpdatedMs;
    private final Throwable error;

    private CacheEntry(
        final Object value,
        final boolean hasValue,
        final Object optimisticValue,
        final long mutationId,
        final Status status,
        final long lastUpdatedMs,
        final Throwable error)
    {
        this.value = value;
        this.hasValue = hasValue;
        this.optimisticValue = optimisticValue;
        this.mutationId = mutationId;
        this.status = status;
        this.lastUpdatedMs = lastUpdatedMs;
        this.error = error;
    }

    /**
     * Entry with no value, as seen before the first fetch completes.
     *
     * @return the empty entry
     */
    public static CacheEntry empty()
    {
        return EMPTY;
    }

    /**
     * Fresh entry holding a confirmed value.
     *
     * @param value         the value
     * @param lastUpdatedMs time the value was current on the backend
     * @return the entry
     */
    public static CacheEntry fresh(final Object value, final long lastUpdatedMs)
    {
        return new CacheEntry(value, true, null, NO_MUTATION, Status.FRESH, lastUpdatedMs, null);
    }

    /**
     * Value readers should see: the overlay if present, otherwise the confirmed value.
     *
     * @param <T> expected type
     * @return the value or null
     */
    @SuppressWarnings("unchecked")
    public <T> T data()
    {
        return (T)(isOptimistic() ? optimisticValue : value);
    }

    /**
     * Has this entry something to show, confirmed or optimistic.
     *
     * @return true if {@link #data()} is meaningful
     */
    public boolean hasData()
    {
        return hasValue || isOptimistic();
    }

    public boolean hasValue()
    {
        return hasValue;
    }

    public Object value()
    {
        return value;
    }

    public boolean isOptimistic()
    {
        return NO_MUTATION != mutationId;
    }

    public Object optimisticValue()
    {
        return optimisticValue;
    }

    public long mutationId()
    {
        return mutationId;
    }

    public Status status()
    {
        return status;
    }

    public long lastUpdatedMs()
    {
        return lastUpdatedMs;
    }

    public Throwable error()
    {
        return error;
    }

    /**
     * Should a reader revalidate this entry.
     *
     * @param nowMs       current time
     * @param staleTimeMs how long a fresh value stays fresh
     * @return true if stale, failed or past its stale time; never for pending entries
     */
    public boolean isStale(final long nowMs, final long staleTimeMs)
    {
        if (isOptimistic())
        {
            return false;
        }

        switch (status)
        {
            case PENDING:
                return false;

            case FRESH:
                return nowMs - lastUpdatedMs >= staleTimeMs;

            default:
                return true;
        }
    }

    CacheEntry withFetched(final Object value, final long lastUpdatedMs, final Status status)
    {
        return new CacheEntry(value, true, null, NO_MUTATION, status, lastUpdatedMs, null);
    }

    CacheEntry withValue(final Object value, final long lastUpdatedMs)
    {
        final Status newStatus = isOptimistic() ? status : Status.FRESH;
        return new CacheEntry(value, true, optimisticValue, mutationId, newStatus, lastUpdatedMs, null);
    }

    CacheEntry withOverlay(final Object optimisticValue, final long mutationId)
    {
        return new CacheEntry(value, hasValue, optimisticValue, mutationId, Status.PENDING, lastUpdatedMs, null);
    }

    CacheEntry withoutOverlay(final Throwable error)
    {
        return new CacheEntry(value, hasValue, null, NO_MUTATION, Status.ERROR, lastUpdatedMs, error);
    }

    CacheEntry withStatus(final Status status)
    {
        return new CacheEntry(value, hasValue, optimisticValue, mutationId, status, lastUpdatedMs, error);
    }

    CacheEntry withError(final Throwable error)
    {
        return new CacheEntry(value, hasValue, optimisticValue, mutationId, Status.ERROR, lastUpdatedMs, error);
    }

    public String toString()
    {
        return "CacheEntry{" +
            "value=" + value +
            (isOptimistic() ? ", optimisticValue=" + optimisticValue + ", mutationId=" + mutationId : "") +
            ", status=" + status +
            ", lastUpdatedMs=" + lastUpdatedMs +
            (null != error ? ", error=" + error.getMessage() : "") +
            '}';
    }
}
