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

import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A mutation between speculative apply and its single terminal outcome.
 */
public final class PendingMutation
{
    /**
     * Lifecycle state.
     */
    public enum State
    {
        PENDING,
        COMMITTED,
        ROLLED_BACK
    }

    private final long id;
    private final Set<QueryKey> affectedKeys;
    private final Map<QueryKey, CacheEntry> snapshot;
    private final Map<QueryKey, Object> optimisticValues;
    private final long submittedAtMs;
    private final AtomicReference<State> state = new AtomicReference<>(State.PENDING);

    PendingMutation(
        final long id,
        final Set<QueryKey> affectedKeys,
        final Map<QueryKey, CacheEntry> snapshot,
        final Map<QueryKey, Object> optimisticValues,
        final long submittedAtMs)
    {
        this.id = id;
        this.affectedKeys = Set.copyOf(affectedKeys);
        this.snapshot = snapshot;
        this.optimisticValues = optimisticValues;
        this.submittedAtMs = submittedAtMs;
    }

    /**
     * Move to a terminal state if still pending.
     *
     * @param terminal {@link State#COMMITTED} or {@link State#ROLLED_BACK}
     * @return true if this call settled the mutation
     */
    boolean settle(final State terminal)
    {
        return state.compareAndSet(State.PENDING, terminal);
    }

    public long id()
    {
        return id;
    }

    public Set<QueryKey> affectedKeys()
    {
        return affectedKeys;
    }

    /**
     * Entries as they were just before the optimistic apply; {@link CacheEntry#empty()} for keys
     * that had none.
     *
     * @return key to prior entry
     */
    public Map<QueryKey, CacheEntry> snapshot()
    {
        return snapshot;
    }

    public Map<QueryKey, Object> optimisticValues()
    {
        return optimisticValues;
    }

    public long submittedAtMs()
    {
        return submittedAtMs;
    }

    public State state()
    {
        return state.get();
    }

    public String toString()
    {
        return "PendingMutation{id=" + id + ", keys=" + affectedKeys + ", state=" + state.get() + '}';
    }
}
