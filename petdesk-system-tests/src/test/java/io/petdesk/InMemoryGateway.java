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
package io.petdesk;

import io.petdesk.cache.MutationDescriptor;
import io.petdesk.cache.QueryKey;
import io.petdesk.cache.RemoteDataGateway;
import io.petdesk.cache.Subscription;
import io.petdesk.cache.WriteResult;
import io.petdesk.cache.realtime.ChangeEvent;
import io.petdesk.cache.realtime.ChangeKind;
import io.petdesk.cache.realtime.ChangeListener;
import io.petdesk.cache.realtime.ConnectionState;
import io.petdesk.resilience.CancellationToken;
import io.petdesk.resilience.ConflictException;
import io.petdesk.resilience.RequestStatusException;
import io.petdesk.resilience.TransientNetworkException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Backend of pets with versioned rows, push notifications and injectable failures.
 */
final class InMemoryGateway implements RemoteDataGateway
{
    private final Map<String, Pet> pets = new TreeMap<>();
    private final Map<String, List<ChangeListener>> subscribers = new TreeMap<>();
    private final List<String> writes = new CopyOnWriteArrayList<>();
    private final AtomicInteger reads = new AtomicInteger();
    private int readFailures;
    private boolean connected = true;

    synchronized void add(final Pet pet)
    {
        pets.put(pet.id, pet);
    }

    synchronized Pet pet(final String id)
    {
        return pets.get(id);
    }

    /**
     * Change a pet as another user would, optionally without pushing the change.
     */
    void renameElsewhere(final String id, final String name, final boolean push)
    {
        final Pet updated;
        synchronized (this)
        {
            updated = pets.get(id).nextVersion(name);
            pets.put(id, updated);
        }

        if (push)
        {
            publish(updated.organizationId, new ChangeEvent("pets", id, ChangeKind.UPDATE));
        }
    }

    synchronized void failNextReads(final int count)
    {
        readFailures = count;
    }

    int reads()
    {
        return reads.get();
    }

    List<String> writes()
    {
        return writes;
    }

    void disconnect()
    {
        setConnected(false, ConnectionState.DISCONNECTED);
    }

    void reconnect()
    {
        setConnected(true, ConnectionState.CONNECTED);
    }

    public CompletableFuture<Object> read(final QueryKey key, final CancellationToken token)
    {
        reads.incrementAndGet();
        synchronized (this)
        {
            if (readFailures > 0)
            {
                readFailures--;
                return CompletableFuture.failedFuture(new TransientNetworkException("connection reset by peer"));
            }

            if (!"pets".equals(key.entityType()))
            {
                return CompletableFuture.failedFuture(new RequestStatusException(404, "unknown entity " + key));
            }

            final String petId = key.param("petId");
            if (null != petId)
            {
                final Pet pet = pets.get(petId);
                return null != pet ?
                    CompletableFuture.completedFuture(pet) :
                    CompletableFuture.failedFuture(new RequestStatusException(404, "no pet " + petId));
            }

            final List<Pet> result = new ArrayList<>();
            for (final Pet pet : pets.values())
            {
                if (pet.organizationId.equals(key.param("organizationId")))
                {
                    result.add(pet);
                }
            }
            result.sort(Comparator.comparing((Pet pet) -> pet.id));

            return CompletableFuture.completedFuture(result);
        }
    }

    public CompletableFuture<WriteResult<Object>> write(final MutationDescriptor mutation, final CancellationToken token)
    {
        writes.add(mutation.toString());

        final Pet updated;
        synchronized (this)
        {
            final Pet pet = pets.get(mutation.entityId());
            if (null == pet)
            {
                return CompletableFuture.failedFuture(new RequestStatusException(404, "no pet " + mutation.entityId()));
            }

            final Object expectedVersion = mutation.payload().get("version");
            if (null != expectedVersion && pet.version != (Integer)expectedVersion)
            {
                return CompletableFuture.failedFuture(new ConflictException(
                    "pet " + pet.id + " is at version " + pet.version + ", not " + expectedVersion));
            }

            updated = pet.nextVersion((String)mutation.payload().get("name"));
            pets.put(updated.id, updated);
        }

        publish(updated.organizationId, new ChangeEvent("pets", updated.id, ChangeKind.UPDATE));

        return CompletableFuture.completedFuture(WriteResult.accepted(updated));
    }

    public Subscription subscribe(final String scope, final ChangeListener listener)
    {
        synchronized (this)
        {
            subscribers.computeIfAbsent(scope, (ignore) -> new CopyOnWriteArrayList<>()).add(listener);
        }

        return () ->
        {
            synchronized (InMemoryGateway.this)
            {
                subscribers.get(scope).remove(listener);
            }
        };
    }

    synchronized int subscriberCount(final String scope)
    {
        final List<ChangeListener> listeners = subscribers.get(scope);
        return null == listeners ? 0 : listeners.size();
    }

    private void publish(final String scope, final ChangeEvent event)
    {
        final List<ChangeListener> listeners;
        synchronized (this)
        {
            if (!connected || !subscribers.containsKey(scope))
            {
                return;
            }
            listeners = new ArrayList<>(subscribers.get(scope));
        }

        for (final ChangeListener listener : listeners)
        {
            listener.onChange(event);
        }
    }

    private void setConnected(final boolean connected, final ConnectionState state)
    {
        final List<ChangeListener> listeners = new ArrayList<>();
        synchronized (this)
        {
            this.connected = connected;
            subscribers.values().forEach(listeners::addAll);
        }

        for (final ChangeListener listener : listeners)
        {
            listener.onConnectionStateChange(state);
        }
    }
}
