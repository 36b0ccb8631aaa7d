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

import io.petdesk.cache.CacheEntry;
import io.petdesk.cache.CanonicalMerge;
import io.petdesk.cache.MutationDescriptor;
import io.petdesk.cache.MutationHandle;
import io.petdesk.cache.OptimisticValueFunction;
import io.petdesk.cache.QueryClient;
import io.petdesk.cache.QueryKey;
import io.petdesk.cache.QueryObserver;
import io.petdesk.cache.WriteResult;
import io.petdesk.cache.monitoring.HealthCheck;
import io.petdesk.cache.realtime.ChangeNotificationListener;
import io.petdesk.resilience.CircuitBreaker;
import io.petdesk.resilience.CircuitOpenException;
import io.petdesk.resilience.ConflictException;
import io.petdesk.resilience.FatalRequestException;
import io.petdesk.resilience.RetryExhaustedException;
import io.petdesk.resilience.RetryPolicy;
import org.agrona.CloseHelper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PetDesk sync scenarios against an in-memory backend")
class PetDeskSyncSystemTest
{
    private static final String ORG = "org-1";
    private static final QueryKey PETS = QueryKey.of("pets", "organizationId", ORG);
    private static final QueryKey MAX = PETS.with("petId", "p-1");
    private static final QueryKey BELLA = PETS.with("petId", "p-2");
    private static final QueryKey COCO = PETS.with("petId", "p-3");

    private static final OptimisticValueFunction<MutationDescriptor> RENAME =
        (key, current, mutation) -> Pet.rename(current, mutation.entityId(), (String)mutation.payload().get("name"));
    private static final CanonicalMerge MERGE_PET =
        (key, optimisticValue, canonicalValue) -> Pet.replaceIn(optimisticValue, (Pet)canonicalValue);

    private final InMemoryGateway gateway = new InMemoryGateway();
    private final List<Throwable> errors = new CopyOnWriteArrayList<>();
    private QueryClient client;

    @BeforeEach
    void setUp()
    {
        gateway.add(new Pet("p-1", ORG, "Max", 1));
        gateway.add(new Pet("p-2", ORG, "Bella", 1));
        gateway.add(new Pet("p-3", ORG, "Coco", 1));
        gateway.add(new Pet("p-9", "org-2", "Luna", 1));
    }

    @AfterEach
    void tearDown()
    {
        CloseHelper.close(client);
        assertEquals(List.of(), errors);
    }

    @Test
    @DisplayName("rename commits, shows the canonical pet and stays consistent after the push")
    void shouldCommitRenameAcrossDetailAndList()
    {
        connect(RetryPolicy.fixed(1, 0), 5);
        final QueryObserver<Object> detail = client.useQuery(MAX);
        final QueryObserver<Object> list = client.useQuery(PETS);
        assertEquals(new Pet("p-1", ORG, "Max", 1), detail.initialLoad().join());
        list.initialLoad().join();

        final MutationHandle<MutationDescriptor, Object> rename =
            client.useMutation(gateway::write, Set.of(MAX, PETS), RENAME, MERGE_PET, null);
        rename.mutate(MutationDescriptor.update("pets", "p-1", Map.of("name", "Rex", "version", 1))).join();

        final Pet rex = new Pet("p-1", ORG, "Rex", 2);
        assertEquals(rex, gateway.pet("p-1"));
        assertEquals(rex, detail.result().data());
        assertEquals(List.of(rex, gateway.pet("p-2"), gateway.pet("p-3")), list.result().data());

        final ChangeNotificationListener listener = client.changeListener();
        Await.until(() -> listener.eventsReceived() == 1, () -> "push of the rename");
        Await.until(() -> !client.cache().isFetching(MAX) && !client.cache().isFetching(PETS),
            () -> "refetch after the push");

        assertEquals(rex, detail.result().data());
        assertFalse(detail.result().isOptimistic());
        assertEquals(List.of(rex, gateway.pet("p-2"), gateway.pet("p-3")), list.result().data());
        assertEquals(1, client.coordinator().committedMutations());
    }

    @Test
    @DisplayName("stale rename Max -> Rex is rolled back and the server's Buddy replaces it")
    void shouldRollBackConflictingRenameAndShowServerValue()
    {
        connect(RetryPolicy.fixed(1, 0), 5);
        final QueryObserver<Object> detail = client.useQuery(MAX);
        final Pet max = (Pet)detail.initialLoad().join();
        final List<String> rendered = new CopyOnWriteArrayList<>();
        detail.onResult((result) -> rendered.add(((Pet)result.data()).name + ":" + result.status()));

        gateway.renameElsewhere("p-1", "Buddy", false);

        final MutationHandle<MutationDescriptor, Object> rename =
            client.useMutation(gateway::write, Set.of(MAX), RENAME, MERGE_PET, null);
        final CompletableFuture<?> result =
            rename.mutate(MutationDescriptor.update("pets", "p-1", Map.of("name", "Rex", "version", max.version)));

        final CompletionException ex = assertThrows(CompletionException.class, result::join);
        assertInstanceOf(ConflictException.class, ex.getCause());
        assertInstanceOf(ConflictException.class, rename.error());

        Await.until(() -> "Buddy".equals(((Pet)detail.result().data()).name), () -> "refetch of p-1");
        Await.until(() -> !client.cache().isFetching(MAX), () -> "refetch to settle");

        assertEquals("Rex:" + CacheEntry.Status.PENDING, rendered.get(0));
        assertEquals("Max:" + CacheEntry.Status.ERROR, rendered.get(1));
        assertEquals("Buddy:" + CacheEntry.Status.FRESH, rendered.get(rendered.size() - 1));
        assertEquals(CacheEntry.Status.FRESH, detail.result().status());
        assertNull(detail.result().error());
        assertEquals(1, client.coordinator().rolledBackMutations());
    }

    @Test
    @DisplayName("rejected write across two pets rolls both back together")
    void shouldRollBackEveryKeyOfRejectedMutation()
    {
        connect(RetryPolicy.fixed(1, 0), 5);
        final QueryObserver<Object> first = client.useQuery(MAX);
        final QueryObserver<Object> second = client.useQuery(BELLA);
        first.initialLoad().join();
        second.initialLoad().join();

        final CompletableFuture<WriteResult<Object>> write = new CompletableFuture<>();
        final MutationHandle<String, Object> clearNames = client.useMutation(
            (name, token) -> write,
            Set.of(MAX, BELLA),
            (key, current, name) -> ((Pet)current).withName(name));

        final CompletableFuture<?> result = clearNames.mutate("");
        assertEquals("", ((Pet)first.result().data()).name);
        assertEquals("", ((Pet)second.result().data()).name);
        assertTrue(first.result().isOptimistic());
        assertTrue(clearNames.isPending());

        write.completeExceptionally(new FatalRequestException("name must not be blank"));

        assertThrows(CompletionException.class, result::join);
        assertInstanceOf(FatalRequestException.class, clearNames.error());
        Await.until(() -> !client.cache().isFetching(MAX) && !client.cache().isFetching(BELLA),
            () -> "refetch after rollback");

        assertEquals(gateway.pet("p-1"), first.result().data());
        assertEquals(gateway.pet("p-2"), second.result().data());
        assertFalse(first.result().isOptimistic());
        assertFalse(second.result().isOptimistic());
        assertEquals(0, client.coordinator().pendingCount());
    }

    @Test
    @DisplayName("two transient failures are retried after 100 ms and 200 ms")
    void shouldRetryTransientReadFailuresWithBackoff()
    {
        connect(RetryPolicy.exponential(3, 100, 2.0, 1000), 5);
        gateway.failNextReads(2);

        final long startNs = System.nanoTime();
        final Object pet = client.query(MAX).join();
        final long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);

        assertEquals(gateway.pet("p-1"), pet);
        assertEquals(3, gateway.reads());
        assertEquals(2, client.retryExecutor().retriedCalls());
        assertEquals(300, client.retryExecutor().totalRetryDelayMs());
        assertThat(elapsedMs, greaterThanOrEqualTo(300L));
        assertTrue(client.readBreaker().isClosed());
    }

    @Test
    @DisplayName("repeated read failures open the circuit and report service degraded")
    void shouldOpenCircuitAndReportDegradedService()
    {
        connect(RetryPolicy.fixed(1, 0), 2);
        awaitLive();
        gateway.failNextReads(10);

        final CompletionException first = assertThrows(CompletionException.class, () -> client.query(MAX).join());
        assertInstanceOf(RetryExhaustedException.class, first.getCause());
        assertThrows(CompletionException.class, () -> client.query(BELLA).join());
        assertEquals(CircuitBreaker.State.OPEN, client.readBreaker().state());

        final CompletionException rejected =
            assertThrows(CompletionException.class, () -> client.query(COCO).join());
        assertInstanceOf(CircuitOpenException.class, rejected.getCause());
        assertEquals(2, gateway.reads());

        final HealthCheck.AggregateResult health = client.health();
        assertEquals(HealthCheck.Status.DEGRADED, health.status);
        assertTrue(health.isServing());
        assertThat(health.toJson(), containsString("Service degraded"));
    }

    @Test
    @DisplayName("missed pushes are covered by polling while disconnected and by a refetch on reconnect")
    void shouldPollWhileDisconnectedAndResumePushOnReconnect()
    {
        connect(RetryPolicy.fixed(1, 0), 5);
        final ChangeNotificationListener listener = client.changeListener();
        awaitLive();
        final QueryObserver<Object> detail = client.useQuery(MAX);
        detail.initialLoad().join();

        gateway.disconnect();
        Await.until(listener::isDegraded, () -> "degraded mode");
        assertEquals(HealthCheck.Status.DEGRADED, client.health().status);

        gateway.renameElsewhere("p-1", "Buddy", true);
        Await.until(() -> "Buddy".equals(((Pet)detail.result().data()).name), () -> "poll to pick up Buddy");
        assertThat(listener.pollCycles(), greaterThanOrEqualTo(1L));
        assertEquals(0, listener.eventsReceived());

        gateway.reconnect();
        Await.until(() -> ChangeNotificationListener.Mode.LIVE == listener.mode(), () -> "live mode");
        assertEquals(1, listener.reconnects());

        gateway.renameElsewhere("p-1", "Rocky", true);
        Await.until(() -> "Rocky".equals(((Pet)detail.result().data()).name), () -> "push to deliver Rocky");
        assertEquals(1, listener.eventsReceived());
        assertEquals(HealthCheck.Status.HEALTHY, client.health().status);
    }

    @Test
    @DisplayName("changes in another organization are not delivered")
    void shouldIgnoreChangesOfOtherOrganizations()
    {
        connect(RetryPolicy.fixed(1, 0), 5);
        final ChangeNotificationListener listener = client.changeListener();
        awaitLive();
        final QueryObserver<Object> detail = client.useQuery(MAX);
        detail.initialLoad().join();

        gateway.renameElsewhere("p-9", "Nala", true);
        gateway.renameElsewhere("p-1", "Buddy", true);

        Await.until(() -> "Buddy".equals(((Pet)detail.result().data()).name), () -> "push to deliver Buddy");
        assertEquals(1, listener.eventsReceived());
        assertEquals(1, gateway.subscriberCount(ORG));
        assertEquals(0, gateway.subscriberCount("org-2"));
    }

    private void connect(final RetryPolicy readPolicy, final int circuitFailureThreshold)
    {
        client = QueryClient.connect(new QueryClient.Context()
            .gateway(gateway)
            .scope(ORG)
            .errorHandler(errors::add)
            .readPolicy(readPolicy)
            .writePolicy(RetryPolicy.fixed(1, 0))
            .staleTimeMs(60_000)
            .circuitFailureThreshold(circuitFailureThreshold)
            .circuitResetTimeoutMs(60_000)
            .pollIntervalMs(50)
            .mutationTimeoutMs(5_000)
            .listenerIdleSleepMs(1));
    }

    private void awaitLive()
    {
        final ChangeNotificationListener listener = client.changeListener();
        Await.until(() -> ChangeNotificationListener.Mode.LIVE == listener.mode(), () -> "listener to subscribe");
    }
}
