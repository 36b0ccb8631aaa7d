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

import io.petdesk.cache.monitoring.HealthCheck;
import io.petdesk.cache.realtime.ChangeNotificationListener;
import io.petdesk.cache.realtime.InvalidationTable;
import io.petdesk.resilience.CancellationToken;
import io.petdesk.resilience.CircuitBreaker;
import io.petdesk.resilience.RemoteCall;
import io.petdesk.resilience.RetryExecutor;
import io.petdesk.resilience.RetryPolicy;
import org.agrona.CloseHelper;
import org.agrona.ErrorHandler;
import org.agrona.concurrent.AgentRunner;
import org.agrona.concurrent.EpochClock;
import org.agrona.concurrent.SleepingMillisIdleStrategy;
import org.agrona.concurrent.SystemEpochClock;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Entry point of the sync layer for one tenant session.
 * <p>
 * Owns one {@link QueryCache}, a {@link CircuitBreaker} per endpoint (read and write), one
 * {@link RetryExecutor}, one {@link MutationCoordinator} and the {@link ChangeNotificationListener}.
 * Nothing is shared between clients.
 * <pre>{@code
 * try (QueryClient client = QueryClient.connect(new QueryClient.Context()
 *     .gateway(gateway)
 *     .scope("org-1")))
 * {
 *     final QueryObserver<List<Pet>> pets = client.useQuery(QueryKey.of("pets", "organizationId", "org-1"), fetcher);
 *     ...
 * }
 * }</pre>
 */
public final class QueryClient implements AutoCloseable
{
    private final Context ctx;
    private final CircuitBreaker readBreaker;
    private final CircuitBreaker writeBreaker;
    private final RetryExecutor retryExecutor;
    private final QueryCache cache;
    private final MutationCoordinator coordinator;
    private final ChangeNotificationListener listener;
    private final AgentRunner listenerRunner;
    private final HealthCheck healthCheck;
    private volatile boolean isClosed;

    private QueryClient(final Context ctx)
    {
        this.ctx = ctx;

        readBreaker = new CircuitBreaker(
            "read", ctx.circuitFailureThreshold(), ctx.circuitResetTimeoutMs(), ctx.epochClock());
        writeBreaker = new CircuitBreaker(
            "write", ctx.circuitFailureThreshold(), ctx.circuitResetTimeoutMs(), ctx.epochClock());
        retryExecutor = new RetryExecutor(ctx.scope(), ctx.readPolicy(), ctx.scheduler(), ctx.errorHandler());
        cache = new QueryCache(
            retryExecutor, ctx.readPolicy(), readBreaker, ctx.epochClock(), ctx.errorHandler(), ctx.staleTimeMs());
        coordinator = new MutationCoordinator(
            cache,
            retryExecutor,
            ctx.writePolicy(),
            writeBreaker,
            ctx.scheduler(),
            ctx.errorHandler(),
            ctx.mutationTimeoutMs());
        listener = new ChangeNotificationListener(
            ctx.gateway(),
            cache,
            ctx.invalidationTable(),
            ctx.scope(),
            ctx.pollIntervalMs(),
            ctx.epochClock(),
            ctx.errorHandler());

        if (ctx.useListenerThread())
        {
            listenerRunner = new AgentRunner(
                new SleepingMillisIdleStrategy(ctx.listenerIdleSleepMs()), ctx.errorHandler(), null, listener);
        }
        else
        {
            listenerRunner = null;
        }

        healthCheck = new HealthCheck()
            .register(HealthCheck.circuitBreaker(readBreaker))
            .register(HealthCheck.circuitBreaker(writeBreaker))
            .register(HealthCheck.changeNotifications(listener))
            .register(HealthCheck.pendingMutations(coordinator, ctx.pendingMutationWarningThreshold()));
    }

    /**
     * Create a client and start its change notification listener.
     * <p>
     * Without a listener thread the listener is started here and the caller drives it with
     * {@link ChangeNotificationListener#doWork()}.
     *
     * @param ctx configuration of the client
     * @return the started client
     */
    public static QueryClient connect(final Context ctx)
    {
        final QueryClient client = new QueryClient(ctx.conclude());
        if (null != client.listenerRunner)
        {
            AgentRunner.startOnThread(client.listenerRunner);
        }
        else
        {
            client.listener.onStart();
        }

        System.out.println("[QueryClient:" + ctx.scope() + "] connected");
        return client;
    }

    /**
     * Observe a query with the default stale time.
     *
     * @param key     the key
     * @param fetcher loads the value
     * @param <T>     value type
     * @return an open observer
     */
    public <T> QueryObserver<T> useQuery(final QueryKey key, final RemoteCall<T> fetcher)
    {
        return useQuery(key, fetcher, ctx.staleTimeMs());
    }

    /**
     * Observe a query.
     *
     * @param key         the key
     * @param fetcher     loads the value
     * @param staleTimeMs how long a fetched value stays fresh
     * @param <T>         value type
     * @return an open observer, closed when the view goes away
     */
    public <T> QueryObserver<T> useQuery(final QueryKey key, final RemoteCall<T> fetcher, final long staleTimeMs)
    {
        return new QueryObserver<>(cache, key, fetcher, staleTimeMs, ctx.errorHandler());
    }

    /**
     * Observe a query read through the gateway.
     *
     * @param key the key, passed to {@link RemoteDataGateway#read(QueryKey, CancellationToken)}
     * @return an open observer
     */
    public QueryObserver<Object> useQuery(final QueryKey key)
    {
        return useQuery(key, gatewayRead(key), ctx.staleTimeMs());
    }

    /**
     * Bind a mutation that commits with {@link CanonicalMerge#REPLACE}: when the write returns a canonical value
     * that one value is stored under every affected key, list keys included. Pass a merge such as
     * {@link CanonicalMerge#replaceOnly(Set)} when the affected keys hold different shapes.
     *
     * @param writer            performs the remote write
     * @param affectedKeys      keys the write changes
     * @param optimisticValueFn computes each key's optimistic value
     * @param <V>               variables type
     * @param <T>               canonical value type
     * @return the handle
     */
    public <V, T> MutationHandle<V, T> useMutation(
        final MutationWriter<V, T> writer,
        final Set<QueryKey> affectedKeys,
        final OptimisticValueFunction<V> optimisticValueFn)
    {
        return useMutation(writer, affectedKeys, optimisticValueFn, CanonicalMerge.REPLACE, null);
    }

    /**
     * Bind a mutation with a merge of the canonical value and lifecycle callbacks.
     *
     * @param writer            performs the remote write
     * @param affectedKeys      keys the write changes
     * @param optimisticValueFn computes each key's optimistic value
     * @param merge             lands the canonical value in each key
     * @param listener          lifecycle callbacks, may be null
     * @param <V>               variables type
     * @param <T>               canonical value type
     * @return the handle
     */
    public <V, T> MutationHandle<V, T> useMutation(
        final MutationWriter<V, T> writer,
        final Set<QueryKey> affectedKeys,
        final OptimisticValueFunction<V> optimisticValueFn,
        final CanonicalMerge merge,
        final MutationListener<T> listener)
    {
        return new MutationHandle<>(coordinator, writer, affectedKeys, optimisticValueFn, merge, listener);
    }

    /**
     * Bind a mutation written through the gateway. Commits with {@link CanonicalMerge#REPLACE}, so the
     * gateway's canonical value is stored under every affected key.
     *
     * @param affectedKeys      keys the write changes
     * @param optimisticValueFn computes each key's optimistic value from the descriptor
     * @return the handle
     */
    public MutationHandle<MutationDescriptor, Object> useMutation(
        final Set<QueryKey> affectedKeys, final OptimisticValueFunction<MutationDescriptor> optimisticValueFn)
    {
        return useMutation(affectedKeys, optimisticValueFn, CanonicalMerge.REPLACE);
    }

    /**
     * Bind a mutation written through the gateway, landing the canonical value in each key with {@code merge}.
     *
     * @param affectedKeys      keys the write changes
     * @param optimisticValueFn computes each key's optimistic value from the descriptor
     * @param merge             lands the canonical value in each key
     * @return the handle
     */
    public MutationHandle<MutationDescriptor, Object> useMutation(
        final Set<QueryKey> affectedKeys,
        final OptimisticValueFunction<MutationDescriptor> optimisticValueFn,
        final CanonicalMerge merge)
    {
        final RemoteDataGateway gateway = ctx.gateway();
        return useMutation(gateway::write, affectedKeys, optimisticValueFn, merge, null);
    }

    /**
     * Read a key through the gateway with the default stale time.
     *
     * @param key the key
     * @return future of the value
     */
    public CompletableFuture<Object> query(final QueryKey key)
    {
        return query(key, CancellationToken.NONE);
    }

    /**
     * Read a key through the gateway with the default stale time.
     *
     * @param key   the key
     * @param token cancellation signal of this reader
     * @return future of the value
     */
    public CompletableFuture<Object> query(final QueryKey key, final CancellationToken token)
    {
        return cache.get(key, gatewayRead(key), ctx.staleTimeMs(), token);
    }

    /**
     * Invalidate every key under a filter.
     *
     * @param filter the filter
     * @return number of keys invalidated
     */
    public int invalidate(final QueryKey filter)
    {
        return cache.invalidateMatching(filter);
    }

    /**
     * Run the health checks.
     *
     * @return aggregated result
     */
    public HealthCheck.AggregateResult health()
    {
        return healthCheck.check();
    }

    public QueryCache cache()
    {
        return cache;
    }

    public MutationCoordinator coordinator()
    {
        return coordinator;
    }

    public CircuitBreaker readBreaker()
    {
        return readBreaker;
    }

    public CircuitBreaker writeBreaker()
    {
        return writeBreaker;
    }

    public RetryExecutor retryExecutor()
    {
        return retryExecutor;
    }

    public ChangeNotificationListener changeListener()
    {
        return listener;
    }

    public HealthCheck healthCheck()
    {
        return healthCheck;
    }

    public Context context()
    {
        return ctx;
    }

    public boolean isClosed()
    {
        return isClosed;
    }

    /**
     * Stop the listener and release the scheduler if the client created it.
     */
    public void close()
    {
        if (isClosed)
        {
            return;
        }
        isClosed = true;

        if (null != listenerRunner)
        {
            CloseHelper.close(ctx.errorHandler(), listenerRunner);
        }
        else
        {
            listener.onClose();
        }

        if (ctx.ownsScheduler())
        {
            ctx.scheduler().shutdownNow();
        }

        System.out.println("[QueryClient:" + ctx.scope() + "] closed");
    }

    public String toString()
    {
        return "QueryClient{" +
            "scope=" + ctx.scope() +
            ", cache=" + cache +
            ", readBreaker=" + readBreaker +
            ", writeBreaker=" + writeBreaker +
            ", coordinator=" + coordinator +
            ", listener=" + listener +
            '}';
    }

    private RemoteCall<Object> gatewayRead(final QueryKey key)
    {
        final RemoteDataGateway gateway = ctx.gateway();
        return (token) -> gateway.read(key, token);
    }

    /**
     * Configuration of a {@link QueryClient}. Values not set fall back to {@link SyncConfiguration}.
     */
    public static final class Context
    {
        private RemoteDataGateway gateway;
        private String scope;
        private InvalidationTable invalidationTable;
        private EpochClock epochClock;
        private ScheduledExecutorService scheduler;
        private boolean ownsScheduler;
        private ErrorHandler errorHandler;
        private RetryPolicy readPolicy;
        private RetryPolicy writePolicy;
        private long staleTimeMs = SyncConfiguration.staleTimeMs();
        private int circuitFailureThreshold = SyncConfiguration.circuitFailureThreshold();
        private long circuitResetTimeoutMs = SyncConfiguration.circuitResetTimeoutMs();
        private long pollIntervalMs = SyncConfiguration.pollIntervalMs();
        private long mutationTimeoutMs = SyncConfiguration.mutationTimeoutMs();
        private long listenerIdleSleepMs = SyncConfiguration.listenerIdleSleepMs();
        private int pendingMutationWarningThreshold = SyncConfiguration.pendingMutationWarningThreshold();
        private boolean useListenerThread = true;
        private boolean isConcluded;

        /**
         * Fill in defaults and validate. Called by {@link QueryClient#connect(Context)}.
         *
         * @return this for chaining
         */
        public Context conclude()
        {
            if (isConcluded)
            {
                throw new IllegalStateException("context already concluded");
            }
            isConcluded = true;

            Objects.requireNonNull(gateway, "gateway");
            Objects.requireNonNull(scope, "scope");

            if (null == invalidationTable)
            {
                invalidationTable = InvalidationTable.petCare(scope);
            }

            if (null == epochClock)
            {
                epochClock = SystemEpochClock.INSTANCE;
            }

            if (null == errorHandler)
            {
                errorHandler = Throwable::printStackTrace;
            }

            if (null == readPolicy)
            {
                readPolicy = SyncConfiguration.retryPolicy();
            }

            if (null == writePolicy)
            {
                writePolicy = readPolicy;
            }

            if (null == scheduler)
            {
                scheduler = Executors.newSingleThreadScheduledExecutor((runnable) ->
                {
                    final Thread thread = new Thread(runnable, "petdesk-sync-" + scope);
                    thread.setDaemon(true);
                    return thread;
                });
                ownsScheduler = true;
            }

            return this;
        }

        public Context gateway(final RemoteDataGateway gateway)
        {
            this.gateway = gateway;
            return this;
        }

        public RemoteDataGateway gateway()
        {
            return gateway;
        }

        /**
         * Session or tenant scope of the push subscription, e.g. the organization id.
         *
         * @param scope the scope
         * @return this for chaining
         */
        public Context scope(final String scope)
        {
            this.scope = scope;
            return this;
        }

        public String scope()
        {
            return scope;
        }

        public Context invalidationTable(final InvalidationTable invalidationTable)
        {
            this.invalidationTable = invalidationTable;
            return this;
        }

        public InvalidationTable invalidationTable()
        {
            return invalidationTable;
        }

        public Context epochClock(final EpochClock epochClock)
        {
            this.epochClock = epochClock;
            return this;
        }

        public EpochClock epochClock()
        {
            return epochClock;
        }

        /**
         * Scheduler for backoff delays and mutation timeouts. When none is set the client creates one and
         * shuts it down on close.
         *
         * @param scheduler the scheduler
         * @return this for chaining
         */
        public Context scheduler(final ScheduledExecutorService scheduler)
        {
            this.scheduler = scheduler;
            return this;
        }

        public ScheduledExecutorService scheduler()
        {
            return scheduler;
        }

        boolean ownsScheduler()
        {
            return ownsScheduler;
        }

        public Context errorHandler(final ErrorHandler errorHandler)
        {
            this.errorHandler = errorHandler;
            return this;
        }

        public ErrorHandler errorHandler()
        {
            return errorHandler;
        }

        public Context readPolicy(final RetryPolicy readPolicy)
        {
            this.readPolicy = readPolicy;
            return this;
        }

        public RetryPolicy readPolicy()
        {
            return readPolicy;
        }

        /**
         * Retry policy for writes, defaults to the read policy.
         *
         * @param writePolicy the policy
         * @return this for chaining
         */
        public Context writePolicy(final RetryPolicy writePolicy)
        {
            this.writePolicy = writePolicy;
            return this;
        }

        public RetryPolicy writePolicy()
        {
            return writePolicy;
        }

        public Context staleTimeMs(final long staleTimeMs)
        {
            this.staleTimeMs = staleTimeMs;
            return this;
        }

        public long staleTimeMs()
        {
            return staleTimeMs;
        }

        public Context circuitFailureThreshold(final int circuitFailureThreshold)
        {
            this.circuitFailureThreshold = circuitFailureThreshold;
            return this;
        }

        public int circuitFailureThreshold()
        {
            return circuitFailureThreshold;
        }

        public Context circuitResetTimeoutMs(final long circuitResetTimeoutMs)
        {
            this.circuitResetTimeoutMs = circuitResetTimeoutMs;
            return this;
        }

        public long circuitResetTimeoutMs()
        {
            return circuitResetTimeoutMs;
        }

        public Context pollIntervalMs(final long pollIntervalMs)
        {
            this.pollIntervalMs = pollIntervalMs;
            return this;
        }

        public long pollIntervalMs()
        {
            return pollIntervalMs;
        }

        public Context mutationTimeoutMs(final long mutationTimeoutMs)
        {
            this.mutationTimeoutMs = mutationTimeoutMs;
            return this;
        }

        public long mutationTimeoutMs()
        {
            return mutationTimeoutMs;
        }

        /**
         * Number of in-flight mutations above which {@link QueryClient#health()} reports DEGRADED.
         *
         * @param pendingMutationWarningThreshold pending count that is still healthy
         * @return this for chaining
         */
        public Context pendingMutationWarningThreshold(final int pendingMutationWarningThreshold)
        {
            this.pendingMutationWarningThreshold = pendingMutationWarningThreshold;
            return this;
        }

        public int pendingMutationWarningThreshold()
        {
            return pendingMutationWarningThreshold;
        }

        public Context listenerIdleSleepMs(final long listenerIdleSleepMs)
        {
            this.listenerIdleSleepMs = listenerIdleSleepMs;
            return this;
        }

        public long listenerIdleSleepMs()
        {
            return listenerIdleSleepMs;
        }

        /**
         * Run the change notification listener on its own thread. When false the caller drives it.
         *
         * @param useListenerThread true to start an {@link AgentRunner}
         * @return this for chaining
         */
        public Context useListenerThread(final boolean useListenerThread)
        {
            this.useListenerThread = useListenerThread;
            return this;
        }

        public boolean useListenerThread()
        {
            return useListenerThread;
        }
    }
}
