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
package io.petdesk.cache.realtime;

import io.petdesk.cache.QueryCache;
import io.petdesk.cache.QueryKey;
import io.petdesk.cache.RemoteDataGateway;
import io.petdesk.cache.Subscription;
import org.agrona.CloseHelper;
import org.agrona.ErrorHandler;
import org.agrona.concurrent.Agent;
import org.agrona.concurrent.EpochClock;
import org.agrona.concurrent.ManyToOneConcurrentLinkedQueue;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns backend pushes into cache invalidations.
 * <p>
 * Gateway callbacks only enqueue; events are processed on the agent's duty cycle, either under an
 * {@link org.agrona.concurrent.AgentRunner} or by calling {@link #doWork()} directly.
 * <ul>
 *   <li>{@link Mode#LIVE}: each event invalidates the filters the {@link InvalidationTable} maps it to.</li>
 *   <li>{@link Mode#DEGRADED}: entered on disconnect. Pushes may have been missed, so every active key is
 *   refetched once per poll interval.</li>
 *   <li>Reconnect: one unconditional refetch of every active key, then back to live. The push channel cannot
 *   resume from an offset.</li>
 * </ul>
 */
public final class ChangeNotificationListener implements Agent, ChangeListener
{
    /**
     * Operating mode.
     */
    public enum Mode
    {
        /** Not yet subscribed or closed */
        IDLE,
        /** Trusting pushes */
        LIVE,
        /** Polling active keys */
        DEGRADED
    }

    private final ManyToOneConcurrentLinkedQueue<Object> inbox = new ManyToOneConcurrentLinkedQueue<>();
    private final RemoteDataGateway gateway;
    private final QueryCache cache;
    private final InvalidationTable table;
    private final String scope;
    private final long pollIntervalMs;
    private final EpochClock epochClock;
    private final ErrorHandler errorHandler;

    private volatile Mode mode = Mode.IDLE;
    private Subscription subscription;
    private long nextPollDeadlineMs;

    private final AtomicLong eventsReceived = new AtomicLong(0);
    private final AtomicLong keysInvalidated = new AtomicLong(0);
    private final AtomicLong pollCycles = new AtomicLong(0);
    private final AtomicLong reconnects = new AtomicLong(0);

    /**
     * Create a listener.
     *
     * @param gateway        source of pushes
     * @param cache          cache to invalidate
     * @param table          maps events to key filters
     * @param scope          session or tenant scope of the subscription
     * @param pollIntervalMs interval between refetches while degraded
     * @param epochClock     clock for the poll deadline
     * @param errorHandler   receives subscription close failures
     */
    public ChangeNotificationListener(
        final RemoteDataGateway gateway,
        final QueryCache cache,
        final InvalidationTable table,
        final String scope,
        final long pollIntervalMs,
        final EpochClock epochClock,
        final ErrorHandler errorHandler)
    {
        this.gateway = gateway;
        this.cache = cache;
        this.table = table;
        this.scope = scope;
        this.pollIntervalMs = pollIntervalMs;
        this.epochClock = epochClock;
        this.errorHandler = errorHandler;
    }

    /**
     * {@inheritDoc}
     */
    public void onStart()
    {
        subscription = gateway.subscribe(scope, this);
        mode = Mode.LIVE;
        System.out.println("[ChangeNotificationListener:" + scope + "] subscribed");
    }

    /**
     * {@inheritDoc}
     */
    public int doWork()
    {
        int workCount = 0;

        Object item;
        while (null != (item = inbox.poll()))
        {
            if (item instanceof ChangeEvent)
            {
                onEvent((ChangeEvent)item);
            }
            else
            {
                onConnectionState((ConnectionState)item);
            }
            workCount++;
        }

        if (Mode.DEGRADED == mode)
        {
            final long nowMs = epochClock.time();
            if (nowMs >= nextPollDeadlineMs)
            {
                nextPollDeadlineMs = nowMs + pollIntervalMs;
                pollCycles.incrementAndGet();
                workCount += cache.refetchActive();
            }
        }

        return workCount;
    }

    /**
     * {@inheritDoc}
     */
    public void onClose()
    {
        mode = Mode.IDLE;
        CloseHelper.close(errorHandler, subscription);
        subscription = null;
    }

    /**
     * {@inheritDoc}
     */
    public String roleName()
    {
        return "change-notification-listener-" + scope;
    }

    /**
     * {@inheritDoc}
     */
    public void onChange(final ChangeEvent event)
    {
        inbox.offer(event);
    }

    /**
     * {@inheritDoc}
     */
    public void onConnectionStateChange(final ConnectionState state)
    {
        inbox.offer(state);
    }

    public Mode mode()
    {
        return mode;
    }

    public boolean isDegraded()
    {
        return Mode.DEGRADED == mode;
    }

    public String scope()
    {
        return scope;
    }

    public long eventsReceived()
    {
        return eventsReceived.get();
    }

    public long keysInvalidated()
    {
        return keysInvalidated.get();
    }

    public long pollCycles()
    {
        return pollCycles.get();
    }

    public long reconnects()
    {
        return reconnects.get();
    }

    public String toString()
    {
        return "ChangeNotificationListener{" +
            "scope=" + scope +
            ", mode=" + mode +
            ", eventsReceived=" + eventsReceived.get() +
            ", keysInvalidated=" + keysInvalidated.get() +
            ", pollCycles=" + pollCycles.get() +
            ", reconnects=" + reconnects.get() +
            '}';
    }

    private void onEvent(final ChangeEvent event)
    {
        eventsReceived.incrementAndGet();
        for (final QueryKey filter : table.filtersFor(event))
        {
            keysInvalidated.addAndGet(cache.invalidateMatching(filter));
        }
    }

    private void onConnectionState(final ConnectionState state)
    {
        if (ConnectionState.DISCONNECTED == state && Mode.LIVE == mode)
        {
            mode = Mode.DEGRADED;
            nextPollDeadlineMs = epochClock.time() + pollIntervalMs;
            System.out.println("[ChangeNotificationListener:" + scope + "] disconnected, polling every " +
                pollIntervalMs + "ms");
        }
        else if (ConnectionState.CONNECTED == state && Mode.DEGRADED == mode)
        {
            mode = Mode.LIVE;
            reconnects.incrementAndGet();
            final int refetched = cache.refetchActive();
            System.out.println("[ChangeNotificationListener:" + scope + "] reconnected, refetched " +
                refetched + " active keys");
        }
    }
}
