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
package io.petdesk.resilience;

import org.agrona.concurrent.EpochClock;
import org.agrona.concurrent.SystemEpochClock;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Circuit Breaker guarding one remote endpoint.
 * <p>
 * States:
 * <ul>
 *   <li>CLOSED: Normal operation, calls flow through and failures are counted</li>
 *   <li>OPEN: Circuit tripped, calls fail fast with {@link CircuitOpenException}</li>
 *   <li>HALF_OPEN: One probe call is testing if the dependency recovered</li>
 * </ul>
 * <p>
 * Transitions:
 * <pre>
 *   CLOSED --[consecutive failures reach threshold]--> OPEN
 *   OPEN --[reset timeout elapsed, on next call]--> HALF_OPEN
 *   HALF_OPEN --[probe success]--> CLOSED
 *   HALF_OPEN --[probe failure]--> OPEN
 * </pre>
 * While the probe is outstanding any other caller is rejected rather than queued. A call that ends
 * with {@link CancelledException} is not a failure of the dependency and does not count.
 */
public final class CircuitBreaker
{
    /**
     * Circuit breaker states.
     */
    public enum State
    {
        /** Normal operation */
        CLOSED,
        /** Circuit tripped, failing fast */
        OPEN,
        /** Testing recovery */
        HALF_OPEN
    }

    /**
     * Listener for circuit breaker state changes.
     */
    @FunctionalInterface
    public interface StateChangeListener
    {
        void onStateChange(State oldState, State newState, String reason);
    }

    private enum Permit
    {
        REJECTED,
        NORMAL,
        PROBE
    }

    private final String name;
    private final int failureThreshold;
    private final long resetTimeoutMs;
    private final EpochClock epochClock;

    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private final AtomicLong lastFailureTimeMs = new AtomicLong(0);
    private final AtomicLong openedAtMs = new AtomicLong(0);
    private final AtomicBoolean probeInFlight = new AtomicBoolean(false);
    private final AtomicLong rejectedCount = new AtomicLong(0);

    private volatile StateChangeListener stateChangeListener;

    /**
     * Create a new circuit breaker on the system clock.
     *
     * @param name             identifier for logging
     * @param failureThreshold consecutive failures before opening the circuit
     * @param resetTimeoutMs   how long to stay open before allowing a probe
     */
    public CircuitBreaker(final String name, final int failureThreshold, final long resetTimeoutMs)
    {
        this(name, failureThreshold, resetTimeoutMs, SystemEpochClock.INSTANCE);
    }

    /**
     * Create a new circuit breaker.
     *
     * @param name             identifier for logging
     * @param failureThreshold consecutive failures before opening the circuit
     * @param resetTimeoutMs   how long to stay open before allowing a probe
     * @param epochClock       source of time for the reset timeout
     */
    public CircuitBreaker(
        final String name,
        final int failureThreshold,
        final long resetTimeoutMs,
        final EpochClock epochClock)
    {
        if (failureThreshold < 1)
        {
            throw new IllegalArgumentException("failureThreshold must be at least 1: " + failureThreshold);
        }

        this.name = name;
        this.failureThreshold = failureThreshold;
        this.resetTimeoutMs = resetTimeoutMs;
        this.epochClock = epochClock;
    }

    /**
     * Create with default settings.
     *
     * @param name identifier for logging
     * @return circuit breaker with defaults (5 failures, 30s open)
     */
    public static CircuitBreaker withDefaults(final String name)
    {
        return new CircuitBreaker(name, 5, 30_000);
    }

    /**
     * Set state change listener.
     *
     * @param listener the listener
     * @return this for chaining
     */
    public CircuitBreaker onStateChange(final StateChangeListener listener)
    {
        this.stateChangeListener = listener;
        return this;
    }

    /**
     * Execute a call with circuit breaker protection.
     * <p>
     * A rejected call never invokes {@code call}.
     *
     * @param call  the remote call
     * @param token cancellation signal passed to the call
     * @param <T>   result type
     * @return future of the call's outcome, or failed with {@link CircuitOpenException}
     */
    public <T> CompletableFuture<T> execute(final RemoteCall<T> call, final CancellationToken token)
    {
        final Permit permit = acquirePermit();
        if (Permit.REJECTED == permit)
        {
            rejectedCount.incrementAndGet();
            return CompletableFuture.failedFuture(new CircuitOpenException(
                name, "circuit " + name + " is " + state.get() + ", call rejected"));
        }

        final boolean probe = Permit.PROBE == permit;
        CompletableFuture<T> future;
        try
        {
            future = call.invoke(token);
        }
        catch (final RuntimeException ex)
        {
            future = CompletableFuture.failedFuture(ex);
        }

        return future.whenComplete((result, error) ->
        {
            if (null == error)
            {
                recordSuccess(probe);
            }
            else if (FailureClassifier.unwrap(error) instanceof CancelledException)
            {
                if (probe)
                {
                    probeInFlight.set(false);
                }
            }
            else
            {
                recordFailure(probe);
            }
        });
    }

    /**
     * Wrap a call so every invocation goes through this breaker.
     *
     * @param call the remote call
     * @param <T>  result type
     * @return the protected call
     */
    public <T> RemoteCall<T> wrap(final RemoteCall<T> call)
    {
        return (token) -> execute(call, token);
    }

    /**
     * Manually open the circuit.
     *
     * @param reason reason for opening
     */
    public void openCircuit(final String reason)
    {
        openedAtMs.set(epochClock.time());
        final State oldState = state.getAndSet(State.OPEN);
        probeInFlight.set(false);
        if (State.OPEN != oldState)
        {
            notifyStateChange(oldState, State.OPEN, reason);
        }
    }

    /**
     * Manually close the circuit.
     */
    public void closeCircuit()
    {
        final State oldState = state.getAndSet(State.CLOSED);
        reset();
        if (State.CLOSED != oldState)
        {
            notifyStateChange(oldState, State.CLOSED, "manual close");
        }
    }

    /**
     * Reset all counters.
     */
    public void reset()
    {
        failureCount.set(0);
        probeInFlight.set(false);
    }

    /**
     * Get current state.
     *
     * @return the current state
     */
    public State state()
    {
        return state.get();
    }

    /**
     * Check if circuit is closed (normal operation).
     *
     * @return true if closed
     */
    public boolean isClosed()
    {
        return state.get() == State.CLOSED;
    }

    /**
     * Check if circuit is open (failing fast).
     *
     * @return true if open
     */
    public boolean isOpen()
    {
        return state.get() == State.OPEN;
    }

    public int failureCount()
    {
        return failureCount.get();
    }

    public long lastFailureTimeMs()
    {
        return lastFailureTimeMs.get();
    }

    public long rejectedCount()
    {
        return rejectedCount.get();
    }

    public String name()
    {
        return name;
    }

    private Permit acquirePermit()
    {
        switch (state.get())
        {
            case CLOSED:
                return Permit.NORMAL;

            case OPEN:
                if (epochClock.time() - openedAtMs.get() >= resetTimeoutMs)
                {
                    transitionTo(State.OPEN, State.HALF_OPEN, "reset timeout elapsed");
                    return probeInFlight.compareAndSet(false, true) ? Permit.PROBE : Permit.REJECTED;
                }
                return Permit.REJECTED;

            case HALF_OPEN:
                return probeInFlight.compareAndSet(false, true) ? Permit.PROBE : Permit.REJECTED;

            default:
                return Permit.REJECTED;
        }
    }

    private void recordSuccess(final boolean probe)
    {
        if (probe)
        {
            if (transitionTo(State.HALF_OPEN, State.CLOSED, "probe succeeded"))
            {
                reset();
            }
            return;
        }

        if (State.CLOSED == state.get())
        {
            failureCount.set(0);
        }
    }

    private void recordFailure(final boolean probe)
    {
        lastFailureTimeMs.set(epochClock.time());
        final int failures = failureCount.incrementAndGet();

        if (probe)
        {
            openCircuit("probe failed");
        }
        else if (State.CLOSED == state.get() && failures >= failureThreshold)
        {
            openCircuit("failure threshold reached: " + failures + " >= " + failureThreshold);
        }
    }

    private boolean transitionTo(final State from, final State to, final String reason)
    {
        if (state.compareAndSet(from, to))
        {
            notifyStateChange(from, to, reason);
            return true;
        }
        return false;
    }

    private void notifyStateChange(final State oldState, final State newState, final String reason)
    {
        System.out.println("[CircuitBreaker:" + name + "] " + oldState + " -> " + newState + " (" + reason + ")");
        final StateChangeListener listener = stateChangeListener;
        if (listener != null)
        {
            try
            {
                listener.onStateChange(oldState, newState, reason);
            }
            catch (final Exception e)
            {
                System.err.println("[CircuitBreaker:" + name + "] State change listener error: " + e.getMessage());
            }
        }
    }

    @Override
    public String toString()
    {
        return "CircuitBreaker{" +
            "name='" + name + '\'' +
            ", state=" + state.get() +
            ", failureCount=" + failureCount.get() +
            ", failureThreshold=" + failureThreshold +
            ", resetTimeoutMs=" + resetTimeoutMs +
            '}';
    }
}
