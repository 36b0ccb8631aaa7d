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

import org.agrona.concurrent.CachedEpochClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static io.petdesk.resilience.RetryExecutorTest.failureOf;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CircuitBreaker Unit Tests")
class CircuitBreakerTest
{
    private static final long RESET_TIMEOUT_MS = 1_000;

    private final CachedEpochClock clock = new CachedEpochClock();
    private final AtomicInteger invocations = new AtomicInteger();
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp()
    {
        clock.update(10_000);
        breaker = new CircuitBreaker("gateway.read", 3, RESET_TIMEOUT_MS, clock);
    }

    @Nested
    @DisplayName("Closed State")
    class ClosedTests
    {
        @Test
        void shouldPassCallsThrough()
        {
            assertEquals("rex", breaker.execute(succeeding("rex"), CancellationToken.NONE).join());
            assertTrue(breaker.isClosed());
        }

        @Test
        void shouldOpenAfterThresholdFailures()
        {
            tripBreaker();

            assertTrue(breaker.isOpen());
            assertEquals(3, breaker.failureCount());
            assertEquals(10_000, breaker.lastFailureTimeMs());
        }

        @Test
        void shouldResetFailureCountOnSuccess()
        {
            breaker.execute(failing(), CancellationToken.NONE);
            breaker.execute(failing(), CancellationToken.NONE);
            breaker.execute(succeeding("ok"), CancellationToken.NONE).join();
            breaker.execute(failing(), CancellationToken.NONE);

            assertTrue(breaker.isClosed());
            assertEquals(1, breaker.failureCount());
        }

        @Test
        void shouldCountFatalFailuresToo()
        {
            for (int i = 0; i < 3; i++)
            {
                breaker.execute((token) -> CompletableFuture.failedFuture(new FatalRequestException("401")),
                    CancellationToken.NONE);
            }

            assertTrue(breaker.isOpen());
        }

        @Test
        void shouldIgnoreCancellation()
        {
            for (int i = 0; i < 5; i++)
            {
                breaker.execute((token) -> CompletableFuture.failedFuture(new CancelledException("left")),
                    CancellationToken.NONE);
            }

            assertTrue(breaker.isClosed());
            assertEquals(0, breaker.failureCount());
        }
    }

    @Nested
    @DisplayName("Open State")
    class OpenTests
    {
        @Test
        @DisplayName("call 10ms after opening is rejected without a network attempt")
        void shouldRejectWithoutInvokingBeforeResetTimeout()
        {
            tripBreaker();
            final int callsBefore = invocations.get();
            clock.advance(10);

            final CompletableFuture<String> result = breaker.execute(succeeding("never"), CancellationToken.NONE);

            final CircuitOpenException rejected = assertInstanceOf(CircuitOpenException.class, failureOf(result));
            assertEquals("gateway.read", rejected.circuitName());
            assertEquals(SyncException.Category.CIRCUIT_OPEN, rejected.category());
            assertEquals(callsBefore, invocations.get());
            assertEquals(1, breaker.rejectedCount());
        }

        @Test
        void shouldAllowProbeOnceResetTimeoutElapsed()
        {
            tripBreaker();
            clock.advance(RESET_TIMEOUT_MS);

            assertEquals("back", breaker.execute(succeeding("back"), CancellationToken.NONE).join());
            assertTrue(breaker.isClosed());
            assertEquals(0, breaker.failureCount());
        }
    }

    @Nested
    @DisplayName("Half-Open State")
    class HalfOpenTests
    {
        @Test
        @DisplayName("exactly one probe is let through, a concurrent caller is rejected")
        void shouldAdmitExactlyOneProbe()
        {
            tripBreaker();
            clock.advance(RESET_TIMEOUT_MS);
            final CompletableFuture<String> pendingProbe = new CompletableFuture<>();
            final int callsBefore = invocations.get();

            final CompletableFuture<String> probe = breaker.execute(counted(pendingProbe), CancellationToken.NONE);
            final CompletableFuture<String> concurrent = breaker.execute(succeeding("x"), CancellationToken.NONE);

            assertEquals(CircuitBreaker.State.HALF_OPEN, breaker.state());
            assertInstanceOf(CircuitOpenException.class, failureOf(concurrent));
            assertEquals(callsBefore + 1, invocations.get());

            pendingProbe.complete("recovered");
            assertEquals("recovered", probe.join());
            assertTrue(breaker.isClosed());
        }

        @Test
        void shouldReopenAndRestartTimerWhenProbeFails()
        {
            tripBreaker();
            clock.advance(RESET_TIMEOUT_MS);

            breaker.execute(failing(), CancellationToken.NONE);
            assertTrue(breaker.isOpen());

            clock.advance(RESET_TIMEOUT_MS - 1);
            assertInstanceOf(CircuitOpenException.class,
                failureOf(breaker.execute(succeeding("early"), CancellationToken.NONE)));

            clock.advance(1);
            assertEquals("late", breaker.execute(succeeding("late"), CancellationToken.NONE).join());
        }

        @Test
        void shouldFreeProbeSlotWhenProbeCancelled()
        {
            tripBreaker();
            clock.advance(RESET_TIMEOUT_MS);

            breaker.execute((token) -> CompletableFuture.failedFuture(new CancelledException("gone")),
                CancellationToken.NONE);

            assertEquals(CircuitBreaker.State.HALF_OPEN, breaker.state());
            assertEquals("probe", breaker.execute(succeeding("probe"), CancellationToken.NONE).join());
            assertTrue(breaker.isClosed());
        }
    }

    @Test
    void shouldNotifyStateChanges()
    {
        final List<String> transitions = new ArrayList<>();
        breaker.onStateChange((from, to, reason) -> transitions.add(from + "->" + to));

        tripBreaker();
        clock.advance(RESET_TIMEOUT_MS);
        breaker.execute(succeeding("ok"), CancellationToken.NONE).join();

        assertEquals(List.of("CLOSED->OPEN", "OPEN->HALF_OPEN", "HALF_OPEN->CLOSED"), transitions);
    }

    @Test
    void shouldComposeWithWrap()
    {
        final RemoteCall<String> protectedCall = breaker.wrap(succeeding("wrapped"));

        assertEquals("wrapped", protectedCall.invoke(CancellationToken.NONE).join());
    }

    private void tripBreaker()
    {
        for (int i = 0; i < 3; i++)
        {
            breaker.execute(failing(), CancellationToken.NONE);
        }
    }

    private RemoteCall<String> succeeding(final String value)
    {
        return counted(CompletableFuture.completedFuture(value));
    }

    private RemoteCall<String> failing()
    {
        return counted(CompletableFuture.failedFuture(new TransientNetworkException("503")));
    }

    private RemoteCall<String> counted(final CompletableFuture<String> outcome)
    {
        return (token) ->
        {
            invocations.incrementAndGet();
            return outcome;
        };
    }
}
