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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.net.ConnectException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RetryPolicy Unit Tests")
class RetryPolicyTest
{
    @Nested
    @DisplayName("Delay Calculation")
    class DelayTests
    {
        @ParameterizedTest
        @CsvSource({
            "1,100",
            "2,200",
            "3,400",
            "4,800",
            "5,1000",
            "10,1000"
        })
        void shouldGrowExponentiallyUpToCap(final int attempt, final long expectedDelayMs)
        {
            final RetryPolicy policy = RetryPolicy.exponential(10, 100, 2.0, 1000);

            assertEquals(expectedDelayMs, policy.calculateDelayMs(attempt));
        }

        @Test
        void shouldReturnZeroForNonPositiveAttempt()
        {
            assertEquals(0, RetryPolicy.http().calculateDelayMs(0));
        }

        @Test
        void shouldKeepFixedDelayConstant()
        {
            final RetryPolicy policy = RetryPolicy.fixed(4, 250);

            assertEquals(250, policy.calculateDelayMs(1));
            assertEquals(250, policy.calculateDelayMs(3));
        }

        @Test
        @DisplayName("jittered delay stays within +/- factor of the base delay")
        void shouldKeepJitterWithinBounds()
        {
            final RetryPolicy policy = RetryPolicy.exponential(5, 1000, 2.0, 60_000).withJitter(0.25);

            for (int i = 0; i < 200; i++)
            {
                final long delay = policy.calculateDelayMs(2);
                assertTrue(delay >= 1500 && delay <= 2500, "delay out of bounds: " + delay);
            }
        }

        @Test
        void shouldMatchDatabasePreset()
        {
            final RetryPolicy policy = RetryPolicy.database();

            assertEquals(5, policy.maxAttempts());
            assertEquals(500, policy.calculateDelayMs(1));
            assertEquals(750, policy.calculateDelayMs(2));
            assertEquals(1125, policy.calculateDelayMs(3));
            assertEquals(5000, policy.calculateDelayMs(9));
        }

        @Test
        void shouldMatchHttpPreset()
        {
            final RetryPolicy policy = RetryPolicy.http();

            assertEquals(3, policy.maxAttempts());
            assertEquals(1000, policy.calculateDelayMs(1));
            assertEquals(2000, policy.calculateDelayMs(2));
        }
    }

    @Nested
    @DisplayName("Attempt Budget and Classification")
    class BudgetTests
    {
        @Test
        void shouldAllowRetriesUntilMaxAttempts()
        {
            final RetryPolicy policy = RetryPolicy.fixed(3, 10);

            assertTrue(policy.shouldRetry(1));
            assertTrue(policy.shouldRetry(2));
            assertFalse(policy.shouldRetry(3));
        }

        @Test
        void shouldClassifyWithDefaultPredicate()
        {
            final RetryPolicy policy = RetryPolicy.http();

            assertTrue(policy.isRetryable(new ConnectException("refused")));
            assertTrue(policy.isRetryable(new RequestStatusException(503, "unavailable")));
            assertFalse(policy.isRetryable(new RequestStatusException(404, "missing")));
            assertFalse(policy.isRetryable(new IllegalStateException("bug")));
        }

        @Test
        void shouldUseCustomPredicate()
        {
            final RetryPolicy policy = RetryPolicy.http().withRetryable((error) -> error instanceof IllegalStateException);

            assertTrue(policy.isRetryable(new IllegalStateException("flaky")));
            assertFalse(policy.isRetryable(new ConnectException("refused")));
        }

        @Test
        void shouldRejectInvalidSettings()
        {
            assertThrows(IllegalArgumentException.class, () -> RetryPolicy.fixed(0, 10));
            assertThrows(IllegalArgumentException.class, () -> RetryPolicy.exponential(3, 10, 0.5, 100));
            assertThrows(IllegalArgumentException.class, () -> RetryPolicy.http().withJitter(1.5));
        }
    }
}
