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

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * Immutable retry policy with exponential backoff, a delay cap and optional jitter.
 * <p>
 * The delay before retry {@code n} (1-based) is
 * <pre>
 *   min(baseDelayMs * multiplier^(n-1), maxDelayMs) * (1 +/- jitterFactor)
 * </pre>
 * Policies are values: the {@code with*} methods return modified copies.
 */
public final class RetryPolicy
{
    /**
     * Callback invoked before each backoff wait.
     */
    @FunctionalInterface
    public interface RetryListener
    {
        /**
         * A retryable failure occurred and another attempt will follow.
         *
         * @param error   the failure of the attempt that just ended
         * @param attempt number of the attempt that failed (1-based)
         * @param delayMs wait before the next attempt
         */
        void onRetry(Throwable error, int attempt, long delayMs);
    }

    private static final RetryListener NO_OP_LISTENER = (error, attempt, delayMs) -> {};

    private final int maxAttempts;
    private final long baseDelayMs;
    private final double multiplier;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final Predicate<Throwable> retryable;
    private final RetryListener retryListener;

    private RetryPolicy(
        final int maxAttempts,
        final long baseDelayMs,
        final double multiplier,
        final long maxDelayMs,
        final double jitterFactor,
        final Predicate<Throwable> retryable,
        final RetryListener retryListener)
    {
        if (maxAttempts < 1)
        {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        if (baseDelayMs < 0 || maxDelayMs < 0)
        {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (multiplier < 1.0)
        {
            throw new IllegalArgumentException("multiplier must be at least 1.0: " + multiplier);
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0)
        {
            throw new IllegalArgumentException("jitterFactor must be within [0.0, 1.0]: " + jitterFactor);
        }

        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelayMs;
        this.multiplier = multiplier;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.retryable = retryable;
        this.retryListener = retryListener;
    }

    /**
     * Create a fixed delay retry policy.
     *
     * @param maxAttempts maximum attempts, including the first
     * @param delayMs     delay between attempts in milliseconds
     * @return the retry policy
     */
    public static RetryPolicy fixed(final int maxAttempts, final long delayMs)
    {
        return new RetryPolicy(
            maxAttempts, delayMs, 1.0, delayMs, 0.0, FailureClassifier.INSTANCE::isRetryable, NO_OP_LISTENER);
    }

    /**
     * Create an exponential backoff retry policy.
     *
     * @param maxAttempts maximum attempts, including the first
     * @param baseDelayMs delay before the first retry in milliseconds
     * @param multiplier  growth factor between successive delays
     * @param maxDelayMs  maximum delay cap in milliseconds
     * @return the retry policy
     */
    public static RetryPolicy exponential(
        final int maxAttempts, final long baseDelayMs, final double multiplier, final long maxDelayMs)
    {
        return new RetryPolicy(
            maxAttempts,
            baseDelayMs,
            multiplier,
            maxDelayMs,
            0.0,
            FailureClassifier.INSTANCE::isRetryable,
            NO_OP_LISTENER);
    }

    /**
     * Policy for HTTP calls: 3 attempts, 1s base delay doubling up to 30s.
     *
     * @return the retry policy
     */
    public static RetryPolicy http()
    {
        return exponential(3, 1000, 2.0, 30_000);
    }

    /**
     * Policy for database calls: 5 attempts, 500ms base delay growing by 1.5 up to 5s.
     *
     * @return the retry policy
     */
    public static RetryPolicy database()
    {
        return exponential(5, 500, 1.5, 5000);
    }

    /**
     * Copy with random jitter applied to each delay.
     *
     * @param jitterFactor jitter factor (0.0 to 1.0), e.g., 0.5 = +/-50% randomization
     * @return the new policy
     */
    public RetryPolicy withJitter(final double jitterFactor)
    {
        return new RetryPolicy(
            maxAttempts, baseDelayMs, multiplier, maxDelayMs, jitterFactor, retryable, retryListener);
    }

    /**
     * Copy with a different test for retryable failures.
     *
     * @param retryable returns true for failures worth another attempt
     * @return the new policy
     */
    public RetryPolicy withRetryable(final Predicate<Throwable> retryable)
    {
        return new RetryPolicy(
            maxAttempts, baseDelayMs, multiplier, maxDelayMs, jitterFactor, retryable, retryListener);
    }

    /**
     * Copy which notifies a listener before each backoff wait.
     *
     * @param retryListener the listener
     * @return the new policy
     */
    public RetryPolicy withRetryListener(final RetryListener retryListener)
    {
        return new RetryPolicy(
            maxAttempts, baseDelayMs, multiplier, maxDelayMs, jitterFactor, retryable, retryListener);
    }

    /**
     * Undisturbed delay for the given attempt, before jitter.
     *
     * @param attempt the attempt that failed (1-based)
     * @return delay in milliseconds
     */
    public long baseDelayForAttemptMs(final int attempt)
    {
        if (attempt <= 0)
        {
            return 0;
        }

        final double delay = baseDelayMs * Math.pow(multiplier, attempt - 1);
        return delay >= maxDelayMs ? maxDelayMs : (long)delay;
    }

    /**
     * Calculate the delay for the given attempt number, jitter included.
     *
     * @param attempt the attempt that failed (1-based)
     * @return delay in milliseconds
     */
    public long calculateDelayMs(final int attempt)
    {
        final long delay = baseDelayForAttemptMs(attempt);
        if (0.0 == jitterFactor || 0 == delay)
        {
            return delay;
        }

        final double jitter = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2 - 1) * jitterFactor;
        return Math.max(0, (long)(delay * jitter));
    }

    /**
     * Check if another attempt is allowed after the given one failed.
     *
     * @param attempt current attempt number (1-based)
     * @return true if more attempts allowed
     */
    public boolean shouldRetry(final int attempt)
    {
        return attempt < maxAttempts;
    }

    /**
     * Check if the failure is worth another attempt.
     *
     * @param error the failure
     * @return true if retryable
     */
    public boolean isRetryable(final Throwable error)
    {
        return retryable.test(FailureClassifier.unwrap(error));
    }

    public RetryListener retryListener()
    {
        return retryListener;
    }

    public int maxAttempts()
    {
        return maxAttempts;
    }

    public long baseDelayMs()
    {
        return baseDelayMs;
    }

    public double multiplier()
    {
        return multiplier;
    }

    public long maxDelayMs()
    {
        return maxDelayMs;
    }

    public double jitterFactor()
    {
        return jitterFactor;
    }

    @Override
    public String toString()
    {
        return "RetryPolicy{" +
            "maxAttempts=" + maxAttempts +
            ", baseDelayMs=" + baseDelayMs +
            ", multiplier=" + multiplier +
            ", maxDelayMs=" + maxDelayMs +
            ", jitterFactor=" + jitterFactor +
            '}';
    }
}
