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

import io.petdesk.resilience.RetryPolicy;

/**
 * Configuration constants for the sync layer.
 * <p>
 * System properties take precedence over the defaults. {@link QueryClient.Context} reads these when a
 * value has not been set on it explicitly.
 */
public final class SyncConfiguration
{
    // ========================================================================
    // System Property Names
    // ========================================================================

    /** System property for how long a fetched value stays fresh */
    public static final String STALE_TIME_MS_PROP = "petdesk.sync.stale.time.ms";

    /** System property for attempts per remote call, including the first */
    public static final String RETRY_MAX_ATTEMPTS_PROP = "petdesk.sync.retry.max.attempts";

    /** System property for the delay before the first retry */
    public static final String RETRY_BASE_DELAY_MS_PROP = "petdesk.sync.retry.base.delay.ms";

    /** System property for the growth factor between retry delays */
    public static final String RETRY_MULTIPLIER_PROP = "petdesk.sync.retry.multiplier";

    /** System property for the retry delay cap */
    public static final String RETRY_MAX_DELAY_MS_PROP = "petdesk.sync.retry.max.delay.ms";

    /** System property for the retry jitter factor */
    public static final String RETRY_JITTER_PROP = "petdesk.sync.retry.jitter";

    /** System property for consecutive failures that open a circuit */
    public static final String CIRCUIT_FAILURE_THRESHOLD_PROP = "petdesk.sync.circuit.failure.threshold";

    /** System property for how long an open circuit waits before a probe */
    public static final String CIRCUIT_RESET_TIMEOUT_MS_PROP = "petdesk.sync.circuit.reset.timeout.ms";

    /** System property for the refetch interval while push notifications are down */
    public static final String POLL_INTERVAL_MS_PROP = "petdesk.sync.poll.interval.ms";

    /** System property for how long a mutation may wait for acknowledgement */
    public static final String MUTATION_TIMEOUT_MS_PROP = "petdesk.sync.mutation.timeout.ms";

    /** System property for the pending mutation count above which health reports DEGRADED */
    public static final String PENDING_MUTATION_WARNING_THRESHOLD_PROP = "petdesk.sync.pending.mutation.warning.threshold";

    /** System property for the listener agent's sleep when idle */
    public static final String LISTENER_IDLE_SLEEP_MS_PROP = "petdesk.sync.listener.idle.sleep.ms";

    // ========================================================================
    // Default Values
    // ========================================================================

    /** Default stale time: 5 minutes */
    public static final long DEFAULT_STALE_TIME_MS = 5 * 60 * 1000L;

    /** Default attempts per remote call */
    public static final int DEFAULT_RETRY_MAX_ATTEMPTS = 3;

    /** Default delay before the first retry */
    public static final long DEFAULT_RETRY_BASE_DELAY_MS = 1000;

    /** Default growth factor between retry delays */
    public static final double DEFAULT_RETRY_MULTIPLIER = 2.0;

    /** Default retry delay cap */
    public static final long DEFAULT_RETRY_MAX_DELAY_MS = 30_000;

    /** Default jitter: +/-10% */
    public static final double DEFAULT_RETRY_JITTER = 0.1;

    /** Default consecutive failures that open a circuit */
    public static final int DEFAULT_CIRCUIT_FAILURE_THRESHOLD = 5;

    /** Default time an open circuit waits before a probe */
    public static final long DEFAULT_CIRCUIT_RESET_TIMEOUT_MS = 30_000;

    /** Default refetch interval while push notifications are down */
    public static final long DEFAULT_POLL_INTERVAL_MS = 30_000;

    /** Default time a mutation may wait for acknowledgement */
    public static final long DEFAULT_MUTATION_TIMEOUT_MS = 30_000;

    /** Default pending mutation warning threshold */
    public static final int DEFAULT_PENDING_MUTATION_WARNING_THRESHOLD = 50;

    /** Default listener agent sleep when idle */
    public static final long DEFAULT_LISTENER_IDLE_SLEEP_MS = 10;

    private SyncConfiguration()
    {
    }

    // ========================================================================
    // Configuration Accessor Methods
    // ========================================================================

    /**
     * How long a fetched value stays fresh.
     *
     * @return stale time in milliseconds
     */
    public static long staleTimeMs()
    {
        return Long.getLong(STALE_TIME_MS_PROP, DEFAULT_STALE_TIME_MS);
    }

    public static int retryMaxAttempts()
    {
        return Integer.getInteger(RETRY_MAX_ATTEMPTS_PROP, DEFAULT_RETRY_MAX_ATTEMPTS);
    }

    public static long retryBaseDelayMs()
    {
        return Long.getLong(RETRY_BASE_DELAY_MS_PROP, DEFAULT_RETRY_BASE_DELAY_MS);
    }

    public static double retryMultiplier()
    {
        return doubleProperty(RETRY_MULTIPLIER_PROP, DEFAULT_RETRY_MULTIPLIER);
    }

    public static long retryMaxDelayMs()
    {
        return Long.getLong(RETRY_MAX_DELAY_MS_PROP, DEFAULT_RETRY_MAX_DELAY_MS);
    }

    public static double retryJitter()
    {
        return doubleProperty(RETRY_JITTER_PROP, DEFAULT_RETRY_JITTER);
    }

    /**
     * Retry policy built from the retry properties.
     *
     * @return exponential policy with jitter
     */
    public static RetryPolicy retryPolicy()
    {
        return RetryPolicy.exponential(retryMaxAttempts(), retryBaseDelayMs(), retryMultiplier(), retryMaxDelayMs())
            .withJitter(retryJitter());
    }

    public static int circuitFailureThreshold()
    {
        return Integer.getInteger(CIRCUIT_FAILURE_THRESHOLD_PROP, DEFAULT_CIRCUIT_FAILURE_THRESHOLD);
    }

    public static long circuitResetTimeoutMs()
    {
        return Long.getLong(CIRCUIT_RESET_TIMEOUT_MS_PROP, DEFAULT_CIRCUIT_RESET_TIMEOUT_MS);
    }

    /**
     * Refetch interval while the push channel is down.
     *
     * @return poll interval in milliseconds
     */
    public static long pollIntervalMs()
    {
        return Long.getLong(POLL_INTERVAL_MS_PROP, DEFAULT_POLL_INTERVAL_MS);
    }

    /**
     * Time after which an unacknowledged mutation is rolled back.
     *
     * @return mutation timeout in milliseconds, 0 for none
     */
    public static long mutationTimeoutMs()
    {
        return Long.getLong(MUTATION_TIMEOUT_MS_PROP, DEFAULT_MUTATION_TIMEOUT_MS);
    }

    public static int pendingMutationWarningThreshold()
    {
        return Integer.getInteger(PENDING_MUTATION_WARNING_THRESHOLD_PROP, DEFAULT_PENDING_MUTATION_WARNING_THRESHOLD);
    }

    public static long listenerIdleSleepMs()
    {
        return Long.getLong(LISTENER_IDLE_SLEEP_MS_PROP, DEFAULT_LISTENER_IDLE_SLEEP_MS);
    }

    private static double doubleProperty(final String name, final double defaultValue)
    {
        final String value = System.getProperty(name);
        if (null == value || value.isEmpty())
        {
            return defaultValue;
        }

        return Double.parseDouble(value);
    }
}
