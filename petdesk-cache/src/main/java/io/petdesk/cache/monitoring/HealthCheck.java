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
package io.petdesk.cache.monitoring;

import io.petdesk.cache.MutationCoordinator;
import io.petdesk.cache.realtime.ChangeNotificationListener;
import io.petdesk.resilience.CircuitBreaker;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Health checks over the sync layer's dependencies.
 * <p>
 * An open circuit or a degraded push channel leaves the layer usable on cached data, so both report
 * {@link Status#DEGRADED}; the UI renders that as "service degraded".
 */
public final class HealthCheck
{
    /**
     * Health status levels.
     */
    public enum Status
    {
        /** Component is healthy */
        HEALTHY,
        /** Component is degraded but functional */
        DEGRADED,
        /** Component is unhealthy */
        UNHEALTHY
    }

    /**
     * Individual health check result.
     */
    public static final class CheckResult
    {
        public final String name;
        public final Status status;
        public final String message;
        public final Instant timestamp;

        public CheckResult(final String name, final Status status, final String message)
        {
            this.name = name;
            this.status = status;
            this.message = message;
            this.timestamp = Instant.now();
        }

        public boolean isHealthy()
        {
            return status == Status.HEALTHY;
        }

        public String toString()
        {
            return name + "=" + status + " (" + message + ")";
        }
    }

    /**
     * Health check interface.
     */
    @FunctionalInterface
    public interface Check
    {
        CheckResult execute();
    }

    private final List<Check> checks = new CopyOnWriteArrayList<>();

    /**
     * Register a check.
     *
     * @param check the check to register
     * @return this for chaining
     */
    public HealthCheck register(final Check check)
    {
        checks.add(check);
        return this;
    }

    /**
     * Run all checks. A check that throws counts as unhealthy.
     *
     * @return aggregated result
     */
    public AggregateResult check()
    {
        final List<CheckResult> results = new ArrayList<>();
        Status overall = Status.HEALTHY;

        for (final Check check : checks)
        {
            try
            {
                final CheckResult result = check.execute();
                results.add(result);

                if (result.status == Status.UNHEALTHY)
                {
                    overall = Status.UNHEALTHY;
                }
                else if (result.status == Status.DEGRADED && overall == Status.HEALTHY)
                {
                    overall = Status.DEGRADED;
                }
            }
            catch (final Exception e)
            {
                results.add(new CheckResult("exception", Status.UNHEALTHY, String.valueOf(e.getMessage())));
                overall = Status.UNHEALTHY;
            }
        }

        return new AggregateResult(overall, results);
    }

    /**
     * Aggregated health check result.
     */
    public static final class AggregateResult
    {
        public final Status status;
        public final List<CheckResult> details;
        public final Instant timestamp;

        AggregateResult(final Status status, final List<CheckResult> details)
        {
            this.status = status;
            this.details = details;
            this.timestamp = Instant.now();
        }

        /**
         * Can the layer still serve reads.
         *
         * @return true if healthy or degraded
         */
        public boolean isServing()
        {
            return status == Status.HEALTHY || status == Status.DEGRADED;
        }

        public String toJson()
        {
            final StringBuilder sb = new StringBuilder();
            sb.append("{\"status\":\"").append(status).append("\",");
            sb.append("\"timestamp\":\"").append(timestamp).append("\",");
            sb.append("\"checks\":[");

            for (int i = 0; i < details.size(); i++)
            {
                final CheckResult r = details.get(i);
                if (i > 0)
                {
                    sb.append(",");
                }
                sb.append("{\"name\":\"").append(r.name).append("\",");
                sb.append("\"status\":\"").append(r.status).append("\",");
                sb.append("\"message\":\"").append(r.message.replace("\"", "\\\"")).append("\"}");
            }

            sb.append("]}");
            return sb.toString();
        }

        public String toString()
        {
            return status + " " + details;
        }
    }

    // =========================================================================
    // Pre-built checks
    // =========================================================================

    /**
     * Circuit breaker check: closed is healthy, open or probing is degraded.
     *
     * @param breaker the breaker
     * @return the check
     */
    public static Check circuitBreaker(final CircuitBreaker breaker)
    {
        return () ->
        {
            final CircuitBreaker.State state = breaker.state();
            final String name = "circuit-" + breaker.name();
            if (CircuitBreaker.State.CLOSED == state)
            {
                return new CheckResult(name, Status.HEALTHY, "Closed");
            }

            return new CheckResult(
                name,
                Status.DEGRADED,
                "Service degraded: circuit " + state + " after " + breaker.failureCount() + " failures");
        };
    }

    /**
     * Push channel check: live is healthy, polling is degraded, not subscribed is unhealthy.
     *
     * @param listener the change notification listener
     * @return the check
     */
    public static Check changeNotifications(final ChangeNotificationListener listener)
    {
        return () -> switch (listener.mode())
        {
            case LIVE -> new CheckResult("change-notifications", Status.HEALTHY, "Live");
            case DEGRADED -> new CheckResult("change-notifications", Status.DEGRADED, "Disconnected, polling");
            case IDLE -> new CheckResult("change-notifications", Status.UNHEALTHY, "Not subscribed");
        };
    }

    /**
     * Pending mutation backlog check.
     *
     * @param coordinator      the coordinator
     * @param warningThreshold pending count above which the check is degraded
     * @return the check
     */
    public static Check pendingMutations(final MutationCoordinator coordinator, final int warningThreshold)
    {
        return () ->
        {
            final int pending = coordinator.pendingCount();
            return new CheckResult(
                "pending-mutations",
                pending > warningThreshold ? Status.DEGRADED : Status.HEALTHY,
                pending + " pending");
        };
    }
}
