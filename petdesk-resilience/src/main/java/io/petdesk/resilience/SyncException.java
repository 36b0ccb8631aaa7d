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

/**
 * Base of all failures raised while talking to the remote backend.
 * <p>
 * Every failure carries a {@link Category} so callers can react to the kind of failure without
 * an {@code instanceof} ladder, e.g. rendering "service degraded" for {@link Category#CIRCUIT_OPEN}.
 */
public class SyncException extends RuntimeException
{
    private static final long serialVersionUID = -2841179532911487512L;

    /**
     * Failure category.
     */
    public enum Category
    {
        /** Network-class failure, worth retrying */
        TRANSIENT,
        /** Validation, auth or not-found, never retried */
        FATAL,
        /** Stale-version rejection, never retried, forces rollback and refetch */
        CONFLICT,
        /** Dependency presumed unhealthy */
        CIRCUIT_OPEN,
        /** Caller cancelled the operation */
        CANCELLED,
        /** Retry budget spent */
        EXHAUSTED,
        /** Deadline passed before an answer arrived */
        TIMEOUT
    }

    private final Category category;

    /**
     * Create an exception with a message.
     *
     * @param message  detail message
     * @param category failure category
     */
    public SyncException(final String message, final Category category)
    {
        super(message);
        this.category = category;
    }

    /**
     * Create an exception with a message and cause.
     *
     * @param message  detail message
     * @param cause    underlying failure
     * @param category failure category
     */
    public SyncException(final String message, final Throwable cause, final Category category)
    {
        super(message, cause);
        this.category = category;
    }

    /**
     * Category of the failure.
     *
     * @return the category
     */
    public Category category()
    {
        return category;
    }

    /**
     * {@inheritDoc}
     */
    public String getMessage()
    {
        return category + " - " + super.getMessage();
    }
}
