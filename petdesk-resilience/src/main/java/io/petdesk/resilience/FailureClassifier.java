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

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Maps failures thrown by remote calls to the {@link SyncException.Category} that decides whether
 * they are retried.
 * <p>
 * Network-class JDK exceptions and {@link SyncException#category()} of
 * {@link SyncException.Category#TRANSIENT} are retryable. Everything else, including failures the
 * classifier has never seen, is fatal.
 */
public final class FailureClassifier
{
    /**
     * Shared instance without counters of interest to anyone.
     */
    public static final FailureClassifier INSTANCE = new FailureClassifier();

    private final AtomicLong transientCount = new AtomicLong(0);
    private final AtomicLong conflictCount = new AtomicLong(0);
    private final AtomicLong fatalCount = new AtomicLong(0);

    /**
     * Classify a failure, unwrapping future completion wrappers first.
     *
     * @param error the failure
     * @return its category
     */
    public SyncException.Category classify(final Throwable error)
    {
        final SyncException.Category category = categoryOf(unwrap(error));
        switch (category)
        {
            case TRANSIENT:
                transientCount.incrementAndGet();
                break;

            case CONFLICT:
                conflictCount.incrementAndGet();
                break;

            case FATAL:
                fatalCount.incrementAndGet();
                break;

            default:
                break;
        }

        return category;
    }

    /**
     * Is the failure worth another attempt.
     *
     * @param error the failure
     * @return true for transient failures
     */
    public boolean isRetryable(final Throwable error)
    {
        return classify(error) == SyncException.Category.TRANSIENT;
    }

    /**
     * Strip {@link CompletionException} and {@link ExecutionException} wrappers.
     *
     * @param error possibly wrapped failure
     * @return the innermost meaningful failure
     */
    public static Throwable unwrap(final Throwable error)
    {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException) &&
            null != current.getCause())
        {
            current = current.getCause();
        }

        return current;
    }

    /**
     * Present a failure as a {@link RuntimeException} suitable for completing a future.
     *
     * @param error possibly wrapped failure
     * @return the unwrapped failure, wrapped in a {@link FatalRequestException} if checked
     */
    public static RuntimeException asUnchecked(final Throwable error)
    {
        final Throwable cause = unwrap(error);
        if (cause instanceof RuntimeException)
        {
            return (RuntimeException)cause;
        }

        return new FatalRequestException(String.valueOf(cause.getMessage()), cause);
    }

    public long transientCount()
    {
        return transientCount.get();
    }

    public long conflictCount()
    {
        return conflictCount.get();
    }

    public long fatalCount()
    {
        return fatalCount.get();
    }

    private static SyncException.Category categoryOf(final Throwable error)
    {
        if (error instanceof SyncException)
        {
            return ((SyncException)error).category();
        }

        if (error instanceof ConnectException ||
            error instanceof NoRouteToHostException ||
            error instanceof SocketTimeoutException ||
            error instanceof UnknownHostException ||
            error instanceof HttpTimeoutException ||
            error instanceof SocketException)
        {
            return SyncException.Category.TRANSIENT;
        }

        return SyncException.Category.FATAL;
    }

    @Override
    public String toString()
    {
        return "FailureClassifier{" +
            "transient=" + transientCount.get() +
            ", conflict=" + conflictCount.get() +
            ", fatal=" + fatalCount.get() +
            '}';
    }
}
