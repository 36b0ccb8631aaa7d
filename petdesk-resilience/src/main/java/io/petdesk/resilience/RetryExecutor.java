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

import org.agrona.ErrorHandler;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs remote calls under a {@link RetryPolicy}, waiting out backoff delays on a scheduler rather
 * than blocking the caller.
 * <p>
 * Only transient failures are retried. {@link CircuitOpenException}, {@link ConflictException},
 * {@link FatalRequestException} and {@link CancelledException} complete the returned future at once,
 * so an open breaker cuts the remaining backoff schedule short. Cancelling the token completes the
 * returned future with {@link CancelledException} immediately, whether a call or a delay is pending.
 * <p>
 * Features:
 * <ul>
 *   <li>Exponential backoff with cap and jitter</li>
 *   <li>Retry listener whose failures are reported to an {@link ErrorHandler} and never propagate</li>
 *   <li>Higher-order {@link #wrap(RemoteCall, RetryPolicy)} composition</li>
 *   <li>Deadline helper {@link #withTimeout(CompletableFuture, long)}</li>
 *   <li>Metrics collection</li>
 * </ul>
 */
public final class RetryExecutor
{
    private final String name;
    private final RetryPolicy defaultPolicy;
    private final ScheduledExecutorService scheduler;
    private final ErrorHandler errorHandler;

    // Metrics
    private final AtomicLong totalCalls = new AtomicLong(0);
    private final AtomicLong successfulCalls = new AtomicLong(0);
    private final AtomicLong failedCalls = new AtomicLong(0);
    private final AtomicLong retriedCalls = new AtomicLong(0);
    private final AtomicLong exhaustedCalls = new AtomicLong(0);
    private final AtomicLong totalRetryDelayMs = new AtomicLong(0);

    /**
     * Create a retry executor.
     *
     * @param name          identifier for logging
     * @param defaultPolicy policy used when a call does not supply one
     * @param scheduler     scheduler on which backoff delays elapse
     * @param errorHandler  receives failures of retry listeners
     */
    public RetryExecutor(
        final String name,
        final RetryPolicy defaultPolicy,
        final ScheduledExecutorService scheduler,
        final ErrorHandler errorHandler)
    {
        this.name = name;
        this.defaultPolicy = defaultPolicy;
        this.scheduler = scheduler;
        this.errorHandler = errorHandler;
    }

    /**
     * Execute a call under the default policy.
     *
     * @param call  the remote call
     * @param token cancellation signal
     * @param <T>   result type
     * @return future of the result
     */
    public <T> CompletableFuture<T> execute(final RemoteCall<T> call, final CancellationToken token)
    {
        return execute(call, defaultPolicy, token);
    }

    /**
     * Execute a call, retrying transient failures as the policy allows.
     *
     * @param call   the remote call
     * @param policy retry policy
     * @param token  cancellation signal
     * @param <T>    result type
     * @return future of the result, failed with {@link RetryExhaustedException} once attempts run out
     */
    public <T> CompletableFuture<T> execute(
        final RemoteCall<T> call, final RetryPolicy policy, final CancellationToken token)
    {
        totalCalls.incrementAndGet();

        final CompletableFuture<T> result = new CompletableFuture<>();
        final CancellationToken.Registration registration =
            token.onCancel(() -> result.completeExceptionally(token.toException()));
        result.whenComplete((value, error) -> registration.close());

        attempt(call, policy, token, 1, result);

        return result;
    }

    /**
     * Execute a call under a deadline covering every attempt and delay.
     * <p>
     * When the deadline passes the attempt in flight is cancelled and the future fails with
     * {@link OperationTimeoutException}.
     *
     * @param call      the remote call
     * @param policy    retry policy
     * @param timeoutMs deadline in milliseconds
     * @param token     cancellation signal
     * @param <T>       result type
     * @return future of the result
     */
    public <T> CompletableFuture<T> executeWithTimeout(
        final RemoteCall<T> call, final RetryPolicy policy, final long timeoutMs, final CancellationToken token)
    {
        final CancellationToken attemptToken = token.child();
        return withTimeout(execute(call, policy, attemptToken), timeoutMs).whenComplete((value, error) ->
        {
            if (null != error && FailureClassifier.unwrap(error) instanceof OperationTimeoutException)
            {
                attemptToken.cancel("timed out after " + timeoutMs + "ms");
            }
            attemptToken.close();
        });
    }

    /**
     * Wrap a call so every invocation is retried under the given policy.
     *
     * @param call   the remote call
     * @param policy retry policy
     * @param <T>    result type
     * @return the retrying call
     */
    public <T> RemoteCall<T> wrap(final RemoteCall<T> call, final RetryPolicy policy)
    {
        return (token) -> execute(call, policy, token);
    }

    /**
     * Fail a future with {@link OperationTimeoutException} if it has not completed within the deadline.
     *
     * @param future    the future to guard
     * @param timeoutMs deadline in milliseconds
     * @param <T>       result type
     * @return a future completing with the first of the outcome or the timeout
     */
    public <T> CompletableFuture<T> withTimeout(final CompletableFuture<T> future, final long timeoutMs)
    {
        final CompletableFuture<T> result = new CompletableFuture<>();
        final ScheduledFuture<?> timer = scheduler.schedule(
            () -> result.completeExceptionally(
                new OperationTimeoutException("operation timed out after " + timeoutMs + "ms", timeoutMs)),
            timeoutMs,
            TimeUnit.MILLISECONDS);

        future.whenComplete((value, error) ->
        {
            timer.cancel(false);
            if (null == error)
            {
                result.complete(value);
            }
            else
            {
                result.completeExceptionally(FailureClassifier.unwrap(error));
            }
        });

        return result;
    }

    public RetryPolicy defaultPolicy()
    {
        return defaultPolicy;
    }

    // Metrics getters
    public long totalCalls()
    {
        return totalCalls.get();
    }

    public long successfulCalls()
    {
        return successfulCalls.get();
    }

    public long failedCalls()
    {
        return failedCalls.get();
    }

    public long retriedCalls()
    {
        return retriedCalls.get();
    }

    public long exhaustedCalls()
    {
        return exhaustedCalls.get();
    }

    public long totalRetryDelayMs()
    {
        return totalRetryDelayMs.get();
    }

    public String name()
    {
        return name;
    }

    /**
     * Reset metrics.
     */
    public void resetMetrics()
    {
        totalCalls.set(0);
        successfulCalls.set(0);
        failedCalls.set(0);
        retriedCalls.set(0);
        exhaustedCalls.set(0);
        totalRetryDelayMs.set(0);
    }

    private <T> void attempt(
        final RemoteCall<T> call,
        final RetryPolicy policy,
        final CancellationToken token,
        final int attempt,
        final CompletableFuture<T> result)
    {
        if (result.isDone())
        {
            return;
        }

        if (token.isCancelled())
        {
            result.completeExceptionally(token.toException());
            return;
        }

        CompletableFuture<T> future;
        try
        {
            future = call.invoke(token);
        }
        catch (final RuntimeException ex)
        {
            future = CompletableFuture.failedFuture(ex);
        }

        future.whenComplete((value, error) ->
        {
            if (result.isDone())
            {
                return;
            }

            if (null == error)
            {
                if (attempt > 1)
                {
                    System.out.println("[RetryExecutor:" + name + "] succeeded after " + attempt + " attempts");
                }
                successfulCalls.incrementAndGet();
                result.complete(value);
                return;
            }

            final Throwable cause = FailureClassifier.unwrap(error);
            if (!isRetryable(policy, cause))
            {
                failedCalls.incrementAndGet();
                result.completeExceptionally(cause);
                return;
            }

            if (!policy.shouldRetry(attempt))
            {
                failedCalls.incrementAndGet();
                exhaustedCalls.incrementAndGet();
                System.out.println("[RetryExecutor:" + name + "] gave up after " + attempt + " attempts: " +
                    cause.getMessage());
                result.completeExceptionally(new RetryExhaustedException(cause, attempt));
                return;
            }

            final long delayMs = policy.calculateDelayMs(attempt);
            retriedCalls.incrementAndGet();
            totalRetryDelayMs.addAndGet(delayMs);
            scheduleRetry(call, policy, token, attempt, cause, delayMs, result);
        });
    }

    private <T> void scheduleRetry(
        final RemoteCall<T> call,
        final RetryPolicy policy,
        final CancellationToken token,
        final int failedAttempt,
        final Throwable cause,
        final long delayMs,
        final CompletableFuture<T> result)
    {
        final Runnable retry = () ->
        {
            if (result.isDone())
            {
                return;
            }

            notifyRetry(policy, cause, failedAttempt, delayMs);
            attempt(call, policy, token, failedAttempt + 1, result);
        };

        try
        {
            final ScheduledFuture<?> timer = scheduler.schedule(retry, delayMs, TimeUnit.MILLISECONDS);
            final CancellationToken.Registration registration = token.onCancel(() -> timer.cancel(false));
            result.whenComplete((value, error) -> registration.close());
        }
        catch (final RejectedExecutionException ex)
        {
            result.completeExceptionally(new CancelledException("retry scheduler closed: " + name));
        }
    }

    private void notifyRetry(final RetryPolicy policy, final Throwable cause, final int attempt, final long delayMs)
    {
        try
        {
            policy.retryListener().onRetry(cause, attempt, delayMs);
        }
        catch (final Exception ex)
        {
            errorHandler.onError(ex);
        }
    }

    private static boolean isRetryable(final RetryPolicy policy, final Throwable cause)
    {
        if (cause instanceof SyncException && SyncException.Category.TRANSIENT != ((SyncException)cause).category())
        {
            return false;
        }

        return policy.isRetryable(cause);
    }

    @Override
    public String toString()
    {
        return "RetryExecutor{" +
            "name='" + name + '\'' +
            ", policy=" + defaultPolicy +
            ", totalCalls=" + totalCalls.get() +
            ", retried=" + retriedCalls.get() +
            ", exhausted=" + exhaustedCalls.get() +
            '}';
    }
}
