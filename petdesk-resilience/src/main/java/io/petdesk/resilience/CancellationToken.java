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

import java.util.ArrayList;
import java.util.List;

/**
 * Cooperative cancellation signal threaded through every awaited step of a remote operation.
 * <p>
 * Cancellation is one-way and idempotent. Actions registered with {@link #onCancel(Runnable)} run
 * once, on the thread that cancels, or immediately if the token is already cancelled.
 * <p>
 * A {@link #child()} stays registered with its parent until it is cancelled or {@link #close() closed},
 * so children of long-lived tokens must be closed once their operation completes.
 */
public final class CancellationToken implements AutoCloseable
{
    /**
     * Registration of a cancel action, closed to deregister it.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable
    {
        /**
         * Deregister the action if it has not run.
         */
        void close();
    }

    /**
     * Token that is never cancelled.
     */
    public static final CancellationToken NONE = new CancellationToken(false, Throwable::printStackTrace);

    private static final Registration NO_REGISTRATION = () -> {};

    private final boolean cancellable;
    private final ErrorHandler errorHandler;
    private final List<Runnable> actions = new ArrayList<>();
    private volatile String reason;
    private volatile Registration parentRegistration;

    private CancellationToken(final boolean cancellable, final ErrorHandler errorHandler)
    {
        this.cancellable = cancellable;
        this.errorHandler = errorHandler;
    }

    /**
     * Create a new, uncancelled token whose action failures are printed to {@code System.err}.
     *
     * @return the token
     */
    public static CancellationToken create()
    {
        return new CancellationToken(true, Throwable::printStackTrace);
    }

    /**
     * Create a new, uncancelled token.
     *
     * @param errorHandler receives exceptions thrown by cancel actions
     * @return the token
     */
    public static CancellationToken create(final ErrorHandler errorHandler)
    {
        return new CancellationToken(true, errorHandler);
    }

    /**
     * Create a token that is cancelled whenever this one is, but may also be cancelled on its own.
     *
     * @return the child token
     */
    public CancellationToken child()
    {
        final CancellationToken child = new CancellationToken(true, errorHandler);
        final Registration registration = onCancel(() -> child.cancel(reason));
        if (child.isCancelled())
        {
            registration.close();
        }
        else
        {
            child.parentRegistration = registration;
        }

        return child;
    }

    /**
     * Detach from the parent token, if any, without cancelling. Idempotent.
     */
    public void close()
    {
        final Registration registration = parentRegistration;
        if (null != registration)
        {
            parentRegistration = null;
            registration.close();
        }
    }

    /**
     * Cancel the token and run its registered actions.
     *
     * @param reason why the operation is abandoned
     * @return true if this call cancelled the token
     */
    public boolean cancel(final String reason)
    {
        if (!cancellable)
        {
            return false;
        }

        final List<Runnable> toRun;
        synchronized (actions)
        {
            if (null != this.reason)
            {
                return false;
            }

            this.reason = null == reason ? "cancelled" : reason;
            toRun = new ArrayList<>(actions);
            actions.clear();
        }

        close();

        for (final Runnable action : toRun)
        {
            try
            {
                action.run();
            }
            catch (final Exception ex)
            {
                errorHandler.onError(ex);
            }
        }

        return true;
    }

    /**
     * Has the token been cancelled.
     *
     * @return true once cancelled
     */
    public boolean isCancelled()
    {
        return null != reason;
    }

    /**
     * Reason given when cancelled.
     *
     * @return the reason or null if not cancelled
     */
    public String reason()
    {
        return reason;
    }

    /**
     * Run an action when the token is cancelled.
     *
     * @param action to run
     * @return registration to remove the action once it is no longer needed
     */
    public Registration onCancel(final Runnable action)
    {
        if (!cancellable)
        {
            return NO_REGISTRATION;
        }

        synchronized (actions)
        {
            if (null == reason)
            {
                actions.add(action);
                return () ->
                {
                    synchronized (actions)
                    {
                        actions.remove(action);
                    }
                };
            }
        }

        action.run();
        return NO_REGISTRATION;
    }

    int registeredActions()
    {
        synchronized (actions)
        {
            return actions.size();
        }
    }

    /**
     * Throw {@link CancelledException} if cancelled.
     */
    public void throwIfCancelled()
    {
        final String reason = this.reason;
        if (null != reason)
        {
            throw new CancelledException(reason);
        }
    }

    /**
     * Exception describing this token's cancellation.
     *
     * @return a new {@link CancelledException}
     */
    public CancelledException toException()
    {
        return new CancelledException(null == reason ? "cancelled" : reason);
    }

    public String toString()
    {
        return "CancellationToken{cancelled=" + isCancelled() + ", reason=" + reason + '}';
    }
}
