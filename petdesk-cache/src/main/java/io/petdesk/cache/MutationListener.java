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

/**
 * Hooks around the outcome of one mutation. Exceptions thrown by hooks are reported, never propagated.
 *
 * @param <T> canonical value type
 */
public interface MutationListener<T>
{
    default void onSuccess(final WriteResult<T> result)
    {
    }

    default void onError(final Throwable error)
    {
    }

    /**
     * Called after {@link #onSuccess(WriteResult)} or {@link #onError(Throwable)}.
     *
     * @param result the result or null on failure
     * @param error  the failure or null on success
     */
    default void onSettled(final WriteResult<T> result, final Throwable error)
    {
    }
}
