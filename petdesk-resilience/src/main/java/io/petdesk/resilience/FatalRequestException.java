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
 * Request rejected for validation, authorisation or not-found reasons. Never retried.
 */
public class FatalRequestException extends SyncException
{
    private static final long serialVersionUID = -6803912374508833301L;

    public FatalRequestException(final String message)
    {
        super(message, Category.FATAL);
    }

    public FatalRequestException(final String message, final Throwable cause)
    {
        super(message, cause, Category.FATAL);
    }
}
