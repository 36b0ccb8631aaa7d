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
 * Remote call answered with a non-success status code.
 * <p>
 * Category is derived from the status: 502, 503 and 504 are transient, 409 is a conflict and
 * everything else is fatal.
 */
public class RequestStatusException extends SyncException
{
    private static final long serialVersionUID = -3158044011795361257L;

    private final int statusCode;

    public RequestStatusException(final int statusCode, final String message)
    {
        super(message + " (status " + statusCode + ")", categoryOf(statusCode));
        this.statusCode = statusCode;
    }

    public int statusCode()
    {
        return statusCode;
    }

    static Category categoryOf(final int statusCode)
    {
        switch (statusCode)
        {
            case 502:
            case 503:
            case 504:
                return Category.TRANSIENT;

            case 409:
                return Category.CONFLICT;

            default:
                return Category.FATAL;
        }
    }
}
