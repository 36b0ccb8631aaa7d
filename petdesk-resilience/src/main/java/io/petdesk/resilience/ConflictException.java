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
 * Write rejected because it was based on a stale version of the record.
 */
public class ConflictException extends SyncException
{
    private static final long serialVersionUID = 3395817405613229086L;

    public ConflictException(final String message)
    {
        super(message, Category.CONFLICT);
    }
}
