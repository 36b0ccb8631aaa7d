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
 * Backend answer to a write.
 *
 * @param <T> canonical value type
 */
public final class WriteResult<T>
{
    private final boolean accepted;
    private final T canonicalValue;
    private final boolean hasCanonicalValue;

    private WriteResult(final boolean accepted, final T canonicalValue, final boolean hasCanonicalValue)
    {
        this.accepted = accepted;
        this.canonicalValue = canonicalValue;
        this.hasCanonicalValue = hasCanonicalValue;
    }

    /**
     * Write accepted, backend returned the stored record.
     *
     * @param canonicalValue the record as stored
     * @param <T>            value type
     * @return the result
     */
    public static <T> WriteResult<T> accepted(final T canonicalValue)
    {
        return new WriteResult<>(true, canonicalValue, true);
    }

    /**
     * Write accepted without a body.
     *
     * @param <T> value type
     * @return the result
     */
    public static <T> WriteResult<T> acceptedWithoutValue()
    {
        return new WriteResult<>(true, null, false);
    }

    /**
     * Write refused without an error status.
     *
     * @param <T> value type
     * @return the result
     */
    public static <T> WriteResult<T> rejected()
    {
        return new WriteResult<>(false, null, false);
    }

    public boolean accepted()
    {
        return accepted;
    }

    public boolean hasCanonicalValue()
    {
        return hasCanonicalValue;
    }

    public T canonicalValue()
    {
        return canonicalValue;
    }

    public String toString()
    {
        return "WriteResult{accepted=" + accepted + (hasCanonicalValue ? ", canonicalValue=" + canonicalValue : "") + '}';
    }
}
