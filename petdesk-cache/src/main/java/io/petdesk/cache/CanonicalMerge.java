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

import java.util.Set;

/**
 * Decides what an affected key holds once the backend returned a canonical value for a write.
 * <p>
 * A write returns one canonical value but may touch several keys of different shapes, for example a pet's
 * detail key and the organization's pet list. {@link #REPLACE} stores that one value under every affected
 * key; use {@link #replaceOnly(Set)} or a custom merge when some keys hold a different shape.
 */
@FunctionalInterface
public interface CanonicalMerge
{
    /**
     * Store the server's value as is.
     */
    CanonicalMerge REPLACE = (key, optimisticValue, canonicalValue) -> canonicalValue;

    /**
     * Commit the optimistic value and ignore the server's.
     */
    CanonicalMerge KEEP_OPTIMISTIC = (key, optimisticValue, canonicalValue) -> optimisticValue;

    /**
     * Store the server's value under the given keys and commit the optimistic value everywhere else.
     *
     * @param keys keys whose shape matches the canonical value
     * @return the merge
     */
    static CanonicalMerge replaceOnly(final Set<QueryKey> keys)
    {
        final Set<QueryKey> replaced = Set.copyOf(keys);
        return (key, optimisticValue, canonicalValue) -> replaced.contains(key) ? canonicalValue : optimisticValue;
    }

    /**
     * @param key             affected key
     * @param optimisticValue value speculatively applied to the key
     * @param canonicalValue  value returned by the backend
     * @return value to commit
     */
    Object merge(QueryKey key, Object optimisticValue, Object canonicalValue);
}
