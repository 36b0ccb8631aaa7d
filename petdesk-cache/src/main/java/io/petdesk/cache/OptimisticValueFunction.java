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
 * Computes the optimistic value of an affected key from the mutation's variables.
 *
 * @param <V> variables of the mutation
 */
@FunctionalInterface
public interface OptimisticValueFunction<V>
{
    /**
     * @param key          the affected key
     * @param currentValue what readers of the key see now, null if nothing cached
     * @param variables    the mutation's variables
     * @return the optimistic value
     */
    Object apply(QueryKey key, Object currentValue, V variables);
}
