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

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Identity of a cached query: entity type plus filter parameters.
 * <p>
 * Parameter order is irrelevant; two keys are equal when their entity types and parameter maps are.
 * A key may also act as a filter, see {@link #matches(QueryKey)}.
 */
public final class QueryKey
{
    private final String entityType;
    private final Map<String, String> params;

    private QueryKey(final String entityType, final Map<String, String> params)
    {
        this.entityType = Objects.requireNonNull(entityType, "entityType");
        this.params = Map.copyOf(params);
    }

    /**
     * Key over all records of an entity type.
     *
     * @param entityType e.g. {@code pets}
     * @return the key
     */
    public static QueryKey of(final String entityType)
    {
        return new QueryKey(entityType, Map.of());
    }

    /**
     * Key with filter parameters given as alternating names and values.
     *
     * @param entityType e.g. {@code pets}
     * @param nameValues e.g. {@code "organizationId", "org-1"}
     * @return the key
     */
    public static QueryKey of(final String entityType, final String... nameValues)
    {
        if (nameValues.length % 2 != 0)
        {
            throw new IllegalArgumentException("parameters must be name/value pairs: " + nameValues.length);
        }

        final Map<String, String> params = new TreeMap<>();
        for (int i = 0; i < nameValues.length; i += 2)
        {
            params.put(
                Objects.requireNonNull(nameValues[i], "name"),
                Objects.requireNonNull(nameValues[i + 1], "value"));
        }

        return new QueryKey(entityType, params);
    }

    /**
     * Key with a parameter map.
     *
     * @param entityType e.g. {@code appointments}
     * @param params     filter parameters
     * @return the key
     */
    public static QueryKey of(final String entityType, final Map<String, String> params)
    {
        return new QueryKey(entityType, params);
    }

    /**
     * Copy with one more filter parameter.
     *
     * @param name  parameter name
     * @param value parameter value
     * @return the new key
     */
    public QueryKey with(final String name, final String value)
    {
        final Map<String, String> copy = new TreeMap<>(params);
        copy.put(name, value);
        return new QueryKey(entityType, copy);
    }

    /**
     * Does this key fall under the given filter: same entity type and every filter parameter present
     * with the same value.
     *
     * @param filter key used as a filter
     * @return true if matched
     */
    public boolean matches(final QueryKey filter)
    {
        if (!entityType.equals(filter.entityType))
        {
            return false;
        }

        for (final Map.Entry<String, String> param : filter.params.entrySet())
        {
            if (!param.getValue().equals(params.get(param.getKey())))
            {
                return false;
            }
        }

        return true;
    }

    public String entityType()
    {
        return entityType;
    }

    public Map<String, String> params()
    {
        return params;
    }

    /**
     * Parameter value.
     *
     * @param name parameter name
     * @return value or null if absent
     */
    public String param(final String name)
    {
        return params.get(name);
    }

    public boolean equals(final Object o)
    {
        if (this == o)
        {
            return true;
        }

        if (!(o instanceof QueryKey))
        {
            return false;
        }

        final QueryKey that = (QueryKey)o;
        return entityType.equals(that.entityType) && params.equals(that.params);
    }

    public int hashCode()
    {
        return 31 * entityType.hashCode() + params.hashCode();
    }

    public String toString()
    {
        return params.isEmpty() ? entityType : entityType + new TreeMap<>(params);
    }
}
