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
package io.petdesk.cache.realtime;

import io.petdesk.cache.QueryKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Maps a pushed {@link ChangeEvent} to the key filters it invalidates.
 * <p>
 * Each filter is applied with {@link QueryKey#matches(QueryKey)}, so a filter of
 * {@code pets{organizationId=org-1}} covers every {@code pets} key of that tenant whatever its other
 * parameters.
 */
public final class InvalidationTable
{
    /** Entity type of conversation rows. */
    public static final String CONVERSATIONS = "conversations";

    /** Entity type of message rows. */
    public static final String MESSAGES = "messages";

    /** Entity type of contact rows. */
    public static final String CONTACTS = "contacts";

    /** Entity type of customer queries. */
    public static final String CUSTOMERS = "customers";

    /** Entity type of appointment rows. */
    public static final String APPOINTMENTS = "appointments";

    /** Entity type of the dashboard statistics query. */
    public static final String DASHBOARD_STATS = "dashboard-stats";

    /** Entity type of pet rows. */
    public static final String PETS = "pets";

    /** Tenant parameter carried by every pet-care key. */
    public static final String ORGANIZATION_ID = "organizationId";

    private final Map<String, List<Function<ChangeEvent, QueryKey>>> rules = new ConcurrentHashMap<>();

    /**
     * Table of the pet-care dashboard, every filter scoped to one tenant.
     * <ul>
     *   <li>conversations, messages: conversations</li>
     *   <li>contacts: customers, conversations</li>
     *   <li>appointments: appointments, dashboard-stats</li>
     *   <li>pets: pets, customers</li>
     * </ul>
     *
     * @param organizationId the tenant
     * @return a new table
     */
    public static InvalidationTable petCare(final String organizationId)
    {
        final QueryKey conversations = QueryKey.of(CONVERSATIONS, ORGANIZATION_ID, organizationId);
        final QueryKey customers = QueryKey.of(CUSTOMERS, ORGANIZATION_ID, organizationId);

        return new InvalidationTable()
            .register(CONVERSATIONS, conversations)
            .register(MESSAGES, conversations)
            .register(CONTACTS, customers)
            .register(CONTACTS, conversations)
            .register(APPOINTMENTS, QueryKey.of(APPOINTMENTS, ORGANIZATION_ID, organizationId))
            .register(APPOINTMENTS, QueryKey.of(DASHBOARD_STATS, ORGANIZATION_ID, organizationId))
            .register(PETS, QueryKey.of(PETS, ORGANIZATION_ID, organizationId))
            .register(PETS, customers);
    }

    /**
     * Invalidate a fixed filter on every change of an entity type.
     *
     * @param entityType changed entity type
     * @param filter     filter to invalidate
     * @return this for chaining
     */
    public InvalidationTable register(final String entityType, final QueryKey filter)
    {
        return register(entityType, (event) -> filter);
    }

    /**
     * Invalidate a filter derived from each change of an entity type.
     *
     * @param entityType changed entity type
     * @param rule       builds the filter from the event, may return null for none
     * @return this for chaining
     */
    public InvalidationTable register(final String entityType, final Function<ChangeEvent, QueryKey> rule)
    {
        rules.computeIfAbsent(entityType, (type) -> new CopyOnWriteArrayList<>()).add(rule);
        return this;
    }

    /**
     * Filters invalidated by an event.
     *
     * @param event the change
     * @return the filters, empty for an unknown entity type
     */
    public List<QueryKey> filtersFor(final ChangeEvent event)
    {
        final List<Function<ChangeEvent, QueryKey>> entityRules = rules.get(event.entityType());
        if (null == entityRules)
        {
            return List.of();
        }

        final List<QueryKey> filters = new ArrayList<>(entityRules.size());
        for (final Function<ChangeEvent, QueryKey> rule : entityRules)
        {
            final QueryKey filter = rule.apply(event);
            if (null != filter)
            {
                filters.add(filter);
            }
        }

        return filters;
    }

    public boolean handles(final String entityType)
    {
        return rules.containsKey(entityType);
    }
}
