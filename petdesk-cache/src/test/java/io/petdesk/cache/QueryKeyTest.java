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

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueryKeyTest
{
    @Test
    void shouldBeEqualRegardlessOfParameterOrder()
    {
        final QueryKey first = QueryKey.of("pets", "organizationId", "org-1", "customerId", "c-7");
        final QueryKey second = QueryKey.of("pets", "customerId", "c-7", "organizationId", "org-1");

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void shouldDifferByEntityTypeOrParameters()
    {
        final QueryKey pets = QueryKey.of("pets", "organizationId", "org-1");

        assertNotEquals(pets, QueryKey.of("customers", "organizationId", "org-1"));
        assertNotEquals(pets, QueryKey.of("pets", "organizationId", "org-2"));
        assertNotEquals(pets, QueryKey.of("pets"));
    }

    @Test
    void shouldMatchFilterWithSubsetOfParameters()
    {
        final QueryKey key = QueryKey.of("appointments", "organizationId", "org-1", "date", "2024-05-01");

        assertTrue(key.matches(QueryKey.of("appointments")));
        assertTrue(key.matches(QueryKey.of("appointments", "organizationId", "org-1")));
        assertTrue(key.matches(key));
        assertFalse(key.matches(QueryKey.of("appointments", "organizationId", "org-2")));
        assertFalse(key.matches(QueryKey.of("appointments", "vetId", "v-1")));
        assertFalse(key.matches(QueryKey.of("dashboard-stats", "organizationId", "org-1")));
    }

    @Test
    void shouldNotBeAffectedByLaterChangesToSourceMap()
    {
        final Map<String, String> params = new HashMap<>();
        params.put("organizationId", "org-1");
        final QueryKey key = QueryKey.of("customers", params);

        params.put("organizationId", "org-2");

        assertEquals("org-1", key.param("organizationId"));
    }

    @Test
    void shouldAddParameterWithoutChangingOriginal()
    {
        final QueryKey base = QueryKey.of("messages", "organizationId", "org-1");
        final QueryKey narrowed = base.with("conversationId", "conv-9");

        assertNull(base.param("conversationId"));
        assertEquals("conv-9", narrowed.param("conversationId"));
        assertTrue(narrowed.matches(base));
    }

    @Test
    void shouldRejectOddParameterList()
    {
        assertThrows(IllegalArgumentException.class, () -> QueryKey.of("pets", "organizationId"));
    }
}
