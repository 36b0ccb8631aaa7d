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

/**
 * What a write asks the backend to do: insert, update or delete one record of an entity type.
 */
public final class MutationDescriptor
{
    /**
     * Kind of write.
     */
    public enum Kind
    {
        INSERT,
        UPDATE,
        DELETE
    }

    private final String entityType;
    private final String entityId;
    private final Kind kind;
    private final Map<String, Object> payload;

    public MutationDescriptor(
        final String entityType, final String entityId, final Kind kind, final Map<String, Object> payload)
    {
        this.entityType = Objects.requireNonNull(entityType, "entityType");
        this.entityId = entityId;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.payload = Map.copyOf(Objects.requireNonNull(payload, "payload"));
    }

    public static MutationDescriptor insert(final String entityType, final Map<String, Object> payload)
    {
        return new MutationDescriptor(entityType, null, Kind.INSERT, payload);
    }

    public static MutationDescriptor update(
        final String entityType, final String entityId, final Map<String, Object> payload)
    {
        return new MutationDescriptor(entityType, Objects.requireNonNull(entityId, "entityId"), Kind.UPDATE, payload);
    }

    public static MutationDescriptor delete(final String entityType, final String entityId)
    {
        return new MutationDescriptor(entityType, Objects.requireNonNull(entityId, "entityId"), Kind.DELETE, Map.of());
    }

    public String entityType()
    {
        return entityType;
    }

    /**
     * @return id of the record, null for inserts
     */
    public String entityId()
    {
        return entityId;
    }

    public Kind kind()
    {
        return kind;
    }

    public Map<String, Object> payload()
    {
        return payload;
    }

    public boolean equals(final Object o)
    {
        if (this == o)
        {
            return true;
        }

        if (!(o instanceof MutationDescriptor))
        {
            return false;
        }

        final MutationDescriptor that = (MutationDescriptor)o;
        return entityType.equals(that.entityType) &&
            Objects.equals(entityId, that.entityId) &&
            kind == that.kind &&
            payload.equals(that.payload);
    }

    public int hashCode()
    {
        return Objects.hash(entityType, entityId, kind, payload);
    }

    public String toString()
    {
        return kind + " " + entityType + (null != entityId ? "#" + entityId : "") + " " + payload;
    }
}
