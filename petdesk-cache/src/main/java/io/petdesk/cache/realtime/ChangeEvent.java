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

import java.util.Objects;

/**
 * A change to one entity, pushed by the backend.
 */
public final class ChangeEvent
{
    private final String entityType;
    private final String entityId;
    private final ChangeKind changeKind;

    public ChangeEvent(final String entityType, final String entityId, final ChangeKind changeKind)
    {
        this.entityType = Objects.requireNonNull(entityType, "entityType");
        this.entityId = entityId;
        this.changeKind = Objects.requireNonNull(changeKind, "changeKind");
    }

    public String entityType()
    {
        return entityType;
    }

    /**
     * Id of the changed entity, may be null when the backend does not report one.
     *
     * @return the entity id
     */
    public String entityId()
    {
        return entityId;
    }

    public ChangeKind changeKind()
    {
        return changeKind;
    }

    public boolean equals(final Object o)
    {
        if (this == o)
        {
            return true;
        }

        if (!(o instanceof ChangeEvent))
        {
            return false;
        }

        final ChangeEvent that = (ChangeEvent)o;
        return entityType.equals(that.entityType) &&
            Objects.equals(entityId, that.entityId) &&
            changeKind == that.changeKind;
    }

    public int hashCode()
    {
        return Objects.hash(entityType, entityId, changeKind);
    }

    public String toString()
    {
        return changeKind + " " + entityType + (null != entityId ? "#" + entityId : "");
    }
}
