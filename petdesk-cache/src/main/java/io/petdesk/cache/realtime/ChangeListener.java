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

/**
 * Receives pushes from the gateway. Called on the gateway's own threads.
 */
public interface ChangeListener
{
    /**
     * An entity changed on the backend.
     *
     * @param event the change
     */
    void onChange(ChangeEvent event);

    /**
     * The push channel connected or dropped.
     *
     * @param state the new state
     */
    void onConnectionStateChange(ConnectionState state);
}
