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

import org.agrona.collections.MutableInteger;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest
{
    @Test
    void shouldRunActionsOnceWhenCancelled()
    {
        final CancellationToken token = CancellationToken.create();
        final MutableInteger runs = new MutableInteger();
        token.onCancel(runs::increment);

        assertTrue(token.cancel("user navigated away"));
        assertFalse(token.cancel("again"));

        assertEquals(1, runs.get());
        assertTrue(token.isCancelled());
        assertEquals("user navigated away", token.reason());
    }

    @Test
    void shouldRunActionImmediatelyWhenAlreadyCancelled()
    {
        final CancellationToken token = CancellationToken.create();
        token.cancel("done");
        final MutableInteger runs = new MutableInteger();

        token.onCancel(runs::increment);

        assertEquals(1, runs.get());
    }

    @Test
    void shouldNotRunDeregisteredAction()
    {
        final CancellationToken token = CancellationToken.create();
        final MutableInteger runs = new MutableInteger();
        final CancellationToken.Registration registration = token.onCancel(runs::increment);

        registration.close();
        token.cancel("done");

        assertEquals(0, runs.get());
    }

    @Test
    void shouldDetachClosedChildrenFromParent()
    {
        final CancellationToken session = CancellationToken.create();
        for (int i = 0; i < 1_000; i++)
        {
            session.child().close();
        }

        final CancellationToken closed = session.child();
        closed.close();
        closed.close();
        assertEquals(0, session.registeredActions());

        session.cancel("logged out");
        assertFalse(closed.isCancelled());
    }

    @Test
    void shouldDeregisterChildFromParentWhenCancelled()
    {
        final CancellationToken parent = CancellationToken.create();
        parent.child().cancel("done");

        assertEquals(0, parent.registeredActions());
        assertFalse(parent.isCancelled());
    }

    @Test
    void shouldPropagateToChildButNotToParent()
    {
        final CancellationToken parent = CancellationToken.create();
        final CancellationToken child = parent.child();
        final CancellationToken other = parent.child();

        child.cancel("child only");
        assertFalse(parent.isCancelled());
        assertFalse(other.isCancelled());

        parent.cancel("shutdown");
        assertTrue(other.isCancelled());
        assertEquals("shutdown", other.reason());
    }

    @Test
    void shouldNeverCancelNone()
    {
        assertFalse(CancellationToken.NONE.cancel("nope"));
        assertFalse(CancellationToken.NONE.isCancelled());
        CancellationToken.NONE.throwIfCancelled();
    }

    @Test
    void shouldReportErrorsFromActions()
    {
        final MutableInteger errors = new MutableInteger();
        final CancellationToken token = CancellationToken.create((throwable) -> errors.increment());
        final MutableInteger runs = new MutableInteger();
        token.onCancel(() ->
        {
            throw new IllegalStateException("listener bug");
        });
        token.onCancel(runs::increment);

        token.cancel("stop");

        assertEquals(1, errors.get());
        assertEquals(1, runs.get());
        assertThrows(CancelledException.class, token::throwIfCancelled);
    }
}
