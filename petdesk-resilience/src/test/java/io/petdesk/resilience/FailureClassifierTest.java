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

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FailureClassifierTest
{
    private final FailureClassifier classifier = new FailureClassifier();

    @Test
    void shouldTreatNetworkFailuresAsTransient()
    {
        assertTrue(classifier.isRetryable(new ConnectException("Connection refused")));
        assertTrue(classifier.isRetryable(new SocketException("Connection reset")));
        assertTrue(classifier.isRetryable(new SocketTimeoutException("Read timed out")));
        assertTrue(classifier.isRetryable(new UnknownHostException("api.petdesk.io")));
        assertTrue(classifier.isRetryable(new TransientNetworkException("flaky")));
        assertEquals(5, classifier.transientCount());
    }

    @Test
    void shouldClassifyStatusCodes()
    {
        assertEquals(SyncException.Category.TRANSIENT, classifier.classify(new RequestStatusException(502, "bad gateway")));
        assertEquals(SyncException.Category.TRANSIENT, classifier.classify(new RequestStatusException(504, "timeout")));
        assertEquals(SyncException.Category.CONFLICT, classifier.classify(new RequestStatusException(409, "conflict")));
        assertEquals(SyncException.Category.FATAL, classifier.classify(new RequestStatusException(401, "unauthorised")));
        assertEquals(SyncException.Category.FATAL, classifier.classify(new RequestStatusException(500, "boom")));
    }

    @Test
    void shouldTreatUnknownFailuresAsFatal()
    {
        assertFalse(classifier.isRetryable(new IOException("disk")));
        assertFalse(classifier.isRetryable(new NullPointerException()));
        assertFalse(classifier.isRetryable(new CircuitOpenException("read", "open")));
        assertEquals(2, classifier.fatalCount());
    }

    @Test
    void shouldUnwrapFutureWrappers()
    {
        final ConnectException cause = new ConnectException("refused");

        assertSame(cause, FailureClassifier.unwrap(new CompletionException(new ExecutionException(cause))));
        assertTrue(classifier.isRetryable(new CompletionException(cause)));
    }

    @Test
    void shouldWrapCheckedFailuresAsFatal()
    {
        final RuntimeException unchecked = FailureClassifier.asUnchecked(new CompletionException(new IOException("disk")));

        assertTrue(unchecked instanceof FatalRequestException);
        assertTrue(unchecked.getCause() instanceof IOException);
    }
}
