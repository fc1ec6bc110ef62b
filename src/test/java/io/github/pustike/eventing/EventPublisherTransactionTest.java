/*
 * Copyright (C) 2016-2026 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.github.pustike.eventing;

import junit.framework.TestCase;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.truth.Truth.assertThat;

/**
 * Tests for {@link EventPublisherTransaction}.
 */
public class EventPublisherTransactionTest extends TestCase {
    private final EventBus bus = new EventBus();
    private final List<Object> received = new ArrayList<>();

    @Override
    protected void setUp() throws Exception {
        super.setUp();
        bus.subscribe(String.class, received::add);
        bus.subscribe(Integer.class, received::add);
    }

    public void testEventsHeldUntilPublished() {
        EventPublisherTransaction transaction = bus.createTransaction();
        transaction.publish("first");
        transaction.publish(2);
        transaction.publish("third");

        assertThat(received).isEmpty();
        assertEquals(3, transaction.getPendingEventCount());

        transaction.publishAllEvents();

        assertThat(received).containsExactly("first", 2, "third").inOrder();
        assertEquals(0, transaction.getPendingEventCount());
    }

    public void testDiscardAllEvents() {
        EventPublisherTransaction transaction = bus.createTransaction();
        transaction.publish("dropped");
        transaction.discardAllEvents();

        transaction.publish("kept");
        transaction.publishAllEvents();

        assertThat(received).containsExactly("kept");
    }

    public void testCloseDiscardsPendingEvents() {
        try (EventPublisherTransaction transaction = bus.createTransaction()) {
            transaction.publish("committed");
            transaction.publishAllEvents();
            transaction.publish("never committed");
        }
        assertThat(received).containsExactly("committed");
    }

    public void testFailingSubscriberLeavesRemainingEventsBuffered() {
        RuntimeException failure = new IllegalStateException("no doubles today");
        bus.subscribe(Double.class, value -> {
            throw failure;
        });
        EventPublisherTransaction transaction = bus.createTransaction();
        transaction.publish("before");
        transaction.publish(1.0d);
        transaction.publish("after");

        try {
            transaction.publishAllEvents();
            fail("The subscriber exception should propagate.");
        } catch (IllegalStateException e) {
            assertSame(failure, e);
        }
        assertThat(received).containsExactly("before");
        assertEquals(1, transaction.getPendingEventCount());

        transaction.publishAllEvents();
        assertThat(received).containsExactly("before", "after").inOrder();
    }

    public void testNullEventRejected() {
        EventPublisherTransaction transaction = bus.createTransaction();
        try {
            transaction.publish(null);
            fail("NullPointerException expected");
        } catch (NullPointerException expected) {
            assertEquals(0, transaction.getPendingEventCount());
        }
    }
}
