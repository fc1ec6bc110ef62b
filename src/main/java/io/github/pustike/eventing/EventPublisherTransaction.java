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

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Buffer for events that are published to the underlying bus as one block, or not at all.
 *
 * <p>Events passed to {@link #publish(Object)} are only collected. {@link #publishAllEvents()} hands them to the bus in
 * the order they were collected, and {@link #discardAllEvents()} drops them. Closing the transaction discards the
 * events that have not been published yet, so a transaction scoped with try-with-resources publishes nothing unless
 * it was committed:
 * <pre>{@code
 * try (EventPublisherTransaction transaction = eventBus.createTransaction()) {
 *     transaction.publish(new OrderPlaced(order));
 *     transaction.publish(new StockReserved(order));
 *     transaction.publishAllEvents();
 * }
 * }</pre>
 * A transaction is meant to be used by a single thread and is not safe for concurrent use.
 */
public final class EventPublisherTransaction implements EventPublisher, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EventPublisherTransaction.class);
    private final EventPublisher eventPublisher;
    private final Queue<Object> pendingEvents;

    EventPublisherTransaction(EventPublisher eventPublisher) {
        this.eventPublisher = Objects.requireNonNull(eventPublisher);
        this.pendingEvents = new ArrayDeque<>();
    }

    /**
     * Adds the event to the buffer of this transaction.
     * @param event the event to publish later
     */
    @Override
    public void publish(Object event) {
        pendingEvents.offer(Objects.requireNonNull(event, "event"));
    }

    /**
     * Publishes all buffered events, in the order they were added. Each event leaves the buffer before it is
     * published, so if a subscriber throws, the events after the failing one remain buffered.
     */
    public void publishAllEvents() {
        Object event;
        while ((event = pendingEvents.poll()) != null) {
            eventPublisher.publish(event);
        }
    }

    /**
     * Drops all buffered events.
     */
    public void discardAllEvents() {
        if (!pendingEvents.isEmpty()) {
            logger.debug("Discarding {} pending events", pendingEvents.size());
            pendingEvents.clear();
        }
    }

    /**
     * Returns the number of events waiting to be published.
     */
    public int getPendingEventCount() {
        return pendingEvents.size();
    }

    @Override
    public void close() {
        discardAllEvents();
    }
}
