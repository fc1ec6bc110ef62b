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

import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle to exactly one subscription, returned by every registration method of an {@link EventSource}.
 *
 * <p>Closing the token removes its subscription from the bus. This can be done explicitly, through
 * {@link EventSource#unsubscribe(UnsubscribeToken)}, or by scoping the subscription with try-with-resources:
 * <pre>{@code
 * try (UnsubscribeToken token = eventBus.subscribe(OrderPlaced.class, this::onOrderPlaced)) {
 *     eventBus.publish(new OrderPlaced(order));
 * }
 * }</pre>
 * Closing is idempotent: once the subscription is gone, by whatever path, further calls have no effect.
 */
public final class UnsubscribeToken implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(UnsubscribeToken.class);
    private final SubscriberRegistry registry;
    private final Subscriber<?> subscriber;
    private final AtomicBoolean closed;

    UnsubscribeToken(SubscriberRegistry registry, Subscriber<?> subscriber) {
        this.registry = registry;
        this.subscriber = subscriber;
        this.closed = new AtomicBoolean();
    }

    /**
     * Gets the event type of the subscription.
     * @return the exact event type the subscription was registered for
     */
    public Class<?> getEventType() {
        return subscriber.eventType;
    }

    /**
     * Gets the identifier of the subscription, unique within its event bus and increasing in registration order.
     * @return the subscription identifier
     */
    public long getId() {
        return subscriber.sequence;
    }

    /**
     * Checks whether the subscription is still registered. A subscription becomes inactive when this token is closed,
     * when its target is unsubscribed by identity, when a weakly held target has been pruned, or when the bus is
     * closed.
     * @return true if the subscription is still registered
     */
    public boolean isActive() {
        return !subscriber.isRemoved();
    }

    /**
     * Removes the subscription from the bus, if it is still registered.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true) && registry.unregister(subscriber)) {
            logger.trace("Unsubscribed {}", subscriber);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + getId() + ", eventType=" + getEventType().getName()
                + ", active=" + isActive() + "}";
    }
}
