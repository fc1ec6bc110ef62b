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

import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Source of events that subscribers can register with. Every registration made through this interface is strong:
 * the event source keeps the callback or handler reachable until it is unsubscribed.
 *
 * <p>Subscriptions are keyed by the exact event type. The same callback or handler may be registered several times,
 * and each registration is then invoked once per published event.
 */
public interface EventSource {
    /**
     * Subscribes a callback to events of the given type.
     * @param eventType the exact event type
     * @param callback the callback to invoke
     * @param <T> the type of event
     * @return the token that removes this subscription
     * @throws NullPointerException if any argument is null
     */
    <T> UnsubscribeToken subscribe(Class<T> eventType, Consumer<? super T> callback);

    /**
     * Subscribes a callback to the events of the given type that satisfy the filter. An event rejected by the filter
     * is skipped, and the subscription stays registered for the next one.
     * @param eventType the exact event type
     * @param callback the callback to invoke
     * @param filter the predicate an event must satisfy to be passed to the callback
     * @param <T> the type of event
     * @return the token that removes this subscription
     * @throws NullPointerException if any argument is null
     */
    <T> UnsubscribeToken subscribe(Class<T> eventType, Consumer<? super T> callback, Predicate<? super T> filter);

    /**
     * Registers a handler object for events of the given type.
     * @param eventType the exact event type
     * @param handler the handler to invoke
     * @param <T> the type of event
     * @return the token that removes this registration
     * @throws NullPointerException if any argument is null
     */
    <T> UnsubscribeToken registerHandlerFor(Class<T> eventType, EventHandler<? super T> handler);

    /**
     * Registers a handler object for the event type bound to its {@code EventHandler<T>} declaration.
     * @param handler the handler to invoke
     * @return the token that removes this registration
     * @throws NullPointerException if handler is null
     * @throws IllegalArgumentException if the event type of the handler cannot be determined from its class, as is the
     * case for lambdas
     */
    UnsubscribeToken registerHandlerFor(EventHandler<?> handler);

    /**
     * Removes the subscription represented by the token. Unknown or already removed subscriptions are ignored.
     * @param token the token returned when subscribing
     * @throws NullPointerException if token is null
     */
    void unsubscribe(UnsubscribeToken token);

    /**
     * Removes the earliest subscription of this exact callback instance. Callbacks are compared by identity, so a
     * method reference or lambda must be kept in order to be unsubscribed this way. Does nothing if no subscription
     * matches.
     * @param callback the callback instance passed when subscribing
     * @throws NullPointerException if callback is null
     */
    void unsubscribe(Consumer<?> callback);

    /**
     * Removes the earliest registration of this exact handler instance. Does nothing if no registration matches.
     * @param handler the handler instance passed when registering
     * @throws NullPointerException if handler is null
     */
    void unregisterHandlerFor(EventHandler<?> handler);
}
