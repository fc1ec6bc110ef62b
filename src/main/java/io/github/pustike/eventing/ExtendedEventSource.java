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

import java.util.function.BiConsumer;
import java.util.function.BiPredicate;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * An {@link EventSource} that can also hold its subscribers weakly.
 *
 * <p>When {@code weak} is true the event source keeps only a {@link java.lang.ref.WeakReference} to the subscriber, so
 * the registration does not extend its lifetime. Once the subscriber has been garbage collected, the subscription is
 * skipped and removed during the next publish of its event type, without any call to unsubscribe.
 *
 * <p>For handler objects and owner subscriptions the subscriber is the handler or the owner object itself:
 * <pre>{@code
 * eventSource.subscribe(OrderPlaced.class, this, OrderView::onOrderPlaced, true);
 * }</pre>
 * A weak {@link Consumer} subscription holds the consumer instance, and its filter, weakly. A lambda or method
 * reference created inline at the call site is referenced by nothing else, so it may be collected as soon as the call
 * returns; subscribe through an owner instead.
 */
public interface ExtendedEventSource extends EventSource {
    /**
     * Subscribes a callback to events of the given type, optionally holding it weakly.
     * @param eventType the exact event type
     * @param callback the callback to invoke
     * @param weak whether the callback is held through a weak reference
     * @param <T> the type of event
     * @return the token that removes this subscription
     */
    <T> UnsubscribeToken subscribe(Class<T> eventType, Consumer<? super T> callback, boolean weak);

    /**
     * Subscribes a filtered callback to events of the given type, optionally holding the callback and filter
     * weakly.
     * @param eventType the exact event type
     * @param callback the callback to invoke
     * @param filter the predicate an event must satisfy to be passed to the callback
     * @param weak whether the callback and filter are held through weak references
     * @param <T> the type of event
     * @return the token that removes this subscription
     */
    <T> UnsubscribeToken subscribe(Class<T> eventType, Consumer<? super T> callback, Predicate<? super T> filter,
                                   boolean weak);

    /**
     * Registers a handler object for events of the given type, optionally holding it weakly.
     * @param eventType the exact event type
     * @param handler the handler to invoke
     * @param weak whether the handler is held through a weak reference
     * @param <T> the type of event
     * @return the token that removes this registration
     */
    <T> UnsubscribeToken registerHandlerFor(Class<T> eventType, EventHandler<? super T> handler, boolean weak);

    /**
     * Registers a handler object for the event type bound to its {@code EventHandler<T>} declaration, optionally
     * holding it weakly.
     * @param handler the handler to invoke
     * @param weak whether the handler is held through a weak reference
     * @return the token that removes this registration
     * @throws IllegalArgumentException if the event type of the handler cannot be determined from its class
     */
    UnsubscribeToken registerHandlerFor(EventHandler<?> handler, boolean weak);

    /**
     * Subscribes a callback on behalf of {@code owner}, optionally holding the owner weakly. The callback receives the
     * owner along with the event, and must not capture the owner itself, or a weak subscription would keep it
     * reachable. A method reference such as {@code Owner::onEvent} or a non-capturing lambda fits.
     * @param eventType the exact event type
     * @param owner the subscriber object whose lifetime governs the subscription
     * @param callback the callback to invoke with the owner and the event
     * @param weak whether the owner is held through a weak reference
     * @param <S> the type of the owner
     * @param <T> the type of event
     * @return the token that removes this subscription
     */
    <S, T> UnsubscribeToken subscribe(Class<T> eventType, S owner, BiConsumer<? super S, ? super T> callback,
                                      boolean weak);

    /**
     * Subscribes a filtered callback on behalf of {@code owner}, optionally holding the owner weakly. Neither the
     * callback nor the filter may capture the owner.
     * @param eventType the exact event type
     * @param owner the subscriber object whose lifetime governs the subscription
     * @param callback the callback to invoke with the owner and the event
     * @param filter the predicate, given the owner and the event, an event must satisfy to be passed to the callback
     * @param weak whether the owner is held through a weak reference
     * @param <S> the type of the owner
     * @param <T> the type of event
     * @return the token that removes this subscription
     */
    <S, T> UnsubscribeToken subscribe(Class<T> eventType, S owner, BiConsumer<? super S, ? super T> callback,
                                      BiPredicate<? super S, ? super T> filter, boolean weak);

    /**
     * Removes the earliest subscription made on behalf of this exact owner instance. Does nothing if the owner has no
     * subscription.
     * @param owner the owner passed when subscribing
     */
    void unsubscribeOwner(Object owner);
}
