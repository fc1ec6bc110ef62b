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

import java.util.Iterator;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.BiPredicate;
import java.util.function.Consumer;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches events to subscribers, and provides ways for subscribers to register themselves.
 *
 * <p>The EventBus allows publish-subscribe-style communication between components without requiring the components to
 * explicitly register with one another (and thus be aware of each other). It is designed exclusively to replace
 * traditional Java in-process event distribution using explicit registration. It is <em>not</em> a general-purpose
 * publish-subscribe system, nor is it intended for interprocess communication.
 *
 * <h2>Receiving Events</h2> <p>To receive events, a component either subscribes a callback for an event type, with
 * {@link #subscribe(Class, Consumer)}, or registers an {@link EventHandler} object, with
 * {@link #registerHandlerFor(EventHandler)}. Callbacks can be given a filter, and handlers can decline events in
 * {@link EventHandler#canHandle(Object)}. Every registration returns an {@link UnsubscribeToken}.
 *
 * <h2>Posting Events</h2> <p>To post an event, simply provide the event object to the {@link #publish(Object)} method.
 * Events are routed based on their exact class: an event is delivered only to the subscribers registered for
 * {@code event.getClass()}, not to those registered for its superclasses or interfaces.
 *
 * <p>When {@code publish} is called, all registered subscribers for an event are run in sequence on the calling thread,
 * in registration order, so subscribers should be reasonably quick. Handlers may mutate the event; later handlers and
 * the publisher see the changes. Exceptions thrown by subscribers are not caught: they propagate out of
 * {@code publish}, and subscribers after the failing one are not called for that event.
 *
 * <h2>Weak Subscriptions</h2> <p>Subscriptions made with {@code weak = true} do not keep their subscriber reachable.
 * Once the subscriber has been garbage collected, the subscription is removed during the next publish of its event
 * type. To tie a callback to the lifetime of the object it belongs to, subscribe it on behalf of that owner with
 * {@link #subscribe(Class, Object, BiConsumer, boolean)}.
 *
 * <p>This class is safe for concurrent use. Registrations and removals made while an event is being dispatched take
 * effect from the next publish on.
 */
public final class EventBus implements ExtendedEventSource, EventPublisher, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EventBus.class);
    // the identifier for this event bus
    private final String identifier;
    // handler for dispatching events to subscribers
    private final Dispatcher dispatcher;
    private final SubscriberRegistry subscriberRegistry;
    private final HandlerTypeResolver handlerTypeResolver;

    /**
     * Creates a new EventBus named "default".
     */
    public EventBus() {
        this("default");
    }

    /**
     * Creates a new EventBus with the given {@code identifier}.
     * @param identifier a brief name for this bus, for logging purposes.
     */
    public EventBus(String identifier) {
        this(identifier, Dispatcher.immediate());
    }

    /**
     * Creates a new EventBus with the given {@code identifier} and {@code dispatcher}.
     * @param identifier a brief name for this bus, for logging purposes.
     * @param dispatcher handler for dispatching events to subscribers
     */
    public EventBus(String identifier, Dispatcher dispatcher) {
        this.identifier = Objects.requireNonNull(identifier);
        this.dispatcher = Objects.requireNonNull(dispatcher);
        this.subscriberRegistry = new SubscriberRegistry();
        this.handlerTypeResolver = new HandlerTypeResolver();
    }

    /**
     * Returns the identifier for this event bus.
     */
    public String getIdentifier() {
        return identifier;
    }

    @Override
    public <T> UnsubscribeToken subscribe(Class<T> eventType, Consumer<? super T> callback) {
        return subscribe(eventType, callback, false);
    }

    @Override
    public <T> UnsubscribeToken subscribe(Class<T> eventType, Consumer<? super T> callback,
                                          Predicate<? super T> filter) {
        return subscribe(eventType, callback, filter, false);
    }

    @Override
    public <T> UnsubscribeToken subscribe(Class<T> eventType, Consumer<? super T> callback, boolean weak) {
        checkEventType(eventType);
        Objects.requireNonNull(callback, "callback");
        return register(Subscriber.forCallback(eventType, subscriberRegistry.nextSequence(), callback, null, weak));
    }

    @Override
    public <T> UnsubscribeToken subscribe(Class<T> eventType, Consumer<? super T> callback,
                                          Predicate<? super T> filter, boolean weak) {
        checkEventType(eventType);
        Objects.requireNonNull(callback, "callback");
        Objects.requireNonNull(filter, "filter");
        return register(Subscriber.forCallback(eventType, subscriberRegistry.nextSequence(), callback, filter, weak));
    }

    @Override
    public <T> UnsubscribeToken registerHandlerFor(Class<T> eventType, EventHandler<? super T> handler) {
        return registerHandlerFor(eventType, handler, false);
    }

    @Override
    public UnsubscribeToken registerHandlerFor(EventHandler<?> handler) {
        return registerHandlerFor(handler, false);
    }

    @Override
    public <T> UnsubscribeToken registerHandlerFor(Class<T> eventType, EventHandler<? super T> handler,
                                                   boolean weak) {
        checkEventType(eventType);
        Objects.requireNonNull(handler, "handler");
        return register(Subscriber.forHandler(eventType, subscriberRegistry.nextSequence(), handler, weak));
    }

    @Override
    public UnsubscribeToken registerHandlerFor(EventHandler<?> handler, boolean weak) {
        Objects.requireNonNull(handler, "handler");
        Class<?> eventType = handlerTypeResolver.resolveEventType(handler.getClass());
        return registerResolvedHandler(eventType, handler, weak);
    }

    @SuppressWarnings("unchecked")
    private <T> UnsubscribeToken registerResolvedHandler(Class<T> eventType, EventHandler<?> handler, boolean weak) {
        return registerHandlerFor(eventType, (EventHandler<? super T>) handler, weak);
    }

    @Override
    public <S, T> UnsubscribeToken subscribe(Class<T> eventType, S owner, BiConsumer<? super S, ? super T> callback,
                                             boolean weak) {
        checkEventType(eventType);
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(callback, "callback");
        return register(Subscriber.forOwner(eventType, subscriberRegistry.nextSequence(), owner, callback, null, weak));
    }

    @Override
    public <S, T> UnsubscribeToken subscribe(Class<T> eventType, S owner, BiConsumer<? super S, ? super T> callback,
                                             BiPredicate<? super S, ? super T> filter, boolean weak) {
        checkEventType(eventType);
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(callback, "callback");
        Objects.requireNonNull(filter, "filter");
        return register(Subscriber.forOwner(eventType, subscriberRegistry.nextSequence(), owner, callback, filter,
                weak));
    }

    // published events are always objects, so a primitive type would never match
    private static void checkEventType(Class<?> eventType) {
        Objects.requireNonNull(eventType, "eventType");
        if (eventType.isPrimitive()) {
            throw new IllegalArgumentException("Primitive event type " + eventType
                    + " can never be published, subscribe to its wrapper class instead.");
        }
    }

    private UnsubscribeToken register(Subscriber<?> subscriber) {
        subscriberRegistry.register(subscriber);
        logger.trace("Registered {} on {}", subscriber, this);
        return new UnsubscribeToken(subscriberRegistry, subscriber);
    }

    @Override
    public void unsubscribe(UnsubscribeToken token) {
        Objects.requireNonNull(token, "token").close();
    }

    @Override
    public void unsubscribe(Consumer<?> callback) {
        Objects.requireNonNull(callback, "callback");
        if (subscriberRegistry.unregisterCallback(callback)) {
            logger.trace("Unsubscribed callback {} from {}", callback, this);
        }
    }

    /**
     * Removes the earliest subscription of this exact callback instance for the given event type, leaving its
     * subscriptions to other event types in place. Does nothing if no subscription matches.
     * @param eventType the exact event type
     * @param callback the callback instance passed when subscribing
     */
    public void unsubscribe(Class<?> eventType, Consumer<?> callback) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(callback, "callback");
        if (subscriberRegistry.unregisterCallback(eventType, callback)) {
            logger.trace("Unsubscribed callback {} for {} from {}", callback, eventType.getName(), this);
        }
    }

    @Override
    public void unregisterHandlerFor(EventHandler<?> handler) {
        Objects.requireNonNull(handler, "handler");
        if (subscriberRegistry.unregisterHandler(handler)) {
            logger.trace("Unregistered handler {} from {}", handler, this);
        }
    }

    @Override
    public void unsubscribeOwner(Object owner) {
        Objects.requireNonNull(owner, "owner");
        if (subscriberRegistry.unregisterOwner(owner)) {
            logger.trace("Unsubscribed owner {} from {}", owner, this);
        }
    }

    /**
     * Posts an event to all subscribers registered for its exact class. This method returns after the event has been
     * dispatched to all of them, unless one of them throws, in which case the exception is propagated as is.
     *
     * <p>An event without subscribers is silently dropped.
     * @param event event to post.
     */
    @Override
    public void publish(Object event) {
        Objects.requireNonNull(event, "event");
        Iterator<Subscriber<?>> eventSubscribers = subscriberRegistry.getSubscribers(event.getClass());
        if (eventSubscribers.hasNext()) {
            dispatcher.dispatch(event, eventSubscribers, subscriberRegistry);
        }
    }

    /**
     * Creates a transaction that buffers events until they are published all together or discarded.
     * @return a new transaction publishing to this bus
     */
    public EventPublisherTransaction createTransaction() {
        return new EventPublisherTransaction(this);
    }

    /**
     * Removes all subscriptions from this bus. Tokens issued earlier become inactive.
     */
    @Override
    public void close() {
        subscriberRegistry.clear();
        handlerTypeResolver.invalidateAll();
    }

    SubscriberRegistry registry() {
        return subscriberRegistry;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{identifier=" + identifier + "}";
    }
}
