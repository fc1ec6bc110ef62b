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

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of subscribers to a single event bus, indexed by exact event type.
 */
final class SubscriberRegistry {
    private static final Logger logger = LoggerFactory.getLogger(SubscriberRegistry.class);

    /**
     * All registered subscribers, indexed by event type, in registration order.
     *
     * <p>The {@link CopyOnWriteArrayList} values make it easy and relatively lightweight to get an immutable snapshot
     * of all current subscribers to an event without any locking, while still allowing the same target to be
     * registered more than once.
     */
    private final ConcurrentMap<Class<?>, CopyOnWriteArrayList<Subscriber<?>>> subscribers;

    /** Source of the registration order across event types. */
    private final AtomicLong sequence;

    SubscriberRegistry() {
        this.subscribers = new ConcurrentHashMap<>();
        this.sequence = new AtomicLong();
    }

    long nextSequence() {
        return sequence.incrementAndGet();
    }

    /**
     * Appends the subscriber to the list of its event type. Duplicate targets are accepted.
     */
    void register(Subscriber<?> subscriber) {
        subscribers.computeIfAbsent(subscriber.eventType, key -> new CopyOnWriteArrayList<>()).add(subscriber);
    }

    /**
     * Removes exactly this subscriber, if it is still registered.
     * @return true if the subscriber was removed by this call
     */
    boolean unregister(Subscriber<?> subscriber) {
        CopyOnWriteArrayList<Subscriber<?>> currentSubscribers = subscribers.get(subscriber.eventType);
        // don't try to remove the list if it's empty; that can't be done safely without a lock
        // anyway, if the list is empty it'll just be wrapping an array of length 0
        if (currentSubscribers != null && currentSubscribers.remove(subscriber)) {
            subscriber.markRemoved();
            return true;
        }
        return false;
    }

    /**
     * Removes the first registered callback subscriber, across all event types, whose target is {@code callback}.
     */
    boolean unregisterCallback(Object callback) {
        return unregisterFirst(subscribers.values(), s -> s.isCallback() && s.getTarget() == callback);
    }

    /**
     * Removes the first registered callback subscriber for {@code eventType} whose target is {@code callback}.
     */
    boolean unregisterCallback(Class<?> eventType, Object callback) {
        CopyOnWriteArrayList<Subscriber<?>> currentSubscribers = subscribers.get(eventType);
        return currentSubscribers != null && unregisterFirst(Collections.singletonList(currentSubscribers),
                s -> s.isCallback() && s.getTarget() == callback);
    }

    /**
     * Removes the first registered handler subscriber, across all event types, whose target is {@code handler}.
     */
    boolean unregisterHandler(Object handler) {
        return unregisterFirst(subscribers.values(), s -> s.isHandler() && s.getTarget() == handler);
    }

    /**
     * Removes the first registered owner subscriber, across all event types, whose owner is {@code owner}.
     */
    boolean unregisterOwner(Object owner) {
        return unregisterFirst(subscribers.values(), s -> s.isOwner() && s.getTarget() == owner);
    }

    private boolean unregisterFirst(Collection<? extends List<Subscriber<?>>> candidates,
                                    Predicate<Subscriber<?>> matcher) {
        // a concurrent removal may win the race for the first match, so retry with the next one
        while (true) {
            Subscriber<?> first = null;
            for (List<Subscriber<?>> eventSubscribers : candidates) {
                for (Subscriber<?> subscriber : eventSubscribers) {
                    if (matcher.test(subscriber)) {
                        if (first == null || subscriber.sequence < first.sequence) {
                            first = subscriber;
                        }
                        break;
                    }
                }
            }
            if (first == null) {
                return false;
            }
            if (unregister(first)) {
                return true;
            }
        }
    }

    /**
     * Gets an iterator representing an immutable snapshot of all subscribers to the given event type at the time this
     * method is called.
     */
    Iterator<Subscriber<?>> getSubscribers(Class<?> eventType) {
        CopyOnWriteArrayList<Subscriber<?>> eventSubscribers = subscribers.get(eventType);
        return eventSubscribers != null ? eventSubscribers.iterator() : Collections.emptyIterator();
    }

    /**
     * Removes subscribers whose weakly held target has been garbage collected.
     */
    void prune(Collection<Subscriber<?>> expiredSubscribers) {
        for (Subscriber<?> subscriber : expiredSubscribers) {
            if (unregister(subscriber)) {
                logger.debug("Pruned expired subscriber {}", subscriber);
            }
        }
    }

    /**
     * Clear all subscribers.
     */
    void clear() {
        int count = 0;
        for (CopyOnWriteArrayList<Subscriber<?>> eventSubscribers : subscribers.values()) {
            for (Subscriber<?> subscriber : eventSubscribers) {
                if (unregister(subscriber)) {
                    count++;
                }
            }
        }
        logger.debug("Cleared {} subscribers", count);
    }

    List<Subscriber<?>> getSubscribersForTesting(Class<?> eventType) {
        CopyOnWriteArrayList<Subscriber<?>> eventSubscribers = subscribers.get(eventType);
        return eventSubscribers != null ? Collections.unmodifiableList(eventSubscribers) : Collections.emptyList();
    }
}
