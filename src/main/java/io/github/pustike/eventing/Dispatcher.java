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
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Queue;

/**
 * Handler for dispatching events to subscribers, providing different event ordering guarantees that make sense for
 * different situations.
 *
 * <p>Both dispatchers run every subscriber on the publishing thread, in the order of the snapshot they were given, and
 * let any exception thrown by a subscriber propagate to the publisher. Subscribers found to have lost their weakly
 * held target during a pass are removed from the registry once the pass ends, whether or not it completed normally.
 */
public abstract class Dispatcher {
    /**
     * Returns a dispatcher that queues events that are published reentrantly on a thread that is already dispatching
     * an event, guaranteeing that all events published on a single thread are dispatched to all subscribers in the
     * order they are published.
     *
     * <p>This yields a breadth-first dispatch order on each thread. That is, all subscribers to a single event A will
     * be called before any subscribers to any events B and C that are published by the subscribers to A. A reentrant
     * publish returns before its event has been dispatched. If a subscriber throws, events still queued on that thread
     * are discarded.
     * @return the per thread dispatcher
     */
    public static Dispatcher perThreadDispatchQueue() {
        return new PerThreadQueuedDispatcher();
    }

    /**
     * Returns a dispatcher that dispatches events to subscribers immediately as they're published without using an
     * intermediate queue to change the dispatch order. This is effectively a depth-first dispatch order, vs.
     * breadth-first when using a queue.
     * @return the immediate dispatcher
     */
    public static Dispatcher immediate() {
        return ImmediateDispatcher.INSTANCE;
    }

    /**
     * Dispatches the given {@code event} to the given {@code subscribers}.
     */
    abstract void dispatch(Object event, Iterator<Subscriber<?>> subscribers, SubscriberRegistry registry);

    /**
     * Runs one dispatch pass over the snapshot and prunes the subscribers whose target has been collected.
     */
    static void dispatchAll(Object event, Iterator<Subscriber<?>> subscribers, SubscriberRegistry registry) {
        List<Subscriber<?>> expiredSubscribers = null;
        try {
            while (subscribers.hasNext()) {
                Subscriber<?> subscriber = subscribers.next();
                if (!subscriber.dispatchEvent(event)) {
                    if (expiredSubscribers == null) {
                        expiredSubscribers = new ArrayList<>();
                    }
                    expiredSubscribers.add(subscriber);
                }
            }
        } finally {
            if (expiredSubscribers != null) {
                registry.prune(expiredSubscribers);
            }
        }
    }

    /**
     * Implementation of a {@link #perThreadDispatchQueue()} dispatcher.
     */
    private static final class PerThreadQueuedDispatcher extends Dispatcher {
        /**
         * Per-thread queue of events to dispatch.
         */
        private final ThreadLocal<Queue<Event>> queue = ThreadLocal.withInitial(ArrayDeque::new);
        /**
         * Per-thread dispatch state, used to avoid reentrant event dispatching.
         */
        private final ThreadLocal<Boolean> dispatching = ThreadLocal.withInitial(() -> false);

        @Override
        void dispatch(Object event, Iterator<Subscriber<?>> subscribers, SubscriberRegistry registry) {
            Objects.requireNonNull(event);
            Objects.requireNonNull(subscribers);
            Queue<Event> queueForThread = queue.get();
            queueForThread.offer(new Event(event, subscribers, registry));

            if (!dispatching.get()) {
                dispatching.set(true);
                try {
                    Event nextEvent;
                    while ((nextEvent = queueForThread.poll()) != null) {
                        dispatchAll(nextEvent.event, nextEvent.subscribers, nextEvent.registry);
                    }
                } finally {
                    dispatching.remove();
                    queue.remove();
                }
            }
        }

        private static final class Event {
            private final Object event;
            private final Iterator<Subscriber<?>> subscribers;
            private final SubscriberRegistry registry;

            private Event(Object event, Iterator<Subscriber<?>> subscribers, SubscriberRegistry registry) {
                this.event = event;
                this.subscribers = subscribers;
                this.registry = registry;
            }
        }
    }

    /**
     * Implementation of {@link #immediate()}.
     */
    private static final class ImmediateDispatcher extends Dispatcher {
        private static final ImmediateDispatcher INSTANCE = new ImmediateDispatcher();

        @Override
        void dispatch(Object event, Iterator<Subscriber<?>> subscribers, SubscriberRegistry registry) {
            Objects.requireNonNull(event);
            dispatchAll(event, subscribers, registry);
        }
    }
}
