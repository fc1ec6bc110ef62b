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

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.BiPredicate;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * A single registration on the bus: the exact event type, a strong or weak reference to the target and, for
 * callbacks, an optional filter. A weak callback subscription holds its filter weakly as well; an owner subscription
 * references the owner as its target and holds its non-capturing callback and filter strongly.
 *
 * <p>Two subscribers are never equal unless they are the same instance, so the same callback registered twice yields
 * two independent subscribers that are invoked and removed independently. Once created a subscriber does not change,
 * except for the one-way transition to the removed state.
 * @param <T> the type of event this subscriber receives
 */
abstract class Subscriber<T> {
    static <T> Subscriber<T> forCallback(Class<T> eventType, long sequence, Consumer<? super T> callback,
                                         Predicate<? super T> filter, boolean weak) {
        return new CallbackSubscriber<>(eventType, sequence,
                TargetReference.<Consumer<? super T>>of(callback, weak),
                filter != null ? TargetReference.<Predicate<? super T>>of(filter, weak) : null);
    }

    static <S, T> Subscriber<T> forOwner(Class<T> eventType, long sequence, S owner,
                                         BiConsumer<? super S, ? super T> callback,
                                         BiPredicate<? super S, ? super T> filter, boolean weak) {
        return new OwnerSubscriber<S, T>(eventType, sequence, TargetReference.<S>of(owner, weak), callback, filter);
    }

    static <T> Subscriber<T> forHandler(Class<T> eventType, long sequence, EventHandler<? super T> handler,
                                        boolean weak) {
        return new HandlerSubscriber<>(eventType, sequence,
                TargetReference.<EventHandler<? super T>>of(handler, weak));
    }

    /** The exact event type this subscriber is registered for. */
    final Class<T> eventType;

    /** Registration order of this subscriber across all event types of the bus. */
    final long sequence;

    private volatile boolean removed;

    private Subscriber(Class<T> eventType, long sequence) {
        this.eventType = Objects.requireNonNull(eventType);
        this.sequence = sequence;
    }

    /**
     * Dispatches {@code event} to the target of this subscriber, if it is still reachable and accepts the event.
     * @return false if the target has been garbage collected and this subscriber should be pruned
     */
    final boolean dispatchEvent(Object event) {
        return invokeSubscriber(eventType.cast(event));
    }

    abstract boolean invokeSubscriber(T event);

    /**
     * Returns the callback or handler object, or null if it was weakly held and has been collected.
     */
    abstract Object getTarget();

    abstract boolean isWeak();

    boolean isCallback() {
        return false;
    }

    boolean isHandler() {
        return false;
    }

    boolean isOwner() {
        return false;
    }

    boolean isRemoved() {
        return removed;
    }

    void markRemoved() {
        removed = true;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{eventType=" + eventType.getName() + ", sequence=" + sequence
                + ", weak=" + isWeak() + "}";
    }

    private static final class CallbackSubscriber<T> extends Subscriber<T> {
        private final TargetReference<Consumer<? super T>> callback;
        private final TargetReference<Predicate<? super T>> filter;

        private CallbackSubscriber(Class<T> eventType, long sequence, TargetReference<Consumer<? super T>> callback,
                                   TargetReference<Predicate<? super T>> filter) {
            super(eventType, sequence);
            this.callback = callback;
            this.filter = filter;
        }

        @Override
        boolean invokeSubscriber(T event) {
            Consumer<? super T> target = callback.get();
            if (target == null) {
                return false;
            }
            if (filter == null) {
                target.accept(event);
                return true;
            }
            Predicate<? super T> predicate = filter.get();
            if (predicate == null) {
                // a weak filter outlived by its callback ends the subscription
                return false;
            }
            if (predicate.test(event)) {
                target.accept(event);
            }
            return true;
        }

        @Override
        Object getTarget() {
            return callback.get();
        }

        @Override
        boolean isWeak() {
            return callback.isWeak();
        }

        @Override
        boolean isCallback() {
            return true;
        }
    }

    private static final class HandlerSubscriber<T> extends Subscriber<T> {
        private final TargetReference<EventHandler<? super T>> handler;

        private HandlerSubscriber(Class<T> eventType, long sequence, TargetReference<EventHandler<? super T>> handler) {
            super(eventType, sequence);
            this.handler = handler;
        }

        @Override
        boolean invokeSubscriber(T event) {
            EventHandler<? super T> target = handler.get();
            if (target == null) {
                return false;
            }
            if (target.canHandle(event)) {
                target.handle(event);
            }
            return true;
        }

        @Override
        Object getTarget() {
            return handler.get();
        }

        @Override
        boolean isWeak() {
            return handler.isWeak();
        }

        @Override
        boolean isHandler() {
            return true;
        }
    }

    private static final class OwnerSubscriber<S, T> extends Subscriber<T> {
        private final TargetReference<S> owner;
        private final BiConsumer<? super S, ? super T> callback;
        private final BiPredicate<? super S, ? super T> filter;

        private OwnerSubscriber(Class<T> eventType, long sequence, TargetReference<S> owner,
                                BiConsumer<? super S, ? super T> callback, BiPredicate<? super S, ? super T> filter) {
            super(eventType, sequence);
            this.owner = owner;
            this.callback = callback;
            this.filter = filter;
        }

        @Override
        boolean invokeSubscriber(T event) {
            S target = owner.get();
            if (target == null) {
                return false;
            }
            if (filter == null || filter.test(target, event)) {
                callback.accept(target, event);
            }
            return true;
        }

        @Override
        Object getTarget() {
            return owner.get();
        }

        @Override
        boolean isWeak() {
            return owner.isWeak();
        }

        @Override
        boolean isOwner() {
            return true;
        }
    }
}
