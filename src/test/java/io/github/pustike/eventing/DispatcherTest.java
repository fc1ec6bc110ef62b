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

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Consumer;

import com.google.common.testing.GcFinalization;

import static com.google.common.truth.Truth.assertThat;

/**
 * Tests for {@link Dispatcher} implementations.
 */
public class DispatcherTest extends TestCase {
    private final SubscriberRegistry registry = new SubscriberRegistry();

    private final IntegerCallback i1 = new IntegerCallback("i1");
    private final IntegerCallback i2 = new IntegerCallback("i2");
    private final IntegerCallback i3 = new IntegerCallback("i3");
    private final List<Subscriber<?>> integerSubscribers = Arrays.asList(
            subscriber(Integer.class, i1),
            subscriber(Integer.class, i2),
            subscriber(Integer.class, i3));

    private final StringCallback s1 = new StringCallback("s1");
    private final StringCallback s2 = new StringCallback("s2");
    private final List<Subscriber<?>> stringSubscribers = Arrays.asList(
            subscriber(String.class, s1),
            subscriber(String.class, s2));

    private final ConcurrentLinkedQueue<Object> dispatchedSubscribers = new ConcurrentLinkedQueue<>();

    private Dispatcher dispatcher;

    public void testPerThreadQueuedDispatcher() {
        dispatcher = Dispatcher.perThreadDispatchQueue();
        dispatcher.dispatch(1, integerSubscribers.iterator(), registry);

        assertThat(dispatchedSubscribers)
                .containsExactly(
                        i1, i2, i3, // Integer subscribers are dispatched to first.
                        s1, s2,     // Though each integer subscriber dispatches to all string subscribers,
                        s1, s2,     // those string subscribers aren't actually dispatched to until all integer
                        s1, s2      // subscribers have finished.
                ).inOrder();
    }

    public void testImmediateDispatcher() {
        dispatcher = Dispatcher.immediate();
        dispatcher.dispatch(1, integerSubscribers.iterator(), registry);

        assertThat(dispatchedSubscribers)
                .containsExactly(
                        i1, s1, s2,  // Each integer subscriber immediately dispatches to 2 string subscribers.
                        i2, s1, s2,
                        i3, s1, s2
                ).inOrder();
    }

    public void testExpiredSubscribersArePrunedAfterPass() {
        dispatcher = Dispatcher.immediate();
        List<WeakReference<?>> references = new ArrayList<>();
        Subscriber<String> expired = expiredSubscriber(references);
        Subscriber<String> alive = subscriber(String.class, s1);
        registry.register(expired);
        registry.register(alive);
        GcFinalization.awaitClear(references.get(0));

        dispatcher.dispatch("hello", registry.getSubscribers(String.class), registry);

        assertThat(dispatchedSubscribers).containsExactly(s1);
        assertTrue(expired.isRemoved());
        assertThat(registry.getSubscribersForTesting(String.class)).containsExactly(alive);
    }

    public void testExpiredSubscribersArePrunedWhenSubscriberThrows() {
        for (Dispatcher candidate : Arrays.asList(Dispatcher.immediate(), Dispatcher.perThreadDispatchQueue())) {
            SubscriberRegistry registry = new SubscriberRegistry();
            List<WeakReference<?>> references = new ArrayList<>();
            Subscriber<String> expired = expiredSubscriber(references);
            RuntimeException failure = new RuntimeException("subscriber failed");
            Consumer<String> throwing = s -> {
                throw failure;
            };
            registry.register(expired);
            registry.register(Subscriber.forCallback(String.class, registry.nextSequence(), throwing, null, false));
            registry.register(subscriber(String.class, s2));
            GcFinalization.awaitClear(references.get(0));

            try {
                candidate.dispatch("hello", registry.getSubscribers(String.class), registry);
                fail("The subscriber exception should propagate.");
            } catch (RuntimeException e) {
                assertSame(failure, e);
            }
            assertTrue(expired.isRemoved());
            assertEquals(2, registry.getSubscribersForTesting(String.class).size());
        }
        assertThat(dispatchedSubscribers).isEmpty();
    }

    public void testQueuedDispatcherRecoversAfterException() {
        dispatcher = Dispatcher.perThreadDispatchQueue();
        Consumer<String> throwing = s -> {
            throw new IllegalStateException();
        };
        List<Subscriber<?>> failing = Arrays.asList(
                Subscriber.forCallback(String.class, registry.nextSequence(), throwing, null, false));
        try {
            dispatcher.dispatch("first", failing.iterator(), registry);
            fail("The subscriber exception should propagate.");
        } catch (IllegalStateException expected) {
            // expected
        }

        dispatcher.dispatch("second", stringSubscribers.iterator(), registry);
        assertThat(dispatchedSubscribers).containsExactly(s1, s2).inOrder();
    }

    private <T> Subscriber<T> subscriber(Class<T> eventType, Consumer<? super T> callback) {
        return Subscriber.forCallback(eventType, registry.nextSequence(), callback, null, false);
    }

    private Subscriber<String> expiredSubscriber(List<WeakReference<?>> references) {
        StringCallback callback = new StringCallback("expired");
        references.add(new WeakReference<>(callback));
        return Subscriber.forCallback(String.class, registry.nextSequence(), callback, null, true);
    }

    public final class IntegerCallback implements Consumer<Integer> {
        private final String name;

        public IntegerCallback(String name) {
            this.name = name;
        }

        @Override
        public void accept(Integer integer) {
            dispatchedSubscribers.add(this);
            dispatcher.dispatch("hello", stringSubscribers.iterator(), registry);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public final class StringCallback implements Consumer<String> {
        private final String name;

        public StringCallback(String name) {
            this.name = name;
        }

        @Override
        public void accept(String string) {
            dispatchedSubscribers.add(this);
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
