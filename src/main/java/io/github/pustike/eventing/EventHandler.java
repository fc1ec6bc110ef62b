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

/**
 * A long-lived event handler object, registered with an {@link EventSource} by reference so that it can later be
 * unregistered by passing the same instance.
 *
 * <p>Handlers are invoked in registration order and may mutate the event in place; handlers registered later
 * observe the changes made by the earlier ones, and so does the publisher once {@link EventPublisher#publish(Object)}
 * returns.
 * @param <T> the exact type of event handled
 */
public interface EventHandler<T> {
    /**
     * Handles the published event.
     * @param event the event, never null
     */
    void handle(T event);

    /**
     * Checks whether this handler wants to receive the given event. A handler that returns {@code false} is skipped
     * for this event only and stays registered.
     * @param event the event, never null
     * @return true by default
     */
    default boolean canHandle(T event) {
        return true;
    }
}
