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
 * Publishes events to the subscribers of their exact runtime type.
 */
public interface EventPublisher {
    /**
     * Publishes an event to all subscribers registered for {@code event.getClass()}. Subscribers to supertypes or
     * interfaces of the event class are not notified.
     *
     * <p>Subscribers are invoked synchronously on the calling thread, in registration order. An exception thrown by
     * a subscriber propagates to the caller and the remaining subscribers are not invoked for this event.
     * @param event the event to publish
     * @throws NullPointerException if event is null
     */
    void publish(Object event);
}
