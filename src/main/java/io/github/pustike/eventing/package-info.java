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
/**
 * Pustike Eventing is an in-process event bus keyed by exact event type, derived from the Guava EventBus design but
 * registering callbacks and handler objects explicitly instead of scanning for annotated methods.
 *
 * <p>It provides: <li>Callback subscriptions with optional filters <li>Handler objects that may mutate events in
 * place <li>Strong or weak registrations, weak ones pruned once their subscriber is garbage collected
 * <li>Unsubscription by token, try-with-resources or identity <li>Exceptions thrown by subscribers propagating to the
 * publisher <li>Transactions buffering events until they are published together
 */
package io.github.pustike.eventing;
