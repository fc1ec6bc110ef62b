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

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Finds the event type {@code T} of an {@link EventHandler EventHandler&lt;T&gt;} implementation from its generic
 * supertypes, caching the result per handler class.
 *
 * <p>Type arguments bound anywhere in the class hierarchy are followed, so both
 * {@code class A implements EventHandler<Foo>} and {@code class B extends AbstractHandler<Foo>} resolve to
 * {@code Foo}. Lambdas, raw implementations and handlers that leave {@code T} unbound cannot be resolved.
 */
final class HandlerTypeResolver {
    private final Map<Class<?>, Class<?>> eventTypeCache;

    HandlerTypeResolver() {
        this.eventTypeCache = new ConcurrentHashMap<>();
    }

    /**
     * Returns the event type handled by the given handler class.
     * @param handlerClass the concrete handler class
     * @return the event type bound to {@code EventHandler<T>}
     * @throws IllegalArgumentException if the handler class does not bind {@code T} to a concrete type
     */
    Class<?> resolveEventType(Class<?> handlerClass) {
        return eventTypeCache.computeIfAbsent(handlerClass, this::resolveEventTypeNotCached);
    }

    /**
     * Discards all cached entries.
     */
    void invalidateAll() {
        eventTypeCache.clear();
    }

    Class<?> resolveEventTypeNotCached(Class<?> handlerClass) {
        Class<?> eventType = resolve(handlerClass, Collections.emptyMap());
        if (eventType == null) {
            String message = "Cannot resolve the event type of handler %s."
                    + " Register it with an explicit event type instead.";
            throw new IllegalArgumentException(String.format(message, handlerClass.getName()));
        }
        return eventType;
    }

    private static Class<?> resolve(Type type, Map<TypeVariable<?>, Type> bindings) {
        Class<?> rawType;
        Map<TypeVariable<?>, Type> typeBindings;
        if (type instanceof ParameterizedType) {
            ParameterizedType parameterizedType = (ParameterizedType) type;
            rawType = (Class<?>) parameterizedType.getRawType();
            Type[] typeArguments = parameterizedType.getActualTypeArguments();
            if (rawType == EventHandler.class) {
                return toClass(substitute(typeArguments[0], bindings));
            }
            TypeVariable<?>[] typeParameters = rawType.getTypeParameters();
            typeBindings = new HashMap<>();
            for (int i = 0; i < typeParameters.length; i++) {
                typeBindings.put(typeParameters[i], substitute(typeArguments[i], bindings));
            }
        } else if (type instanceof Class) {
            rawType = (Class<?>) type;
            if (rawType == EventHandler.class) {// raw use, nothing to resolve
                return null;
            }
            typeBindings = Collections.emptyMap();
        } else {
            return null;
        }
        for (Type interfaceType : rawType.getGenericInterfaces()) {
            Class<?> eventType = resolve(interfaceType, typeBindings);
            if (eventType != null) {
                return eventType;
            }
        }
        Type superclass = rawType.getGenericSuperclass();
        return superclass != null ? resolve(superclass, typeBindings) : null;
    }

    private static Type substitute(Type type, Map<TypeVariable<?>, Type> bindings) {
        if (type instanceof TypeVariable) {
            Type bound = bindings.get(type);
            return bound != null ? bound : type;
        }
        return type;
    }

    private static Class<?> toClass(Type type) {
        if (type instanceof Class) {
            return (Class<?>) type;
        } else if (type instanceof ParameterizedType) {
            return (Class<?>) ((ParameterizedType) type).getRawType();
        }
        return null;
    }
}
