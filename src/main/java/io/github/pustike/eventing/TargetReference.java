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

import java.lang.ref.WeakReference;
import java.util.Objects;

/**
 * Holder of a subscription target, either strongly or through a {@link WeakReference}.
 *
 * <p>A weak holder never keeps its target reachable: once the target has been garbage collected, {@link #get()}
 * returns {@code null} and {@link #isAlive()} returns {@code false}, permanently.
 * @param <T> the type of the target
 */
abstract class TargetReference<T> {
    /**
     * Creates a holder that keeps the target alive for as long as the holder itself is reachable.
     */
    static <T> TargetReference<T> strong(T target) {
        return new StrongReference<>(target);
    }

    /**
     * Creates a holder that does not extend the lifetime of the target.
     */
    static <T> TargetReference<T> weak(T target) {
        return new WeakTargetReference<>(target);
    }

    static <T> TargetReference<T> of(T target, boolean weak) {
        return weak ? weak(target) : strong(target);
    }

    /**
     * Returns the target, or {@code null} if it is no longer reachable.
     */
    abstract T get();

    abstract boolean isWeak();

    final boolean isAlive() {
        return get() != null;
    }

    private static final class StrongReference<T> extends TargetReference<T> {
        private final T target;

        private StrongReference(T target) {
            this.target = Objects.requireNonNull(target);
        }

        @Override
        T get() {
            return target;
        }

        @Override
        boolean isWeak() {
            return false;
        }
    }

    private static final class WeakTargetReference<T> extends TargetReference<T> {
        private final WeakReference<T> reference;

        private WeakTargetReference(T target) {
            this.reference = new WeakReference<>(Objects.requireNonNull(target));
        }

        @Override
        T get() {
            return reference.get();
        }

        @Override
        boolean isWeak() {
            return true;
        }
    }
}
