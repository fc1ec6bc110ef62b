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

import com.google.common.testing.GcFinalization;

/**
 * Tests for {@link TargetReference}.
 */
public class TargetReferenceTest extends TestCase {
    private Object retained;

    public void testStrongReferenceKeepsTargetAlive() {
        TargetReference<Object> reference = TargetReference.strong(new Object());

        GcFinalization.awaitFullGc();

        assertTrue(reference.isAlive());
        assertNotNull(reference.get());
        assertFalse(reference.isWeak());
    }

    public void testWeakReferenceResolvesReachableTarget() {
        retained = new Object();
        TargetReference<Object> reference = TargetReference.weak(retained);

        GcFinalization.awaitFullGc();

        assertTrue(reference.isWeak());
        assertTrue(reference.isAlive());
        assertSame(retained, reference.get());
    }

    public void testWeakReferenceDoesNotKeepTargetAlive() {
        WeakReference<?>[] probe = new WeakReference<?>[1];
        TargetReference<Object> reference = weaklyHeldTarget(probe);

        GcFinalization.awaitClear(probe[0]);

        assertFalse(reference.isAlive());
        assertNull(reference.get());
    }

    public void testNullTargetRejected() {
        try {
            TargetReference.of(null, true);
            fail("NullPointerException expected");
        } catch (NullPointerException expected) {
            // expected
        }
    }

    private static TargetReference<Object> weaklyHeldTarget(WeakReference<?>[] probe) {
        Object target = new Object();
        probe[0] = new WeakReference<>(target);
        return TargetReference.weak(target);
    }
}
