package io.nosqlbench.cea.metrics;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class IcerTest {

    @Test
    void northEastIsDefined() {
        Icer icer = Icer.of(200, 0.5);
        assertEquals(Icer.Status.DEFINED, icer.status());
        assertEquals(400.0, icer.value().getAsDouble(), 1e-9);
    }

    @Test
    void cheaperAndBetterIsDominant() {
        Icer icer = Icer.of(-100, 0.25);
        assertEquals(Icer.Status.DOMINANT, icer.status());
        assertTrue(icer.hasValue());
        assertTrue(icer.value().getAsDouble() <= 0);
    }

    @Test
    void costlierAndWorseHasNoValue() {
        Icer icer = Icer.of(400, -0.5);
        assertEquals(Icer.Status.DOMINATED, icer.status());
        assertFalse(icer.hasValue());
        assertTrue(icer.value().isEmpty());
    }

    @Test
    void southWestIsSavingsPerQalyForgone() {
        Icer icer = Icer.of(-300, -0.1);
        assertEquals(Icer.Status.DEFINED, icer.status());
        assertEquals(3000.0, icer.value().getAsDouble(), 1e-9);
    }

    @Test
    void zeroQalyDifferenceIsUndefined() {
        assertEquals(Icer.Status.UNDEFINED, Icer.of(100, 0.0).status());
        assertEquals(Icer.Status.UNDEFINED, Icer.of(100, 1e-12).status());
        assertTrue(Icer.undefined().value().isEmpty());
    }

    @Test
    void valuesAreNeverNonFinite() {
        double[] costs = {-1e6, -1, 0, 1, 1e6};
        double[] qalys = {-2, -1e-6, 0, 1e-6, 2};
        for (double c : costs) {
            for (double q : qalys) {
                Icer icer = Icer.of(c, q);
                if (icer.hasValue()) {
                    assertTrue(Double.isFinite(icer.value().getAsDouble()), icer.toString());
                }
            }
        }
    }
}
