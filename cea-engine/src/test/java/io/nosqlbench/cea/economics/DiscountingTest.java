package io.nosqlbench.cea.economics;

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

import io.nosqlbench.cea.model.errors.ValidationException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class DiscountingTest {

    @Test
    void firstCycleIsUndiscounted() {
        assertEquals(1.0, new Discounting(0.035, 1.0 / 12).factor(0));
    }

    @Test
    void twelveMonthlyCyclesMakeOneYear() {
        assertEquals(1 / 1.035, new Discounting(0.035, 1.0 / 12).factor(12), 1e-12);
        assertEquals(1 / (1.035 * 1.035), new Discounting(0.035, 1.0).factor(2), 1e-12);
    }

    @Test
    void factorsDecrease() {
        double[] f = new Discounting(0.05, 1.0 / 12).factors(24);
        assertEquals(24, f.length);
        for (int c = 1; c < f.length; c++) {
            assertTrue(f[c] < f[c - 1]);
        }
    }

    @Test
    void zeroRateIsFlat() {
        double[] f = Discounting.none(1.0 / 12).factors(6);
        for (double v : f) {
            assertEquals(1.0, v);
        }
    }

    @Test
    void invalidRatesAreRejected() {
        assertThrows(ValidationException.class, () -> new Discounting(-0.01, 1));
        assertThrows(ValidationException.class, () -> new Discounting(1.0, 1));
        assertThrows(ValidationException.class, () -> new Discounting(0.03, 0));
    }
}
