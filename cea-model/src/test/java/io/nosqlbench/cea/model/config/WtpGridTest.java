package io.nosqlbench.cea.model.config;

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
class WtpGridTest {

    @Test
    void rangeIncludesUpperBoundOnGrid() {
        WtpGrid grid = WtpGrid.range(0, 100_000, 25_000);
        assertArrayEquals(new double[]{0, 25_000, 50_000, 75_000, 100_000}, grid.points());
    }

    @Test
    void rangeStopsBelowUpperBoundOffGrid() {
        WtpGrid grid = WtpGrid.range(0, 90_000, 25_000);
        assertEquals(4, grid.size());
        assertEquals(75_000, grid.get(3));
    }

    @Test
    void fractionalStepsDoNotLosePoints() {
        assertEquals(11, WtpGrid.range(0, 1, 0.1).size());
    }

    @Test
    void singlePointRange() {
        WtpGrid grid = WtpGrid.range(50_000, 50_000, 1_000);
        assertEquals(1, grid.size());
        assertEquals(0, grid.indexOf(50_000));
    }

    @Test
    void explicitGridMustIncrease() {
        assertThrows(ValidationException.class, () -> WtpGrid.of(0, 50_000, 50_000));
        assertThrows(ValidationException.class, () -> WtpGrid.of());
        assertThrows(ValidationException.class, () -> WtpGrid.of(-1));
    }

    @Test
    void invalidRangesAreRejected() {
        assertThrows(ValidationException.class, () -> WtpGrid.range(10, 0, 1));
        assertThrows(ValidationException.class, () -> WtpGrid.range(0, 10, 0));
        assertThrows(ValidationException.class, () -> WtpGrid.range(0, Double.POSITIVE_INFINITY, 1));
    }

    @Test
    void indexOfMissingThreshold() {
        assertEquals(-1, WtpGrid.of(0, 50_000).indexOf(20_000));
        assertEquals(1, WtpGrid.of(0, 50_000).indexOf(50_000));
    }
}
