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

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class SensitivityConfigTest {

    @Test
    void defaultsUseTheFifthAndNinetyFifthPercentiles() {
        SensitivityConfig config = SensitivityConfig.defaults();
        assertEquals(0.05, config.lowerPercentile());
        assertEquals(0.95, config.upperPercentile());
        assertTrue(config.ranges().isEmpty());
        assertTrue(config.scenarios().isEmpty());
        assertTrue(config.twoWay().isEmpty());
        assertTrue(config.range("anything").isEmpty());
    }

    @Test
    void percentilesMustBeOrderedInsideTheUnitInterval() {
        assertThrows(ValidationException.class, () -> SensitivityConfig.builder().percentiles(0.0, 0.9));
        assertThrows(ValidationException.class, () -> SensitivityConfig.builder().percentiles(0.1, 1.0));
        assertThrows(ValidationException.class, () -> SensitivityConfig.builder().percentiles(0.6, 0.4));
        assertEquals(0.1, SensitivityConfig.builder().percentiles(0.1, 0.9).build().lowerPercentile());
    }

    @Test
    void rangesAreCheckedAndUnique() {
        ValidationException reversed = assertThrows(ValidationException.class,
            () -> SensitivityConfig.builder().range("c_drug", 10, 5));
        assertEquals("c_drug", reversed.subject());
        assertThrows(ValidationException.class,
            () -> SensitivityConfig.builder().range("c_drug", Double.NaN, 5));
        assertThrows(ValidationException.class,
            () -> SensitivityConfig.builder().range("c_drug", 1, 2).range("c_drug", 3, 4));

        SensitivityConfig point = SensitivityConfig.builder().range("q", 0.2, 0.2).build();
        assertEquals(0.2, point.range("q").orElseThrow().high());
    }

    @Test
    void scenarioNamesMustBeUniqueAndValuesFinite() {
        assertThrows(ValidationException.class, () -> SensitivityConfig.builder()
            .scenario("cheap", Map.of("c", 1.0))
            .scenario("cheap", Map.of("c", 2.0)));
        assertThrows(ValidationException.class,
            () -> SensitivityConfig.builder().scenario(" ", Map.of("c", 1.0)));
        assertThrows(ValidationException.class,
            () -> SensitivityConfig.builder().scenario("broken", Map.of("c", Double.POSITIVE_INFINITY)));
    }

    @Test
    void twoWayNeedsDistinctParametersAndTwoSteps() {
        assertThrows(ValidationException.class, () -> SensitivityConfig.builder().twoWay("a", "a", 3));
        assertThrows(ValidationException.class, () -> SensitivityConfig.builder().twoWay("a", "b", 1));
    }

    @Test
    void referencedParametersCoverEverySetting() {
        SensitivityConfig config = SensitivityConfig.builder()
            .range("a", 0, 1)
            .scenario("s", Map.of("b", 2.0))
            .twoWay("c", "d", 4)
            .build();
        assertThat(config.referencedParameters()).containsExactly("a", "b", "c", "d");
    }
}
