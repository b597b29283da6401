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

import io.nosqlbench.cea.model.errors.AdoptionOverflowException;
import io.nosqlbench.cea.model.errors.ValidationException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class AdoptionCurveTest {

    @Test
    void explicitSharesAreReturnedByYear() {
        AdoptionCurve curve = new AdoptionCurve(3, Map.of("x", new double[]{0.1, 0.2, 0.3}));
        assertEquals(0.1, curve.share("x", 1));
        assertEquals(0.3, curve.share("x", 3));
        assertEquals(0.0, curve.share("y", 2));
        assertThrows(IndexOutOfBoundsException.class, () -> curve.share("x", 4));
    }

    @Test
    void sharesAboveOneInAYearOverflow() {
        Map<String, double[]> shares = new LinkedHashMap<>();
        shares.put("x", new double[]{0.5, 0.7});
        shares.put("y", new double[]{0.4, 0.4});
        AdoptionOverflowException e = assertThrows(AdoptionOverflowException.class,
            () -> new AdoptionCurve(2, shares));
        assertEquals(2, e.year());
        assertEquals(1.1, e.totalShare(), 1e-12);
    }

    @Test
    void sharesSummingToExactlyOneAreAccepted() {
        Map<String, double[]> shares = new LinkedHashMap<>();
        shares.put("x", new double[]{0.7});
        shares.put("y", new double[]{0.3});
        assertEquals(1.0, new AdoptionCurve(1, shares).totalShare(1), 1e-12);
    }

    @Test
    void malformedSeriesAreRejected() {
        assertThrows(ValidationException.class, () -> new AdoptionCurve(2, Map.of("x", new double[]{0.1})));
        assertThrows(ValidationException.class, () -> new AdoptionCurve(1, Map.of("x", new double[]{-0.1})));
        assertThrows(ValidationException.class, () -> new AdoptionCurve(0, Map.of()));
    }

    @Test
    void linearInterpolationReachesTarget() {
        AdoptionCurve curve = AdoptionCurve.interpolate(Map.of("x", 0.0), Map.of("x", 0.4), 4,
            AdoptionCurve.Shape.LINEAR);
        assertEquals(0.1, curve.share("x", 1), 1e-12);
        assertEquals(0.2, curve.share("x", 2), 1e-12);
        assertEquals(0.4, curve.share("x", 4), 1e-12);
    }

    @Test
    void sCurveIsHalfwayAtMidpoint() {
        AdoptionCurve curve = AdoptionCurve.interpolate(Map.of(), Map.of("x", 0.6), 10,
            AdoptionCurve.Shape.S_CURVE);
        assertEquals(0.3, curve.share("x", 5), 1e-12);
        assertTrue(curve.share("x", 2) < curve.share("x", 5));
        assertTrue(curve.share("x", 9) > curve.share("x", 5));
    }

    @Test
    void interpolatedOverflowIsRejected() {
        assertThrows(AdoptionOverflowException.class, () -> AdoptionCurve.interpolate(
            Map.of(), Map.of("x", 0.6, "y", 0.6), 3, AdoptionCurve.Shape.LINEAR));
    }

    @Test
    void budgetConfigGrowsPopulation() {
        BudgetImpactConfig config = BudgetImpactConfig.builder()
            .adoption(new AdoptionCurve(3, Map.of("x", new double[]{0.1, 0.2, 0.3})))
            .basePopulation(1000)
            .populationGrowth(0.1)
            .build();
        assertEquals(3, config.years());
        assertEquals(1000, config.eligiblePopulation(1), 1e-9);
        assertEquals(1210, config.eligiblePopulation(3), 1e-9);
    }

    @Test
    void budgetConfigRejectsOverfullBaseline() {
        BudgetImpactConfig.Builder builder = BudgetImpactConfig.builder()
            .adoption(new AdoptionCurve(1, Map.of("x", new double[]{0.1})))
            .baselineShare("a", 0.7)
            .baselineShare("b", 0.4);
        assertThrows(AdoptionOverflowException.class, builder::build);
    }

    @Test
    void budgetConfigNeedsAnAdoptionCurve() {
        assertThrows(ValidationException.class, () -> BudgetImpactConfig.builder().basePopulation(10).build());
    }
}
