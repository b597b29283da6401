package io.nosqlbench.cea.model;

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

import io.nosqlbench.cea.model.errors.DistributionException;
import io.nosqlbench.cea.model.errors.ValidationException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class DistributionModelTest {

    private static final double TOLERANCE = 1e-9;

    @Test
    void betaFromMomentsReproducesMoments() {
        BetaDistributionModel beta = BetaDistributionModel.fromMeanAndSe(0.3, 0.05);
        double a = beta.getAlpha();
        double b = beta.getBeta();
        assertEquals(0.3, beta.mean(), TOLERANCE);
        double variance = a * b / ((a + b) * (a + b) * (a + b + 1));
        assertEquals(0.05 * 0.05, variance, TOLERANCE);
    }

    @Test
    void gammaFromMomentsReproducesMoments() {
        GammaDistributionModel gamma = GammaDistributionModel.fromMeanAndSe(400, 40);
        assertEquals(400, gamma.mean(), 1e-6);
        assertEquals(100.0, gamma.getShape(), 1e-9);
        assertEquals(4.0, gamma.getScale(), 1e-9);
    }

    @Test
    void logNormalFromMomentsReproducesMean() {
        LogNormalDistributionModel ln = LogNormalDistributionModel.fromMeanAndSe(6000, 600);
        assertEquals(6000, ln.mean(), 1e-6);
    }

    @Test
    void fixedModelIsDegenerate() {
        FixedDistributionModel fixed = new FixedDistributionModel(0.25);
        assertTrue(fixed.isDegenerate());
        assertEquals(0.25, fixed.mean());
        assertFalse(new BetaDistributionModel(2, 3).isDegenerate());
    }

    @Test
    void outOfDomainParametersAreRejected() {
        assertThrows(DistributionException.class, () -> new BetaDistributionModel(0, 1));
        assertThrows(DistributionException.class, () -> new BetaDistributionModel(1, Double.NaN));
        assertThrows(DistributionException.class, () -> new GammaDistributionModel(-1, 1));
        assertThrows(DistributionException.class, () -> new LogNormalDistributionModel(0, 0));
        assertThrows(DistributionException.class, () -> BetaDistributionModel.fromMeanAndSe(1.2, 0.1));
        assertThrows(DistributionException.class, () -> BetaDistributionModel.fromMeanAndSe(0.5, 0.6));
        assertThrows(DistributionException.class, () -> GammaDistributionModel.fromMeanAndSe(100, 0));
    }

    @Test
    void distributionErrorsAreValidationErrors() {
        DistributionException e = assertThrows(DistributionException.class, () -> new GammaDistributionModel(1, -2));
        assertInstanceOf(ValidationException.class, e);
        assertEquals("gamma", e.subject());
    }
}
