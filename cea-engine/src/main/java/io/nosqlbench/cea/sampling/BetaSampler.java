package io.nosqlbench.cea.sampling;

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

import io.nosqlbench.cea.model.BetaDistributionModel;
import org.apache.commons.math3.distribution.BetaDistribution;

/**
 * Sampler for Beta distributions using the inverse CDF from Commons Math.
 *
 * <p>Values always lie in [0, 1], which makes Beta the distribution of
 * choice for probabilities and utilities.
 */
final class BetaSampler implements DistributionSampler {

    private final BetaDistribution distribution;

    BetaSampler(BetaDistributionModel model) {
        this.distribution = new BetaDistribution(model.getAlpha(), model.getBeta());
    }

    @Override
    public double sample(double u) {
        double x = distribution.inverseCumulativeProbability(DistributionSampler.clamp(u));
        return Math.max(0.0, Math.min(1.0, x));
    }
}
