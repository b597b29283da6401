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

import io.nosqlbench.cea.model.LogNormalDistributionModel;
import org.apache.commons.math3.distribution.LogNormalDistribution;

/**
 * Sampler for log-normal distributions using the inverse CDF from Commons Math.
 *
 * <p>Commons Math names the log-scale mean "scale" and the log-scale
 * standard deviation "shape".
 */
final class LogNormalSampler implements DistributionSampler {

    private final LogNormalDistribution distribution;

    LogNormalSampler(LogNormalDistributionModel model) {
        this.distribution = new LogNormalDistribution(model.getMu(), model.getSigma());
    }

    @Override
    public double sample(double u) {
        return Math.max(0.0, distribution.inverseCumulativeProbability(DistributionSampler.clamp(u)));
    }
}
