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
import io.nosqlbench.cea.model.DistributionModel;
import io.nosqlbench.cea.model.FixedDistributionModel;
import io.nosqlbench.cea.model.GammaDistributionModel;
import io.nosqlbench.cea.model.LogNormalDistributionModel;

/// Factory for creating bound [DistributionSampler] instances.
///
/// Type dispatch happens here, once per parameter, not on every draw.
///
/// ```java
/// DistributionSampler sampler = DistributionSamplerFactory.forModel(new BetaDistributionModel(60, 40));
/// double p = sampler.sample(0.5);
/// ```
public final class DistributionSamplerFactory {

    private DistributionSamplerFactory() {
        // Factory class, no instantiation
    }

    /// Creates a sampler bound to the given model.
    ///
    /// @param model the distribution model
    /// @return a sampler bound to the model's parameters
    /// @throws IllegalArgumentException if the model type is not supported
    public static DistributionSampler forModel(DistributionModel model) {
        if (model instanceof FixedDistributionModel) {
            return new FixedSampler((FixedDistributionModel) model);
        } else if (model instanceof BetaDistributionModel) {
            return new BetaSampler((BetaDistributionModel) model);
        } else if (model instanceof GammaDistributionModel) {
            return new GammaSampler((GammaDistributionModel) model);
        } else if (model instanceof LogNormalDistributionModel) {
            return new LogNormalSampler((LogNormalDistributionModel) model);
        } else {
            throw new IllegalArgumentException(
                "No sampler for distribution type: " + model.getClass().getName());
        }
    }
}
