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

/// Closed set of distributions an uncertain model parameter may follow.
///
/// ## Variants
///
/// | Type | Class | Parameters | Support |
/// |------|-------|------------|---------|
/// | fixed | [FixedDistributionModel] | value | {value} |
/// | beta | [BetaDistributionModel] | α, β | [0, 1] |
/// | gamma | [GammaDistributionModel] | shape k, scale θ | [0, +∞) |
/// | lognormal | [LogNormalDistributionModel] | μ, σ (log scale) | (0, +∞) |
///
/// Each variant carries only its own validated parameters. Construction
/// with out-of-domain parameters raises
/// [io.nosqlbench.cea.model.errors.DistributionException]. New distribution
/// types are additions to the permitted list, never attribute bags.
///
/// ## Models vs Samplers
///
/// A DistributionModel is a pure description. Drawing values is done by a
/// sampler bound to the model in the engine module, which transforms a
/// uniform variate through the model's inverse CDF.
public sealed interface DistributionModel
    permits FixedDistributionModel, BetaDistributionModel, GammaDistributionModel, LogNormalDistributionModel {

    /// Returns the serialization type name, e.g. "beta".
    String getDistributionType();

    /// Returns the expected value, used for the deterministic base case.
    double mean();

    /// Returns the lower bound of the support.
    double lowerBound();

    /// Returns the upper bound of the support.
    double upperBound();

    /// Returns true when the distribution has no spread and consumes no
    /// random variate when sampled.
    default boolean isDegenerate() {
        return false;
    }
}
