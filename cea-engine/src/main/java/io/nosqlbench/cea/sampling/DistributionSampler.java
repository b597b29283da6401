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

/// Sampler bound to one parameter distribution.
///
/// ## Overview
///
/// The sampler is created once per parameter, with the distribution's
/// parameters extracted at construction. Sampling needs only the uniform
/// input, so the per-iteration hot path does no type dispatch.
///
/// ```text
///   Construction (once)                    Sampling (per iteration)
///  ┌───────────────────┐                 ┌─────────────────┐
///  │ DistributionModel │                 │   double u      │
///  │ beta(α, β), ...   │ ──► Sampler ◄── │   ∈ (0,1)       │
///  └───────────────────┘     (bound)     └────────┬────────┘
///                                                 ▼
///                                        ┌─────────────────┐
///                                        │ F⁻¹(u)          │
///                                        └─────────────────┘
/// ```
///
/// Using the inverse CDF makes every sampler monotone in u, which is what
/// lets parameters that share a uniform variate keep their rank correlation.
///
/// @see DistributionSamplerFactory
@FunctionalInterface
public interface DistributionSampler {

    /// Lower clamp applied to every uniform before inversion.
    double U_MIN = 1e-12;
    /// Upper clamp applied to every uniform before inversion.
    double U_MAX = 1.0 - 1e-12;

    /// Returns the quantile of the bound distribution at u.
    ///
    /// @param u a value in the open interval (0, 1)
    /// @return a value within the distribution's support
    double sample(double u);

    /// Whether this sampler ignores its input. Such samplers consume no
    /// uniform variate.
    default boolean consumesUniform() {
        return true;
    }

    /// Clamps u into [U_MIN, U_MAX].
    static double clamp(double u) {
        return Math.max(U_MIN, Math.min(U_MAX, u));
    }
}
