package io.nosqlbench.cea.dsa;

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

/// Low and high values of one varied parameter, with its base-case value.
///
/// @param parameter parameter name
/// @param base value in the base case (the distribution mean)
/// @param low value used for the low run
/// @param high value used for the high run
/// @param explicit whether the range was declared rather than taken from quantiles
public record ParameterBounds(String parameter, double base, double low, double high, boolean explicit) {

    /// Returns `steps` evenly spaced values from low to high inclusive.
    public double[] linspace(int steps) {
        double[] values = new double[steps];
        for (int i = 0; i < steps; i++) {
            values[i] = i == steps - 1 ? high : low + (high - low) * i / (steps - 1);
        }
        return values;
    }
}
