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

/// Incremental net monetary benefit of a comparator with one parameter at
/// its low and high values.
public record OneWayResult(ParameterBounds bounds, double baseOutcome, double lowOutcome, double highOutcome) {

    public String parameter() {
        return bounds.parameter();
    }

    /// Width of the tornado bar, `|high - low|`.
    public double range() {
        return Math.abs(highOutcome - lowOutcome);
    }

    /// Whether moving this parameter across its range changes the sign of
    /// the incremental net benefit, which flips the decision.
    public boolean changesDecision() {
        return Math.signum(lowOutcome) != Math.signum(highOutcome);
    }
}
