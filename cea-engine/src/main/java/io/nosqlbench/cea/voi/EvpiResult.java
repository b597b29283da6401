package io.nosqlbench.cea.voi;

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

import java.util.List;

/// Expected value of perfect information over a threshold grid, with the
/// estimate at the policy threshold singled out.
public final class EvpiResult {

    private final List<VoiEstimate> estimates;
    private final VoiEstimate atPolicy;
    private final int iterations;

    public EvpiResult(List<VoiEstimate> estimates, VoiEstimate atPolicy, int iterations) {
        this.estimates = List.copyOf(estimates);
        this.atPolicy = atPolicy;
        this.iterations = iterations;
    }

    public List<VoiEstimate> estimates() {
        return estimates;
    }

    public VoiEstimate get(int wtpIndex) {
        return estimates.get(wtpIndex);
    }

    /// Estimate at the policy-relevant threshold.
    public VoiEstimate atPolicy() {
        return atPolicy;
    }

    public int iterations() {
        return iterations;
    }

    /// Whether any threshold's estimate is flagged low precision.
    public boolean lowPrecision() {
        for (VoiEstimate estimate : estimates) {
            if (estimate.lowPrecision()) {
                return true;
            }
        }
        return atPolicy.lowPrecision();
    }
}
