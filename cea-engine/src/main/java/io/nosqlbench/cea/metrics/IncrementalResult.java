package io.nosqlbench.cea.metrics;

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

/// Deterministic result of one strategy against the reference.
///
/// @param strategyId the strategy
/// @param cost expected cost
/// @param qalys expected QALYs
/// @param deltaCost cost minus the reference's cost
/// @param deltaQaly QALYs minus the reference's QALYs
/// @param icer ratio against the reference
/// @param dominance frontier status
/// @param reference whether this is the reference strategy
public record IncrementalResult(String strategyId, double cost, double qalys, double deltaCost, double deltaQaly,
                                Icer icer, Dominance dominance, boolean reference) {

    /// Whether the strategy is dominated, strictly or by extension.
    public boolean dominated() {
        return dominance != Dominance.NONE;
    }
}
