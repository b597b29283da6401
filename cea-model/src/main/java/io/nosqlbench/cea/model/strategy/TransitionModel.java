package io.nosqlbench.cea.model.strategy;

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

import io.nosqlbench.cea.model.SampledParameters;

import java.util.List;

/// Builds the transition matrix a strategy applies in a given cycle.
///
/// The cycle index lets a model express time-varying hazards, for example
/// an elevated relapse risk in the first months after treatment.
public interface TransitionModel {

    /// Returns the health states the produced matrices range over.
    StateSpace stateSpace();

    /// Builds the matrix for one cycle.
    ///
    /// @param cycle zero-based cycle index
    /// @param parameters the iteration's realised parameter values
    /// @return the transition matrix, not yet validated
    TransitionMatrix matrixFor(int cycle, SampledParameters parameters);

    /// Returns the names of the parameters this model reads.
    default List<String> requiredParameters() {
        return List.of();
    }
}
