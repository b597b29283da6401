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

import java.util.List;

/// Everything the deterministic sensitivity analysis produces.
///
/// @param tornadoes one-way results, one per non-reference strategy
/// @param twoWay two-way grids, one per declared pair and non-reference strategy
/// @param scenarios one result per declared scenario
public record SensitivityResults(List<TornadoResult> tornadoes, List<TwoWayResult> twoWay,
                                 List<ScenarioResult> scenarios) {

    public SensitivityResults {
        tornadoes = List.copyOf(tornadoes);
        twoWay = List.copyOf(twoWay);
        scenarios = List.copyOf(scenarios);
    }
}
