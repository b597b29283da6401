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

import io.nosqlbench.cea.economics.StrategyOutcome;

import java.util.List;

/// Outcomes of every strategy under one named scenario.
public final class ScenarioResult {

    private final String name;
    private final List<StrategyOutcome> outcomes;
    private final double[] incrementalNmb;

    public ScenarioResult(String name, List<StrategyOutcome> outcomes, double[] incrementalNmb) {
        this.name = name;
        this.outcomes = List.copyOf(outcomes);
        this.incrementalNmb = incrementalNmb.clone();
    }

    public String name() {
        return name;
    }

    public List<StrategyOutcome> outcomes() {
        return outcomes;
    }

    /// Incremental net monetary benefit of strategy s against the reference;
    /// 0 for the reference itself.
    public double incrementalNmb(int s) {
        return incrementalNmb[s];
    }
}
