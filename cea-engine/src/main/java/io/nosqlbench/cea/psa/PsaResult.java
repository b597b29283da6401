package io.nosqlbench.cea.psa;

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

import io.nosqlbench.cea.model.ParameterTable;

import java.util.List;

/// Draws of a probabilistic run, ordered by iteration.
///
/// A cancelled run returns the draws completed so far with `complete`
/// set to false.
public final class PsaResult {

    private final List<String> strategyIds;
    private final ParameterTable parameters;
    private final List<SimulationDraw> draws;
    private final List<Long> failedIterations;
    private final boolean complete;

    public PsaResult(List<String> strategyIds, ParameterTable parameters, List<SimulationDraw> draws,
                     List<Long> failedIterations, boolean complete) {
        this.strategyIds = List.copyOf(strategyIds);
        this.parameters = parameters;
        this.draws = List.copyOf(draws);
        this.failedIterations = List.copyOf(failedIterations);
        this.complete = complete;
    }

    public List<String> strategyIds() {
        return strategyIds;
    }

    public int strategyCount() {
        return strategyIds.size();
    }

    public ParameterTable parameters() {
        return parameters;
    }

    public List<SimulationDraw> draws() {
        return draws;
    }

    public int iterationCount() {
        return draws.size();
    }

    public List<Long> failedIterations() {
        return failedIterations;
    }

    public int skippedCount() {
        return failedIterations.size();
    }

    public boolean isComplete() {
        return complete;
    }

    /// Costs indexed by draw, then strategy.
    public double[][] costs() {
        double[][] costs = new double[draws.size()][strategyIds.size()];
        for (int i = 0; i < draws.size(); i++) {
            for (int s = 0; s < strategyIds.size(); s++) {
                costs[i][s] = draws.get(i).cost(s);
            }
        }
        return costs;
    }

    /// QALYs indexed by draw, then strategy.
    public double[][] qalys() {
        double[][] qalys = new double[draws.size()][strategyIds.size()];
        for (int i = 0; i < draws.size(); i++) {
            for (int s = 0; s < strategyIds.size(); s++) {
                qalys[i][s] = draws.get(i).qalys(s);
            }
        }
        return qalys;
    }

    /// Realised values of one parameter, one per draw.
    public double[] parameterColumn(String name) {
        int index = parameters.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("unknown parameter " + name);
        }
        double[] column = new double[draws.size()];
        for (int i = 0; i < draws.size(); i++) {
            column[i] = draws.get(i).parameterValue(index);
        }
        return column;
    }
}
