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

import io.nosqlbench.cea.model.config.WtpGrid;

import java.util.List;

/// Cost-effectiveness acceptability curves: for each threshold, the
/// fraction of draws in which each strategy has the highest NMB.
///
/// Each row sums to 1. With no draws every probability is 0.
public final class CeacTable {

    private final List<String> strategyIds;
    private final WtpGrid grid;
    private final double[][] probabilities;

    CeacTable(List<String> strategyIds, WtpGrid grid, double[][] probabilities) {
        this.strategyIds = List.copyOf(strategyIds);
        this.grid = grid;
        this.probabilities = probabilities;
    }

    public List<String> strategyIds() {
        return strategyIds;
    }

    public WtpGrid grid() {
        return grid;
    }

    public double probability(int wtpIndex, int strategy) {
        return probabilities[wtpIndex][strategy];
    }

    /// Probability that a strategy is optimal at a threshold on the grid.
    public double probability(double wtp, String strategyId) {
        int w = grid.indexOf(wtp);
        if (w < 0) {
            throw new IllegalArgumentException("threshold " + wtp + " is not on the grid");
        }
        int s = strategyIds.indexOf(strategyId);
        if (s < 0) {
            throw new IllegalArgumentException("unknown strategy " + strategyId);
        }
        return probabilities[w][s];
    }

    public double rowSum(int wtpIndex) {
        double sum = 0.0;
        for (double p : probabilities[wtpIndex]) {
            sum += p;
        }
        return sum;
    }
}
