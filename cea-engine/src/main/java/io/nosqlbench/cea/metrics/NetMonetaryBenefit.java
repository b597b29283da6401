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
import io.nosqlbench.cea.psa.SimulationDraw;

import java.util.List;

/// Expected net monetary benefit of every strategy at every threshold.
///
/// `NMB(s, w) = w × qaly(s) - cost(s)`, averaged over draws. The
/// incremental NMB of a strategy is its expected NMB minus the reference's.
public final class NetMonetaryBenefit {

    private final List<String> strategyIds;
    private final WtpGrid grid;
    private final int referenceIndex;
    private final double[][] expected;

    private NetMonetaryBenefit(List<String> strategyIds, WtpGrid grid, int referenceIndex, double[][] expected) {
        this.strategyIds = strategyIds;
        this.grid = grid;
        this.referenceIndex = referenceIndex;
        this.expected = expected;
    }

    /// Averages NMB over draws.
    public static NetMonetaryBenefit of(List<String> strategyIds, int referenceIndex, List<SimulationDraw> draws,
                                        WtpGrid grid) {
        int strategies = strategyIds.size();
        double[][] expected = new double[grid.size()][strategies];
        if (!draws.isEmpty()) {
            double[] meanCost = new double[strategies];
            double[] meanQaly = new double[strategies];
            for (SimulationDraw draw : draws) {
                for (int s = 0; s < strategies; s++) {
                    meanCost[s] += draw.cost(s);
                    meanQaly[s] += draw.qalys(s);
                }
            }
            for (int s = 0; s < strategies; s++) {
                meanCost[s] /= draws.size();
                meanQaly[s] /= draws.size();
            }
            for (int w = 0; w < grid.size(); w++) {
                for (int s = 0; s < strategies; s++) {
                    expected[w][s] = nmb(meanCost[s], meanQaly[s], grid.get(w));
                }
            }
        }
        return new NetMonetaryBenefit(List.copyOf(strategyIds), grid, referenceIndex, expected);
    }

    public static double nmb(double cost, double qalys, double wtp) {
        return wtp * qalys - cost;
    }

    /// Index of the largest value; exact ties go to the lowest index.
    public static int argmax(double[] values) {
        int best = 0;
        for (int s = 1; s < values.length; s++) {
            if (values[s] > values[best]) {
                best = s;
            }
        }
        return best;
    }

    public List<String> strategyIds() {
        return strategyIds;
    }

    public WtpGrid grid() {
        return grid;
    }

    public double expected(int wtpIndex, int strategy) {
        return expected[wtpIndex][strategy];
    }

    public double incremental(int wtpIndex, int strategy) {
        return expected[wtpIndex][strategy] - expected[wtpIndex][referenceIndex];
    }

    /// Strategy with the highest expected NMB at a threshold.
    public int optimal(int wtpIndex) {
        return argmax(expected[wtpIndex]);
    }
}
