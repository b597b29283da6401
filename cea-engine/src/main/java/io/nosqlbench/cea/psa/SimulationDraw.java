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

import com.google.gson.annotations.SerializedName;
import io.nosqlbench.cea.economics.StrategyOutcome;

import java.util.Arrays;

/// Outcome of one probabilistic iteration: the realised parameter values
/// and, per strategy index, the discounted cost and QALYs.
public final class SimulationDraw {

    @SerializedName("iteration")
    private final long iteration;

    @SerializedName("seed")
    private final long seed;

    @SerializedName("parameters")
    private final double[] parameterValues;

    @SerializedName("costs")
    private final double[] costs;

    @SerializedName("qalys")
    private final double[] qalys;

    public SimulationDraw(long iteration, long seed, double[] parameterValues, double[] costs, double[] qalys) {
        if (costs.length != qalys.length) {
            throw new IllegalArgumentException("cost and QALY arrays differ in length");
        }
        this.iteration = iteration;
        this.seed = seed;
        this.parameterValues = parameterValues.clone();
        this.costs = costs.clone();
        this.qalys = qalys.clone();
    }

    /// Builds a draw from per-strategy outcomes in registry order.
    public static SimulationDraw of(long iteration, long seed, double[] parameterValues, StrategyOutcome[] outcomes) {
        double[] costs = new double[outcomes.length];
        double[] qalys = new double[outcomes.length];
        for (int s = 0; s < outcomes.length; s++) {
            costs[s] = outcomes[s].cost();
            qalys[s] = outcomes[s].qalys();
        }
        return new SimulationDraw(iteration, seed, parameterValues, costs, qalys);
    }

    public long iteration() {
        return iteration;
    }

    public long seed() {
        return seed;
    }

    public double[] parameterValues() {
        return parameterValues.clone();
    }

    public double parameterValue(int index) {
        return parameterValues[index];
    }

    public int strategyCount() {
        return costs.length;
    }

    public double cost(int strategy) {
        return costs[strategy];
    }

    public double qalys(int strategy) {
        return qalys[strategy];
    }

    /// Net monetary benefit of a strategy at a threshold: `wtp × qalys - cost`.
    public double nmb(int strategy, double wtp) {
        return wtp * qalys[strategy] - costs[strategy];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SimulationDraw)) return false;
        SimulationDraw that = (SimulationDraw) o;
        return iteration == that.iteration && seed == that.seed
            && Arrays.equals(parameterValues, that.parameterValues)
            && Arrays.equals(costs, that.costs)
            && Arrays.equals(qalys, that.qalys);
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(iteration);
        result = 31 * result + Long.hashCode(seed);
        result = 31 * result + Arrays.hashCode(costs);
        result = 31 * result + Arrays.hashCode(qalys);
        return result;
    }

    @Override
    public String toString() {
        return "SimulationDraw[iteration=" + iteration + ", costs=" + Arrays.toString(costs)
            + ", qalys=" + Arrays.toString(qalys) + "]";
    }
}
