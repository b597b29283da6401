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

import io.nosqlbench.cea.model.errors.InvalidTransitionException;

import java.util.Arrays;

/// Square matrix of per-cycle transition probabilities, rows indexed by the
/// state a cohort fraction leaves and columns by the state it enters.
///
/// Instances are immutable. [#validate(String, int)] checks the
/// row-stochastic invariant: every entry is non-negative and every row sums
/// to 1 within [#ROW_SUM_TOLERANCE].
public final class TransitionMatrix {

    public static final double ROW_SUM_TOLERANCE = 1e-9;

    private final double[][] probabilities;

    public TransitionMatrix(double[][] probabilities) {
        int n = probabilities.length;
        double[][] copy = new double[n][];
        for (int i = 0; i < n; i++) {
            if (probabilities[i].length != n) {
                throw new IllegalArgumentException("transition matrix must be square, row " + i
                    + " has " + probabilities[i].length + " columns for " + n + " rows");
            }
            copy[i] = probabilities[i].clone();
        }
        this.probabilities = copy;
    }

    public int size() {
        return probabilities.length;
    }

    public double get(int from, int to) {
        return probabilities[from][to];
    }

    /// Returns a copy of one row.
    public double[] row(int from) {
        return probabilities[from].clone();
    }

    /// Checks the row-stochastic invariant.
    ///
    /// @param strategyId the strategy the matrix belongs to, for diagnostics
    /// @param cycle the cycle the matrix applies to, for diagnostics
    /// @return this matrix
    /// @throws InvalidTransitionException on a negative or non-finite entry,
    ///         or a row sum outside 1 ± 1e-9
    public TransitionMatrix validate(String strategyId, int cycle) {
        for (int i = 0; i < probabilities.length; i++) {
            double sum = 0.0;
            for (int j = 0; j < probabilities.length; j++) {
                double p = probabilities[i][j];
                if (!Double.isFinite(p) || p < 0.0) {
                    throw new InvalidTransitionException(strategyId, cycle, i,
                        "probability to column " + j + " is " + p);
                }
                sum += p;
            }
            if (Math.abs(sum - 1.0) > ROW_SUM_TOLERANCE) {
                throw new InvalidTransitionException(strategyId, cycle, i,
                    String.format("row sums to %.12f", sum));
            }
        }
        return this;
    }

    /// Adds an external death probability to every row except the absorbing one.
    ///
    /// For a row with model death probability d and external probability q,
    /// the combined death probability is `1 - (1 - d)(1 - q)`; the other
    /// entries are scaled by `1 - q` so the row still sums to 1.
    ///
    /// @param deathState index of the absorbing state
    /// @param q per-cycle external death probability in [0, 1]
    /// @return the blended matrix
    public TransitionMatrix withAdditionalMortality(int deathState, double q) {
        if (q == 0.0) {
            return this;
        }
        int n = probabilities.length;
        double[][] blended = new double[n][];
        for (int i = 0; i < n; i++) {
            blended[i] = probabilities[i].clone();
            if (i == deathState) {
                continue;
            }
            double survive = 1.0 - q;
            for (int j = 0; j < n; j++) {
                if (j != deathState) {
                    blended[i][j] *= survive;
                }
            }
            blended[i][deathState] = 1.0 - (1.0 - probabilities[i][deathState]) * survive;
        }
        return new TransitionMatrix(blended);
    }

    /// Computes `next = occupancy × P` without allocating.
    ///
    /// @param occupancy the current occupancy vector
    /// @param next receives the next occupancy vector; must not alias occupancy
    public void advance(double[] occupancy, double[] next) {
        int n = probabilities.length;
        Arrays.fill(next, 0.0);
        for (int i = 0; i < n; i++) {
            double mass = occupancy[i];
            if (mass == 0.0) {
                continue;
            }
            double[] row = probabilities[i];
            for (int j = 0; j < n; j++) {
                next[j] += mass * row[j];
            }
        }
    }

    @Override
    public String toString() {
        return Arrays.deepToString(probabilities);
    }
}
