package io.nosqlbench.cea.markov;

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

import io.nosqlbench.cea.model.strategy.StateSpace;
import io.nosqlbench.cea.model.strategy.TransitionMatrix;

import java.util.Arrays;

/// Occupancy fractions of one cohort over its health states.
///
/// Entries are non-negative and sum to 1. A state is created per strategy
/// per iteration, advanced in place once per cycle, and dropped once its
/// outcome has been aggregated.
public final class CohortState {

    private final int deathState;
    private double[] occupancy;
    private double[] scratch;

    private CohortState(int deathState, double[] occupancy) {
        this.deathState = deathState;
        this.occupancy = occupancy;
        this.scratch = new double[occupancy.length];
    }

    /// Creates a cohort that starts entirely in the initial state.
    public static CohortState initial(StateSpace space) {
        double[] occupancy = new double[space.size()];
        occupancy[space.initialState()] = 1.0;
        return new CohortState(space.deathState(), occupancy);
    }

    public int size() {
        return occupancy.length;
    }

    public double get(int state) {
        return occupancy[state];
    }

    /// Fraction of the cohort in the absorbing state.
    public double absorbed() {
        return occupancy[deathState];
    }

    /// Fraction of the cohort still alive.
    public double alive() {
        return 1.0 - occupancy[deathState];
    }

    public double total() {
        double sum = 0.0;
        for (double v : occupancy) {
            sum += v;
        }
        return sum;
    }

    /// Applies one cycle of transitions in place.
    void advance(TransitionMatrix matrix) {
        matrix.advance(occupancy, scratch);
        double[] swap = occupancy;
        occupancy = scratch;
        scratch = swap;
    }

    public double[] toArray() {
        return occupancy.clone();
    }

    @Override
    public String toString() {
        return "CohortState" + Arrays.toString(occupancy);
    }
}
