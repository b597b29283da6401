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

import io.nosqlbench.cea.model.SampledParameters;
import io.nosqlbench.cea.model.strategy.StateSpace;
import io.nosqlbench.cea.model.strategy.StrategyArm;
import io.nosqlbench.cea.model.strategy.TransitionMatrix;

import java.util.ArrayList;
import java.util.List;

/// Runs a cohort through a strategy's Markov chain.
///
/// ## Phases
///
/// ```text
///  prepare (fail fast)                          run
///  ┌───────────────────────────────┐            ┌────────────────────────────┐
///  │ for each cycle c < horizon:   │            │ state = all in initial     │
///  │   P = model.matrixFor(c)      │            │ for c in 0..horizon-1:     │
///  │   P = blend(P, q_bg(age(c)))  │  ───────►  │   listener.onCycle(c)      │
///  │   P.validate(strategy, c)     │            │   state = state × P[c]     │
///  └───────────────────────────────┘            │   stop when all absorbed   │
///                                               └────────────────────────────┘
/// ```
///
/// Every matrix is validated before cycle 0, so an invalid definition is
/// reported with its strategy, cycle and row without having simulated
/// anything.
///
/// ## Background Mortality
///
/// At cycle c the cohort age is `startAge + c × cycleYears`. Each
/// non-absorbing row's death probability d becomes `1 - (1 - d)(1 - q)`
/// and its other entries are scaled by `1 - q`.
///
/// Instances are immutable and may be shared across worker threads.
public final class MarkovCohortSimulator {

    /// Absorbed fraction at which the cohort is considered fully absorbed.
    public static final double ABSORBED_THRESHOLD = 1.0 - 1e-12;

    private final int horizonCycles;
    private final double cycleYears;
    private final double startAge;
    private final BackgroundMortality mortality;

    /// @param horizonCycles number of cycles to run at most
    /// @param cycleYears cycle length in years
    /// @param startAge cohort age at cycle 0
    /// @param mortality background mortality blended into every matrix
    public MarkovCohortSimulator(int horizonCycles, double cycleYears, double startAge, BackgroundMortality mortality) {
        if (horizonCycles < 1) {
            throw new IllegalArgumentException("horizon must be at least one cycle, got " + horizonCycles);
        }
        this.horizonCycles = horizonCycles;
        this.cycleYears = cycleYears;
        this.startAge = startAge;
        this.mortality = mortality;
    }

    public int horizonCycles() {
        return horizonCycles;
    }

    public double cycleYears() {
        return cycleYears;
    }

    /// Builds and validates the matrix of every cycle, then blends in
    /// background mortality and validates the result again.
    ///
    /// @param arm the strategy
    /// @param parameters realised parameter values
    /// @return one validated matrix per cycle
    /// @throws io.nosqlbench.cea.model.errors.InvalidTransitionException on the first invalid matrix
    public TransitionMatrix[] prepare(StrategyArm arm, SampledParameters parameters) {
        StateSpace space = arm.stateSpace();
        TransitionMatrix[] matrices = new TransitionMatrix[horizonCycles];
        for (int c = 0; c < horizonCycles; c++) {
            TransitionMatrix matrix = arm.transitions().matrixFor(c, parameters);
            if (matrix.size() != space.size()) {
                throw new IllegalStateException("strategy " + arm.id() + " produced a " + matrix.size()
                    + "-state matrix for a " + space.size() + "-state model");
            }
            // The blend can turn a negative death entry positive, so the model matrix is checked first.
            matrix.validate(arm.id(), c);
            double q = mortality.cycleProbability(startAge + c * cycleYears, cycleYears);
            matrices[c] = matrix.withAdditionalMortality(space.deathState(), q).validate(arm.id(), c);
        }
        return matrices;
    }

    /// Simulates one strategy for one parameter draw.
    ///
    /// @param arm the strategy
    /// @param parameters realised parameter values
    /// @param listener receives start-of-cycle occupancy
    /// @return the number of cycles simulated
    public int simulate(StrategyArm arm, SampledParameters parameters, CohortTraceListener listener) {
        TransitionMatrix[] matrices = prepare(arm, parameters);
        CohortState state = CohortState.initial(arm.stateSpace());
        int cycle = 0;
        while (cycle < horizonCycles) {
            listener.onCycle(cycle, state);
            state.advance(matrices[cycle]);
            cycle++;
            if (state.absorbed() >= ABSORBED_THRESHOLD) {
                break;
            }
        }
        listener.onComplete(cycle, state);
        return cycle;
    }

    /// Simulates and returns the full start-of-cycle trace, followed by the
    /// occupancy after the last cycle.
    public double[][] simulateTrace(StrategyArm arm, SampledParameters parameters) {
        List<double[]> rows = new ArrayList<>();
        simulate(arm, parameters, new CohortTraceListener() {
            @Override
            public void onCycle(int cycle, CohortState state) {
                rows.add(state.toArray());
            }

            @Override
            public void onComplete(int cyclesRun, CohortState finalState) {
                rows.add(finalState.toArray());
            }
        });
        return rows.toArray(new double[0][]);
    }
}
