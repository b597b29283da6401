package io.nosqlbench.cea.economics;

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

import io.nosqlbench.cea.markov.CohortState;
import io.nosqlbench.cea.markov.CohortTraceListener;
import io.nosqlbench.cea.markov.MarkovCohortSimulator;
import io.nosqlbench.cea.model.SampledParameters;
import io.nosqlbench.cea.model.config.DiscountRates;
import io.nosqlbench.cea.model.errors.ValidationException;
import io.nosqlbench.cea.model.strategy.OneTimeCost;
import io.nosqlbench.cea.model.strategy.StrategyArm;
import io.nosqlbench.cea.model.strategy.StrategyRegistry;

/// Turns a simulated cohort into discounted per-patient costs and QALYs.
///
/// ## Accumulation
///
/// Occupancy is taken at the start of each cycle c:
///
/// ```text
/// cost  = Σ_c dfCost(c) × ( Σ_s occ_c[s] × cost(s, c) + alive_c × oneTime(c) )
/// qalys = Σ_c dfQaly(c) × Σ_s occ_c[s] × max(0, utility(s, c) - acute(c)) × cycleYears
/// ly    = Σ_c alive_c × cycleYears
/// ```
///
/// where `acute(c)` is the strategy's acute-phase disutility while
/// `c < acuteCycles` and 0 afterwards. State costs are per cycle; state
/// utilities are annual weights. Nothing is retained beyond the running
/// sums, so memory does not grow with the horizon.
public final class EconomicAggregator {

    private final MarkovCohortSimulator simulator;
    private final double[] costFactors;
    private final double[] qalyFactors;
    private final double cycleYears;

    public EconomicAggregator(MarkovCohortSimulator simulator, DiscountRates rates) {
        this.simulator = simulator;
        this.cycleYears = simulator.cycleYears();
        this.costFactors = new Discounting(rates.costs(), cycleYears).factors(simulator.horizonCycles());
        this.qalyFactors = new Discounting(rates.qalys(), cycleYears).factors(simulator.horizonCycles());
    }

    public MarkovCohortSimulator simulator() {
        return simulator;
    }

    /// Simulates one strategy and aggregates its outcome.
    ///
    /// @throws io.nosqlbench.cea.model.errors.InvalidTransitionException if a matrix is invalid
    /// @throws ValidationException if a cost resolves to a negative value or a
    ///         one-time cost lies outside the horizon
    public StrategyOutcome evaluate(StrategyArm arm, SampledParameters parameters) {
        checkHorizon(arm);
        Accumulator accumulator = new Accumulator(arm, parameters);
        simulator.simulate(arm, parameters, accumulator);
        return new StrategyOutcome(arm.id(), accumulator.cost, accumulator.qalys, accumulator.lifeYears);
    }

    /// Rejects one-time costs scheduled at or after the last simulated cycle.
    ///
    /// @throws ValidationException naming the strategy and the cost label
    public void checkHorizon(StrategyArm arm) {
        for (OneTimeCost oneTime : arm.oneTimeCosts()) {
            if (oneTime.cycle() >= simulator.horizonCycles()) {
                throw new ValidationException(arm.id(), "one-time cost " + oneTime.label() + " falls in cycle "
                    + oneTime.cycle() + ", outside the " + simulator.horizonCycles() + "-cycle horizon");
            }
        }
    }

    /// Checks every registered strategy with [#checkHorizon(StrategyArm)].
    public void checkHorizon(StrategyRegistry registry) {
        for (int s = 0; s < registry.size(); s++) {
            checkHorizon(registry.get(s));
        }
    }

    /// Evaluates every registered strategy, in registry order.
    public StrategyOutcome[] evaluateAll(StrategyRegistry registry, SampledParameters parameters) {
        StrategyOutcome[] outcomes = new StrategyOutcome[registry.size()];
        for (int s = 0; s < registry.size(); s++) {
            outcomes[s] = evaluate(registry.get(s), parameters);
        }
        return outcomes;
    }

    private final class Accumulator implements CohortTraceListener {
        private final StrategyArm arm;
        private final SampledParameters parameters;
        private final double acuteDisutility;
        private double cost;
        private double qalys;
        private double lifeYears;

        Accumulator(StrategyArm arm, SampledParameters parameters) {
            this.arm = arm;
            this.parameters = parameters;
            this.acuteDisutility = arm.acuteDisutility().resolve(parameters);
        }

        @Override
        public void onCycle(int cycle, CohortState state) {
            double cycleCost = 0.0;
            double cycleUtility = 0.0;
            double decrement = cycle < arm.acuteCycles() ? acuteDisutility : 0.0;
            for (int s = 0; s < state.size(); s++) {
                double occupancy = state.get(s);
                if (occupancy == 0.0) {
                    continue;
                }
                double stateCost = arm.costs().valueFor(s, cycle, parameters);
                if (stateCost < 0.0) {
                    throw new ValidationException(arm.id(), "cost of state " + arm.stateSpace().name(s)
                        + " is negative in cycle " + cycle + ": " + stateCost);
                }
                cycleCost += occupancy * stateCost;
                if (s != arm.stateSpace().deathState()) {
                    double utility = arm.utilities().valueFor(s, cycle, parameters) - decrement;
                    cycleUtility += occupancy * Math.max(0.0, utility);
                }
            }
            double alive = state.alive();
            for (OneTimeCost oneTime : arm.oneTimeCosts()) {
                if (oneTime.cycle() == cycle) {
                    double amount = oneTime.amount().resolve(parameters);
                    if (amount < 0.0) {
                        throw new ValidationException(arm.id(), "one-time cost " + oneTime.label()
                            + " is negative: " + amount);
                    }
                    cycleCost += alive * amount;
                }
            }
            cost += costFactors[cycle] * cycleCost;
            qalys += qalyFactors[cycle] * cycleUtility * cycleYears;
            lifeYears += alive * cycleYears;
        }
    }
}
