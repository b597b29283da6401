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

import io.nosqlbench.cea.economics.StrategyOutcome;
import io.nosqlbench.cea.model.config.WtpGrid;
import io.nosqlbench.cea.psa.SimulationDraw;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives ICERs, dominance, net monetary benefit and acceptability
 * curves.
 *
 * <p>The deterministic metrics use one outcome per strategy, normally the
 * base case at parameter means. The probabilistic metrics use the draws
 * of a PSA run. Optimal strategies are chosen by {@link NetMonetaryBenefit#argmax},
 * so exact ties always go to the lowest strategy index.
 */
public final class DecisionMetricsCalculator {

    private final List<String> strategyIds;
    private final int referenceIndex;

    /**
     * @param strategyIds ids in strategy index order
     * @param referenceIndex index of the reference strategy
     */
    public DecisionMetricsCalculator(List<String> strategyIds, int referenceIndex) {
        if (referenceIndex < 0 || referenceIndex >= strategyIds.size()) {
            throw new IllegalArgumentException("reference index " + referenceIndex + " out of range");
        }
        this.strategyIds = List.copyOf(strategyIds);
        this.referenceIndex = referenceIndex;
    }

    /**
     * Computes increments, ICERs and the efficiency frontier.
     *
     * @param outcomes one outcome per strategy, in index order
     * @return one result per strategy, in index order
     */
    public List<IncrementalResult> incremental(StrategyOutcome[] outcomes) {
        EfficiencyFrontier frontier = frontier(outcomes);
        StrategyOutcome reference = outcomes[referenceIndex];
        List<IncrementalResult> results = new ArrayList<>(outcomes.length);
        for (int s = 0; s < outcomes.length; s++) {
            double deltaCost = outcomes[s].cost() - reference.cost();
            double deltaQaly = outcomes[s].qalys() - reference.qalys();
            boolean isReference = s == referenceIndex;
            Icer icer = isReference ? Icer.undefined() : Icer.of(deltaCost, deltaQaly);
            results.add(new IncrementalResult(strategyIds.get(s), outcomes[s].cost(), outcomes[s].qalys(),
                deltaCost, deltaQaly, icer, frontier.dominance(s), isReference));
        }
        return results;
    }

    public EfficiencyFrontier frontier(StrategyOutcome[] outcomes) {
        double[] costs = new double[outcomes.length];
        double[] qalys = new double[outcomes.length];
        for (int s = 0; s < outcomes.length; s++) {
            costs[s] = outcomes[s].cost();
            qalys[s] = outcomes[s].qalys();
        }
        return EfficiencyFrontier.of(strategyIds, costs, qalys);
    }

    /**
     * Fraction of draws in which each strategy has the highest NMB.
     */
    public CeacTable ceac(List<SimulationDraw> draws, WtpGrid grid) {
        int strategies = strategyIds.size();
        double[][] probabilities = new double[grid.size()][strategies];
        double[] nmb = new double[strategies];
        for (int w = 0; w < grid.size(); w++) {
            double wtp = grid.get(w);
            int[] wins = new int[strategies];
            for (SimulationDraw draw : draws) {
                for (int s = 0; s < strategies; s++) {
                    nmb[s] = draw.nmb(s, wtp);
                }
                wins[NetMonetaryBenefit.argmax(nmb)]++;
            }
            if (!draws.isEmpty()) {
                for (int s = 0; s < strategies; s++) {
                    probabilities[w][s] = (double) wins[s] / draws.size();
                }
            }
        }
        return new CeacTable(strategyIds, grid, probabilities);
    }

    /**
     * Traces the strategy with the highest expected NMB at each threshold.
     */
    public CeafTable ceaf(NetMonetaryBenefit nmb, CeacTable ceac) {
        List<CeafTable.Row> rows = new ArrayList<>(ceac.grid().size());
        for (int w = 0; w < ceac.grid().size(); w++) {
            int best = nmb.optimal(w);
            rows.add(new CeafTable.Row(ceac.grid().get(w), best, strategyIds.get(best),
                nmb.expected(w, best), ceac.probability(w, best)));
        }
        return new CeafTable(rows);
    }

    /**
     * Cost and QALY increments of each non-reference strategy, per draw.
     */
    public List<CePlanePoint> cePlane(List<SimulationDraw> draws) {
        List<CePlanePoint> points = new ArrayList<>(draws.size() * Math.max(0, strategyIds.size() - 1));
        for (SimulationDraw draw : draws) {
            for (int s = 0; s < strategyIds.size(); s++) {
                if (s == referenceIndex) {
                    continue;
                }
                points.add(new CePlanePoint(draw.iteration(), strategyIds.get(s),
                    draw.cost(s) - draw.cost(referenceIndex), draw.qalys(s) - draw.qalys(referenceIndex)));
            }
        }
        return points;
    }

    /**
     * Computes every metric.
     *
     * @param deterministic base-case outcome per strategy
     * @param draws PSA draws, ordered by iteration
     * @param grid thresholds for the probabilistic metrics
     */
    public DecisionMetrics calculate(StrategyOutcome[] deterministic, List<SimulationDraw> draws, WtpGrid grid) {
        NetMonetaryBenefit nmb = NetMonetaryBenefit.of(strategyIds, referenceIndex, draws, grid);
        CeacTable ceac = ceac(draws, grid);
        return new DecisionMetrics(List.of(deterministic), incremental(deterministic), frontier(deterministic),
            nmb, ceac, ceaf(nmb, ceac), cePlane(draws));
    }
}
