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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class DecisionMetricsCalculatorTest {

    private static final double[] NO_PARAMETERS = new double[0];

    private static SimulationDraw draw(long iteration, double costB, double qalyB, double costA, double qalyA) {
        return new SimulationDraw(iteration, iteration, NO_PARAMETERS,
            new double[] {costB, costA}, new double[] {qalyB, qalyA});
    }

    /// 1000 draws in which A beats the reference B at 50,000 in exactly 650.
    private static List<SimulationDraw> splitDraws() {
        List<SimulationDraw> draws = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            double costA = i < 650 ? 40_000 : 60_000;
            draws.add(draw(i, 0, 0, costA, 1.0));
        }
        return draws;
    }

    @Test
    void icerAgainstTheReference() {
        DecisionMetricsCalculator calculator = new DecisionMetricsCalculator(List.of("B", "A"), 0);
        List<IncrementalResult> results = calculator.incremental(new StrategyOutcome[] {
            new StrategyOutcome("B", 800, 4.5, 10),
            new StrategyOutcome("A", 1000, 5.0, 10)});

        IncrementalResult reference = results.get(0);
        assertTrue(reference.reference());
        assertEquals(Icer.Status.UNDEFINED, reference.icer().status());

        IncrementalResult a = results.get(1);
        assertEquals(200.0, a.deltaCost(), 1e-9);
        assertEquals(0.5, a.deltaQaly(), 1e-9);
        assertEquals(400.0, a.icer().value().getAsDouble(), 1e-9);
        assertFalse(a.dominated());
    }

    @Test
    void dominatedStrategyHasNoIcer() {
        DecisionMetricsCalculator calculator = new DecisionMetricsCalculator(List.of("B", "C"), 0);
        List<IncrementalResult> results = calculator.incremental(new StrategyOutcome[] {
            new StrategyOutcome("B", 800, 4.5, 10),
            new StrategyOutcome("C", 1200, 4.0, 10)});
        IncrementalResult c = results.get(1);
        assertEquals(Dominance.STRICT, c.dominance());
        assertEquals(Icer.Status.DOMINATED, c.icer().status());
        assertTrue(c.icer().value().isEmpty());
    }

    @Test
    void ceacCountsWins() {
        DecisionMetricsCalculator calculator = new DecisionMetricsCalculator(List.of("B", "A"), 0);
        WtpGrid grid = WtpGrid.of(0, 50_000);
        CeacTable ceac = calculator.ceac(splitDraws(), grid);

        assertEquals(0.65, ceac.probability(50_000, "A"), 1e-12);
        assertEquals(0.35, ceac.probability(50_000, "B"), 1e-12);
        assertEquals(1.0, ceac.probability(0, "B"), 1e-12);
        for (int w = 0; w < grid.size(); w++) {
            assertEquals(1.0, ceac.rowSum(w), 1e-9);
        }
    }

    @Test
    void singleDrawGivesZeroOrOne() {
        DecisionMetricsCalculator calculator = new DecisionMetricsCalculator(List.of("B", "A"), 0);
        CeacTable ceac = calculator.ceac(List.of(draw(0, 0, 0, 10_000, 1.0)), WtpGrid.of(50_000));
        assertEquals(1.0, ceac.probability(0, 1));
        assertEquals(0.0, ceac.probability(0, 0));
    }

    @Test
    void tiesGoToTheLowestIndex() {
        DecisionMetricsCalculator calculator = new DecisionMetricsCalculator(List.of("B", "A"), 0);
        CeacTable ceac = calculator.ceac(List.of(draw(0, 100, 1.0, 100, 1.0)), WtpGrid.of(1000));
        assertEquals(1.0, ceac.probability(0, 0));
    }

    @Test
    void ceafFollowsExpectedNmb() {
        DecisionMetricsCalculator calculator = new DecisionMetricsCalculator(List.of("B", "A"), 0);
        DecisionMetrics metrics = calculator.calculate(new StrategyOutcome[] {
            new StrategyOutcome("B", 0, 0, 1),
            new StrategyOutcome("A", 47_000, 1, 1)}, splitDraws(), WtpGrid.of(0, 40_000, 50_000));

        CeafTable ceaf = metrics.ceaf();
        assertEquals(3, ceaf.size());
        assertEquals("B", ceaf.get(0).strategyId());
        assertEquals("B", ceaf.get(1).strategyId());
        // mean cost of A is 47,000
        assertEquals("A", ceaf.get(2).strategyId());
        assertEquals(3_000.0, ceaf.get(2).expectedNmb(), 1e-6);
        assertEquals(0.65, ceaf.get(2).probability(), 1e-12);
        assertEquals(3_000.0, metrics.netMonetaryBenefit().incremental(2, 1), 1e-6);
    }

    @Test
    void cePlaneExcludesTheReference() {
        DecisionMetricsCalculator calculator = new DecisionMetricsCalculator(List.of("B", "A", "C"), 1);
        List<SimulationDraw> draws = List.of(new SimulationDraw(0, 0, NO_PARAMETERS,
            new double[] {100, 300, 250}, new double[] {1, 2, 1.5}));
        List<CePlanePoint> plane = calculator.cePlane(draws);
        assertThat(plane).extracting(CePlanePoint::strategyId).containsExactly("B", "C");
        assertEquals(-200.0, plane.get(0).deltaCost(), 1e-9);
        assertEquals(-1.0, plane.get(0).deltaQaly(), 1e-9);
    }

    @Test
    void noDrawsGivesEmptyCurves() {
        DecisionMetricsCalculator calculator = new DecisionMetricsCalculator(List.of("B", "A"), 0);
        CeacTable ceac = calculator.ceac(List.of(), WtpGrid.of(0, 1000));
        assertEquals(0.0, ceac.rowSum(0));
    }

    @Test
    void referenceMustBeInRange() {
        assertThrows(IllegalArgumentException.class, () -> new DecisionMetricsCalculator(List.of("B"), 1));
    }
}
