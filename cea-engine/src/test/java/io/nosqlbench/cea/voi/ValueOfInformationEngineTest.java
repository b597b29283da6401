package io.nosqlbench.cea.voi;

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

import io.nosqlbench.cea.TrdFixtures;
import io.nosqlbench.cea.model.ParameterTable;
import io.nosqlbench.cea.model.config.EvppiMethod;
import io.nosqlbench.cea.model.config.WtpGrid;
import io.nosqlbench.cea.model.strategy.StrategyRegistry;
import io.nosqlbench.cea.psa.PsaResult;
import io.nosqlbench.cea.psa.SimulationDraw;
import io.nosqlbench.cea.sampling.ParameterSampler;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class ValueOfInformationEngineTest {

    private static final List<String> IDS = List.of("B", "A");

    private static SimulationDraw costsOnly(long iteration, double costB, double costA) {
        return new SimulationDraw(iteration, iteration, new double[0],
            new double[] {costB, costA}, new double[] {0, 0});
    }

    @Test
    void evpiIsTheMeanOpportunityLoss() {
        // A is chosen on average; draw 1 would have preferred B by 50
        List<SimulationDraw> draws = List.of(costsOnly(0, 0, -100), costsOnly(1, 0, 50));
        ValueOfInformationEngine engine = new ValueOfInformationEngine(IDS, 10.0);
        EvpiResult evpi = engine.evpi(draws, WtpGrid.of(0, 20_000), 1000, 20_000);

        VoiEstimate first = evpi.get(0);
        assertEquals(25.0, first.perPatient(), 1e-9);
        assertEquals(25_000.0, first.population(), 1e-6);
        assertEquals(25.0, first.standardError(), 1e-9);
        assertEquals(1.0, first.coefficientOfVariation(), 1e-9);
        assertFalse(first.lowPrecision());
        assertEquals(2, evpi.iterations());
        assertEquals(20_000.0, evpi.atPolicy().wtp());
    }

    @Test
    void evpiIsZeroWhenOneStrategyAlwaysWins() {
        List<SimulationDraw> draws = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            draws.add(costsOnly(i, 1000 + i, 500 + i));
        }
        EvpiResult evpi = new ValueOfInformationEngine(IDS, 0.1).evpi(draws, WtpGrid.of(0, 50_000), 1000, 50_000);
        for (VoiEstimate estimate : evpi.estimates()) {
            assertEquals(0.0, estimate.perPatient());
            assertEquals(0.0, estimate.population());
            assertFalse(estimate.lowPrecision());
        }
    }

    @Test
    void singleDrawIsLowPrecision() {
        EvpiResult evpi = new ValueOfInformationEngine(IDS, 0.1)
            .evpi(List.of(costsOnly(0, 0, 10)), WtpGrid.of(0), 1000, 0);
        assertTrue(evpi.get(0).lowPrecision());
        assertEquals(0.0, evpi.get(0).perPatient());
        assertTrue(evpi.lowPrecision());
    }

    @Test
    void noisyEstimateIsFlagged() {
        List<SimulationDraw> draws = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            draws.add(costsOnly(i, 0, i == 0 ? -1000 : 100));
        }
        EvpiResult evpi = new ValueOfInformationEngine(IDS, 0.1).evpi(draws, WtpGrid.of(0), 1, 0);
        assertTrue(evpi.get(0).perPatient() > 0);
        assertTrue(evpi.get(0).coefficientOfVariation() > 0.1);
        assertTrue(evpi.get(0).lowPrecision());
    }

    @Test
    void evpiIsNeverNegative() {
        PsaResult psa = TrdFixtures.runner(TrdFixtures.config().iterations(200).build()).run();
        WtpGrid grid = WtpGrid.range(0, 100_000, 10_000);
        EvpiResult evpi = new ValueOfInformationEngine(psa.strategyIds(), 0.5).evpi(psa.draws(), grid, 1000, 50_000);
        for (VoiEstimate estimate : evpi.estimates()) {
            assertTrue(estimate.perPatient() >= 0.0);
            assertEquals(estimate.perPatient() * 1000, estimate.population(), 1e-6);
        }
    }

    @Test
    void regressionEvppiCoversEveryGroup() {
        PsaResult psa = TrdFixtures.runner(TrdFixtures.config().iterations(200).build()).run();
        WtpGrid grid = WtpGrid.of(20_000, 50_000);
        ValueOfInformationEngine engine = new ValueOfInformationEngine(psa.strategyIds(), 0.5);
        EvpiResult evpi = engine.evpi(psa.draws(), grid, 1000, 50_000);
        List<EvppiResult> evppi = engine.evppiRegression(psa, grid, 1000);

        assertThat(evppi).extracting(EvppiResult::group).containsExactly("efficacy", "costs");
        for (EvppiResult result : evppi) {
            assertEquals(EvppiMethod.REGRESSION, result.method());
            for (int w = 0; w < grid.size(); w++) {
                double partial = result.get(w).perPatient();
                assertTrue(partial >= 0.0);
                assertThat(partial).isLessThanOrEqualTo(evpi.get(w).perPatient() * 1.05 + 1.0);
            }
        }
        assertThat(evppi.get(0).parameters()).containsExactly("p_remit_uc", "p_remit_ket");
    }

    @Test
    void regressionWithTooFewDrawsFallsBackToTheMean() {
        PsaResult psa = TrdFixtures.runner(TrdFixtures.config().iterations(3).batchSize(3).build()).run();
        ValueOfInformationEngine engine = new ValueOfInformationEngine(psa.strategyIds(), 0.5);
        List<EvppiResult> evppi = engine.evppiRegression(psa, WtpGrid.of(50_000), 1000);
        for (EvppiResult result : evppi) {
            assertEquals(0.0, result.get(0).perPatient(), 1e-9);
            assertTrue(result.get(0).lowPrecision());
        }
    }

    @Test
    void nestedEvppiResimulatesEachGroup() {
        ParameterTable table = TrdFixtures.parameters();
        StrategyRegistry registry = TrdFixtures.registry(table);
        ValueOfInformationEngine engine = new ValueOfInformationEngine(registry.ids(), 0.5);
        WtpGrid grid = WtpGrid.of(0, 50_000);

        List<EvppiResult> first = engine.evppiNested(new ParameterSampler(table), TrdFixtures.evaluator(registry),
            grid, 1000, 6, 4, 11L);
        List<EvppiResult> second = engine.evppiNested(new ParameterSampler(table), TrdFixtures.evaluator(registry),
            grid, 1000, 6, 4, 11L);

        assertEquals(2, first.size());
        for (int g = 0; g < first.size(); g++) {
            assertEquals(EvppiMethod.NESTED_MONTE_CARLO, first.get(g).method());
            for (int w = 0; w < grid.size(); w++) {
                assertTrue(first.get(g).get(w).perPatient() >= 0.0);
                assertEquals(first.get(g).get(w), second.get(g).get(w));
            }
        }
    }

    @Test
    void opportunityLossesAreNonNegative() {
        double[][] nmb = {{1, 2, 3}, {5, 1, 0}, {2, 2, 2}};
        double[] losses = ValueOfInformationEngine.opportunityLosses(nmb);
        assertEquals(3, losses.length);
        for (double loss : losses) {
            assertTrue(loss >= 0.0);
        }
        assertEquals(0, ValueOfInformationEngine.opportunityLosses(new double[0][0]).length);
    }
}
