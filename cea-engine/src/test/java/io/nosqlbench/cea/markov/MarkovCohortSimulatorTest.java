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

import io.nosqlbench.cea.TrdFixtures;
import io.nosqlbench.cea.model.ParameterTable;
import io.nosqlbench.cea.model.SampledParameters;
import io.nosqlbench.cea.model.errors.InvalidTransitionException;
import io.nosqlbench.cea.model.strategy.StateSpace;
import io.nosqlbench.cea.model.strategy.StateValueModel;
import io.nosqlbench.cea.model.strategy.StrategyArm;
import io.nosqlbench.cea.model.strategy.ValueRef;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class MarkovCohortSimulatorTest {

    private static final SampledParameters NO_PARAMETERS =
        new SampledParameters(new ParameterTable(List.of()), 0, new double[0]);

    private static final BackgroundMortality LIFE_TABLE =
        BackgroundMortality.lifeTable(Map.of(40.0, 0.002, 50.0, 0.004, 60.0, 0.01), 1.5);

    private static StrategyArm constantArm(double remission, double early, double late, double excess) {
        DepressionTransitionModel transitions = DepressionTransitionModel.builder()
            .remission(ValueRef.constant(remission))
            .earlyRelapse(ValueRef.constant(early))
            .lateRelapse(ValueRef.constant(late))
            .excessMortality(ValueRef.constant(excess))
            .build();
        StateSpace space = transitions.stateSpace();
        return StrategyArm.builder("test")
            .transitions(transitions)
            .costs(StateValueModel.byState(space, Map.of(
                StateSpace.DEPRESSED, ValueRef.constant(100), StateSpace.REMISSION, ValueRef.constant(10))))
            .utilities(StateValueModel.byState(space, Map.of(
                StateSpace.DEPRESSED, ValueRef.constant(0.5), StateSpace.REMISSION, ValueRef.constant(0.8))))
            .build();
    }

    @Test
    void everyTraceRowSumsToOne() {
        ParameterTable table = TrdFixtures.parameters();
        StrategyArm arm = TrdFixtures.registry(table).get("ketamine");
        MarkovCohortSimulator simulator = new MarkovCohortSimulator(120, 1.0 / 12, 45, LIFE_TABLE);
        double[][] trace = simulator.simulateTrace(arm, SampledParameters.deterministic(table));
        assertEquals(121, trace.length);
        for (double[] row : trace) {
            double sum = 0;
            for (double v : row) {
                assertTrue(v >= 0);
                sum += v;
            }
            assertEquals(1.0, sum, 1e-9);
        }
    }

    @Test
    void cohortStartsDepressed() {
        MarkovCohortSimulator simulator = new MarkovCohortSimulator(3, 1.0 / 12, 40, BackgroundMortality.none());
        double[][] trace = simulator.simulateTrace(constantArm(0.2, 0.1, 0.05, 0.0), NO_PARAMETERS);
        assertArrayEquals(new double[]{1, 0, 0}, trace[0], 0.0);
        assertArrayEquals(new double[]{0.8, 0.2, 0}, trace[1], 1e-12);
        // 0.8 * 0.8 + 0.2 * 0.1 stay or return to Depressed
        assertEquals(0.66, trace[2][0], 1e-12);
    }

    @Test
    void invalidMatrixIsDetectedBeforeTheFirstCycle() {
        MarkovCohortSimulator simulator = new MarkovCohortSimulator(12, 1.0 / 12, 40, BackgroundMortality.none());
        List<Integer> visited = new ArrayList<>();
        InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
            () -> simulator.simulate(constantArm(0.2, 0.1, 1.5, 0.0), NO_PARAMETERS,
                (cycle, state) -> visited.add(cycle)));
        assertEquals(6, e.cycle());
        assertEquals("test", e.strategyId());
        assertTrue(visited.isEmpty(), "no cycle may run before every matrix is validated");
    }

    @Test
    void negativeDeathProbabilityIsNotHiddenByBackgroundMortality() {
        StrategyArm arm = constantArm(0.2, 0.1, 0.05, -0.0005);
        MarkovCohortSimulator plain = new MarkovCohortSimulator(12, 1.0 / 12, 60, BackgroundMortality.none());
        assertThrows(InvalidTransitionException.class, () -> plain.prepare(arm, NO_PARAMETERS));

        MarkovCohortSimulator blended = new MarkovCohortSimulator(12, 1.0 / 12, 60,
            BackgroundMortality.lifeTable(Map.of(60.0, 0.01), 1.5));
        InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
            () -> blended.prepare(arm, NO_PARAMETERS));
        assertEquals(0, e.cycle());
        assertEquals(0, e.row());
    }

    @Test
    void simulationStopsOnceEveryoneHasDied() {
        MarkovCohortSimulator simulator = new MarkovCohortSimulator(60, 1.0 / 12, 40, BackgroundMortality.none());
        int cycles = simulator.simulate(constantArm(0.0, 0.1, 0.1, 1.0), NO_PARAMETERS, (cycle, state) -> { });
        assertEquals(1, cycles);
    }

    @Test
    void backgroundMortalityRaisesDeaths() {
        StrategyArm arm = constantArm(0.1, 0.1, 0.05, 0.0);
        double[][] without = new MarkovCohortSimulator(24, 1.0 / 12, 45, BackgroundMortality.none())
            .simulateTrace(arm, NO_PARAMETERS);
        double[][] with = new MarkovCohortSimulator(24, 1.0 / 12, 45, LIFE_TABLE)
            .simulateTrace(arm, NO_PARAMETERS);
        assertEquals(0.0, without[24][2], 1e-15);
        assertTrue(with[24][2] > 0.005);
    }

    @Test
    void listenerSeesFinalState() {
        MarkovCohortSimulator simulator = new MarkovCohortSimulator(5, 1.0 / 12, 40, BackgroundMortality.none());
        double[] total = new double[1];
        simulator.simulate(constantArm(0.2, 0.1, 0.05, 0.01), NO_PARAMETERS, new CohortTraceListener() {
            @Override
            public void onCycle(int cycle, CohortState state) {
            }

            @Override
            public void onComplete(int cyclesRun, CohortState finalState) {
                assertEquals(5, cyclesRun);
                total[0] = finalState.total();
            }
        });
        assertEquals(1.0, total[0], 1e-12);
    }
}
