package io.nosqlbench.cea.io;

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

import io.nosqlbench.cea.dsa.OneWayResult;
import io.nosqlbench.cea.dsa.ParameterBounds;
import io.nosqlbench.cea.dsa.ScenarioResult;
import io.nosqlbench.cea.dsa.TornadoResult;
import io.nosqlbench.cea.economics.StrategyOutcome;
import io.nosqlbench.cea.metrics.DecisionMetricsCalculator;
import io.nosqlbench.cea.metrics.IncrementalResult;
import io.nosqlbench.cea.model.config.WtpGrid;
import io.nosqlbench.cea.psa.SimulationDraw;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class ResultTableWriterTest {

    @TempDir
    Path tempDir;

    private static final StrategyOutcome[] OUTCOMES = {
        new StrategyOutcome("B", 800, 4.5, 9.0),
        new StrategyOutcome("C", 1200, 4.0, 9.0)};

    @Test
    void deterministicTableUsesFixedPrecision() throws Exception {
        Path file = new ResultTableWriter(tempDir).writeDeterministic(
            List.of(new StrategyOutcome("usual_care", 1234.5, 1.25, 1.9)));
        assertThat(Files.readAllLines(file, StandardCharsets.UTF_8))
            .containsExactly("strategy,cost,qalys,life_years", "usual_care,1234.50,1.250000,1.900000");
    }

    @Test
    void undefinedRatiosAreWrittenAsNa() throws Exception {
        DecisionMetricsCalculator calculator = new DecisionMetricsCalculator(List.of("B", "C"), 0);
        List<IncrementalResult> results = calculator.incremental(OUTCOMES);
        Path file = new ResultTableWriter(tempDir).writeIncremental(results, calculator.frontier(OUTCOMES));

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals("strategy,cost,qalys,delta_cost,delta_qaly,icer,icer_status,dominance,on_frontier,sequential_icer",
            lines.get(0));
        assertEquals("B,800.00,4.500000,0.00,0.000000,NA,UNDEFINED,NONE,true,NA", lines.get(1));
        assertEquals("C,1200.00,4.000000,400.00,-0.500000,NA,DOMINATED,STRICT,false,NA", lines.get(2));
    }

    @Test
    void ceacHasOneColumnPerStrategy() throws Exception {
        DecisionMetricsCalculator calculator = new DecisionMetricsCalculator(List.of("B", "C"), 0);
        List<SimulationDraw> draws = List.of(
            new SimulationDraw(0, 0, new double[0], new double[] {0, 100}, new double[] {0, 1}),
            new SimulationDraw(1, 1, new double[0], new double[] {0, 300}, new double[] {0, 1}));
        Path file = new ResultTableWriter(tempDir).writeCeac(calculator.ceac(draws, WtpGrid.of(0, 200)));
        assertThat(Files.readAllLines(file, StandardCharsets.UTF_8)).containsExactly(
            "wtp,B,C",
            "0.00,1.000000,0.000000",
            "200.00,0.500000,0.500000");
    }

    @Test
    void dsaRowsFollowTornadoOrder() throws Exception {
        TornadoResult tornado = new TornadoResult("ketamine", "usual_care", 50_000, 100, List.of(
            new OneWayResult(new ParameterBounds("p_remit", 0.15, 0.1, 0.2, false), 100, 50, 150),
            new OneWayResult(new ParameterBounds("c_course", 2500, 2000, 3000, true), 100, 300, -100)));
        Path file = new ResultTableWriter(tempDir).writeDsa(List.of(tornado));
        assertThat(Files.readAllLines(file, StandardCharsets.UTF_8)).containsExactly(
            "strategy,parameter,base_value,low_value,high_value,bounds,base_inmb,low_inmb,high_inmb,range",
            "ketamine,c_course,2500.000000,2000.000000,3000.000000,range,100.00,300.00,-100.00,400.00",
            "ketamine,p_remit,0.150000,0.100000,0.200000,percentile,100.00,50.00,150.00,100.00");
    }

    @Test
    void scenarioRowsListEveryStrategy() throws Exception {
        ScenarioResult scenario = new ScenarioResult("cheap drug", List.of(OUTCOMES), new double[]{0, -2_900});
        Path file = new ResultTableWriter(tempDir).writeScenarios(List.of(scenario));
        assertThat(Files.readAllLines(file, StandardCharsets.UTF_8)).containsExactly(
            "scenario,strategy,cost,qalys,incremental_nmb",
            "cheap drug,B,800.00,4.500000,0.00",
            "cheap drug,C,1200.00,4.000000,-2900.00");
    }

    @Test
    void numbersAreNormalised() {
        assertEquals("0.00", ResultTableWriter.money(-0.001));
        assertEquals("-0.01", ResultTableWriter.money(-0.009));
        assertEquals("NA", ResultTableWriter.value(Double.NaN));
        assertEquals("NA", ResultTableWriter.money(Double.POSITIVE_INFINITY));
        assertEquals("1000000.00", ResultTableWriter.money(1e6));
    }

    @Test
    void fieldsWithSeparatorsAreQuoted() {
        assertEquals("plain", ResultTableWriter.quote("plain"));
        assertEquals("\"a,b\"", ResultTableWriter.quote("a,b"));
        assertEquals("\"say \"\"hi\"\"\"", ResultTableWriter.quote("say \"hi\""));
    }

    @Test
    void repeatedWritesAreByteIdentical() throws Exception {
        DecisionMetricsCalculator calculator = new DecisionMetricsCalculator(List.of("B", "C"), 0);
        Path first = new ResultTableWriter(tempDir.resolve("one")).writeIncremental(
            calculator.incremental(OUTCOMES), calculator.frontier(OUTCOMES));
        Path second = new ResultTableWriter(tempDir.resolve("two")).writeIncremental(
            calculator.incremental(OUTCOMES), calculator.frontier(OUTCOMES));
        assertEquals(-1L, Files.mismatch(first, second));
        assertFalse(Files.readString(first, StandardCharsets.UTF_8).contains("\r"));
    }
}
