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

import io.nosqlbench.cea.model.config.AdoptionCurve;
import io.nosqlbench.cea.model.config.BudgetImpactConfig;
import io.nosqlbench.cea.model.config.EvppiMethod;
import io.nosqlbench.cea.model.config.FailurePolicy;
import io.nosqlbench.cea.model.config.RunConfig;
import io.nosqlbench.cea.model.config.SensitivityConfig;
import io.nosqlbench.cea.model.errors.AdoptionOverflowException;
import io.nosqlbench.cea.model.errors.ValidationException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class ModelDefinitionLoaderTest {

    private static final String MINIMAL = String.join("\n",
        "parameters:",
        "  - {name: p_a, value: 0.10}",
        "  - {name: p_b, value: 0.20}",
        "  - {name: p_rel, value: 0.05}",
        "  - {name: c, value: 100}",
        "  - {name: u, value: 0.7}",
        "strategies:",
        "  - id: a",
        "    transitions: {remission: p_a, relapse: p_rel}",
        "    costs: {Depressed: c, Remission: 20}",
        "    utilities: {Depressed: u, Remission: 0.85}",
        "  - id: b",
        "    transitions: {remission: p_b, relapse: p_rel}",
        "    costs: {Depressed: c, Remission: 20}",
        "    utilities: {Depressed: u, Remission: 0.85}",
        "");

    static Path fixture() throws Exception {
        return Path.of(ModelDefinitionLoaderTest.class.getResource("/trd-model.yaml").toURI());
    }

    @Test
    void loadsTheFixtureModel() throws Exception {
        ModelDefinition model = new ModelDefinitionLoader().load(fixture());

        RunConfig run = model.runConfig();
        assertEquals(40, run.iterations());
        assertEquals(20240501L, run.seed());
        assertEquals("AU", run.jurisdiction());
        assertEquals(0.05, run.discountRates().costs());
        assertEquals(FailurePolicy.ABORT, run.failurePolicy());
        assertEquals(EvppiMethod.REGRESSION, run.evppiMethod());
        assertEquals(45.0, run.startAge());

        assertThat(model.strategies().ids()).containsExactly("usual_care", "ketamine", "ect");
        assertEquals("usual_care", model.strategies().reference().id());
        assertEquals(5, model.wtpGrid().size());
        assertEquals(1.5, model.mortality().smr());

        assertEquals(14, model.declaredParameters().size());
        assertEquals(12, model.parameters().size());
        assertEquals(450.0, model.parameters().get("c_depressed").distribution().mean(), 1e-9);
        assertEquals("AU", model.parameters().get("c_depressed").jurisdiction());
        assertEquals("ketamine", model.parameters().get("c_ketamine_course").owner());

        BudgetImpactConfig budget = model.budgetImpact().orElseThrow();
        assertEquals(5, budget.years());
        assertEquals(0.30, budget.adoption().share("ketamine", 5), 1e-12);
        assertEquals(10_000 * 1.02, budget.eligiblePopulation(2), 1e-9);
        assertEquals(50_000.0, budget.implementationCosts().get("ketamine").doubleValue());
    }

    @Test
    void minimalModelTakesDefaults() {
        ModelDefinition model = new ModelDefinitionLoader().loadFromString(MINIMAL);
        assertEquals("a", model.strategies().reference().id());
        assertNull(model.runConfig().jurisdiction());
        assertEquals(101, model.wtpGrid().size());
        assertTrue(model.budgetImpact().isEmpty());
        assertEquals(0.0, model.mortality().smr() - 1.0);
    }

    @Test
    void runSettingsAreRead() {
        String yaml = "run: {iterations: 12, failure_policy: skip-and-count, evppi_method: nested_monte_carlo,"
            + " evppi_outer_samples: 8, discount_rate: 0.035}\nwtp_grid: [0, 20000, 50000]\n" + MINIMAL;
        RunConfig run = new ModelDefinitionLoader().loadFromString(yaml).runConfig();
        assertEquals(12, run.iterations());
        assertEquals(FailurePolicy.SKIP_AND_COUNT, run.failurePolicy());
        assertEquals(EvppiMethod.NESTED_MONTE_CARLO, run.evppiMethod());
        assertEquals(8, run.evppiOuterSamples());
        assertEquals(100, run.evppiInnerSamples());
        assertEquals(0.035, run.discountRates().qalys());
    }

    @Test
    void explicitSharesAreRead() {
        String yaml = MINIMAL + "adoption:\n  years: 2\n  population: 500\n  shares: {b: [0.1, 0.4]}\n";
        BudgetImpactConfig budget = new ModelDefinitionLoader().loadFromString(yaml).budgetImpact().orElseThrow();
        assertEquals(0.4, budget.adoption().share("b", 2));
        assertEquals(0.0, budget.adoption().share("a", 1));
        assertEquals(500.0, budget.basePopulation());
    }

    @Test
    void sCurveIsSelectable() {
        String yaml = MINIMAL
            + "adoption: {years: 4, population: 1, shape: s-curve, initial: {b: 0.0}, target: {b: 0.5}}\n";
        AdoptionCurve curve = new ModelDefinitionLoader().loadFromString(yaml).budgetImpact().orElseThrow().adoption();
        assertTrue(curve.share("b", 1) < curve.share("b", 4));
    }

    @Test
    void malformedYamlIsAValidationError() {
        ValidationException e = assertThrows(ValidationException.class,
            () -> new ModelDefinitionLoader().loadFromString("run: [1, 2"));
        assertEquals("model", e.subject());
    }

    @Test
    void errorsNameTheOffendingPath() {
        String yaml = MINIMAL.replace("{name: p_a, value: 0.10}", "{name: p_a, distribution: {type: weibull}}");
        ValidationException e = assertThrows(ValidationException.class,
            () -> new ModelDefinitionLoader().loadFromString(yaml));
        assertEquals("parameters[0].distribution.type", e.subject());

        String noCost = MINIMAL.replace("  - {name: c, value: 100}\n", "");
        assertThrows(ValidationException.class, () -> new ModelDefinitionLoader().loadFromString(noCost));

        String badIterations = "run: {iterations: many}\n" + MINIMAL;
        assertThrows(ValidationException.class, () -> new ModelDefinitionLoader().loadFromString(badIterations));
    }

    @Test
    void atLeastTwoStrategiesAreRequired() {
        ValidationException none = assertThrows(ValidationException.class,
            () -> new ModelDefinitionLoader().loadFromString("run: {iterations: 10}\n"));
        assertEquals("strategies", none.subject());
        assertThat(none.getMessage()).contains("got 0");

        String single = MINIMAL.substring(0, MINIMAL.indexOf("  - id: b"));
        ValidationException one = assertThrows(ValidationException.class,
            () -> new ModelDefinitionLoader().loadFromString(single));
        assertEquals("strategies", one.subject());
        assertThat(one.getMessage()).contains("got 1");
    }

    @Test
    void sensitivitySettingsAreLoaded() throws Exception {
        SensitivityConfig sensitivity = new ModelDefinitionLoader().load(fixture()).sensitivity();
        assertEquals(0.025, sensitivity.lowerPercentile());
        assertEquals(0.975, sensitivity.upperPercentile());
        assertEquals(new SensitivityConfig.Range("q_excess", 0.0, 0.001), sensitivity.range("q_excess").orElseThrow());
        assertEquals(List.of(new SensitivityConfig.TwoWay("p_remit_ket", "c_ketamine_course", 3)),
            sensitivity.twoWay());
        assertThat(sensitivity.scenarios()).extracting(SensitivityConfig.Scenario::name)
            .containsExactly("ect_discount", "low_relapse");
        assertEquals(4000.0, sensitivity.scenarios().get(0).overrides().get("c_ect_course").doubleValue());

        SensitivityConfig defaults = new ModelDefinitionLoader().loadFromString(MINIMAL).sensitivity();
        assertEquals(0.05, defaults.lowerPercentile());
        assertTrue(defaults.ranges().isEmpty());
    }

    @Test
    void sensitivityMustReferToDeclaredParameters() {
        String unknownRange = MINIMAL + "sensitivity: {ranges: {p_missing: [0, 1]}}\n";
        ValidationException e = assertThrows(ValidationException.class,
            () -> new ModelDefinitionLoader().loadFromString(unknownRange));
        assertEquals("sensitivity.ranges.p_missing", e.subject());

        String badPair = MINIMAL + "sensitivity: {ranges: {c: [200, 100]}}\n";
        assertThrows(ValidationException.class, () -> new ModelDefinitionLoader().loadFromString(badPair));

        String oneName = MINIMAL + "sensitivity: {two_way: [{parameters: [c]}]}\n";
        ValidationException pair = assertThrows(ValidationException.class,
            () -> new ModelDefinitionLoader().loadFromString(oneName));
        assertEquals("sensitivity.two_way[0].parameters", pair.subject());
    }

    @Test
    void overfullAdoptionIsRejected() {
        String yaml = MINIMAL + "adoption: {years: 1, population: 10, shares: {a: [0.7], b: [0.6]}}\n";
        AdoptionOverflowException e = assertThrows(AdoptionOverflowException.class,
            () -> new ModelDefinitionLoader().loadFromString(yaml));
        assertEquals(1, e.year());
    }

    @Test
    void runConfigCanBeReplacedWithinTheJurisdiction() throws Exception {
        ModelDefinition model = new ModelDefinitionLoader().load(fixture());
        ModelDefinition more = model.withRunConfig(model.runConfig().toBuilder().iterations(80).build());
        assertEquals(80, more.runConfig().iterations());
        assertThrows(IllegalArgumentException.class,
            () -> model.withRunConfig(model.runConfig().toBuilder().jurisdiction("NZ").build()));
    }
}
