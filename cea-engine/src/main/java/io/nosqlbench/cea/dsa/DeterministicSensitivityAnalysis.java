package io.nosqlbench.cea.dsa;

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
import io.nosqlbench.cea.model.Parameter;
import io.nosqlbench.cea.model.ParameterTable;
import io.nosqlbench.cea.model.SampledParameters;
import io.nosqlbench.cea.model.config.SensitivityConfig;
import io.nosqlbench.cea.model.errors.ValidationException;
import io.nosqlbench.cea.psa.IterationEvaluator;
import io.nosqlbench.cea.sampling.DistributionSampler;
import io.nosqlbench.cea.sampling.DistributionSamplerFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Deterministic sensitivity analysis around the base case.
///
/// Every run starts from [SampledParameters#deterministic(ParameterTable)]
/// and replaces only the values under study, so the outcome of a run
/// depends on nothing but those values. The outcome reported for a
/// comparator is its incremental net monetary benefit against the
/// reference at a fixed willingness to pay:
///
/// ```text
/// INMB = wtp × (qalys_c - qalys_ref) - (cost_c - cost_ref)
/// ```
///
/// ## Analyses
///
/// | Analysis | Runs | Output |
/// |----------|------|--------|
/// | one-way | 2 per varied parameter | [TornadoResult] per comparator |
/// | two-way | steps² per pair | [TwoWayResult] per pair and comparator |
/// | scenario | 1 per scenario | [ScenarioResult] |
///
/// Correlation groups are ignored here: a one-way run moves one parameter
/// even when others share its uniform in the probabilistic analysis.
public final class DeterministicSensitivityAnalysis {

    private static final Logger logger = LogManager.getLogger(DeterministicSensitivityAnalysis.class);

    private final IterationEvaluator evaluator;
    private final ParameterTable table;
    private final List<String> strategyIds;
    private final int reference;
    private final double wtp;
    private final SampledParameters base;

    /// @param evaluator evaluates every strategy for one set of parameter values
    /// @param table the parameter table
    /// @param strategyIds strategy ids in registry order
    /// @param reference index of the reference strategy
    /// @param wtp willingness to pay per QALY
    public DeterministicSensitivityAnalysis(IterationEvaluator evaluator, ParameterTable table,
                                            List<String> strategyIds, int reference, double wtp) {
        if (reference < 0 || reference >= strategyIds.size()) {
            throw new IllegalArgumentException(
                "reference index " + reference + " outside 0.." + (strategyIds.size() - 1));
        }
        this.evaluator = evaluator;
        this.table = table;
        this.strategyIds = List.copyOf(strategyIds);
        this.reference = reference;
        this.wtp = wtp;
        this.base = SampledParameters.deterministic(table);
    }

    /// Runs one-way analysis for every comparator, two-way analysis for
    /// every declared pair, and every declared scenario.
    public SensitivityResults analyze(SensitivityConfig config) {
        checkParameters(config);
        List<ParameterBounds> bounds = bounds(config);
        List<TornadoResult> tornadoes = new ArrayList<>();
        List<TwoWayResult> grids = new ArrayList<>();
        for (int s = 0; s < strategyIds.size(); s++) {
            if (s == reference) {
                continue;
            }
            tornadoes.add(oneWay(s, bounds));
            for (SensitivityConfig.TwoWay pair : config.twoWay()) {
                grids.add(twoWay(s, pair, bounds));
            }
        }
        List<ScenarioResult> scenarios = scenarios(config);
        logger.info("Sensitivity analysis: {} varied parameters, {} comparators, {} two-way grids, {} scenarios",
            bounds.size(), tornadoes.size(), grids.size(), scenarios.size());
        return new SensitivityResults(tornadoes, grids, scenarios);
    }

    /// Resolves the low and high value of every varied parameter, in table order.
    ///
    /// @return bounds of every parameter with an explicit range or a non-fixed distribution
    public List<ParameterBounds> bounds(SensitivityConfig config) {
        List<ParameterBounds> bounds = new ArrayList<>();
        for (int i = 0; i < table.size(); i++) {
            Parameter p = table.get(i);
            double mean = base.get(i);
            Optional<SensitivityConfig.Range> range = config.range(p.name());
            if (range.isPresent()) {
                bounds.add(new ParameterBounds(p.name(), mean, range.get().low(), range.get().high(), true));
                continue;
            }
            DistributionSampler sampler = DistributionSamplerFactory.forModel(p.distribution());
            if (sampler.consumesUniform()) {
                bounds.add(new ParameterBounds(p.name(), mean, sampler.sample(config.lowerPercentile()),
                    sampler.sample(config.upperPercentile()), false));
            }
        }
        return bounds;
    }

    /// One-way analysis of one comparator.
    ///
    /// @param comparator strategy id, not the reference
    public TornadoResult oneWay(String comparator, SensitivityConfig config) {
        checkParameters(config);
        return oneWay(comparatorIndex(comparator), bounds(config));
    }

    /// Two-way analysis of one comparator over one pair of parameters.
    ///
    /// @throws ValidationException if either parameter has no range to vary over
    public TwoWayResult twoWay(String comparator, SensitivityConfig.TwoWay pair, SensitivityConfig config) {
        checkParameters(config);
        table.get(pair.first());
        table.get(pair.second());
        return twoWay(comparatorIndex(comparator), pair, bounds(config));
    }

    /// Evaluates every declared scenario, in declaration order.
    public List<ScenarioResult> scenarios(SensitivityConfig config) {
        checkParameters(config);
        List<ScenarioResult> results = new ArrayList<>(config.scenarios().size());
        for (SensitivityConfig.Scenario scenario : config.scenarios()) {
            StrategyOutcome[] outcomes = evaluator.evaluate(base.withOverrides(scenario.overrides()));
            double[] inmb = new double[outcomes.length];
            for (int s = 0; s < outcomes.length; s++) {
                inmb[s] = s == reference ? 0.0 : incrementalNmb(outcomes, s);
            }
            results.add(new ScenarioResult(scenario.name(), Arrays.asList(outcomes), inmb));
        }
        return results;
    }

    /// Incremental net monetary benefit of strategy s against the reference.
    public double incrementalNmb(StrategyOutcome[] outcomes, int s) {
        StrategyOutcome c = outcomes[s];
        StrategyOutcome r = outcomes[reference];
        return wtp * (c.qalys() - r.qalys()) - (c.cost() - r.cost());
    }

    private TornadoResult oneWay(int comparator, List<ParameterBounds> bounds) {
        double baseOutcome = incrementalNmb(evaluator.evaluate(base), comparator);
        List<OneWayResult> rows = new ArrayList<>(bounds.size());
        for (ParameterBounds b : bounds) {
            double low = incrementalNmb(evaluator.evaluate(base.withOverrides(Map.of(b.parameter(), b.low()))),
                comparator);
            double high = incrementalNmb(evaluator.evaluate(base.withOverrides(Map.of(b.parameter(), b.high()))),
                comparator);
            rows.add(new OneWayResult(b, baseOutcome, low, high));
        }
        TornadoResult result = new TornadoResult(strategyIds.get(comparator), strategyIds.get(reference), wtp,
            baseOutcome, rows);
        logger.debug("One-way analysis of {}: ranked {}", result.comparator(), result.rankedParameters());
        return result;
    }

    private TwoWayResult twoWay(int comparator, SensitivityConfig.TwoWay pair, List<ParameterBounds> bounds) {
        double[] first = find(bounds, pair.first()).linspace(pair.steps());
        double[] second = find(bounds, pair.second()).linspace(pair.steps());
        double[][] outcomes = new double[first.length][second.length];
        for (int i = 0; i < first.length; i++) {
            for (int j = 0; j < second.length; j++) {
                SampledParameters values = base.withOverrides(
                    Map.of(pair.first(), first[i], pair.second(), second[j]));
                outcomes[i][j] = incrementalNmb(evaluator.evaluate(values), comparator);
            }
        }
        return new TwoWayResult(strategyIds.get(comparator), pair.first(), first, pair.second(), second, outcomes);
    }

    private static ParameterBounds find(List<ParameterBounds> bounds, String parameter) {
        for (ParameterBounds b : bounds) {
            if (b.parameter().equals(parameter)) {
                return b;
            }
        }
        throw new ValidationException(parameter, "fixed parameter needs an explicit range for two-way analysis");
    }

    private int comparatorIndex(String comparator) {
        int index = strategyIds.indexOf(comparator);
        if (index < 0) {
            throw new ValidationException(comparator, "unknown strategy");
        }
        if (index == reference) {
            throw new ValidationException(comparator, "the reference strategy cannot be its own comparator");
        }
        return index;
    }

    private void checkParameters(SensitivityConfig config) {
        for (String name : config.referencedParameters()) {
            if (!table.contains(name)) {
                throw new ValidationException(name, "sensitivity analysis refers to an undeclared parameter");
            }
        }
    }
}
