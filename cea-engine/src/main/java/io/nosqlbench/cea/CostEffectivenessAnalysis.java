package io.nosqlbench.cea;

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

import io.nosqlbench.cea.budget.BudgetImpactProjector;
import io.nosqlbench.cea.budget.BudgetImpactResult;
import io.nosqlbench.cea.checkpoint.PsaCheckpointManager;
import io.nosqlbench.cea.dsa.DeterministicSensitivityAnalysis;
import io.nosqlbench.cea.dsa.SensitivityResults;
import io.nosqlbench.cea.economics.EconomicAggregator;
import io.nosqlbench.cea.economics.StrategyOutcome;
import io.nosqlbench.cea.io.ModelDefinition;
import io.nosqlbench.cea.io.ModelDefinitionLoader;
import io.nosqlbench.cea.io.ResultTableWriter;
import io.nosqlbench.cea.markov.MarkovCohortSimulator;
import io.nosqlbench.cea.metrics.DecisionMetrics;
import io.nosqlbench.cea.metrics.DecisionMetricsCalculator;
import io.nosqlbench.cea.model.SampledParameters;
import io.nosqlbench.cea.model.config.BudgetImpactConfig;
import io.nosqlbench.cea.model.config.EvppiMethod;
import io.nosqlbench.cea.model.config.RunConfig;
import io.nosqlbench.cea.model.config.WtpGrid;
import io.nosqlbench.cea.psa.IterationEvaluator;
import io.nosqlbench.cea.psa.ProbabilisticRunner;
import io.nosqlbench.cea.psa.PsaResult;
import io.nosqlbench.cea.psa.SimulationDraw;
import io.nosqlbench.cea.sampling.ParameterSampler;
import io.nosqlbench.cea.sampling.ParameterSnapshot;
import io.nosqlbench.cea.voi.EvppiResult;
import io.nosqlbench.cea.voi.EvpiResult;
import io.nosqlbench.cea.voi.ValueOfInformationEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Runs a complete analysis of one model.
///
/// ```
/// ┌──────────────┐  ┌──────────────────┐  ┌───────────────────┐
/// │  base case   │  │ probabilistic    │  │ decision metrics  │
/// │ (mean values)├─►│ analysis (PSA)   ├─►│ ICER, CEAC, CEAF  │
/// └──────┬───────┘  └────────┬─────────┘  └───────────────────┘
///        │                   │            ┌───────────────────┐
///        │                   └───────────►│ EVPI / EVPPI      │
///        │                                └───────────────────┘
///        │                                ┌───────────────────┐
///        ├───────────────────────────────►│ budget impact     │
///        │                                └───────────────────┘
///        │                                ┌───────────────────┐
///        └───────────────────────────────►│ sensitivity (DSA) │
///                                         └───────────────────┘
/// ```
///
/// Budget impact costs each year's eligible patients at the base-case
/// cost per patient of the strategy they receive.
public final class CostEffectivenessAnalysis {

    private static final Logger logger = LogManager.getLogger(CostEffectivenessAnalysis.class);

    private final ModelDefinition model;
    private final EconomicAggregator aggregator;
    private final ParameterSampler sampler;
    private final IterationEvaluator evaluator;
    private ProbabilisticRunner.ProgressCallback progressCallback;

    public CostEffectivenessAnalysis(ModelDefinition model) {
        this.model = model;
        RunConfig config = model.runConfig();
        MarkovCohortSimulator simulator = new MarkovCohortSimulator(config.horizonCycles(), config.cycleYears(),
            config.startAge(), model.mortality());
        this.aggregator = new EconomicAggregator(simulator, config.discountRates());
        this.sampler = new ParameterSampler(model.parameters());
        this.evaluator = IterationEvaluator.of(aggregator, model.strategies());
    }

    /// Loads a YAML model definition and prepares it for analysis.
    public static CostEffectivenessAnalysis load(Path definition) throws IOException {
        return new CostEffectivenessAnalysis(new ModelDefinitionLoader().load(definition));
    }

    public CostEffectivenessAnalysis onProgress(ProbabilisticRunner.ProgressCallback callback) {
        this.progressCallback = callback;
        return this;
    }

    public ModelDefinition model() {
        return model;
    }

    /// Evaluates every strategy with each parameter at its mean.
    public StrategyOutcome[] baseCase() {
        return aggregator.evaluateAll(model.strategies(), SampledParameters.deterministic(model.parameters()));
    }

    /// Runs the deterministic sensitivity analysis at the policy threshold.
    public SensitivityResults sensitivity() {
        DeterministicSensitivityAnalysis dsa = new DeterministicSensitivityAnalysis(evaluator, model.parameters(),
            model.strategies().ids(), model.strategies().referenceIndex(), model.runConfig().policyWtp());
        return dsa.analyze(model.sensitivity());
    }

    /// Builds a runner for the probabilistic analysis of this model.
    public ProbabilisticRunner runner() {
        ProbabilisticRunner runner = new ProbabilisticRunner(model.runConfig(), sampler, evaluator,
            model.strategies().ids());
        if (progressCallback != null) {
            runner.onProgress(progressCallback);
        }
        return runner;
    }

    /// Runs the base case and the probabilistic analysis, resuming from the
    /// configured checkpoint when one exists, then derives every result.
    ///
    /// @return all results
    /// @throws IOException if the checkpoint cannot be read
    /// @throws PsaCheckpointManager.CheckpointException if the checkpoint is corrupt
    public Results run() throws IOException, PsaCheckpointManager.CheckpointException {
        Path checkpoint = model.runConfig().checkpointPath();
        PsaResult psa;
        if (checkpoint != null && Files.exists(checkpoint)) {
            psa = runner().resume(checkpoint);
        } else {
            psa = runner().run();
        }
        return analyze(psa);
    }

    /// Derives decision metrics, value of information and budget impact from
    /// a finished probabilistic analysis.
    public Results analyze(PsaResult psa) {
        RunConfig config = model.runConfig();
        WtpGrid grid = model.wtpGrid();
        List<String> ids = model.strategies().ids();
        int reference = model.strategies().referenceIndex();

        StrategyOutcome[] deterministic = baseCase();
        List<SimulationDraw> draws = psa.draws();
        DecisionMetrics metrics = new DecisionMetricsCalculator(ids, reference).calculate(deterministic, draws, grid);

        ValueOfInformationEngine voi = new ValueOfInformationEngine(ids, config.evpiCvThreshold());
        double population = config.eligiblePopulation();
        EvpiResult evpi = voi.evpi(draws, grid, population, config.policyWtp());
        List<EvppiResult> evppi;
        if (config.evppiMethod() == EvppiMethod.NESTED_MONTE_CARLO) {
            evppi = voi.evppiNested(sampler, evaluator, grid, population, config.evppiOuterSamples(),
                config.evppiInnerSamples(), config.seed());
        } else {
            evppi = voi.evppiRegression(psa, grid, population);
        }

        BudgetImpactResult budget = null;
        Optional<BudgetImpactConfig> budgetConfig = model.budgetImpact();
        if (budgetConfig.isPresent()) {
            Map<String, Double> perPatient = new LinkedHashMap<>();
            for (StrategyOutcome o : deterministic) {
                perPatient.put(o.strategyId(), o.cost());
            }
            budget = new BudgetImpactProjector(ids, model.strategies().reference().id())
                .project(budgetConfig.get(), perPatient);
        }

        long[] iterations = new long[draws.size()];
        List<double[]> values = new ArrayList<>(draws.size());
        for (int i = 0; i < draws.size(); i++) {
            iterations[i] = draws.get(i).iteration();
            values.add(draws.get(i).parameterValues());
        }
        ParameterSnapshot snapshot = ParameterSnapshot.of(model.parameters(), iterations, values);
        SensitivityResults sensitivity = sensitivity();

        logger.info("Analysis complete: {} draws, {} skipped, EVPI at policy threshold {}",
            psa.iterationCount(), psa.skippedCount(), evpi.atPolicy().perPatient());
        return new Results(Arrays.asList(deterministic), psa, metrics, evpi, evppi, budget, snapshot, sensitivity);
    }

    /// Everything one analysis produces.
    public static final class Results {
        private final List<StrategyOutcome> deterministic;
        private final PsaResult psa;
        private final DecisionMetrics metrics;
        private final EvpiResult evpi;
        private final List<EvppiResult> evppi;
        private final BudgetImpactResult budgetImpact;
        private final ParameterSnapshot snapshot;
        private final SensitivityResults sensitivity;

        Results(List<StrategyOutcome> deterministic, PsaResult psa, DecisionMetrics metrics, EvpiResult evpi,
                List<EvppiResult> evppi, BudgetImpactResult budgetImpact, ParameterSnapshot snapshot,
                SensitivityResults sensitivity) {
            this.deterministic = List.copyOf(deterministic);
            this.psa = psa;
            this.metrics = metrics;
            this.evpi = evpi;
            this.evppi = List.copyOf(evppi);
            this.budgetImpact = budgetImpact;
            this.snapshot = snapshot;
            this.sensitivity = sensitivity;
        }

        public List<StrategyOutcome> deterministic() {
            return deterministic;
        }

        public PsaResult psa() {
            return psa;
        }

        public DecisionMetrics metrics() {
            return metrics;
        }

        public EvpiResult evpi() {
            return evpi;
        }

        public List<EvppiResult> evppi() {
            return evppi;
        }

        public Optional<BudgetImpactResult> budgetImpact() {
            return Optional.ofNullable(budgetImpact);
        }

        public ParameterSnapshot parameterSnapshot() {
            return snapshot;
        }

        public SensitivityResults sensitivity() {
            return sensitivity;
        }

        /// Writes every table into a directory.
        ///
        /// @return the files written
        public List<Path> writeTables(Path directory) throws IOException {
            ResultTableWriter writer = new ResultTableWriter(directory);
            List<Path> written = new ArrayList<>();
            written.add(writer.writeDeterministic(deterministic));
            written.add(writer.writeIncremental(metrics.incremental(), metrics.frontier()));
            written.add(writer.writeCeac(metrics.ceac()));
            written.add(writer.writeCeaf(metrics.ceaf()));
            written.add(writer.writeCePlane(metrics.cePlane()));
            written.add(writer.writeEvpi(evpi));
            written.add(writer.writeEvppi(evppi));
            if (budgetImpact != null) {
                written.add(writer.writeBudgetImpact(budgetImpact));
            }
            written.add(writer.writeParameterSnapshot(snapshot));
            written.add(writer.writeDsa(sensitivity.tornadoes()));
            if (!sensitivity.twoWay().isEmpty()) {
                written.add(writer.writeTwoWayDsa(sensitivity.twoWay()));
            }
            if (!sensitivity.scenarios().isEmpty()) {
                written.add(writer.writeScenarios(sensitivity.scenarios()));
            }
            return written;
        }
    }
}
