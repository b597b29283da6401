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

import io.nosqlbench.cea.markov.BackgroundMortality;
import io.nosqlbench.cea.model.Parameter;
import io.nosqlbench.cea.model.ParameterTable;
import io.nosqlbench.cea.model.config.BudgetImpactConfig;
import io.nosqlbench.cea.model.config.RunConfig;
import io.nosqlbench.cea.model.config.SensitivityConfig;
import io.nosqlbench.cea.model.config.WtpGrid;
import io.nosqlbench.cea.model.strategy.StrategyRegistry;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// A fully validated model: run settings, thresholds, the parameter table
/// resolved for the run's jurisdiction, the strategy registry and, when the
/// definition has an `adoption` section, the budget impact settings.
/// Sensitivity settings default to [SensitivityConfig#defaults()].
public final class ModelDefinition {

    private final RunConfig runConfig;
    private final WtpGrid wtpGrid;
    private final List<Parameter> declaredParameters;
    private final ParameterTable parameters;
    private final StrategyRegistry strategies;
    private final BackgroundMortality mortality;
    private final BudgetImpactConfig budgetImpact;
    private final SensitivityConfig sensitivity;

    public ModelDefinition(RunConfig runConfig, WtpGrid wtpGrid, List<Parameter> declaredParameters,
                           ParameterTable parameters, StrategyRegistry strategies, BackgroundMortality mortality,
                           BudgetImpactConfig budgetImpact) {
        this(runConfig, wtpGrid, declaredParameters, parameters, strategies, mortality, budgetImpact,
            SensitivityConfig.defaults());
    }

    public ModelDefinition(RunConfig runConfig, WtpGrid wtpGrid, List<Parameter> declaredParameters,
                           ParameterTable parameters, StrategyRegistry strategies, BackgroundMortality mortality,
                           BudgetImpactConfig budgetImpact, SensitivityConfig sensitivity) {
        this.runConfig = Objects.requireNonNull(runConfig, "runConfig");
        this.wtpGrid = Objects.requireNonNull(wtpGrid, "wtpGrid");
        this.declaredParameters = List.copyOf(declaredParameters);
        this.parameters = Objects.requireNonNull(parameters, "parameters");
        this.strategies = Objects.requireNonNull(strategies, "strategies");
        this.mortality = mortality == null ? BackgroundMortality.none() : mortality;
        this.budgetImpact = budgetImpact;
        this.sensitivity = sensitivity == null ? SensitivityConfig.defaults() : sensitivity;
    }

    public RunConfig runConfig() {
        return runConfig;
    }

    public WtpGrid wtpGrid() {
        return wtpGrid;
    }

    /// Every parameter row as declared, across all jurisdictions.
    public List<Parameter> declaredParameters() {
        return declaredParameters;
    }

    /// The parameter table resolved for [RunConfig#jurisdiction()].
    public ParameterTable parameters() {
        return parameters;
    }

    public StrategyRegistry strategies() {
        return strategies;
    }

    public BackgroundMortality mortality() {
        return mortality;
    }

    public Optional<BudgetImpactConfig> budgetImpact() {
        return Optional.ofNullable(budgetImpact);
    }

    public SensitivityConfig sensitivity() {
        return sensitivity;
    }

    /// Returns a copy that runs under different settings.
    ///
    /// The jurisdiction and reference strategy must not change, since the
    /// parameter table and registry were resolved against them.
    public ModelDefinition withRunConfig(RunConfig config) {
        if (!Objects.equals(config.jurisdiction(), runConfig.jurisdiction())
            || !Objects.equals(config.referenceStrategy(), runConfig.referenceStrategy())) {
            throw new IllegalArgumentException("jurisdiction and reference strategy are fixed once a model is loaded");
        }
        return new ModelDefinition(config, wtpGrid, declaredParameters, parameters, strategies, mortality,
            budgetImpact, sensitivity);
    }
}
