package io.nosqlbench.cea.budget;

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
import io.nosqlbench.cea.model.errors.AdoptionOverflowException;
import io.nosqlbench.cea.model.errors.ValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Projects per-patient costs onto a population under changing market shares.
///
/// ## Per Year
///
/// ```text
/// population(y)      = base × (1 + growth)^(y-1)
/// populationCost(y,s)= population(y) × share(s, y) × perPatientCost(s)
/// unadopted(y)       = population(y) × (1 - Σ_s share(s, y)) × perPatientCost(reference)
/// implementation(y)  = Σ one-time cost of s, for s whose share first turns positive in y
/// total(y)           = Σ_s populationCost(y,s) + unadopted(y) + implementation(y)
/// baseline(y)        = population(y) × Σ_s baselineShare(s) × perPatientCost(s)
///                      (+ the unassigned baseline share at the reference's cost)
/// impact(y)          = total(y) - baseline(y)
/// ```
///
/// Per-patient costs are normally the deterministic discounted costs of
/// the cohort model.
public final class BudgetImpactProjector {

    private static final Logger logger = LogManager.getLogger(BudgetImpactProjector.class);

    private final List<String> strategyIds;
    private final String referenceId;

    public BudgetImpactProjector(List<String> strategyIds, String referenceId) {
        if (!strategyIds.contains(referenceId)) {
            throw new ValidationException(referenceId, "reference strategy is not registered");
        }
        this.strategyIds = List.copyOf(strategyIds);
        this.referenceId = referenceId;
    }

    /// Projects the budget.
    ///
    /// @param config population, adoption and implementation inputs
    /// @param perPatientCost cost per patient of every strategy
    /// @return one row per projection year
    /// @throws AdoptionOverflowException if any year's shares sum above 1
    /// @throws ValidationException if a strategy is unknown or lacks a cost
    public BudgetImpactResult project(BudgetImpactConfig config, Map<String, Double> perPatientCost) {
        AdoptionCurve adoption = config.adoption();
        validate(config, perPatientCost);

        Map<String, Double> baseline = config.baselineShares().isEmpty()
            ? Map.of(referenceId, 1.0)
            : config.baselineShares();
        double baselinePerPatient = 0.0;
        double baselineAssigned = 0.0;
        for (Map.Entry<String, Double> entry : baseline.entrySet()) {
            baselinePerPatient += entry.getValue() * perPatientCost.get(entry.getKey());
            baselineAssigned += entry.getValue();
        }
        baselinePerPatient += Math.max(0.0, 1.0 - baselineAssigned) * perPatientCost.get(referenceId);

        Set<String> launched = new HashSet<>();
        double cumulative = 0.0;
        List<BudgetImpactRow> rows = new ArrayList<>(adoption.years());
        for (int year = 1; year <= adoption.years(); year++) {
            double population = config.eligiblePopulation(year);
            Map<String, Double> costs = new LinkedHashMap<>();
            double adoptedShare = 0.0;
            double implementation = 0.0;
            for (String strategy : strategyIds) {
                double share = adoption.share(strategy, year);
                adoptedShare += share;
                costs.put(strategy, population * share * perPatientCost.getOrDefault(strategy, 0.0));
                if (share > 0.0 && launched.add(strategy)) {
                    implementation += config.implementationCosts().getOrDefault(strategy, 0.0);
                }
            }
            double unadopted = population * Math.max(0.0, 1.0 - adoptedShare) * perPatientCost.get(referenceId);
            double total = unadopted + implementation;
            for (double cost : costs.values()) {
                total += cost;
            }
            double baselineCost = population * baselinePerPatient;
            double impact = total - baselineCost;
            cumulative += impact;
            rows.add(new BudgetImpactRow(year, population, costs, unadopted, implementation, total,
                baselineCost, impact, cumulative));
            logger.debug("Budget year {}: population {}, total {}, impact {}", year, population, total, impact);
        }
        return new BudgetImpactResult(strategyIds, rows);
    }

    private void validate(BudgetImpactConfig config, Map<String, Double> perPatientCost) {
        AdoptionCurve adoption = config.adoption();
        for (int year = 1; year <= adoption.years(); year++) {
            double total = adoption.totalShare(year);
            if (total > 1.0 + AdoptionCurve.SHARE_TOLERANCE) {
                throw new AdoptionOverflowException(year, total);
            }
        }
        Set<String> referenced = new HashSet<>(adoption.strategies());
        referenced.addAll(config.baselineShares().keySet());
        referenced.addAll(config.implementationCosts().keySet());
        referenced.add(referenceId);
        for (String strategy : referenced) {
            if (!strategyIds.contains(strategy)) {
                throw new ValidationException(strategy, "budget impact refers to an unknown strategy");
            }
            Double cost = perPatientCost.get(strategy);
            if (cost == null || !Double.isFinite(cost)) {
                throw new ValidationException(strategy, "no per-patient cost for budget impact");
            }
        }
    }
}
