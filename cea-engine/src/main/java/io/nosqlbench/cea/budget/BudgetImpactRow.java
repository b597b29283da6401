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

import java.util.Map;

/// One projection year.
///
/// @param year projection year, from 1
/// @param eligiblePopulation eligible patients that year
/// @param populationCosts cost of each strategy's adopted share, in strategy order
/// @param unadoptedCost cost of the share no strategy has adopted, which stays on the reference strategy
/// @param implementationCost one-time costs of strategies first adopted that year
/// @param totalCost sum of the population, unadopted and implementation costs
/// @param baselineCost cost of the same population under the pre-adoption mix
/// @param budgetImpact total minus baseline
/// @param cumulativeImpact running sum of the budget impact up to this year
public record BudgetImpactRow(int year, double eligiblePopulation, Map<String, Double> populationCosts,
                              double unadoptedCost, double implementationCost, double totalCost,
                              double baselineCost, double budgetImpact, double cumulativeImpact) {

    public BudgetImpactRow {
        populationCosts = Map.copyOf(populationCosts);
    }

    public double populationCost(String strategyId) {
        return populationCosts.getOrDefault(strategyId, 0.0);
    }
}
