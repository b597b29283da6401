package io.nosqlbench.cea.model.config;

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

import io.nosqlbench.cea.model.errors.AdoptionOverflowException;
import io.nosqlbench.cea.model.errors.ValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Inputs of a budget impact projection beyond the per-patient costs.
///
/// ## Population
///
/// The eligible population in year y is `basePopulation × (1 + growth)^(y-1)`.
///
/// ## Baseline
///
/// The baseline mix is the pre-adoption market share of each strategy,
/// constant across years. When not given, the whole population is on the
/// reference strategy.
public final class BudgetImpactConfig {

    private final AdoptionCurve adoption;
    private final double basePopulation;
    private final double populationGrowth;
    private final Map<String, Double> baselineShares;
    private final Map<String, Double> implementationCosts;

    private BudgetImpactConfig(Builder builder) {
        this.adoption = builder.adoption;
        this.basePopulation = builder.basePopulation;
        this.populationGrowth = builder.populationGrowth;
        this.baselineShares = Collections.unmodifiableMap(new LinkedHashMap<>(builder.baselineShares));
        this.implementationCosts = Collections.unmodifiableMap(new LinkedHashMap<>(builder.implementationCosts));
    }

    public static Builder builder() {
        return new Builder();
    }

    public AdoptionCurve adoption() {
        return adoption;
    }

    public int years() {
        return adoption.years();
    }

    public double basePopulation() {
        return basePopulation;
    }

    public double populationGrowth() {
        return populationGrowth;
    }

    /// Eligible population in a projection year, from 1.
    public double eligiblePopulation(int year) {
        return basePopulation * Math.pow(1.0 + populationGrowth, year - 1);
    }

    /// Baseline shares; empty means 100% on the reference strategy.
    public Map<String, Double> baselineShares() {
        return baselineShares;
    }

    /// One-time implementation costs per strategy, charged in the first year
    /// the strategy's adoption share becomes positive.
    public Map<String, Double> implementationCosts() {
        return implementationCosts;
    }

    public static final class Builder {
        private AdoptionCurve adoption;
        private double basePopulation;
        private double populationGrowth;
        private final Map<String, Double> baselineShares = new LinkedHashMap<>();
        private final Map<String, Double> implementationCosts = new LinkedHashMap<>();

        public Builder adoption(AdoptionCurve adoption) {
            this.adoption = Objects.requireNonNull(adoption);
            return this;
        }

        public Builder basePopulation(double basePopulation) {
            if (!(basePopulation >= 0) || !Double.isFinite(basePopulation)) {
                throw new ValidationException("eligible_population", "must be non-negative, got " + basePopulation);
            }
            this.basePopulation = basePopulation;
            return this;
        }

        public Builder populationGrowth(double populationGrowth) {
            if (!(populationGrowth > -1.0) || !Double.isFinite(populationGrowth)) {
                throw new ValidationException("population_growth", "must exceed -1, got " + populationGrowth);
            }
            this.populationGrowth = populationGrowth;
            return this;
        }

        public Builder baselineShare(String strategy, double share) {
            if (!(share >= 0.0 && share <= 1.0)) {
                throw new ValidationException(strategy, "baseline share must be in [0, 1], got " + share);
            }
            this.baselineShares.put(strategy, share);
            return this;
        }

        public Builder implementationCost(String strategy, double cost) {
            if (!(cost >= 0.0) || !Double.isFinite(cost)) {
                throw new ValidationException(strategy, "implementation cost must be non-negative, got " + cost);
            }
            this.implementationCosts.put(strategy, cost);
            return this;
        }

        public BudgetImpactConfig build() {
            if (adoption == null) {
                throw new ValidationException("adoption", "budget impact needs an adoption curve");
            }
            double baselineTotal = 0.0;
            for (double share : baselineShares.values()) {
                baselineTotal += share;
            }
            if (baselineTotal > 1.0 + AdoptionCurve.SHARE_TOLERANCE) {
                throw new AdoptionOverflowException(0, baselineTotal);
            }
            return new BudgetImpactConfig(this);
        }
    }
}
