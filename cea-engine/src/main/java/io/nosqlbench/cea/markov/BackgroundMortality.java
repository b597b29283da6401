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

import io.nosqlbench.cea.model.errors.ValidationException;

import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

/// Age-dependent all-cause mortality from a life table.
///
/// ## Lookup
///
/// Each row gives the annual probability of death from its age up to the
/// next row's age. Ages below the first row use the first row; ages beyond
/// the last row use the last row.
///
/// ## Conversion
///
/// The annual probability is multiplied by the standardized mortality
/// ratio, capped at 1, and converted to the cycle length assuming a
/// constant hazard within the year:
///
/// ```text
/// q_cycle = 1 - (1 - min(1, q_annual × smr))^cycleYears
/// ```
public final class BackgroundMortality {

    private static final BackgroundMortality NONE = new BackgroundMortality(new double[]{0.0}, new double[]{0.0}, 1.0);

    private final double[] ages;
    private final double[] annualProbabilities;
    private final double smr;

    private BackgroundMortality(double[] ages, double[] annualProbabilities, double smr) {
        this.ages = ages;
        this.annualProbabilities = annualProbabilities;
        this.smr = smr;
    }

    /// Mortality that never applies.
    public static BackgroundMortality none() {
        return NONE;
    }

    /// Builds a life table from age to annual death probability.
    ///
    /// @param table annual probability of death keyed by age
    /// @param smr standardized mortality ratio applied to every row
    /// @return the life table
    public static BackgroundMortality lifeTable(Map<Double, Double> table, double smr) {
        if (table.isEmpty()) {
            throw new ValidationException("background_mortality", "life table has no rows");
        }
        if (!(smr >= 0.0) || !Double.isFinite(smr)) {
            throw new ValidationException("background_mortality.smr", "must be non-negative, got " + smr);
        }
        TreeMap<Double, Double> sorted = new TreeMap<>(table);
        double[] ages = new double[sorted.size()];
        double[] qs = new double[sorted.size()];
        int i = 0;
        for (Map.Entry<Double, Double> row : sorted.entrySet()) {
            double q = row.getValue();
            if (!(q >= 0.0 && q <= 1.0)) {
                throw new ValidationException("background_mortality",
                    "annual probability at age " + row.getKey() + " must be in [0, 1], got " + q);
            }
            ages[i] = row.getKey();
            qs[i] = q;
            i++;
        }
        return new BackgroundMortality(ages, qs, smr);
    }

    /// Annual probability of death at an age, before the SMR.
    public double annualProbability(double age) {
        int index = Arrays.binarySearch(ages, age);
        if (index < 0) {
            index = Math.max(0, -index - 2);
        }
        return annualProbabilities[index];
    }

    /// Probability of dying within one cycle at an age.
    public double cycleProbability(double age, double cycleYears) {
        double annual = Math.min(1.0, annualProbability(age) * smr);
        if (annual == 0.0) {
            return 0.0;
        }
        return 1.0 - Math.pow(1.0 - annual, cycleYears);
    }

    public double smr() {
        return smr;
    }
}
