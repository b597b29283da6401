package io.nosqlbench.cea.economics;

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

/// Per-cycle discount factors for an annual rate.
///
/// The factor of cycle c is `(1 + r)^(-c × cycleYears)`, so cycle 0 is
/// undiscounted and a full year of cycles carries exactly one year of
/// discounting.
public final class Discounting {

    private final double annualRate;
    private final double cycleYears;

    public Discounting(double annualRate, double cycleYears) {
        if (!(annualRate >= 0.0 && annualRate < 1.0)) {
            throw new ValidationException("discount_rate", "must be in [0, 1), got " + annualRate);
        }
        if (!(cycleYears > 0.0)) {
            throw new ValidationException("cycle_length", "must be positive, got " + cycleYears);
        }
        this.annualRate = annualRate;
        this.cycleYears = cycleYears;
    }

    public static Discounting none(double cycleYears) {
        return new Discounting(0.0, cycleYears);
    }

    public double annualRate() {
        return annualRate;
    }

    public double factor(int cycle) {
        return Math.pow(1.0 + annualRate, -cycle * cycleYears);
    }

    /// Factors for cycles 0 to cycles-1.
    public double[] factors(int cycles) {
        double[] f = new double[cycles];
        for (int c = 0; c < cycles; c++) {
            f[c] = factor(c);
        }
        return f;
    }
}
