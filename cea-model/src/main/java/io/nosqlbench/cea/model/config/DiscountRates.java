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

import io.nosqlbench.cea.model.errors.ValidationException;

/// Annual discount rates for one jurisdiction, applied separately to
/// costs and to health outcomes.
///
/// @param costs annual cost discount rate, in [0, 1)
/// @param qalys annual QALY discount rate, in [0, 1)
public record DiscountRates(double costs, double qalys) {

    public DiscountRates {
        check("costs", costs);
        check("qalys", qalys);
    }

    public static DiscountRates uniform(double rate) {
        return new DiscountRates(rate, rate);
    }

    private static void check(String name, double rate) {
        if (!(rate >= 0.0 && rate < 1.0)) {
            throw new ValidationException("discount_rates." + name, "rate must be in [0, 1), got " + rate);
        }
    }
}
