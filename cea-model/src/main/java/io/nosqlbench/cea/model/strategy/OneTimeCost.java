package io.nosqlbench.cea.model.strategy;

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

/// A cost incurred once, at a fixed cycle, by every living cohort member,
/// for example an acute treatment course.
///
/// @param label short description, reported in diagnostics
/// @param cycle zero-based cycle at which the cost occurs
/// @param amount the cost per patient
public record OneTimeCost(String label, int cycle, ValueRef amount) {

    public OneTimeCost {
        if (cycle < 0) {
            throw new ValidationException(label, "one-time cost cycle must be non-negative, got " + cycle);
        }
        if (amount == null) {
            throw new ValidationException(label, "one-time cost has no amount");
        }
    }
}
