package io.nosqlbench.cea.model.errors;

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

/// Adoption shares across strategies exceed 1 in some projection year.
/// Shares are never renormalised silently.
public class AdoptionOverflowException extends ValidationException {

    private final int year;
    private final double totalShare;

    public AdoptionOverflowException(int year, double totalShare) {
        super("year " + year,
            String.format("adoption shares sum to %.6f, which exceeds 1", totalShare));
        this.year = year;
        this.totalShare = totalShare;
    }

    public int year() {
        return year;
    }

    public double totalShare() {
        return totalShare;
    }
}
