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

import java.util.List;

/// Budget trajectory over the projection horizon.
public final class BudgetImpactResult {

    private final List<String> strategyIds;
    private final List<BudgetImpactRow> rows;

    public BudgetImpactResult(List<String> strategyIds, List<BudgetImpactRow> rows) {
        this.strategyIds = List.copyOf(strategyIds);
        this.rows = List.copyOf(rows);
    }

    public List<String> strategyIds() {
        return strategyIds;
    }

    public List<BudgetImpactRow> rows() {
        return rows;
    }

    /// Row of a projection year, from 1.
    public BudgetImpactRow year(int year) {
        return rows.get(year - 1);
    }

    public double cumulativeImpact() {
        return rows.isEmpty() ? 0.0 : rows.get(rows.size() - 1).cumulativeImpact();
    }
}
