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

/// A constructed transition matrix is not row-stochastic: it has a
/// negative entry, or a row whose sum deviates from 1 beyond tolerance.
public class InvalidTransitionException extends CeaException {

    private final String strategyId;
    private final int cycle;
    private final int row;

    public InvalidTransitionException(String strategyId, int cycle, int row, String message) {
        super("strategy " + strategyId + ", cycle " + cycle + ", row " + row, message);
        this.strategyId = strategyId;
        this.cycle = cycle;
        this.row = row;
    }

    public String strategyId() {
        return strategyId;
    }

    public int cycle() {
        return cycle;
    }

    public int row() {
        return row;
    }
}
