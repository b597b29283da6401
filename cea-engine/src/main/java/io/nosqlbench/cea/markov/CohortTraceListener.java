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

/// Receives the cohort occupancy at the start of every simulated cycle.
///
/// The state passed to [#onCycle] is live and is advanced as soon as the
/// callback returns; listeners that keep occupancy must copy it.
@FunctionalInterface
public interface CohortTraceListener {

    /// Called once per cycle, before the cycle's transitions are applied.
    ///
    /// @param cycle the cycle index, from 0
    /// @param state start-of-cycle occupancy
    void onCycle(int cycle, CohortState state);

    /// Called once after the last cycle.
    ///
    /// @param cyclesRun number of cycles simulated, less than the horizon when
    ///        the whole cohort was absorbed early
    /// @param finalState occupancy after the last cycle
    default void onComplete(int cyclesRun, CohortState finalState) {
    }
}
