package io.nosqlbench.cea.psa;

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

import io.nosqlbench.cea.model.errors.ResumeConflictException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.TreeMap;
import java.util.TreeSet;

/// Append-only store of simulation draws, keyed by iteration index.
///
/// Workers never write here directly: each fills a local buffer for its
/// share of a batch, and the buffers are merged at the batch boundary.
/// Merging is synchronized; reads return copies ordered by iteration, so
/// reductions never depend on completion order.
public final class DrawCollection {

    private final TreeMap<Long, SimulationDraw> draws = new TreeMap<>();
    private final TreeSet<Long> failed = new TreeSet<>();

    /// Merges a batch of draws.
    ///
    /// @throws ResumeConflictException if an iteration is already present
    public synchronized void merge(Collection<SimulationDraw> batch) {
        for (SimulationDraw draw : batch) {
            if (draws.containsKey(draw.iteration()) || failed.contains(draw.iteration())) {
                throw new ResumeConflictException("iteration " + draw.iteration(),
                    "iteration is already present; merging would double-count it");
            }
        }
        for (SimulationDraw draw : batch) {
            draws.put(draw.iteration(), draw);
        }
    }

    /// Records iterations that failed and were skipped.
    public synchronized void markFailed(Collection<Long> iterations) {
        for (Long iteration : iterations) {
            if (draws.containsKey(iteration)) {
                throw new ResumeConflictException("iteration " + iteration,
                    "iteration has a draw and cannot also be recorded as failed");
            }
            failed.add(iteration);
        }
    }

    public synchronized boolean contains(long iteration) {
        return draws.containsKey(iteration) || failed.contains(iteration);
    }

    public synchronized int size() {
        return draws.size();
    }

    public synchronized int failedCount() {
        return failed.size();
    }

    /// Returns the draws ordered by iteration.
    public synchronized List<SimulationDraw> sorted() {
        List<SimulationDraw> copy = new ArrayList<>(draws.values());
        copy.sort(Comparator.comparingLong(SimulationDraw::iteration));
        return copy;
    }

    public synchronized List<Long> failedIterations() {
        return new ArrayList<>(failed);
    }
}
