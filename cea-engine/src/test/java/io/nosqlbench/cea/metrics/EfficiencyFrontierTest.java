package io.nosqlbench.cea.metrics;

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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class EfficiencyFrontierTest {

    @Test
    void costlierAndWorseIsStrictlyDominated() {
        EfficiencyFrontier frontier = EfficiencyFrontier.of(List.of("B", "C"),
            new double[] {800, 1200}, new double[] {4.5, 4.0});
        assertEquals(Dominance.STRICT, frontier.dominance(1));
        assertFalse(frontier.contains(1));
        assertThat(frontier.memberIds()).containsExactly("B");
        assertTrue(frontier.sequentialIcer(1).isEmpty());
    }

    @Test
    void pointAboveTheLineIsExtendedlyDominated() {
        EfficiencyFrontier frontier = EfficiencyFrontier.of(List.of("A", "B", "C"),
            new double[] {0, 500, 600}, new double[] {0, 1, 2});
        assertEquals(Dominance.EXTENDED, frontier.dominance(1));
        assertThat(frontier.memberIds()).containsExactly("A", "C");
        assertTrue(frontier.sequentialIcer(0).isEmpty());
        assertEquals(300.0, frontier.sequentialIcer(2).getAsDouble(), 1e-9);
    }

    @Test
    void membersAreOrderedByQaly() {
        EfficiencyFrontier frontier = EfficiencyFrontier.of(List.of("high", "low", "mid"),
            new double[] {3000, 1000, 1500}, new double[] {3, 1, 2});
        assertThat(frontier.memberIds()).containsExactly("low", "mid", "high");
        assertEquals(500.0, frontier.sequentialIcer(2).getAsDouble(), 1e-9);
        assertEquals(1500.0, frontier.sequentialIcer(0).getAsDouble(), 1e-9);
    }

    @Test
    void sequentialIcersIncrease() {
        EfficiencyFrontier frontier = EfficiencyFrontier.of(List.of("a", "b", "c", "d", "e"),
            new double[] {0, 900, 1000, 2500, 1200}, new double[] {0, 0.5, 2.0, 3.0, 1.5});
        double last = Double.NEGATIVE_INFINITY;
        for (int s : frontier.members()) {
            if (frontier.sequentialIcer(s).isPresent()) {
                assertTrue(frontier.sequentialIcer(s).getAsDouble() > last);
                last = frontier.sequentialIcer(s).getAsDouble();
            }
        }
    }

    @Test
    void rebuildingFromMembersIsIdempotent() {
        List<String> ids = List.of("a", "b", "c", "d", "e");
        double[] costs = {0, 900, 1000, 2500, 1200};
        double[] qalys = {0, 0.5, 2.0, 3.0, 1.5};
        EfficiencyFrontier first = EfficiencyFrontier.of(ids, costs, qalys);

        List<Integer> members = first.members();
        double[] memberCosts = new double[members.size()];
        double[] memberQalys = new double[members.size()];
        for (int k = 0; k < members.size(); k++) {
            memberCosts[k] = costs[members.get(k)];
            memberQalys[k] = qalys[members.get(k)];
        }
        EfficiencyFrontier second = EfficiencyFrontier.of(first.memberIds(), memberCosts, memberQalys);
        assertEquals(first.memberIds(), second.memberIds());
    }

    @Test
    void exactDuplicatesKeepTheLowestIndex() {
        EfficiencyFrontier frontier = EfficiencyFrontier.of(List.of("x", "y"),
            new double[] {100, 100}, new double[] {1, 1});
        assertTrue(frontier.contains(0));
        assertEquals(Dominance.STRICT, frontier.dominance(1));
    }

    @Test
    void singleStrategyIsItsOwnFrontier() {
        EfficiencyFrontier frontier = EfficiencyFrontier.of(List.of("only"), new double[] {10}, new double[] {1});
        assertThat(frontier.memberIds()).containsExactly("only");
        assertTrue(frontier.sequentialIcer(0).isEmpty());
    }

    @Test
    void mismatchedInputsAreRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> EfficiencyFrontier.of(List.of("a", "b"), new double[] {1}, new double[] {1, 2}));
        assertThrows(IllegalArgumentException.class,
            () -> EfficiencyFrontier.of(List.of(), new double[0], new double[0]));
    }
}
