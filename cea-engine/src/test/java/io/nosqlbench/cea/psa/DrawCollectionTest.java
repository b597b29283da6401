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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class DrawCollectionTest {

    private static SimulationDraw draw(long iteration) {
        return new SimulationDraw(iteration, 100 + iteration, new double[] {0.5},
            new double[] {iteration, 2 * iteration}, new double[] {1, 2});
    }

    @Test
    void drawsAreReturnedInIterationOrder() {
        DrawCollection draws = new DrawCollection();
        draws.merge(List.of(draw(5), draw(1)));
        draws.merge(List.of(draw(3)));
        assertThat(draws.sorted()).extracting(SimulationDraw::iteration).containsExactly(1L, 3L, 5L);
        assertEquals(3, draws.size());
    }

    @Test
    void duplicateIterationIsRejected() {
        DrawCollection draws = new DrawCollection();
        draws.merge(List.of(draw(1), draw(2)));
        assertThrows(ResumeConflictException.class, () -> draws.merge(List.of(draw(3), draw(2))));
        assertEquals(2, draws.size());
        assertFalse(draws.contains(3));
    }

    @Test
    void failedIterationsAreTrackedSeparately() {
        DrawCollection draws = new DrawCollection();
        draws.merge(List.of(draw(0)));
        draws.markFailed(List.of(4L, 2L));
        assertTrue(draws.contains(2));
        assertEquals(2, draws.failedCount());
        assertEquals(List.of(2L, 4L), draws.failedIterations());
        assertThrows(ResumeConflictException.class, () -> draws.markFailed(List.of(0L)));
        assertThrows(ResumeConflictException.class, () -> draws.merge(List.of(draw(4))));
    }
}
