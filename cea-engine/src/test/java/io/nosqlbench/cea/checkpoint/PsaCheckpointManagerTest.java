package io.nosqlbench.cea.checkpoint;

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

import io.nosqlbench.cea.TrdFixtures;
import io.nosqlbench.cea.model.Parameter;
import io.nosqlbench.cea.model.errors.ResumeConflictException;
import io.nosqlbench.cea.psa.SimulationDraw;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class PsaCheckpointManagerTest {

    private static final String FINGERPRINT = "seed=7;horizon=24";
    private static final List<String> STRATEGIES = List.of("usual_care", "ketamine");

    @TempDir
    Path tempDir;

    private static SimulationDraw draw(long iteration) {
        return new SimulationDraw(iteration, 7 + iteration, new double[] {0.05 + iteration / 1000.0, 0.15},
            new double[] {1234.5678, 3456.789 + iteration}, new double[] {1.1, 1.25});
    }

    private static PsaCheckpointState.Builder state(long... iterations) {
        List<SimulationDraw> draws = new ArrayList<>();
        for (long i : iterations) {
            draws.add(draw(i));
        }
        return new PsaCheckpointState.Builder()
            .configFingerprint(FINGERPRINT)
            .baseSeed(7)
            .totalIterations(10)
            .strategyIds(STRATEGIES)
            .parameters(TrdFixtures.parameters().parameters())
            .draws(draws);
    }

    @Test
    void saveAndLoadPreserveTheState() throws Exception {
        Path path = tempDir.resolve("checkpoint.json");
        PsaCheckpointState original = state(0, 1, 2).failedIterations(List.of(3L)).build();
        PsaCheckpointManager.save(path, original);

        PsaCheckpointState loaded = PsaCheckpointManager.load(path);
        assertEquals(PsaCheckpointState.CURRENT_VERSION, loaded.version());
        assertEquals(FINGERPRINT, loaded.configFingerprint());
        assertEquals(7, loaded.baseSeed());
        assertEquals(STRATEGIES, loaded.strategyIds());
        assertEquals(original.draws(), loaded.draws());
        assertEquals(List.of(3L), loaded.failedIterations());
        assertEquals(TrdFixtures.parameters().parameters(), loaded.parameters());
        assertThat(loaded.checksum()).startsWith("sha256:");
        assertEquals(4, loaded.completedIterations());
        assertFalse(Files.exists(tempDir.resolve("checkpoint.json.tmp")));
    }

    @Test
    void savingTwiceReplacesTheFile() throws Exception {
        Path path = tempDir.resolve("nested/dir/checkpoint.json");
        PsaCheckpointManager.save(path, state(0).build());
        PsaCheckpointManager.save(path, state(0, 1).build());
        assertEquals(2, PsaCheckpointManager.load(path).draws().size());
    }

    @Test
    void missingFileIsRejected() {
        assertThrows(PsaCheckpointManager.CheckpointException.class,
            () -> PsaCheckpointManager.load(tempDir.resolve("absent.json")));
    }

    @Test
    void malformedFilesAreRejected() throws Exception {
        Path invalid = tempDir.resolve("invalid.json");
        Files.writeString(invalid, "{\"version\": 1, \"draws\": [", StandardCharsets.UTF_8);
        assertThrows(PsaCheckpointManager.CheckpointException.class, () -> PsaCheckpointManager.load(invalid));

        Path empty = tempDir.resolve("empty.json");
        Files.writeString(empty, "", StandardCharsets.UTF_8);
        assertThrows(PsaCheckpointManager.CheckpointException.class, () -> PsaCheckpointManager.load(empty));
    }

    @Test
    void tamperedContentFailsTheChecksum() throws Exception {
        Path path = tempDir.resolve("checkpoint.json");
        PsaCheckpointManager.save(path, state(0, 1).build());
        String json = Files.readString(path, StandardCharsets.UTF_8);
        Files.writeString(path, json.replaceFirst("\"total_iterations\":\\s*10", "\"total_iterations\": 11"),
            StandardCharsets.UTF_8);

        PsaCheckpointManager.CheckpointException e = assertThrows(PsaCheckpointManager.CheckpointException.class,
            () -> PsaCheckpointManager.load(path));
        assertThat(e.getMessage()).contains("checksum");
    }

    @Test
    void otherVersionsAreRejected() throws Exception {
        Path path = tempDir.resolve("checkpoint.json");
        PsaCheckpointManager.save(path, state(0).build());
        String json = Files.readString(path, StandardCharsets.UTF_8);
        Files.writeString(path, json.replaceFirst("\"version\":\\s*1", "\"version\": 99"), StandardCharsets.UTF_8);

        PsaCheckpointManager.CheckpointException e = assertThrows(PsaCheckpointManager.CheckpointException.class,
            () -> PsaCheckpointManager.load(path));
        assertThat(e.getMessage()).contains("version");
    }

    @Test
    void compatibilityIsChecked() {
        PsaCheckpointState state = state(0).build();
        List<Parameter> parameters = TrdFixtures.parameters().parameters();

        PsaCheckpointManager.verifyCompatible(state, FINGERPRINT, 7, STRATEGIES, parameters);
        assertThrows(ResumeConflictException.class,
            () -> PsaCheckpointManager.verifyCompatible(state, FINGERPRINT, 8, STRATEGIES, parameters));
        assertThrows(ResumeConflictException.class,
            () -> PsaCheckpointManager.verifyCompatible(state, "seed=7;horizon=12", 7, STRATEGIES, parameters));
        assertThrows(ResumeConflictException.class,
            () -> PsaCheckpointManager.verifyCompatible(state, FINGERPRINT, 7, List.of("ketamine"), parameters));
        assertThrows(ResumeConflictException.class,
            () -> PsaCheckpointManager.verifyCompatible(state, FINGERPRINT, 7, STRATEGIES, parameters.subList(0, 2)));
    }

    @Test
    void disjointCheckpointsMerge() {
        PsaCheckpointState merged = PsaCheckpointManager.merge(state(4, 0).build(),
            state(1, 2).failedIterations(List.of(3L)).build());
        assertThat(merged.draws()).extracting(SimulationDraw::iteration).containsExactly(0L, 1L, 2L, 4L);
        assertEquals(List.of(3L), merged.failedIterations());
        assertNull(merged.checksum());
    }

    @Test
    void overlappingCheckpointsDoNotMerge() {
        assertThrows(ResumeConflictException.class,
            () -> PsaCheckpointManager.merge(state(0, 1).build(), state(1, 2).build()));
        assertThrows(ResumeConflictException.class,
            () -> PsaCheckpointManager.merge(state(0).failedIterations(List.of(5L)).build(), state(5).build()));
    }
}
