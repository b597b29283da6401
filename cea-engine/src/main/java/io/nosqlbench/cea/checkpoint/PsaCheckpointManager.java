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

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import io.nosqlbench.cea.model.Parameter;
import io.nosqlbench.cea.model.errors.ResumeConflictException;
import io.nosqlbench.cea.psa.SimulationDraw;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// Saves, loads and reconciles checkpoints of probabilistic runs.
///
/// ## Atomic Writes
///
/// ```text
///   1. Serialize the state without checksum, hash it (SHA-256)
///   2. Write the state with checksum to checkpoint.json.tmp
///   3. Rename the temp file over checkpoint.json (atomic on POSIX)
///
///   If interrupted at any point the previous checkpoint remains intact.
/// ```
///
/// ## Resume Rules
///
/// A checkpoint may seed a run only when its configuration fingerprint,
/// base seed, strategy ids and parameter declarations all equal the run's.
/// Two checkpoints may be merged only when no iteration appears in both.
/// Violations raise [ResumeConflictException]; they are configuration
/// conflicts, not I/O failures.
///
/// @see PsaCheckpointState
/// @see CeaGsonConfig
public final class PsaCheckpointManager {

    private static final Logger logger = LogManager.getLogger(PsaCheckpointManager.class);

    private static final String TEMP_SUFFIX = ".tmp";
    private static final String CHECKSUM_PREFIX = "sha256:";

    private PsaCheckpointManager() {
        // Utility class
    }

    /// Saves checkpoint state to a file atomically.
    ///
    /// @param path the path to save the checkpoint to
    /// @param state the checkpoint state to save
    /// @throws IOException if writing fails
    public static void save(Path path, PsaCheckpointState state) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(state, "state cannot be null");

        Gson gson = CeaGsonConfig.gson();
        String checksum = computeChecksum(gson.toJson(state.toBuilder().checksum(null).build()));
        String finalJson = gson.toJson(state.toBuilder().checksum(checksum).build());

        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tempPath = path.resolveSibling(path.getFileName() + TEMP_SUFFIX);
        try (Writer writer = Files.newBufferedWriter(tempPath, StandardCharsets.UTF_8)) {
            writer.write(finalJson);
        }
        Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.debug("Saved checkpoint {} with {} of {} iterations",
            path, state.completedIterations(), state.totalIterations());
    }

    /// Loads and verifies checkpoint state from a file.
    ///
    /// @param path the path to load the checkpoint from
    /// @return the loaded checkpoint state
    /// @throws IOException if reading fails
    /// @throws CheckpointException if the checkpoint is missing, malformed, of
    ///         another version, or fails its checksum
    public static PsaCheckpointState load(Path path) throws IOException, CheckpointException {
        Objects.requireNonNull(path, "path cannot be null");

        if (!Files.exists(path)) {
            throw new CheckpointException("Checkpoint file not found: " + path);
        }
        String json = Files.readString(path, StandardCharsets.UTF_8);

        PsaCheckpointState state;
        try {
            state = CeaGsonConfig.gson().fromJson(json, PsaCheckpointState.class);
        } catch (JsonParseException | IllegalArgumentException e) {
            throw new CheckpointException("Invalid checkpoint JSON: " + e.getMessage(), e);
        }
        if (state == null) {
            throw new CheckpointException("Checkpoint file is empty: " + path);
        }
        if (state.version() != PsaCheckpointState.CURRENT_VERSION) {
            throw new CheckpointException(
                "Unsupported checkpoint version: " + state.version()
                    + " (expected: " + PsaCheckpointState.CURRENT_VERSION + ")");
        }
        if (state.checksum() == null) {
            throw new CheckpointException("Checkpoint has no checksum: " + path);
        }
        String expected = computeChecksum(CeaGsonConfig.gson().toJson(state.toBuilder().checksum(null).build()));
        if (!expected.equals(state.checksum())) {
            throw new CheckpointException(
                "Checkpoint checksum mismatch: expected " + expected + " but found " + state.checksum());
        }
        logger.debug("Loaded checkpoint {} with {} of {} iterations",
            path, state.completedIterations(), state.totalIterations());
        return state;
    }

    /// Checks that a checkpoint was produced by the same run definition.
    ///
    /// @throws ResumeConflictException on any mismatch
    public static void verifyCompatible(PsaCheckpointState state, String fingerprint, long baseSeed,
                                        List<String> strategyIds, List<Parameter> parameters) {
        if (state.baseSeed() != baseSeed) {
            throw new ResumeConflictException("base_seed",
                "checkpoint seed " + state.baseSeed() + " differs from run seed " + baseSeed);
        }
        if (!Objects.equals(state.configFingerprint(), fingerprint)) {
            throw new ResumeConflictException("config",
                "checkpoint was written by configuration '" + state.configFingerprint()
                    + "', run uses '" + fingerprint + "'");
        }
        if (!state.strategyIds().equals(strategyIds)) {
            throw new ResumeConflictException("strategies",
                "checkpoint strategies " + state.strategyIds() + " differ from " + strategyIds);
        }
        if (!state.parameters().equals(parameters)) {
            throw new ResumeConflictException("parameters",
                "checkpoint parameter declarations differ from the run's");
        }
    }

    /// Combines two checkpoints of the same run, such as partial runs over
    /// disjoint iteration ranges.
    ///
    /// @return a checkpoint holding the draws of both, ordered by iteration
    /// @throws ResumeConflictException if the runs differ or an iteration appears in both
    public static PsaCheckpointState merge(PsaCheckpointState first, PsaCheckpointState second) {
        verifyCompatible(second, first.configFingerprint(), first.baseSeed(), first.strategyIds(), first.parameters());
        Set<Long> seen = new HashSet<>();
        List<SimulationDraw> draws = new ArrayList<>();
        List<Long> failed = new ArrayList<>();
        for (PsaCheckpointState state : List.of(first, second)) {
            for (SimulationDraw draw : state.draws()) {
                claim(seen, draw.iteration());
                draws.add(draw);
            }
            for (Long iteration : state.failedIterations()) {
                claim(seen, iteration);
                failed.add(iteration);
            }
        }
        draws.sort(Comparator.comparingLong(SimulationDraw::iteration));
        failed.sort(Comparator.naturalOrder());
        return first.toBuilder()
            .totalIterations(Math.max(first.totalIterations(), second.totalIterations()))
            .timestamp(null)
            .checksum(null)
            .draws(draws)
            .failedIterations(failed)
            .build();
    }

    private static void claim(Set<Long> seen, long iteration) {
        if (!seen.add(iteration)) {
            throw new ResumeConflictException("iteration " + iteration,
                "iteration is present in both checkpoints");
        }
    }

    private static String computeChecksum(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return CHECKSUM_PREFIX + HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /// Exception thrown when checkpoint loading or validation fails.
    public static class CheckpointException extends Exception {
        public CheckpointException(String message) {
            super(message);
        }

        public CheckpointException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
