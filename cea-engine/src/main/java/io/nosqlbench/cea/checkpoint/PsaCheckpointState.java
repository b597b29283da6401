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

import com.google.gson.annotations.SerializedName;
import io.nosqlbench.cea.model.Parameter;
import io.nosqlbench.cea.psa.SimulationDraw;

import java.time.Instant;
import java.util.List;

/// Saved progress of a probabilistic run.
///
/// ## JSON Schema
///
/// ```json
/// {
///   "version": 1,
///   "config_fingerprint": "seed=42;horizon=60;...",
///   "base_seed": 42,
///   "total_iterations": 1000,
///   "timestamp": "2026-01-07T10:30:00Z",
///   "checksum": "sha256:abc123...",
///   "strategy_ids": ["usual_care", "ketamine"],
///   "parameters": [{"name": "p_remit", "distribution": {"type": "beta", ...}}, ...],
///   "draws": [{"iteration": 0, "seed": 42, "costs": [...], "qalys": [...]}, ...],
///   "failed_iterations": []
/// }
/// ```
///
/// The parameter declarations are stored so that a resume can check the
/// draws were produced from the same distributions.
///
/// @see PsaCheckpointManager
public final class PsaCheckpointState {

    /// Current checkpoint format version.
    public static final int CURRENT_VERSION = 1;

    @SerializedName("version")
    private final int version;

    @SerializedName("config_fingerprint")
    private final String configFingerprint;

    @SerializedName("base_seed")
    private final long baseSeed;

    @SerializedName("total_iterations")
    private final int totalIterations;

    @SerializedName("timestamp")
    private final String timestamp;

    @SerializedName("checksum")
    private final String checksum;

    @SerializedName("strategy_ids")
    private final List<String> strategyIds;

    @SerializedName("parameters")
    private final List<Parameter> parameters;

    @SerializedName("draws")
    private final List<SimulationDraw> draws;

    @SerializedName("failed_iterations")
    private final List<Long> failedIterations;

    private PsaCheckpointState(Builder builder) {
        this.version = CURRENT_VERSION;
        this.configFingerprint = builder.configFingerprint;
        this.baseSeed = builder.baseSeed;
        this.totalIterations = builder.totalIterations;
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now().toString();
        this.checksum = builder.checksum;
        this.strategyIds = builder.strategyIds;
        this.parameters = builder.parameters;
        this.draws = builder.draws;
        this.failedIterations = builder.failedIterations;
    }

    public int version() {
        return version;
    }

    public String configFingerprint() {
        return configFingerprint;
    }

    public long baseSeed() {
        return baseSeed;
    }

    public int totalIterations() {
        return totalIterations;
    }

    public String timestamp() {
        return timestamp;
    }

    public String checksum() {
        return checksum;
    }

    public List<String> strategyIds() {
        return strategyIds;
    }

    public List<Parameter> parameters() {
        return parameters;
    }

    public List<SimulationDraw> draws() {
        return draws == null ? List.of() : draws;
    }

    public List<Long> failedIterations() {
        return failedIterations == null ? List.of() : failedIterations;
    }

    /// Number of iterations accounted for, including skipped ones.
    public int completedIterations() {
        return draws().size() + failedIterations().size();
    }

    public boolean isComplete() {
        return completedIterations() >= totalIterations;
    }

    /// Returns a builder holding this state's values.
    public Builder toBuilder() {
        return new Builder()
            .configFingerprint(configFingerprint)
            .baseSeed(baseSeed)
            .totalIterations(totalIterations)
            .timestamp(timestamp)
            .checksum(checksum)
            .strategyIds(strategyIds)
            .parameters(parameters)
            .draws(draws)
            .failedIterations(failedIterations);
    }

    @Override
    public String toString() {
        return "PsaCheckpointState[" + completedIterations() + "/" + totalIterations
            + ", seed=" + baseSeed + ", timestamp=" + timestamp + "]";
    }

    /// Builder for [PsaCheckpointState].
    public static final class Builder {
        private String configFingerprint;
        private long baseSeed;
        private int totalIterations;
        private String timestamp;
        private String checksum;
        private List<String> strategyIds = List.of();
        private List<Parameter> parameters = List.of();
        private List<SimulationDraw> draws = List.of();
        private List<Long> failedIterations = List.of();

        public Builder configFingerprint(String configFingerprint) {
            this.configFingerprint = configFingerprint;
            return this;
        }

        public Builder baseSeed(long baseSeed) {
            this.baseSeed = baseSeed;
            return this;
        }

        public Builder totalIterations(int totalIterations) {
            this.totalIterations = totalIterations;
            return this;
        }

        public Builder timestamp(String timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder checksum(String checksum) {
            this.checksum = checksum;
            return this;
        }

        public Builder strategyIds(List<String> strategyIds) {
            this.strategyIds = strategyIds == null ? List.of() : List.copyOf(strategyIds);
            return this;
        }

        public Builder parameters(List<Parameter> parameters) {
            this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
            return this;
        }

        public Builder draws(List<SimulationDraw> draws) {
            this.draws = draws == null ? List.of() : List.copyOf(draws);
            return this;
        }

        public Builder failedIterations(List<Long> failedIterations) {
            this.failedIterations = failedIterations == null ? List.of() : List.copyOf(failedIterations);
            return this;
        }

        public PsaCheckpointState build() {
            return new PsaCheckpointState(this);
        }
    }
}
