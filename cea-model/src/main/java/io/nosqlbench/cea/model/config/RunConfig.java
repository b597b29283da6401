package io.nosqlbench.cea.model.config;

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

import io.nosqlbench.cea.model.errors.ValidationException;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/// Immutable settings of one analysis run.
///
/// ## Defaults
///
/// | Setting | Default |
/// |---------|---------|
/// | iterations | 1000 |
/// | seed | 42 |
/// | horizonCycles | 60 (five years of monthly cycles) |
/// | cycleLengthMonths | 1 |
/// | discount rates | 3% costs and QALYs for every jurisdiction |
/// | batchSize | 100 |
/// | threads | available processors |
/// | failurePolicy | [FailurePolicy#ABORT], tolerance 5% when skipping |
/// | evpiCvThreshold | 0.1 |
/// | evppiMethod | [EvppiMethod#REGRESSION] |
/// | evppi samples | 100 outer × 100 inner |
/// | startAge | 40 |
///
/// ## Fingerprint
///
/// [#fingerprint()] summarises every setting that changes what one
/// iteration computes. A checkpoint is only resumed under a configuration
/// with the same fingerprint. Iteration count, thread count and batch size
/// are excluded so that a run can be extended or resumed on another machine.
public final class RunConfig {

    private final int iterations;
    private final long seed;
    private final int horizonCycles;
    private final int cycleLengthMonths;
    private final String jurisdiction;
    private final Map<String, DiscountRates> discountRates;
    private final DiscountRates defaultDiscountRates;
    private final String referenceStrategy;
    private final double policyWtp;
    private final double eligiblePopulation;
    private final int batchSize;
    private final int threads;
    private final FailurePolicy failurePolicy;
    private final double failureTolerance;
    private final double evpiCvThreshold;
    private final EvppiMethod evppiMethod;
    private final int evppiOuterSamples;
    private final int evppiInnerSamples;
    private final double startAge;
    private final Path checkpointPath;

    private RunConfig(Builder builder) {
        this.iterations = builder.iterations;
        this.seed = builder.seed;
        this.horizonCycles = builder.horizonCycles;
        this.cycleLengthMonths = builder.cycleLengthMonths;
        this.jurisdiction = builder.jurisdiction;
        this.discountRates = Collections.unmodifiableMap(new LinkedHashMap<>(builder.discountRates));
        this.defaultDiscountRates = builder.defaultDiscountRates;
        this.referenceStrategy = builder.referenceStrategy;
        this.policyWtp = builder.policyWtp;
        this.eligiblePopulation = builder.eligiblePopulation;
        this.batchSize = builder.batchSize;
        this.threads = builder.threads;
        this.failurePolicy = builder.failurePolicy;
        this.failureTolerance = builder.failureTolerance;
        this.evpiCvThreshold = builder.evpiCvThreshold;
        this.evppiMethod = builder.evppiMethod;
        this.evppiOuterSamples = builder.evppiOuterSamples;
        this.evppiInnerSamples = builder.evppiInnerSamples;
        this.startAge = builder.startAge;
        this.checkpointPath = builder.checkpointPath;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns a builder initialised with this configuration's values.
    public Builder toBuilder() {
        Builder b = new Builder()
            .iterations(iterations)
            .seed(seed)
            .horizonCycles(horizonCycles)
            .cycleLengthMonths(cycleLengthMonths)
            .jurisdiction(jurisdiction)
            .defaultDiscountRates(defaultDiscountRates)
            .referenceStrategy(referenceStrategy)
            .policyWtp(policyWtp)
            .eligiblePopulation(eligiblePopulation)
            .batchSize(batchSize)
            .threads(threads)
            .failurePolicy(failurePolicy)
            .failureTolerance(failureTolerance)
            .evpiCvThreshold(evpiCvThreshold)
            .evppiMethod(evppiMethod)
            .evppiSamples(evppiOuterSamples, evppiInnerSamples)
            .startAge(startAge)
            .checkpointPath(checkpointPath);
        discountRates.forEach(b::discountRates);
        return b;
    }

    public int iterations() {
        return iterations;
    }

    public long seed() {
        return seed;
    }

    /// Seed of one iteration: `seed + iteration`.
    public long seedFor(long iteration) {
        return seed + iteration;
    }

    public int horizonCycles() {
        return horizonCycles;
    }

    public int cycleLengthMonths() {
        return cycleLengthMonths;
    }

    /// Cycle length in years, e.g. 1/12 for monthly cycles.
    public double cycleYears() {
        return cycleLengthMonths / 12.0;
    }

    /// Returns the jurisdiction, or null when the model has none.
    public String jurisdiction() {
        return jurisdiction;
    }

    /// Discount rates of the run's jurisdiction, falling back to the default rates.
    public DiscountRates discountRates() {
        if (jurisdiction != null && discountRates.containsKey(jurisdiction)) {
            return discountRates.get(jurisdiction);
        }
        return defaultDiscountRates;
    }

    public Map<String, DiscountRates> discountRatesByJurisdiction() {
        return discountRates;
    }

    /// Returns the reference strategy id, or null to use the first registered strategy.
    public String referenceStrategy() {
        return referenceStrategy;
    }

    public double policyWtp() {
        return policyWtp;
    }

    public double eligiblePopulation() {
        return eligiblePopulation;
    }

    public int batchSize() {
        return batchSize;
    }

    public int threads() {
        return threads;
    }

    public FailurePolicy failurePolicy() {
        return failurePolicy;
    }

    public double failureTolerance() {
        return failureTolerance;
    }

    public double evpiCvThreshold() {
        return evpiCvThreshold;
    }

    public EvppiMethod evppiMethod() {
        return evppiMethod;
    }

    public int evppiOuterSamples() {
        return evppiOuterSamples;
    }

    public int evppiInnerSamples() {
        return evppiInnerSamples;
    }

    public double startAge() {
        return startAge;
    }

    /// Returns the checkpoint file, or null when checkpointing is off.
    public Path checkpointPath() {
        return checkpointPath;
    }

    public String fingerprint() {
        DiscountRates rates = discountRates();
        return String.format(Locale.ROOT,
            "seed=%d;horizon=%d;cycleMonths=%d;jurisdiction=%s;discount=%.6f/%.6f;reference=%s;startAge=%.4f",
            seed, horizonCycles, cycleLengthMonths, jurisdiction, rates.costs(), rates.qalys(),
            referenceStrategy, startAge);
    }

    @Override
    public String toString() {
        return "RunConfig[iterations=" + iterations + ", " + fingerprint() + ", threads=" + threads
            + ", batchSize=" + batchSize + ", failurePolicy=" + failurePolicy + "]";
    }

    /// Builder for [RunConfig]. Setters validate eagerly.
    public static final class Builder {
        private int iterations = 1000;
        private long seed = 42L;
        private int horizonCycles = 60;
        private int cycleLengthMonths = 1;
        private String jurisdiction;
        private final Map<String, DiscountRates> discountRates = new LinkedHashMap<>();
        private DiscountRates defaultDiscountRates = DiscountRates.uniform(0.03);
        private String referenceStrategy;
        private double policyWtp = 50_000.0;
        private double eligiblePopulation;
        private int batchSize = 100;
        private int threads = Runtime.getRuntime().availableProcessors();
        private FailurePolicy failurePolicy = FailurePolicy.ABORT;
        private double failureTolerance = 0.05;
        private double evpiCvThreshold = 0.1;
        private EvppiMethod evppiMethod = EvppiMethod.REGRESSION;
        private int evppiOuterSamples = 100;
        private int evppiInnerSamples = 100;
        private double startAge = 40.0;
        private Path checkpointPath;

        public Builder iterations(int iterations) {
            this.iterations = positive("iterations", iterations);
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder horizonCycles(int horizonCycles) {
            this.horizonCycles = positive("horizon_cycles", horizonCycles);
            return this;
        }

        public Builder cycleLengthMonths(int cycleLengthMonths) {
            this.cycleLengthMonths = positive("cycle_length_months", cycleLengthMonths);
            return this;
        }

        public Builder jurisdiction(String jurisdiction) {
            this.jurisdiction = jurisdiction == null || jurisdiction.isBlank() ? null : jurisdiction;
            return this;
        }

        public Builder discountRates(String jurisdiction, DiscountRates rates) {
            this.discountRates.put(Objects.requireNonNull(jurisdiction), Objects.requireNonNull(rates));
            return this;
        }

        public Builder defaultDiscountRates(DiscountRates rates) {
            this.defaultDiscountRates = Objects.requireNonNull(rates);
            return this;
        }

        public Builder referenceStrategy(String referenceStrategy) {
            this.referenceStrategy = referenceStrategy;
            return this;
        }

        public Builder policyWtp(double policyWtp) {
            this.policyWtp = nonNegative("policy_wtp", policyWtp);
            return this;
        }

        public Builder eligiblePopulation(double eligiblePopulation) {
            this.eligiblePopulation = nonNegative("eligible_population", eligiblePopulation);
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = positive("batch_size", batchSize);
            return this;
        }

        public Builder threads(int threads) {
            this.threads = positive("threads", threads);
            return this;
        }

        public Builder failurePolicy(FailurePolicy failurePolicy) {
            this.failurePolicy = Objects.requireNonNull(failurePolicy);
            return this;
        }

        public Builder failureTolerance(double failureTolerance) {
            if (!(failureTolerance >= 0.0 && failureTolerance <= 1.0)) {
                throw new ValidationException("failure_tolerance", "must be in [0, 1], got " + failureTolerance);
            }
            this.failureTolerance = failureTolerance;
            return this;
        }

        public Builder evpiCvThreshold(double evpiCvThreshold) {
            if (!(evpiCvThreshold > 0.0) || !Double.isFinite(evpiCvThreshold)) {
                throw new ValidationException("evpi_cv_threshold", "must be positive, got " + evpiCvThreshold);
            }
            this.evpiCvThreshold = evpiCvThreshold;
            return this;
        }

        public Builder evppiMethod(EvppiMethod evppiMethod) {
            this.evppiMethod = Objects.requireNonNull(evppiMethod);
            return this;
        }

        public Builder evppiSamples(int outer, int inner) {
            this.evppiOuterSamples = positive("evppi_outer_samples", outer);
            this.evppiInnerSamples = positive("evppi_inner_samples", inner);
            return this;
        }

        public Builder startAge(double startAge) {
            this.startAge = nonNegative("start_age", startAge);
            return this;
        }

        public Builder checkpointPath(Path checkpointPath) {
            this.checkpointPath = checkpointPath;
            return this;
        }

        public RunConfig build() {
            if (jurisdiction != null && !discountRates.isEmpty() && !discountRates.containsKey(jurisdiction)) {
                throw new ValidationException(jurisdiction, "no discount rates are defined for this jurisdiction");
            }
            return new RunConfig(this);
        }

        private static int positive(String name, int value) {
            if (value < 1) {
                throw new ValidationException(name, "must be positive, got " + value);
            }
            return value;
        }

        private static double nonNegative(String name, double value) {
            if (!(value >= 0.0) || !Double.isFinite(value)) {
                throw new ValidationException(name, "must be finite and non-negative, got " + value);
            }
            return value;
        }
    }
}
