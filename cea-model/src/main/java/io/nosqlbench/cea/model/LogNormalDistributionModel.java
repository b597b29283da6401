package io.nosqlbench.cea.model;

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
import io.nosqlbench.cea.model.errors.DistributionException;

import java.util.Objects;

/**
 * Log-normal distribution, parameterised on the log scale.
 *
 * <p>If {@code ln X ~ N(μ, σ²)} then X is log-normal with
 * {@code E[X] = exp(μ + σ²/2)}. Used for relative risks, hazard ratios and
 * cost multipliers. From a mean m and standard error se on the natural
 * scale: {@code σ² = ln(1 + se²/m²)}, {@code μ = ln m - σ²/2}.
 */
@DistributionType(LogNormalDistributionModel.DISTRIBUTION_TYPE)
public final class LogNormalDistributionModel implements DistributionModel {

    public static final String DISTRIBUTION_TYPE = "lognormal";

    @SerializedName("mu")
    private final double mu;

    @SerializedName("sigma")
    private final double sigma;

    /**
     * @param mu the mean of the underlying normal; must be finite
     * @param sigma the standard deviation of the underlying normal; must be positive
     * @throws DistributionException if a parameter is out of domain
     */
    public LogNormalDistributionModel(double mu, double sigma) {
        if (!Double.isFinite(mu)) {
            throw new DistributionException(DISTRIBUTION_TYPE, "mu must be finite, got: " + mu);
        }
        if (!(sigma > 0) || !Double.isFinite(sigma)) {
            throw new DistributionException(DISTRIBUTION_TYPE, "sigma must be positive, got: " + sigma);
        }
        this.mu = mu;
        this.sigma = sigma;
    }

    public static LogNormalDistributionModel fromMeanAndSe(double mean, double standardError) {
        if (!(mean > 0)) {
            throw new DistributionException(DISTRIBUTION_TYPE, "mean must be positive, got: " + mean);
        }
        if (!(standardError > 0)) {
            throw new DistributionException(DISTRIBUTION_TYPE,
                "standard error must be positive, got: " + standardError);
        }
        double sigmaSquared = Math.log(1 + (standardError * standardError) / (mean * mean));
        return new LogNormalDistributionModel(Math.log(mean) - sigmaSquared / 2, Math.sqrt(sigmaSquared));
    }

    public double getMu() {
        return mu;
    }

    public double getSigma() {
        return sigma;
    }

    @Override
    public String getDistributionType() {
        return DISTRIBUTION_TYPE;
    }

    @Override
    public double mean() {
        return Math.exp(mu + sigma * sigma / 2);
    }

    @Override
    public double lowerBound() {
        return 0.0;
    }

    @Override
    public double upperBound() {
        return Double.POSITIVE_INFINITY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogNormalDistributionModel)) return false;
        LogNormalDistributionModel that = (LogNormalDistributionModel) o;
        return Double.compare(that.mu, mu) == 0 && Double.compare(that.sigma, sigma) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mu, sigma);
    }

    @Override
    public String toString() {
        return "LogNormal[μ=" + mu + ", σ=" + sigma + "]";
    }
}
