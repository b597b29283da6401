package io.nosqlbench.cea.voi;

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

/// Value-of-information estimate at one threshold.
///
/// @param wtp the threshold
/// @param perPatient expected opportunity loss per patient, never negative
/// @param population per-patient value times the eligible population
/// @param standardError standard error of the per-patient mean, 0 when
///        fewer than two samples exist
/// @param coefficientOfVariation standard error over the estimate; 0 when
///        the estimate and its spread are both 0
/// @param lowPrecision whether the estimate is too noisy to report as is
public record VoiEstimate(double wtp, double perPatient, double population, double standardError,
                          double coefficientOfVariation, boolean lowPrecision) {

    /// Summarises per-sample opportunity losses.
    ///
    /// @param wtp the threshold
    /// @param losses non-negative opportunity losses, one per sample
    /// @param eligiblePopulation population multiplier
    /// @param cvThreshold largest acceptable coefficient of variation
    /// @param forceLowPrecision marks the estimate imprecise regardless of the losses
    static VoiEstimate fromLosses(double wtp, double[] losses, double eligiblePopulation, double cvThreshold,
                                  boolean forceLowPrecision) {
        int n = losses.length;
        double mean = 0.0;
        for (double loss : losses) {
            mean += loss;
        }
        mean = n == 0 ? 0.0 : mean / n;
        double standardError = 0.0;
        if (n >= 2) {
            double sumSq = 0.0;
            for (double loss : losses) {
                double d = loss - mean;
                sumSq += d * d;
            }
            standardError = Math.sqrt(sumSq / (n - 1)) / Math.sqrt(n);
        }
        double cv = mean > 0.0 ? standardError / mean : 0.0;
        boolean low = forceLowPrecision || n < 2 || cv > cvThreshold;
        double perPatient = Math.max(0.0, mean);
        return new VoiEstimate(wtp, perPatient, perPatient * eligiblePopulation, standardError, cv, low);
    }
}
