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

/// Estimator used for the expected value of partial perfect information.
///
/// | Method | Re-simulates | Bias | Cost |
/// |--------|--------------|------|------|
/// | REGRESSION | no | upward in small samples, from overfitting noise | one regression per strategy and group |
/// | NESTED_MONTE_CARLO | yes | upward for few inner samples, vanishing as they grow | outer × inner × strategies simulations |
public enum EvppiMethod {
    REGRESSION,
    NESTED_MONTE_CARLO
}
