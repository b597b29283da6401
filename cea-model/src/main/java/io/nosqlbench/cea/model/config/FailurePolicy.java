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

/// What a probabilistic run does when one iteration produces an invalid
/// transition matrix.
public enum FailurePolicy {
    /// Rethrow and stop the run.
    ABORT,
    /// Record the failed iteration, continue, and report the skip count.
    /// The run still aborts once the failed fraction exceeds the configured
    /// tolerance.
    SKIP_AND_COUNT
}
