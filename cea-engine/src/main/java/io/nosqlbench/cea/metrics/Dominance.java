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

/// Why a strategy is, or is not, on the efficiency frontier.
public enum Dominance {
    /// On the frontier.
    NONE,
    /// Another strategy is no more costly and at least as effective, and
    /// strictly better on one of the two.
    STRICT,
    /// Lies above the line joining two frontier strategies; a mix of them
    /// would buy more health for the same money.
    EXTENDED
}
