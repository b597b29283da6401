package io.nosqlbench.cea.economics;

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

/// Discounted totals of one strategy for one parameter draw.
///
/// @param strategyId the strategy
/// @param cost discounted cost per patient
/// @param qalys discounted quality-adjusted life years per patient
/// @param lifeYears undiscounted life years per patient
public record StrategyOutcome(String strategyId, double cost, double qalys, double lifeYears) {
}
