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

import io.nosqlbench.cea.model.config.EvppiMethod;

import java.util.List;

/// Expected value of partial perfect information for one parameter group.
public final class EvppiResult {

    private final String group;
    private final List<String> parameters;
    private final EvppiMethod method;
    private final List<VoiEstimate> estimates;

    public EvppiResult(String group, List<String> parameters, EvppiMethod method, List<VoiEstimate> estimates) {
        this.group = group;
        this.parameters = List.copyOf(parameters);
        this.method = method;
        this.estimates = List.copyOf(estimates);
    }

    public String group() {
        return group;
    }

    public List<String> parameters() {
        return parameters;
    }

    public EvppiMethod method() {
        return method;
    }

    public List<VoiEstimate> estimates() {
        return estimates;
    }

    public VoiEstimate get(int wtpIndex) {
        return estimates.get(wtpIndex);
    }
}
