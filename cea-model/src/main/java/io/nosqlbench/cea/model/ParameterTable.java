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

import io.nosqlbench.cea.model.errors.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Ordered, name-unique collection of parameter declarations.
///
/// Table order is significant: the sampler consumes uniform variates in
/// this order, so reordering the table changes the draws for a given seed.
public final class ParameterTable {

    private final List<Parameter> parameters;
    private final Map<String, Integer> indexByName;

    public ParameterTable(List<Parameter> parameters) {
        List<Parameter> copy = List.copyOf(parameters);
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < copy.size(); i++) {
            Parameter p = copy.get(i);
            if (index.putIfAbsent(p.name(), i) != null) {
                throw new ValidationException(p.name(), "parameter is declared more than once");
            }
        }
        this.parameters = copy;
        this.indexByName = Collections.unmodifiableMap(index);
    }

    /// Selects the rows that apply to a jurisdiction.
    ///
    /// Rows without a jurisdiction apply everywhere. When a name is declared
    /// both generically and for the requested jurisdiction, the specific row
    /// wins and keeps the position of the first declaration. Rows for other
    /// jurisdictions are dropped.
    ///
    /// @param rows the raw table rows, possibly repeating names across jurisdictions
    /// @param jurisdiction the run's jurisdiction, or null to keep only generic rows
    /// @return the resolved table
    public static ParameterTable forJurisdiction(List<Parameter> rows, String jurisdiction) {
        Map<String, Parameter> resolved = new LinkedHashMap<>();
        for (Parameter row : rows) {
            String rowJurisdiction = row.jurisdiction();
            if (rowJurisdiction != null && !rowJurisdiction.equals(jurisdiction)) {
                continue;
            }
            Parameter existing = resolved.get(row.name());
            if (existing == null) {
                resolved.put(row.name(), row);
            } else if (existing.jurisdiction() == null && rowJurisdiction != null) {
                resolved.put(row.name(), row);
            } else if (existing.jurisdiction() == null || rowJurisdiction != null) {
                throw new ValidationException(row.name(),
                    "parameter is declared more than once for jurisdiction " + jurisdiction);
            }
        }
        return new ParameterTable(new ArrayList<>(resolved.values()));
    }

    public List<Parameter> parameters() {
        return parameters;
    }

    public int size() {
        return parameters.size();
    }

    public Parameter get(int index) {
        return parameters.get(index);
    }

    public boolean contains(String name) {
        return indexByName.containsKey(name);
    }

    /// Returns the position of a parameter, or -1 when it is not declared.
    public int indexOf(String name) {
        Integer index = indexByName.get(name);
        return index == null ? -1 : index;
    }

    public Parameter get(String name) {
        Integer index = indexByName.get(name);
        if (index == null) {
            throw new ValidationException(name, "parameter is not declared");
        }
        return parameters.get(index);
    }

    public Set<String> names() {
        return indexByName.keySet();
    }

    /// Returns the parameters owned by a strategy, plus the shared ones.
    public List<Parameter> visibleTo(String strategyId) {
        List<Parameter> visible = new ArrayList<>();
        for (Parameter p : parameters) {
            if (p.isShared() || p.owner().equals(strategyId)) {
                visible.add(p);
            }
        }
        return visible;
    }

    /// Returns EVPPI group labels mapped to their member parameter names,
    /// in first-appearance order.
    public Map<String, List<String>> evppiGroups() {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        for (Parameter p : parameters) {
            if (p.evppiGroup() != null) {
                groups.computeIfAbsent(p.evppiGroup(), g -> new ArrayList<>()).add(p.name());
            }
        }
        return groups;
    }
}
