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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.nosqlbench.cea.model.DistributionTypeAdapterFactory;

/// Centralized Gson configuration for checkpoint serialization.
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled | Human-readable checkpoints |
/// | Serialize nulls | Disabled | Compact output |
/// | HTML escaping | Disabled | Cleaner numeric output |
/// | DistributionModel adapter | Registered | Polymorphic distribution support |
///
/// ```java
/// Gson gson = CeaGsonConfig.gson();
/// String json = gson.toJson(new BetaDistributionModel(60, 40), DistributionModel.class);
/// // {"type":"beta","alpha":60.0,"beta":40.0}
/// ```
///
/// The [Gson] instance is thread-safe and shared.
///
/// @see DistributionTypeAdapterFactory
/// @see PsaCheckpointManager
public final class CeaGsonConfig {

    private static final Gson INSTANCE = builder().create();

    private CeaGsonConfig() {
        // Utility class
    }

    /// Returns the shared, pretty-printing Gson instance.
    public static Gson gson() {
        return INSTANCE;
    }

    /// Creates a new GsonBuilder with the engine's type adapters, for
    /// callers that need to customise further.
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .registerTypeAdapterFactory(DistributionTypeAdapterFactory.create());
    }
}
