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

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.internal.Streams;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * GSON TypeAdapterFactory for polymorphic {@link DistributionModel} serialization.
 *
 * <p>Each variant is written with a leading {@code "type"} field taken from its
 * {@link DistributionType} annotation, followed by only its own parameters:
 *
 * <pre>{@code
 *  SERIALIZE                              DESERIALIZE
 *  ─────────                              ───────────
 *  GammaDistributionModel                 { "type": "gamma", ... }
 *        │                                         │
 *        ▼                                         ▼
 *  1. Get @DistributionType("gamma")      1. Read "type" field
 *  2. Serialize variant fields            2. Lookup registered class
 *  3. Prepend "type" field                3. Deserialize with delegate
 *        │                                4. Re-run domain validation
 *        ▼                                         │
 *  { "type": "gamma",                              ▼
 *    "shape": 4.0, "scale": 250.0 }       GammaDistributionModel
 * }</pre>
 *
 * <p>Deserialized models pass through their constructors again, so a
 * hand-edited checkpoint cannot smuggle in an out-of-domain distribution.
 *
 * @see DistributionType
 */
public final class DistributionTypeAdapterFactory implements TypeAdapterFactory {

    private static final String TYPE_FIELD = "type";

    private final Map<String, Class<? extends DistributionModel>> typeToClass = new LinkedHashMap<>();
    private final Map<Class<? extends DistributionModel>, String> classToType = new LinkedHashMap<>();

    private DistributionTypeAdapterFactory() {
    }

    /**
     * Creates a new factory with every distribution variant registered.
     *
     * @return a configured factory
     */
    public static DistributionTypeAdapterFactory create() {
        DistributionTypeAdapterFactory factory = new DistributionTypeAdapterFactory();
        factory.registerType(FixedDistributionModel.class);
        factory.registerType(BetaDistributionModel.class);
        factory.registerType(GammaDistributionModel.class);
        factory.registerType(LogNormalDistributionModel.class);
        return factory;
    }

    private void registerType(Class<? extends DistributionModel> modelClass) {
        DistributionType annotation = modelClass.getAnnotation(DistributionType.class);
        if (annotation == null) {
            throw new IllegalArgumentException(
                "Class " + modelClass.getName() + " has no @DistributionType annotation");
        }
        String typeName = annotation.value();
        if (typeToClass.containsKey(typeName)) {
            throw new IllegalArgumentException(
                "Type '" + typeName + "' is already registered to " + typeToClass.get(typeName).getName());
        }
        typeToClass.put(typeName, modelClass);
        classToType.put(modelClass, typeName);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        if (!DistributionModel.class.isAssignableFrom(type.getRawType())) {
            return null;
        }

        return new TypeAdapter<T>() {
            @Override
            public void write(JsonWriter out, T value) throws IOException {
                if (value == null) {
                    out.nullValue();
                    return;
                }
                String typeName = classToType.get(value.getClass());
                if (typeName == null) {
                    typeName = ((DistributionModel) value).getDistributionType();
                }

                TypeAdapter<T> concreteDelegate = (TypeAdapter<T>) gson.getDelegateAdapter(
                    DistributionTypeAdapterFactory.this, TypeToken.get(value.getClass()));
                JsonObject fields = concreteDelegate.toJsonTree(value).getAsJsonObject();

                // "type" first, then the variant's own fields
                JsonObject result = new JsonObject();
                result.addProperty(TYPE_FIELD, typeName);
                for (Map.Entry<String, JsonElement> entry : fields.entrySet()) {
                    if (!TYPE_FIELD.equals(entry.getKey())) {
                        result.add(entry.getKey(), entry.getValue());
                    }
                }
                Streams.write(result, out);
            }

            @Override
            public T read(JsonReader in) throws IOException {
                JsonElement element = JsonParser.parseReader(in);
                if (element.isJsonNull()) {
                    return null;
                }
                JsonObject obj = element.getAsJsonObject();
                if (!obj.has(TYPE_FIELD)) {
                    throw new IllegalArgumentException("Missing '" + TYPE_FIELD + "' field in JSON: " + obj);
                }
                String typeName = obj.get(TYPE_FIELD).getAsString();
                Class<? extends DistributionModel> targetClass = typeToClass.get(typeName);
                if (targetClass == null) {
                    throw new IllegalArgumentException(
                        "Unknown distribution type: '" + typeName + "'. Known types: " + typeToClass.keySet());
                }
                TypeAdapter<? extends DistributionModel> targetAdapter =
                    gson.getDelegateAdapter(DistributionTypeAdapterFactory.this, TypeToken.get(targetClass));
                return (T) revalidate(targetAdapter.fromJsonTree(obj));
            }
        };
    }

    /**
     * Returns the registered type names, in registration order.
     *
     * @return the known type names
     */
    public Set<String> typeNames() {
        return typeToClass.keySet();
    }

    // Gson bypasses constructors; rebuilding restores the domain checks.
    private static DistributionModel revalidate(DistributionModel model) {
        if (model instanceof FixedDistributionModel fixed) {
            return new FixedDistributionModel(fixed.getValue());
        } else if (model instanceof BetaDistributionModel beta) {
            return new BetaDistributionModel(beta.getAlpha(), beta.getBeta());
        } else if (model instanceof GammaDistributionModel gamma) {
            return new GammaDistributionModel(gamma.getShape(), gamma.getScale());
        } else if (model instanceof LogNormalDistributionModel logNormal) {
            return new LogNormalDistributionModel(logNormal.getMu(), logNormal.getSigma());
        }
        throw new IllegalArgumentException("Unsupported distribution model: " + model);
    }
}
