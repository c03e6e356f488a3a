package io.pcvct.variations.distribution;

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
import java.io.StringReader;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

/**
 * Gson {@link TypeAdapterFactory} for polymorphic {@link ScalarDistribution} values.
 *
 * <p>Each registered implementation is written as a JSON object whose first
 * field is {@code "type"}, followed by the implementation's own fields:
 *
 * <pre>{@code
 * {"type":"uniform","lower":0.0,"upper":1.0}
 * {"type":"normal","mean":0.0,"std_dev":1.0,"lower":"-Infinity","upper":"Infinity"}
 * }</pre>
 *
 * <p>Reading dispatches on the {@code type} field. Infinite truncation bounds
 * need a Gson built with {@code serializeSpecialFloatingPointValues()}; they are
 * written as strings and read back leniently.
 *
 * <pre>{@code
 * Gson gson = new GsonBuilder()
 *     .registerTypeAdapterFactory(DistributionTypeAdapterFactory.create())
 *     .serializeSpecialFloatingPointValues()
 *     .create();
 * ScalarDistribution d = gson.fromJson(json, ScalarDistribution.class);
 * }</pre>
 *
 * @see DistributionType
 */
public final class DistributionTypeAdapterFactory implements TypeAdapterFactory {

    private static final String TYPE_FIELD = "type";

    private final Map<String, Class<? extends ScalarDistribution>> typeToClass = new HashMap<>();
    private final Map<Class<? extends ScalarDistribution>, String> classToType = new HashMap<>();

    private DistributionTypeAdapterFactory() {
    }

    /**
     * Creates a factory with the uniform and normal distributions registered.
     *
     * @return a configured factory
     */
    public static DistributionTypeAdapterFactory create() {
        DistributionTypeAdapterFactory factory = new DistributionTypeAdapterFactory();
        factory.registerType(UniformDistribution.class);
        factory.registerType(NormalDistribution.class);
        return factory;
    }

    /**
     * Registers an implementation under the name given by its {@link DistributionType}.
     *
     * @param distributionClass the implementation class
     * @throws IllegalArgumentException if the class is not annotated or its name is taken
     */
    public void registerType(Class<? extends ScalarDistribution> distributionClass) {
        DistributionType annotation = distributionClass.getAnnotation(DistributionType.class);
        if (annotation == null) {
            throw new IllegalArgumentException(
                "Class " + distributionClass.getName() + " has no @DistributionType annotation");
        }
        String typeName = annotation.value();
        if (typeToClass.containsKey(typeName)) {
            throw new IllegalArgumentException(
                "Type '" + typeName + "' is already registered to " + typeToClass.get(typeName).getName());
        }
        typeToClass.put(typeName, distributionClass);
        classToType.put(distributionClass, typeName);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        if (!ScalarDistribution.class.isAssignableFrom(type.getRawType())) {
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
                    throw new IllegalArgumentException(
                        "Distribution " + value + " (" + value.getClass().getName() + ") has no registered JSON type");
                }

                TypeAdapter<T> concreteDelegate = (TypeAdapter<T>) gson.getDelegateAdapter(
                    DistributionTypeAdapterFactory.this, TypeToken.get(value.getClass()));

                StringWriter buffer = new StringWriter();
                JsonWriter lenientWriter = new JsonWriter(buffer);
                lenientWriter.setLenient(true);
                concreteDelegate.write(lenientWriter, value);
                lenientWriter.close();

                JsonReader lenientReader = new JsonReader(new StringReader(buffer.toString()));
                lenientReader.setLenient(true);
                JsonObject fields = JsonParser.parseReader(lenientReader).getAsJsonObject();

                JsonObject result = new JsonObject();
                result.addProperty(TYPE_FIELD, typeName);
                for (Map.Entry<String, JsonElement> entry : fields.entrySet()) {
                    if (!TYPE_FIELD.equals(entry.getKey())) {
                        result.add(entry.getKey(), entry.getValue());
                    }
                }

                boolean wasLenient = out.isLenient();
                out.setLenient(true);
                try {
                    Streams.write(result, out);
                } finally {
                    out.setLenient(wasLenient);
                }
            }

            @Override
            public T read(JsonReader in) throws IOException {
                boolean wasLenient = in.isLenient();
                in.setLenient(true);
                JsonElement element;
                try {
                    element = JsonParser.parseReader(in);
                } finally {
                    in.setLenient(wasLenient);
                }
                if (element.isJsonNull()) {
                    return null;
                }
                JsonObject obj = element.getAsJsonObject();
                if (!obj.has(TYPE_FIELD)) {
                    throw new IllegalArgumentException("Missing '" + TYPE_FIELD + "' field in JSON: " + obj);
                }
                String typeName = obj.get(TYPE_FIELD).getAsString();
                Class<? extends ScalarDistribution> targetClass = typeToClass.get(typeName);
                if (targetClass == null) {
                    throw new IllegalArgumentException(
                        "Unknown distribution type: '" + typeName + "'. Known types: " + typeToClass.keySet());
                }

                JsonObject fields = obj.deepCopy();
                fields.remove(TYPE_FIELD);
                TypeAdapter<? extends ScalarDistribution> targetAdapter =
                    gson.getDelegateAdapter(DistributionTypeAdapterFactory.this, TypeToken.get(targetClass));
                JsonReader lenientReader = new JsonReader(new StringReader(fields.toString()));
                lenientReader.setLenient(true);
                return (T) targetAdapter.read(lenientReader);
            }
        };
    }

    /**
     * @param distributionClass an implementation class
     * @return its registered type name, or null
     */
    public String getTypeName(Class<? extends ScalarDistribution> distributionClass) {
        return classToType.get(distributionClass);
    }
}
