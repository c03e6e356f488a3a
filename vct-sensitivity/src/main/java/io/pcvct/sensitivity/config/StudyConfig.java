package io.pcvct.sensitivity.config;

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
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.annotations.SerializedName;
import io.pcvct.sensitivity.FirstOrderEstimator;
import io.pcvct.sensitivity.GsaMethod;
import io.pcvct.sensitivity.GsaRunOptions;
import io.pcvct.sensitivity.MoatMethod;
import io.pcvct.sensitivity.RbdMethod;
import io.pcvct.sensitivity.ReplicatePolicy;
import io.pcvct.sensitivity.SobolMethod;
import io.pcvct.sensitivity.TotalOrderEstimator;
import io.pcvct.variations.CoVariation;
import io.pcvct.variations.DiscreteVariation;
import io.pcvct.variations.DistributedVariation;
import io.pcvct.variations.ElementaryVariation;
import io.pcvct.variations.TargetPath;
import io.pcvct.variations.Variation;
import io.pcvct.variations.VariationValidationException;
import io.pcvct.variations.distribution.DistributionTypeAdapterFactory;
import io.pcvct.variations.distribution.ScalarDistribution;
import io.pcvct.variations.persistence.JsonValues;
import io.pcvct.variations.sampling.LhsVariation;
import io.pcvct.variations.sampling.RandomGenerators;
import io.pcvct.variations.sampling.RbdVariation;
import io.pcvct.variations.sampling.SkipStart;
import io.pcvct.variations.sampling.SobolRandomization;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;

/**
 * JSON description of a sensitivity study.
 *
 * <pre>{@code
 * {
 *   "method": "sobol",
 *   "n": 15,
 *   "replicates": 3,
 *   "seed": 42,
 *   "algorithm": "xo_shi_ro_256_pp",
 *   "first_order": "Jansen1999",
 *   "total_order": "Sobol2007",
 *   "skip_start": true,
 *   "ignore_indices": [2],
 *   "replicate_policy": "exclude_missing",
 *   "variations": [
 *     {"target": ["overall", "max_time"], "values": [1440, 2880]},
 *     {"target": ["cell_definitions", "cell_definition:name:default", "phenotype", "cycle", "rate"],
 *      "distribution": {"type": "uniform", "lower": 0.001, "upper": 0.01}},
 *     {"covary": [
 *       {"target": ["microenvironment_setup", "variable:name:oxygen", "diffusion_coefficient"],
 *        "distribution": {"type": "normal", "mean": 1000.0, "std_dev": 100.0}},
 *       {"target": ["microenvironment_setup", "variable:name:oxygen", "decay_rate"],
 *        "distribution": {"type": "normal", "mean": 0.1, "std_dev": 0.01}, "flip": true}
 *     ]}
 *   ]
 * }
 * }</pre>
 *
 * <p>{@code method} is one of {@code moat}, {@code sobol} or {@code rbd}.
 * {@code skip_start} is {@code true}, {@code false} or a number of points to skip;
 * absent means automatic. A missing {@code seed} draws a fresh one and logs it.
 * {@code algorithm} names a {@link RandomGenerators.Algorithm}, XorShiro256++ when absent.
 */
public class StudyConfig {

    private static final Logger logger = LogManager.getLogger(StudyConfig.class);

    private static final Gson GSON = new GsonBuilder()
        .registerTypeAdapterFactory(DistributionTypeAdapterFactory.create())
        .serializeSpecialFloatingPointValues()
        .setPrettyPrinting()
        .create();

    @SerializedName("method")
    private String method;

    @SerializedName("n")
    private Integer n;

    @SerializedName("replicates")
    private Integer replicates;

    @SerializedName("seed")
    private Long seed;

    @SerializedName("algorithm")
    private String algorithm;

    /** LHS options for MOAT base points */
    @SerializedName("add_noise")
    private Boolean addNoise;

    @SerializedName("orthogonalize")
    private Boolean orthogonalize;

    /** Sobol' options */
    @SerializedName("first_order")
    private String firstOrder;

    @SerializedName("total_order")
    private String totalOrder;

    @SerializedName("skip_start")
    private JsonElement skipStart;

    @SerializedName("include_one")
    private Boolean includeOne;

    @SerializedName("random_shift")
    private Boolean randomShift;

    /** RBD options */
    @SerializedName("use_sobol")
    private Boolean useSobol;

    @SerializedName("num_harmonics")
    private Integer numHarmonics;

    @SerializedName("ignore_indices")
    private List<Integer> ignoreIndices;

    @SerializedName("replicate_policy")
    private String replicatePolicy;

    @SerializedName("variations")
    private List<VariationConfig> variations;

    /**
     * One varied parameter, or a co-variation of several.
     *
     * <p>Exactly one of {@code values}, {@code distribution} or {@code covary} is set.
     */
    public static class VariationConfig {
        @SerializedName("target")
        private List<String> target;

        @SerializedName("values")
        private JsonArray values;

        @SerializedName("distribution")
        private ScalarDistribution distribution;

        @SerializedName("flip")
        private Boolean flip;

        @SerializedName("covary")
        private List<VariationConfig> covary;

        public VariationConfig() {
        }

        public static VariationConfig discrete(List<String> target, List<?> values) {
            VariationConfig config = new VariationConfig();
            config.target = target;
            config.values = new JsonArray();
            for (Object value : values) {
                config.values.add(JsonValues.toJson(value));
            }
            return config;
        }

        public static VariationConfig distributed(List<String> target, ScalarDistribution distribution, boolean flip) {
            VariationConfig config = new VariationConfig();
            config.target = target;
            config.distribution = distribution;
            config.flip = flip ? Boolean.TRUE : null;
            return config;
        }

        public static VariationConfig covary(List<VariationConfig> members) {
            VariationConfig config = new VariationConfig();
            config.covary = members;
            return config;
        }

        /**
         * @return the variation described by this entry
         * @throws VariationValidationException if the entry is incomplete or ambiguous
         */
        public Variation toVariation() {
            if (covary != null) {
                if (target != null || values != null || distribution != null) {
                    throw new VariationValidationException("A 'covary' entry cannot also set target, values or distribution");
                }
                List<ElementaryVariation> members = new ArrayList<>(covary.size());
                for (VariationConfig member : covary) {
                    members.add(member.toElementary());
                }
                return new CoVariation(members);
            }
            return toElementary();
        }

        ElementaryVariation toElementary() {
            if (target == null) {
                throw new VariationValidationException("Variation entry has no 'target'");
            }
            TargetPath path = new TargetPath(target);
            if ((values == null) == (distribution == null)) {
                throw new VariationValidationException(
                    "Variation of " + path + " must set exactly one of 'values' or 'distribution'");
            }
            if (values != null) {
                List<Object> parsed = new ArrayList<>(values.size());
                for (JsonElement value : values) {
                    parsed.add(JsonValues.fromJson(value));
                }
                return new DiscreteVariation<>(path, parsed);
            }
            return new DistributedVariation(path, distribution, Boolean.TRUE.equals(flip));
        }
    }

    public StudyConfig() {
    }

    public String getMethod() {
        return method;
    }

    public StudyConfig setMethod(String method) {
        this.method = method;
        return this;
    }

    public Integer getN() {
        return n;
    }

    public StudyConfig setN(Integer n) {
        this.n = n;
        return this;
    }

    /// @return the replicates per configuration, 1 when unset
    public int getReplicates() {
        return replicates == null ? 1 : replicates;
    }

    public StudyConfig setReplicates(Integer replicates) {
        this.replicates = replicates;
        return this;
    }

    public Long getSeed() {
        return seed;
    }

    public StudyConfig setSeed(Long seed) {
        this.seed = seed;
        return this;
    }

    /// @return the PRNG algorithm for random designs
    /// @throws IllegalArgumentException if the configured name is unknown
    public RandomGenerators.Algorithm getAlgorithm() {
        if (algorithm == null) {
            return RandomGenerators.Algorithm.XO_SHI_RO_256_PP;
        }
        String name = algorithm.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (RandomGenerators.Algorithm candidate : RandomGenerators.Algorithm.values()) {
            if (candidate.name().equals(name)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown algorithm '" + algorithm + "'; expected one of "
            + Arrays.toString(RandomGenerators.Algorithm.values()));
    }

    public StudyConfig setAlgorithm(String algorithm) {
        this.algorithm = algorithm;
        return this;
    }

    public StudyConfig setSkipStart(JsonElement skipStart) {
        this.skipStart = skipStart;
        return this;
    }

    public StudyConfig setIgnoreIndices(List<Integer> ignoreIndices) {
        this.ignoreIndices = ignoreIndices;
        return this;
    }

    public StudyConfig setVariations(List<VariationConfig> variations) {
        this.variations = variations;
        return this;
    }

    /**
     * @return the variations in declaration order
     * @throws VariationValidationException if there are none or an entry is invalid
     */
    public List<Variation> toVariations() {
        if (variations == null || variations.isEmpty()) {
            throw new VariationValidationException("Study configuration has no 'variations'");
        }
        List<Variation> result = new ArrayList<>(variations.size());
        for (VariationConfig variation : variations) {
            result.add(variation.toVariation());
        }
        return result;
    }

    /**
     * Builds the configured method. Random designs draw from a provider seeded
     * with {@code seed}.
     *
     * @return the method
     * @throws IllegalArgumentException if the method or its options are invalid
     */
    public GsaMethod<?> toMethod() {
        if (method == null) {
            throw new IllegalArgumentException("Study configuration has no 'method'");
        }
        switch (method.toLowerCase(Locale.ROOT)) {
            case MoatMethod.NAME: {
                LhsVariation lhs = LhsVariation.builder(n == null ? MoatMethod.DEFAULT_N : n, rng())
                    .addNoise(Boolean.TRUE.equals(addNoise))
                    .orthogonalize(orthogonalize == null || orthogonalize)
                    .build();
                return new MoatMethod(lhs);
            }
            case SobolMethod.NAME: {
                SobolMethod.Builder builder = SobolMethod.builder(requireN())
                    .skipStart(toSkipStart(skipStart))
                    .includeOne(includeOne);
                if (firstOrder != null) {
                    builder.firstOrder(FirstOrderEstimator.fromLabel(firstOrder));
                }
                if (totalOrder != null) {
                    builder.totalOrder(TotalOrderEstimator.fromLabel(totalOrder));
                }
                if (Boolean.TRUE.equals(randomShift)) {
                    builder.randomization(SobolRandomization.randomShift(rng()));
                }
                return builder.build();
            }
            case RbdMethod.NAME: {
                RbdVariation rbd = (useSobol == null || useSobol)
                    ? RbdVariation.sobol(requireN())
                    : RbdVariation.random(requireN(), rng());
                return new RbdMethod(rbd, numHarmonics == null ? RbdMethod.DEFAULT_NUM_HARMONICS : numHarmonics);
            }
            default:
                throw new IllegalArgumentException("Unknown sensitivity method '" + method
                    + "'; expected moat, sobol or rbd");
        }
    }

    /// @return run options carrying the ignored features and replicate policy
    public GsaRunOptions.Builder toRunOptions() {
        GsaRunOptions.Builder builder = GsaRunOptions.builder();
        if (ignoreIndices != null) {
            builder.ignoreIndices(new HashSet<>(ignoreIndices));
        }
        if (replicatePolicy != null) {
            builder.replicatePolicy(ReplicatePolicy.valueOf(replicatePolicy.toUpperCase(Locale.ROOT)));
        }
        return builder;
    }

    private int requireN() {
        if (n == null) {
            throw new IllegalArgumentException("Method '" + method + "' needs 'n'");
        }
        return n;
    }

    private UniformRandomProvider rng() {
        if (seed == null) {
            seed = RandomSource.createLong();
            logger.info("No seed configured; using seed {}", seed);
        }
        return RandomGenerators.create(getAlgorithm(), seed);
    }

    static SkipStart toSkipStart(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return SkipStart.auto();
        }
        if (!element.isJsonPrimitive()) {
            throw new JsonParseException("skip_start must be a boolean or an integer, got " + element);
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean() ? SkipStart.toCommonDenominator() : SkipStart.none();
        }
        if (primitive.isNumber()) {
            return SkipStart.count(primitive.getAsInt());
        }
        throw new JsonParseException("skip_start must be a boolean or an integer, got " + element);
    }

    public static StudyConfig fromJson(String json) {
        return GSON.fromJson(json, StudyConfig.class);
    }

    public static StudyConfig fromJson(Reader reader) {
        return GSON.fromJson(reader, StudyConfig.class);
    }

    public static StudyConfig loadFromFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader);
        }
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    public void toJson(Writer writer) {
        GSON.toJson(this, writer);
    }

    public void saveToFile(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            toJson(writer);
        }
    }

    @Override
    public String toString() {
        return toJson();
    }
}
