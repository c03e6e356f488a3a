package io.pcvct.sensitivity;

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

import io.pcvct.variations.VariationId;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Options shared by all sensitivity methods.
 *
 * <pre>{@code
 * GsaRunOptions options = GsaRunOptions.builder()
 *     .reference(VariationId.base())
 *     .ignoreIndices(Set.of(2))
 *     .replicatePolicy(ReplicatePolicy.EXCLUDE_MISSING)
 *     .schemeDirectory(Path.of("out"))
 *     .build();
 * }</pre>
 */
public final class GsaRunOptions {

    private final VariationId reference;
    private final Set<Integer> ignoreIndices;
    private final ReplicatePolicy replicatePolicy;
    private final Path schemeDirectory;

    private GsaRunOptions(Builder builder) {
        this.reference = builder.reference;
        this.ignoreIndices = Collections.unmodifiableSet(new TreeSet<>(builder.ignoreIndices));
        this.replicatePolicy = builder.replicatePolicy;
        this.schemeDirectory = builder.schemeDirectory;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @return options with the base reference, no ignored features, {@link ReplicatePolicy#PROPAGATE} and no scheme output
    public static GsaRunOptions defaults() {
        return builder().build();
    }

    /// @return the row ids whose values fill non-varied columns
    public VariationId getReference() {
        return reference;
    }

    /// @return 0-based indices of features excluded from analysis, ascending
    public Set<Integer> getIgnoreIndices() {
        return ignoreIndices;
    }

    public ReplicatePolicy getReplicatePolicy() {
        return replicatePolicy;
    }

    /// @return the directory for the scheme CSV, or null to skip recording
    public Path getSchemeDirectory() {
        return schemeDirectory;
    }

    /**
     * Builder for {@link GsaRunOptions}.
     */
    public static final class Builder {
        private VariationId reference = VariationId.base();
        private Set<Integer> ignoreIndices = Set.of();
        private ReplicatePolicy replicatePolicy = ReplicatePolicy.PROPAGATE;
        private Path schemeDirectory;

        private Builder() {
        }

        public Builder reference(VariationId reference) {
            this.reference = reference;
            return this;
        }

        public Builder ignoreIndices(Set<Integer> ignoreIndices) {
            this.ignoreIndices = ignoreIndices;
            return this;
        }

        public Builder replicatePolicy(ReplicatePolicy replicatePolicy) {
            this.replicatePolicy = replicatePolicy;
            return this;
        }

        public Builder schemeDirectory(Path schemeDirectory) {
            this.schemeDirectory = schemeDirectory;
            return this;
        }

        public GsaRunOptions build() {
            if (reference == null) {
                throw new IllegalArgumentException("reference must not be null");
            }
            if (ignoreIndices == null) {
                throw new IllegalArgumentException("ignoreIndices must not be null");
            }
            if (replicatePolicy == null) {
                throw new IllegalArgumentException("replicatePolicy must not be null");
            }
            return new GsaRunOptions(this);
        }
    }
}
