package com.casesentinel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Named datasets ingested for one case, in ingestion order.
 *
 * <p>
 * Iteration order of {@link #getDatasets()} is the order sources were added;
 * every detection and matching sweep processes sources in that order.
 * </p>
 *
 * @since 1.0.0
 */
public final class RecordStore {

    private final Map<String, Dataset> datasets;

    private RecordStore(Map<String, Dataset> datasets) {
        this.datasets = Collections.unmodifiableMap(new LinkedHashMap<>(datasets));
    }

    /**
     * @return an empty store
     */
    public static RecordStore empty() {
        return new RecordStore(Map.of());
    }

    /**
     * @return a new {@link Builder}
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return unmodifiable source name to dataset mapping, in insertion order
     */
    public Map<String, Dataset> getDatasets() {
        return datasets;
    }

    /**
     * @param source source name
     * @return the dataset, or empty if no such source was ingested
     */
    public Optional<Dataset> get(String source) {
        return Optional.ofNullable(datasets.get(source));
    }

    public Set<String> sourceNames() {
        return datasets.keySet();
    }

    public int size() {
        return datasets.size();
    }

    public boolean isEmpty() {
        return datasets.isEmpty();
    }

    @Override
    public String toString() {
        return "RecordStore" + datasets;
    }

    /**
     * Fluent builder for {@link RecordStore}. Source names must be unique.
     */
    public static class Builder {
        private final Map<String, Dataset> datasets = new LinkedHashMap<>();

        /**
         * @param source  unique source name
         * @param dataset its dataset
         * @return this builder
         * @throws IllegalArgumentException if {@code source} was already added
         */
        public Builder add(String source, Dataset dataset) {
            Objects.requireNonNull(source, "Source name must not be null");
            Objects.requireNonNull(dataset, "Dataset must not be null");
            if (datasets.containsKey(source)) {
                throw new IllegalArgumentException("Duplicate source name: " + source);
            }
            datasets.put(source, dataset);
            return this;
        }

        public RecordStore build() {
            return new RecordStore(datasets);
        }
    }
}
