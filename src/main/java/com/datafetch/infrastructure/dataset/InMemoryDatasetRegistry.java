package com.datafetch.infrastructure.dataset;

import com.datafetch.domain.model.TimeSeriesDataset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dataset store held in memory, used as the {@link DatasetResolver} of this service. A columnar
 * store plugs in by registering its own resolver bean in place of this one.
 */
@Slf4j
@Component
public class InMemoryDatasetRegistry implements DatasetResolver {

    private final Map<String, Optional<TimeSeriesDataset>> datasets = new ConcurrentHashMap<>();

    /**
     * Registers a dataset under its name, replacing any previous one.
     */
    public void register(TimeSeriesDataset dataset) {
        datasets.put(dataset.getName(), Optional.of(dataset));
        log.debug("Registered dataset {}", dataset);
    }

    /**
     * Registers a dataset id that is known to the catalog but holds no data.
     */
    public void registerWithoutData(String datasetId) {
        datasets.put(datasetId, Optional.empty());
    }

    public boolean remove(String datasetId) {
        return datasets.remove(datasetId) != null;
    }

    @Override
    public DatasetHandle resolve(String datasetId, List<String> variables) {
        Optional<TimeSeriesDataset> stored = datasets.get(datasetId);
        if (stored == null) {
            throw new DatasetResolutionException("Dataset '" + datasetId + "' not found");
        }
        if (stored.isEmpty()) {
            return new InMemoryHandle(datasetId, null);
        }
        try {
            return new InMemoryHandle(datasetId, stored.get().project(variables));
        } catch (IllegalArgumentException e) {
            throw new DatasetResolutionException(e.getMessage(), e);
        }
    }

    private static class InMemoryHandle implements DatasetHandle {

        private final String datasetId;
        private final TimeSeriesDataset projected;

        InMemoryHandle(String datasetId, TimeSeriesDataset projected) {
            this.datasetId = datasetId;
            this.projected = projected;
        }

        @Override
        public String getDatasetId() {
            return datasetId;
        }

        @Override
        public long getEstimatedBytes() {
            return projected == null ? 0 : projected.estimatedBytes();
        }

        @Override
        public Optional<TimeSeriesDataset> fetch(Instant start, Instant end) {
            return Optional.ofNullable(projected).map(dataset -> dataset.slice(start, end));
        }
    }
}
