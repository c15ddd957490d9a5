package com.datafetch.infrastructure.dataset;

import com.datafetch.domain.model.TimeSeriesDataset;

import java.time.Instant;
import java.util.Optional;

/**
 * Lazy, projected view of one stored dataset. Nothing is read until {@link #fetch}.
 */
public interface DatasetHandle {

    String getDatasetId();

    /**
     * Bytes of the projected variables over the dataset's full extent.
     */
    long getEstimatedBytes();

    /**
     * Reads the samples within {@code [start, end]}.
     *
     * @return empty when the store holds no data at all for this dataset; a dataset with zero
     *         samples when it has data, just none in the window
     */
    Optional<TimeSeriesDataset> fetch(Instant start, Instant end);
}
