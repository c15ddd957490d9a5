package com.datafetch.infrastructure.dataset;

import java.util.List;

/**
 * Resolves a dataset id and a variable projection to a lazy handle on the stored data.
 */
public interface DatasetResolver {

    /**
     * @throws DatasetResolutionException if the dataset is unknown or lacks a projected variable
     */
    DatasetHandle resolve(String datasetId, List<String> variables);
}
