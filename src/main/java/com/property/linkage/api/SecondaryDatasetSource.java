package com.property.linkage.api;

import com.property.linkage.core.model.DatasetKind;

/**
 * Lazily loaded secondary dataset. Loading may fail with a schema error, which the
 * orchestrator reports against this source before moving to the next one.
 */
public interface SecondaryDatasetSource {

    String name();

    DatasetKind kind();

    /**
     * @throws com.property.linkage.bulk.SchemaException if a required column is missing
     */
    SecondaryDataset load();
}
