package com.property.linkage.metrics;

import com.property.linkage.core.model.DatasetKind;
import com.property.linkage.core.model.MatchStrategy;

import java.time.Duration;

/**
 * Interface for recording linkage metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine runs without a
 * meter registry.
 */
public interface MetricsService {

    void recordMatch(String dataset, MatchStrategy strategy);

    void incrementInserted(String dataset);

    void recordSkipped(String dataset, String reason, long count);

    void recordPassDuration(String dataset, DatasetKind kind, Duration duration);

    void recordRegistrySize(int size);
}
