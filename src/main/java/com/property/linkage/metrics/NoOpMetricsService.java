package com.property.linkage.metrics;

import com.property.linkage.core.model.DatasetKind;
import com.property.linkage.core.model.MatchStrategy;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordMatch(String dataset, MatchStrategy strategy) {
    }

    @Override
    public void incrementInserted(String dataset) {
    }

    @Override
    public void recordSkipped(String dataset, String reason, long count) {
    }

    @Override
    public void recordPassDuration(String dataset, DatasetKind kind, Duration duration) {
    }

    @Override
    public void recordRegistrySize(int size) {
    }
}
