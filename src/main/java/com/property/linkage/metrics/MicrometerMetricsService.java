package com.property.linkage.metrics;

import com.property.linkage.core.model.DatasetKind;
import com.property.linkage.core.model.MatchStrategy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code linkage.records.matched}: Counter (tags: dataset, strategy)</li>
 *   <li>{@code linkage.records.inserted}: Counter (tag: dataset)</li>
 *   <li>{@code linkage.records.skipped}: Counter (tags: dataset, reason)</li>
 *   <li>{@code linkage.pass.duration}: Timer (tags: dataset, kind)</li>
 *   <li>{@code linkage.registry.size}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary registrySizeSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.registrySizeSummary = DistributionSummary.builder("linkage.registry.size")
                .description("Registry size after each linkage pass")
                .register(registry);
    }

    @Override
    public void recordMatch(String dataset, MatchStrategy strategy) {
        String key = "matched:" + dataset + ":" + strategy.name();
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("linkage.records.matched")
                        .description("Secondary records matched to the registry")
                        .tag("dataset", dataset)
                        .tag("strategy", strategy.getLabel())
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementInserted(String dataset) {
        String key = "inserted:" + dataset;
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("linkage.records.inserted")
                        .description("Niche-only records inserted into the registry")
                        .tag("dataset", dataset)
                        .register(registry))
                .increment();
    }

    @Override
    public void recordSkipped(String dataset, String reason, long count) {
        String key = "skipped:" + dataset + ":" + reason;
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("linkage.records.skipped")
                        .description("Secondary records excluded from matching")
                        .tag("dataset", dataset)
                        .tag("reason", reason)
                        .register(registry))
                .increment(count);
    }

    @Override
    public void recordPassDuration(String dataset, DatasetKind kind, Duration duration) {
        String key = dataset + ":" + kind.name();
        timerCache.computeIfAbsent(key, k ->
                Timer.builder("linkage.pass.duration")
                        .description("Duration of one secondary dataset pass")
                        .tag("dataset", dataset)
                        .tag("kind", kind.getLabel())
                        .register(registry))
                .record(duration);
    }

    @Override
    public void recordRegistrySize(int size) {
        registrySizeSummary.record(size);
    }
}
