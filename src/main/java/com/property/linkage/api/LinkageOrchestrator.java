package com.property.linkage.api;

import com.property.linkage.bulk.SchemaException;
import com.property.linkage.core.model.CanonicalPropertyRecord;
import com.property.linkage.core.model.MatchResult;
import com.property.linkage.core.model.MatchStrategy;
import com.property.linkage.core.model.SecondaryRecord;
import com.property.linkage.index.CanonicalIndex;
import com.property.linkage.index.CanonicalIndexBuilder;
import com.property.linkage.index.JurisdictionFilter;
import com.property.linkage.index.MatchCascadeResolver;
import com.property.linkage.logging.LogContext;
import com.property.linkage.merge.EnrichmentApplier;
import com.property.linkage.merge.EnrichmentResult;
import com.property.linkage.merge.InsertionSynthesizer;
import com.property.linkage.metrics.MetricsService;
import com.property.linkage.metrics.NoOpMetricsService;
import com.property.linkage.rules.KeyNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Links secondary datasets into a {@link PropertyRegistry}, one dataset at a time.
 *
 * <p>Each pass runs jurisdiction filter, anomaly exclusion, match resolution against the
 * canonical index, then a serial apply phase in input order: matched rows enrich every
 * candidate, unmatched niche rows are synthesized into new records. New records are appended
 * after the pass, so they are visible to later datasets but not to the pass that created them.</p>
 *
 * <p>The index is rebuilt only when the registry changed since it was last built. With
 * {@link LinkageOptions#getParallelism()} above one, resolution runs on a fixed thread pool;
 * the apply phase stays serial so tag order is reproducible.</p>
 *
 * <p>Instances keep the cached index between passes and must not be shared between threads.</p>
 */
public class LinkageOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(LinkageOrchestrator.class);

    static final String SKIP_JURISDICTION = "jurisdiction";
    static final String SKIP_BLANK_ADDRESS = "blank_address";
    static final String SKIP_INVALID_ID = "invalid_structured_id";

    private final LinkageOptions options;
    private final MetricsService metricsService;
    private final CanonicalIndexBuilder indexBuilder;
    private final MatchCascadeResolver resolver;
    private final EnrichmentApplier applier;
    private final InsertionSynthesizer synthesizer;

    private PropertyRegistry indexedRegistry;
    private CanonicalIndex cachedIndex;

    public LinkageOrchestrator() {
        this(LinkageOptions.defaults());
    }

    public LinkageOrchestrator(LinkageOptions options) {
        this(options, new NoOpMetricsService());
    }

    public LinkageOrchestrator(LinkageOptions options, MetricsService metricsService) {
        this(options, metricsService, new CanonicalIndexBuilder(), new MatchCascadeResolver(),
                new EnrichmentApplier(), new InsertionSynthesizer(options.getNicheOnlyPriorityId()));
    }

    public LinkageOrchestrator(LinkageOptions options,
                               MetricsService metricsService,
                               CanonicalIndexBuilder indexBuilder,
                               MatchCascadeResolver resolver,
                               EnrichmentApplier applier,
                               InsertionSynthesizer synthesizer) {
        this.options = Objects.requireNonNull(options, "options is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.indexBuilder = Objects.requireNonNull(indexBuilder, "indexBuilder is required");
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
        this.applier = Objects.requireNonNull(applier, "applier is required");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer is required");
    }

    /**
     * Loads and links each source in order. A source failing with a schema error is reported
     * in its summary and skipped; the remaining sources still run.
     */
    public List<LinkageSummary> linkAll(PropertyRegistry registry, List<? extends SecondaryDatasetSource> sources) {
        List<LinkageSummary> summaries = new ArrayList<>(sources.size());
        for (SecondaryDatasetSource source : sources) {
            SecondaryDataset dataset;
            try {
                dataset = source.load();
            } catch (SchemaException e) {
                log.warn("linkage.schemaError dataset={} kind={} error={}",
                        source.name(), source.kind().getLabel(), e.getMessage());
                summaries.add(LinkageSummary.failure(source.name(), source.kind(), e.getMessage()));
                continue;
            }
            summaries.add(link(registry, dataset));
        }
        return summaries;
    }

    /**
     * Runs one linkage pass of {@code dataset} against {@code registry}, mutating the registry.
     */
    public LinkageSummary link(PropertyRegistry registry, SecondaryDataset dataset) {
        Objects.requireNonNull(registry, "registry is required");
        Objects.requireNonNull(dataset, "dataset is required");
        long start = System.nanoTime();

        try (LogContext ctx = LogContext.forDataset(dataset.name(), dataset.kind().getLabel())
                .with("jurisdiction", registry.getJurisdictionCode())) {
            log.info("linkage.starting dataset={} kind={} sourceType={} records={} registrySize={}",
                    dataset.name(), dataset.kind().getLabel(), dataset.sourceType(),
                    dataset.records().size(), registry.size());

            List<SecondaryRecord> inJurisdiction =
                    JurisdictionFilter.filterByJurisdiction(dataset.records(), registry.getJurisdictionCode());
            long jurisdictionFiltered = dataset.records().size() - inJurisdiction.size();
            if (jurisdictionFiltered > 0) {
                log.info("linkage.jurisdictionFiltered dataset={} expected={} dropped={}",
                        dataset.name(), registry.getJurisdictionCode(), jurisdictionFiltered);
            }

            List<SecondaryRecord> eligible = new ArrayList<>(inJurisdiction.size());
            long blankAddress = 0;
            long invalidId = 0;
            for (SecondaryRecord record : inJurisdiction) {
                if (KeyNormalizer.normalizeAddress(record.getAddress()).isEmpty()) {
                    blankAddress++;
                    log.debug("linkage.skipped reason={} line={}", SKIP_BLANK_ADDRESS, record.getLineNumber());
                } else if (KeyNormalizer.isUnparseableStructuredId(record.getStructuredId())) {
                    invalidId++;
                    log.debug("linkage.skipped reason={} line={} structuredId='{}'",
                            SKIP_INVALID_ID, record.getLineNumber(), record.getStructuredId());
                } else {
                    eligible.add(record);
                }
            }

            CanonicalIndex index = indexFor(registry);
            List<MatchResult> results = resolveAll(eligible, index);

            Map<MatchStrategy, Long> breakdown = new EnumMap<>(MatchStrategy.class);
            List<CanonicalPropertyRecord> inserts = new ArrayList<>();
            long matched = 0;
            long enriched = 0;
            long unmatched = 0;

            for (int i = 0; i < eligible.size(); i++) {
                SecondaryRecord record = eligible.get(i);
                MatchResult result = results.get(i);
                breakdown.merge(result.strategy(), 1L, Long::sum);

                if (result.isMatched()) {
                    matched++;
                    metricsService.recordMatch(dataset.name(), result.strategy());
                    for (CanonicalPropertyRecord candidate : result.matched()) {
                        EnrichmentResult applied = applier.apply(candidate, record);
                        if (applied.hasChanges()) {
                            enriched++;
                        }
                    }
                } else {
                    unmatched++;
                    if (dataset.kind().allowsInsertion()) {
                        inserts.add(synthesizer.synthesize(record));
                        metricsService.incrementInserted(dataset.name());
                    }
                }

                if ((i + 1) % options.getProgressInterval() == 0) {
                    log.info("linkage.progress dataset={} processed={} of={}", dataset.name(), i + 1, eligible.size());
                }
            }

            registry.addAll(inserts);

            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            recordSkips(dataset.name(), jurisdictionFiltered, blankAddress, invalidId);
            metricsService.recordPassDuration(dataset.name(), dataset.kind(), duration);
            metricsService.recordRegistrySize(registry.size());

            LinkageSummary summary = new LinkageSummary(dataset.name(), dataset.kind(),
                    dataset.records().size(), jurisdictionFiltered, blankAddress, invalidId,
                    matched, enriched, inserts.size(), unmatched, breakdown, duration.toMillis(), null);
            log.info("linkage.completed {}", summary);
            return summary;
        }
    }

    /**
     * Index over the registry's current contents, rebuilt when the registry has grown.
     */
    CanonicalIndex indexFor(PropertyRegistry registry) {
        if (cachedIndex == null || indexedRegistry != registry
                || cachedIndex.getRegistryVersion() != registry.getVersion()) {
            cachedIndex = indexBuilder.build(registry.records(), registry.getVersion());
            indexedRegistry = registry;
            log.info("index.rebuilt records={} structuredIds={} addressKeys={}",
                    cachedIndex.getIndexedRecords(), cachedIndex.structuredIdKeyCount(),
                    cachedIndex.addressKeyCount());
        }
        return cachedIndex;
    }

    private List<MatchResult> resolveAll(List<SecondaryRecord> records, CanonicalIndex index) {
        int parallelism = Math.min(options.getParallelism(), records.size());
        if (parallelism <= 1) {
            return resolveChunk(records, index);
        }

        ExecutorService executor = Executors.newFixedThreadPool(parallelism);
        try {
            int chunkSize = (records.size() + parallelism - 1) / parallelism;
            List<CompletableFuture<List<MatchResult>>> futures = new ArrayList<>(parallelism);
            for (int from = 0; from < records.size(); from += chunkSize) {
                List<SecondaryRecord> chunk = records.subList(from, Math.min(from + chunkSize, records.size()));
                futures.add(CompletableFuture.supplyAsync(() -> resolveChunk(chunk, index), executor));
            }

            List<MatchResult> results = new ArrayList<>(records.size());
            for (CompletableFuture<List<MatchResult>> future : futures) {
                results.addAll(future.join());
            }
            return results;
        } finally {
            executor.shutdown();
        }
    }

    private List<MatchResult> resolveChunk(List<SecondaryRecord> records, CanonicalIndex index) {
        List<MatchResult> results = new ArrayList<>(records.size());
        for (SecondaryRecord record : records) {
            results.add(resolver.resolve(record, index));
        }
        return results;
    }

    private void recordSkips(String dataset, long jurisdiction, long blankAddress, long invalidId) {
        if (jurisdiction > 0) {
            metricsService.recordSkipped(dataset, SKIP_JURISDICTION, jurisdiction);
        }
        if (blankAddress > 0) {
            metricsService.recordSkipped(dataset, SKIP_BLANK_ADDRESS, blankAddress);
        }
        if (invalidId > 0) {
            metricsService.recordSkipped(dataset, SKIP_INVALID_ID, invalidId);
        }
    }
}
