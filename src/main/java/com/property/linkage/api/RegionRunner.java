package com.property.linkage.api;

import com.property.linkage.bulk.NicheListCsvReader;
import com.property.linkage.bulk.NicheTypeDetector;
import com.property.linkage.bulk.ProgressCallback;
import com.property.linkage.bulk.RegistryCsvExporter;
import com.property.linkage.bulk.RegistryCsvImporter;
import com.property.linkage.bulk.RegistryImport;
import com.property.linkage.bulk.SkipTraceCsvReader;
import com.property.linkage.bulk.SummaryJsonWriter;
import com.property.linkage.classify.PriorityScorer;
import com.property.linkage.core.model.CanonicalPropertyRecord;
import com.property.linkage.logging.LogContext;
import com.property.linkage.merge.RecentSalesAppender;
import com.property.linkage.metrics.MetricsService;
import com.property.linkage.metrics.NoOpMetricsService;
import com.property.linkage.region.ConfigurationException;
import com.property.linkage.region.RegionConfig;
import com.property.linkage.region.RegionConfigurationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Runs the full pipeline for one region directory: registry load, recent-sales append,
 * niche passes in file-name order, an optional skip-trace pass, then CSV and JSON output.
 */
public class RegionRunner {
    private static final Logger log = LoggerFactory.getLogger(RegionRunner.class);

    static final String LINKED_SUFFIX = "_linked.csv";
    static final String SUMMARY_SUFFIX = "_summary.json";
    static final int DISTRIBUTION_LIMIT = 10;

    private final RegionConfigurationService configService;
    private final Path regionsDir;
    private final LinkageOptions options;
    private final MetricsService metricsService;
    private final Clock clock;

    public RegionRunner(RegionConfigurationService configService, Path regionsDir, LinkageOptions options,
                        MetricsService metricsService) {
        this(configService, regionsDir, options, metricsService, Clock.systemDefaultZone());
    }

    public RegionRunner(RegionConfigurationService configService, Path regionsDir, LinkageOptions options,
                        MetricsService metricsService, Clock clock) {
        this.configService = Objects.requireNonNull(configService, "configService is required");
        this.regionsDir = Objects.requireNonNull(regionsDir, "regionsDir is required");
        this.options = options != null ? options : LinkageOptions.defaults();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Runs the region.
     *
     * @param skipTraceFile skip-trace export to apply; null to use one found in the region directory
     * @param outputDir     directory for the linked CSV and summary; null for the region directory
     * @throws ConfigurationException if the region is unknown or has no registry file
     */
    public RunSummary run(String regionKey, Path skipTraceFile, Path outputDir) {
        RegionConfig region = configService.getRegion(regionKey);
        Path regionDir = regionsDir.resolve(regionKey);
        Path outDir = outputDir != null ? outputDir : regionDir;
        String runId = LogContext.generateRunId();
        Instant startedAt = clock.instant();

        try (LogContext ctx = LogContext.forRun(runId, regionKey)
                .with("jurisdiction", region.jurisdictionCode())) {
            RegionFiles files = discover(regionDir);
            Path skipTrace = skipTraceFile != null ? skipTraceFile : files.skipTrace();
            log.info("run.starting region={} registry={} recentSales={} niche={} skipTrace={}",
                    region.displayName(), files.registry().getFileName(), files.recentSales().size(),
                    files.niche().size(), skipTrace != null ? skipTrace.getFileName() : "none");

            RegistryCsvImporter importer = new RegistryCsvImporter(new PriorityScorer(region.thresholds(), clock));
            RegistryImport registryImport = importer.importFile(
                    files.registry(), region.jurisdictionCode(), ProgressCallback.NOOP);
            PropertyRegistry registry = new PropertyRegistry(region.jurisdictionCode(), registryImport.columns());
            registry.addAll(registryImport.records());

            long appended = appendRecentSales(registry, files.recentSales(), importer, region.jurisdictionCode());

            List<SecondaryDatasetSource> sources = new ArrayList<>();
            NicheTypeDetector detector = new NicheTypeDetector();
            for (Path niche : files.niche()) {
                sources.add(new NicheListCsvReader(niche, detector.detect(niche.getFileName().toString())));
            }
            if (skipTrace != null) {
                sources.add(new SkipTraceCsvReader(skipTrace));
            }

            LinkageOrchestrator orchestrator = new LinkageOrchestrator(options, metricsService);
            List<LinkageSummary> summaries = orchestrator.linkAll(registry, sources);

            createDirectories(outDir);
            new RegistryCsvExporter().exportFile(registry, outDir.resolve(regionKey + LINKED_SUFFIX));

            RunSummary summary = new RunSummary(runId, regionKey, region.displayName(), region.jurisdictionCode(),
                    startedAt.toString(), clock.instant().toString(), registryImport.records().size(), appended,
                    summaries, registry.size(), codeDistribution(registry.records(), DISTRIBUTION_LIMIT));
            new SummaryJsonWriter().write(summary, outDir.resolve(regionKey + SUMMARY_SUFFIX));

            log.info("run.completed region={} finalSize={} inserted={} failedDatasets={}",
                    regionKey, summary.finalRegistrySize(), summary.totalInserted(), summary.hasFailedDatasets());
            return summary;
        }
    }

    private long appendRecentSales(PropertyRegistry registry, List<Path> files, RegistryCsvImporter importer,
                                   String jurisdiction) {
        RecentSalesAppender appender = new RecentSalesAppender();
        long appended = 0;
        for (Path file : files) {
            RegistryImport sales = importer.importFile(file, jurisdiction, ProgressCallback.NOOP);
            appended += appender.append(registry, sales.records());
        }
        return appended;
    }

    /**
     * Sorts the CSV files of a region directory into registry, recent sales, niche lists and
     * skip-trace. Previously written output files are ignored.
     *
     * @throws ConfigurationException if the directory holds no CSV file
     */
    public static RegionFiles discover(Path regionDir) {
        List<Path> csvFiles;
        try (Stream<Path> children = Files.list(regionDir)) {
            csvFiles = children
                    .filter(Files::isRegularFile)
                    .filter(p -> lowerName(p).endsWith(".csv"))
                    .filter(p -> !lowerName(p).endsWith(LINKED_SUFFIX))
                    .sorted(Comparator.comparing(RegionRunner::lowerName))
                    .toList();
        } catch (IOException e) {
            throw new ConfigurationException("Cannot list region directory " + regionDir, e);
        }
        if (csvFiles.isEmpty()) {
            throw new ConfigurationException("No CSV files in region directory " + regionDir);
        }

        Path registry = csvFiles.stream()
                .filter(p -> lowerName(p).contains("main_region"))
                .findFirst()
                .orElseGet(() -> largest(csvFiles));

        List<Path> recentSales = new ArrayList<>();
        List<Path> niche = new ArrayList<>();
        Path skipTrace = null;
        for (Path file : csvFiles) {
            String name = lowerName(file);
            if (file.equals(registry)) {
                continue;
            }
            if (name.contains("recent") && name.contains("sales")) {
                recentSales.add(file);
            } else if (name.contains("skip") && name.contains("trace")) {
                if (skipTrace == null) {
                    skipTrace = file;
                } else {
                    log.warn("discover.extraSkipTrace file={} using={}", file.getFileName(), skipTrace.getFileName());
                }
            } else {
                niche.add(file);
            }
        }
        return new RegionFiles(registry, recentSales, niche, skipTrace);
    }

    /**
     * Most frequent composite priority codes, most frequent first, ties by code.
     */
    static Map<String, Long> codeDistribution(List<CanonicalPropertyRecord> records, int limit) {
        Map<String, Long> counts = new HashMap<>();
        for (CanonicalPropertyRecord record : records) {
            counts.merge(record.getCompositePriorityCode(), 1L, Long::sum);
        }
        Map<String, Long> top = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(limit)
                .forEach(e -> top.put(e.getKey(), e.getValue()));
        return top;
    }

    private static Path largest(List<Path> files) {
        Path largest = files.get(0);
        long largestSize = -1;
        for (Path file : files) {
            long size = sizeOf(file);
            if (size > largestSize) {
                largest = file;
                largestSize = size;
            }
        }
        return largest;
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read size of " + file, e);
        }
    }

    private static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory " + dir, e);
        }
    }

    private static String lowerName(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT);
    }

    /**
     * Input files of one region.
     *
     * @param registry    registry export
     * @param recentSales recent-sales exports, in file-name order
     * @param niche       niche lists, in file-name order
     * @param skipTrace   skip-trace export, or null
     */
    public record RegionFiles(Path registry, List<Path> recentSales, List<Path> niche, Path skipTrace) {
        public RegionFiles {
            recentSales = List.copyOf(recentSales);
            niche = List.copyOf(niche);
        }
    }
}
