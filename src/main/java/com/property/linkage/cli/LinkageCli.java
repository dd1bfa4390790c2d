package com.property.linkage.cli;

import com.property.linkage.api.LinkageOptions;
import com.property.linkage.api.LinkageSummary;
import com.property.linkage.api.RegionRunner;
import com.property.linkage.api.RunSummary;
import com.property.linkage.bulk.SchemaException;
import com.property.linkage.metrics.MicrometerMetricsService;
import com.property.linkage.region.ConfigurationException;
import com.property.linkage.region.JsonRegionConfigurationService;
import com.property.linkage.region.RegionConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Command-line entry point.
 *
 * <pre>
 * linkage --regions-dir &lt;dir&gt; --region &lt;key&gt; [--skip-trace &lt;file&gt;] [--output &lt;dir&gt;] [--parallelism &lt;n&gt;]
 * linkage --regions-dir &lt;dir&gt; --list-regions
 * </pre>
 */
public final class LinkageCli {
    private static final Logger log = LoggerFactory.getLogger(LinkageCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final Set<String> VALUE_OPTIONS = Set.of(
            "--regions-dir", "--region", "--skip-trace", "--output", "--parallelism");
    private static final String LIST_REGIONS = "--list-regions";

    private LinkageCli() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Map<String, String> options = new HashMap<>();
        boolean listRegions = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (LIST_REGIONS.equals(arg)) {
                listRegions = true;
            } else if (VALUE_OPTIONS.contains(arg) && i + 1 < args.length) {
                options.put(arg, args[++i]);
            } else {
                return usage(err, "Unexpected argument: " + arg);
            }
        }

        String regionsDir = options.get("--regions-dir");
        if (regionsDir == null) {
            return usage(err, "--regions-dir is required");
        }
        if (!listRegions && options.get("--region") == null) {
            return usage(err, "--region or --list-regions is required");
        }

        LinkageOptions.Builder linkage = LinkageOptions.builder();
        if (options.containsKey("--parallelism")) {
            try {
                linkage.parallelism(Integer.parseInt(options.get("--parallelism")));
            } catch (IllegalArgumentException e) {
                return usage(err, "--parallelism must be a positive integer");
            }
        }

        try {
            JsonRegionConfigurationService configService = new JsonRegionConfigurationService(Path.of(regionsDir));
            if (listRegions) {
                for (RegionConfig region : configService.listRegions()) {
                    out.println(region.key() + "\t" + region.displayName() + "\t" + region.jurisdictionCode());
                }
                return EXIT_OK;
            }

            RegionRunner runner = new RegionRunner(configService, Path.of(regionsDir), linkage.build(),
                    new MicrometerMetricsService(new SimpleMeterRegistry()));
            String skipTrace = options.get("--skip-trace");
            String output = options.get("--output");
            RunSummary summary = runner.run(options.get("--region"),
                    skipTrace != null ? Path.of(skipTrace) : null,
                    output != null ? Path.of(output) : null);
            print(summary, out);
            return EXIT_OK;
        } catch (ConfigurationException | SchemaException | UncheckedIOException e) {
            log.error("cli.failed error={}", e.getMessage(), e);
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private static void print(RunSummary summary, PrintStream out) {
        out.println("Region " + summary.regionName() + " (" + summary.jurisdictionCode() + ")");
        out.println("  registry records loaded: " + summary.registryRecordsLoaded());
        out.println("  recent sales appended:   " + summary.recentSalesAppended());
        for (LinkageSummary dataset : summary.datasets()) {
            if (dataset.failed()) {
                out.println("  " + dataset.datasetName() + ": FAILED " + dataset.error());
            } else {
                out.println("  " + dataset.datasetName() + ": matched=" + dataset.matchedRecords()
                        + " inserted=" + dataset.insertedRecords() + " skipped="
                        + (dataset.jurisdictionFiltered() + dataset.skippedBlankAddress()
                        + dataset.skippedInvalidStructuredId()));
            }
        }
        out.println("  final registry size:     " + summary.finalRegistrySize());
    }

    private static int usage(PrintStream err, String message) {
        err.println(message);
        err.println("Usage: linkage --regions-dir <dir> --region <key> [--skip-trace <file>] "
                + "[--output <dir>] [--parallelism <n>]");
        err.println("       linkage --regions-dir <dir> --list-regions");
        return EXIT_USAGE;
    }
}
