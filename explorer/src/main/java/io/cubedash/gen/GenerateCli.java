package io.cubedash.gen;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import io.cubedash.config.AppConfig;
import io.cubedash.db.Database;
import io.cubedash.db.SchemaRepo;
import io.cubedash.model.GenerateResult;
import io.cubedash.summary.RefreshOptions;
import io.cubedash.summary.RefreshResult;
import io.cubedash.summary.SummaryStore;
import org.apache.commons.cli.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code cubedash-gen}: initialise the summary schema and refresh product summaries.
 *
 * <pre>
 * cubedash-gen --init                  create the schema and exit
 * cubedash-gen --all                   refresh every product
 * cubedash-gen -j 4 ls8_ard ls7_ard    refresh two products on four workers
 * </pre>
 */
public final class GenerateCli {
    private static final Logger log = LoggerFactory.getLogger(GenerateCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final Pattern SHORT_DURATION = Pattern.compile("^(\\d+)\\s*([smhdw])$");

    private static final Options options = new Options();

    static {
        options.addOption("h", "help", false, "Show this help");
        options.addOption("v", "verbose", false, "More logging (repeat for even more)");
        options.addOption(null, "init", false, "Create or update the summary schema");
        options.addOption(null, "drop", false, "Drop the summary schema first");
        options.addOption(null, "all", false, "Refresh every product in the catalog");
        options.addOption(null, "force-refresh", false, "Regenerate every period, not just changed ones");
        options.addOption(null, "recreate-dataset-extents", false, "Rescan every dataset's extent");
        options.addOption(null, "reset-incremental-position", false, "Forget where the last scan stopped");
        options.addOption(null, "refresh-stats", false, "Refresh the supporting statistics views afterwards");
        options.addOption(null, "minimum-scan-window", true,
                "Overlap for incremental scans (ISO-8601 like PT2H, or 30m, 2h, 3d)");
        options.addOption(null, "epsg", true, "EPSG code footprints are grouped in");
        options.addOption("j", "jobs", true, "Products refreshed in parallel (default 1)");
    }

    private final SchemaRepo schema;
    private final SummaryStore store;
    private final int groupingEpsg;
    private final PrintStream out;
    private final PrintStream err;

    GenerateCli(SchemaRepo schema, SummaryStore store, int groupingEpsg, PrintStream out, PrintStream err) {
        this.schema = schema;
        this.store = store;
        this.groupingEpsg = groupingEpsg;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        CommandLine cmd;
        try {
            cmd = parse(args);
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            printHelp(System.err);
            return EXIT_USAGE;
        }
        if (cmd.hasOption("help")) {
            printHelp(System.out);
            return EXIT_OK;
        }
        applyVerbosity(verbosity(cmd));

        AppConfig cfg;
        try {
            cfg = AppConfig.load();
            if (cmd.hasOption("epsg"))
                cfg = cfg.withGroupingEpsg(Integer.parseInt(cmd.getOptionValue("epsg").trim()));
        } catch (IllegalStateException | NumberFormatException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }

        try (HikariDataSource ds = Database.createGenDataSource(cfg)) {
            SummaryStore store = SummaryStore.create(cfg, new ObjectMapper(), ds);
            return new GenerateCli(store.schema(), store, cfg.groupingEpsg(), System.out, System.err).execute(cmd);
        }
    }

    static CommandLine parse(String[] args) throws ParseException {
        return new DefaultParser().parse(options, args);
    }

    /**
     * Runs a parsed command line.
     *
     * @return the process exit code
     */
    int execute(CommandLine cmd) {
        List<String> products = cmd.getArgList();
        boolean all = cmd.hasOption("all");
        boolean init = cmd.hasOption("init");
        boolean drop = cmd.hasOption("drop");
        boolean refreshStats = cmd.hasOption("refresh-stats");

        if (!all && products.isEmpty() && !init && !drop && !refreshStats) {
            err.println("Specify products to refresh, or --all (or --init to only create the schema)");
            printHelp(err);
            return EXIT_USAGE;
        }
        if (all && !products.isEmpty()) {
            err.println("Give either --all or product names, not both");
            return EXIT_USAGE;
        }

        RefreshOptions opts;
        int workers;
        try {
            opts = new RefreshOptions(
                    cmd.hasOption("force-refresh"),
                    cmd.hasOption("recreate-dataset-extents"),
                    cmd.hasOption("reset-incremental-position"),
                    cmd.hasOption("minimum-scan-window") ? parseDuration(cmd.getOptionValue("minimum-scan-window"))
                            : null);
            workers = Integer.parseInt(cmd.getOptionValue("jobs", "1").trim());
            if (workers < 1)
                throw new IllegalArgumentException("--jobs must be at least 1");
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        }

        try {
            if (drop) {
                log.warn("Dropping summary schema");
                schema.dropSchema();
                out.println("Dropped summary schema");
            }
            if (init) {
                log.info("Initialising summary schema (EPSG:{})", groupingEpsg);
                schema.initSchema(groupingEpsg);
                out.println("Summary schema is ready");
            } else if (!schema.schemaInitialised()) {
                if (drop && !all && products.isEmpty())
                    return EXIT_OK;
                err.println("No cubedash schema exists. Run `cubedash-gen --init` first to create it.");
                return EXIT_FAILED;
            } else if (!schema.isCompatible(true)) {
                err.println("The cubedash schema is out of date. Run `cubedash-gen --init` to update it.");
                return EXIT_FAILED;
            }

            if (!all && products.isEmpty() && !refreshStats)
                return EXIT_OK;

            List<String> names = all ? store.catalogProductNames() : products;
            boolean failed = false;
            if (!names.isEmpty())
                failed = refreshAll(names, opts, workers);

            if (refreshStats) {
                log.info("Refreshing statistics");
                schema.refreshStats(true);
            }
            return failed ? EXIT_FAILED : EXIT_OK;
        } catch (Exception e) {
            log.error("cubedash-gen failed", e);
            err.println("Failed: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    /**
     * Refreshes products on a pool of workers.
     *
     * @return whether any product failed
     */
    boolean refreshAll(List<String> names, RefreshOptions opts, int workers) throws InterruptedException {
        log.info("Refreshing {} product(s) on {} worker(s)", names.size(), workers);
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(workers, names.size()), r -> {
            Thread t = new Thread(r, "cubedash-gen");
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<RefreshResult>> futures = new ArrayList<>();
            for (String name : names)
                futures.add(pool.submit(() -> store.refresh(name, opts)));

            boolean failed = false;
            for (int i = 0; i < futures.size(); i++) {
                RefreshResult r;
                try {
                    r = futures.get(i).get();
                } catch (java.util.concurrent.ExecutionException e) {
                    log.error("Refresh of {} did not complete", names.get(i), e.getCause());
                    r = new RefreshResult(names.get(i), GenerateResult.ERROR, null);
                }
                out.printf("%s: %s%n", r.productName(), r.result().name().toLowerCase(Locale.ROOT));
                if (r.result() == GenerateResult.ERROR)
                    failed = true;
            }
            return failed;
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Accepts ISO-8601 ({@code PT2H}) or a short form ({@code 90s}, {@code 30m},
     * {@code 2h}, {@code 3d}, {@code 1w}).
     */
    static Duration parseDuration(String s) {
        String v = s == null ? "" : s.trim();
        Matcher m = SHORT_DURATION.matcher(v.toLowerCase(Locale.ROOT));
        if (m.matches()) {
            long n = Long.parseLong(m.group(1));
            return switch (m.group(2)) {
                case "s" -> Duration.ofSeconds(n);
                case "m" -> Duration.ofMinutes(n);
                case "h" -> Duration.ofHours(n);
                case "d" -> Duration.ofDays(n);
                default -> Duration.ofDays(7 * n);
            };
        }
        try {
            Duration d = Duration.parse(v);
            if (d.isNegative())
                throw new IllegalArgumentException("Scan window must not be negative: " + s);
            return d;
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unreadable duration: " + s, e);
        }
    }

    static int verbosity(CommandLine cmd) {
        int n = 0;
        for (Option o : cmd.getOptions()) {
            if ("v".equals(o.getOpt()))
                n++;
        }
        return n;
    }

    /**
     * {@code -v} shows our debug output, {@code -vv} everything.
     */
    static void applyVerbosity(int level) {
        if (level <= 0)
            return;
        ch.qos.logback.classic.Logger ours = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger("io.cubedash");
        ours.setLevel(Level.DEBUG);
        if (level > 1) {
            ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger) LoggerFactory
                    .getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(Level.DEBUG);
        }
    }

    static void printHelp(PrintStream stream) {
        HelpFormatter formatter = new HelpFormatter();
        java.io.PrintWriter pw = new java.io.PrintWriter(stream);
        formatter.printHelp(pw, formatter.getWidth(), "cubedash-gen [options] [PRODUCT ...]", null, options,
                formatter.getLeftPadding(), formatter.getDescPadding(), null);
        pw.flush();
    }
}
