package io.cubedash.gen;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zaxxer.hikari.HikariDataSource;
import io.cubedash.config.AppConfig;
import io.cubedash.db.Database;
import io.cubedash.model.ProductSummary;
import io.cubedash.summary.SummaryJson;
import io.cubedash.summary.SummaryStore;
import io.cubedash.summary.TimePeriodOverview;
import org.apache.commons.cli.*;

import java.io.PrintStream;
import java.util.List;
import java.util.Optional;

/**
 * {@code cubedash-view PRODUCT [YEAR [MONTH [DAY]]]}: prints a stored summary as JSON.
 */
public final class ViewCli {
    private static final Options options = new Options();

    static {
        options.addOption("h", "help", false, "Show this help");
        options.addOption("v", "verbose", false, "More logging");
    }

    private final SummaryStore store;
    private final ObjectMapper om;
    private final PrintStream out;
    private final PrintStream err;

    ViewCli(SummaryStore store, ObjectMapper om, PrintStream out, PrintStream err) {
        this.store = store;
        this.om = om;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            printHelp();
            return GenerateCli.EXIT_USAGE;
        }
        if (cmd.hasOption("help")) {
            printHelp();
            return GenerateCli.EXIT_OK;
        }
        GenerateCli.applyVerbosity(GenerateCli.verbosity(cmd));

        AppConfig cfg = AppConfig.load();
        ObjectMapper om = new ObjectMapper();
        try (HikariDataSource ds = Database.createGenDataSource(cfg)) {
            return new ViewCli(SummaryStore.create(cfg, om, ds), om, System.out, System.err).execute(cmd.getArgList());
        }
    }

    int execute(List<String> args) {
        if (args.isEmpty() || args.size() > 4) {
            err.println("Usage: cubedash-view PRODUCT [YEAR [MONTH [DAY]]]");
            return GenerateCli.EXIT_USAGE;
        }
        Integer year;
        Integer month;
        Integer day;
        try {
            year = args.size() > 1 ? Integer.valueOf(args.get(1)) : null;
            month = args.size() > 2 ? Integer.valueOf(args.get(2)) : null;
            day = args.size() > 3 ? Integer.valueOf(args.get(3)) : null;
        } catch (NumberFormatException e) {
            err.println("Year, month and day must be numbers");
            return GenerateCli.EXIT_USAGE;
        }
        String product = args.get(0);

        try {
            Optional<ProductSummary> p = store.getProductSummary(product);
            if (p.isEmpty()) {
                err.println("No summary for product " + product);
                return GenerateCli.EXIT_FAILED;
            }
            Optional<TimePeriodOverview> s = store.get(product, year, month, day);
            ObjectNode doc = om.createObjectNode();
            doc.set("product", SummaryJson.product(om, p.get()));
            if (s.isPresent())
                doc.set("summary", SummaryJson.overview(om, s.get()));
            else
                doc.putNull("summary");
            out.println(om.writerWithDefaultPrettyPrinter().writeValueAsString(doc));
            return GenerateCli.EXIT_OK;
        } catch (Exception e) {
            err.println("Failed: " + e.getMessage());
            return GenerateCli.EXIT_FAILED;
        }
    }

    private static void printHelp() {
        new HelpFormatter().printHelp("cubedash-view [options] PRODUCT [YEAR [MONTH [DAY]]]", options);
    }
}
