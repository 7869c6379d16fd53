package io.cubedash;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import io.cubedash.api.ApiServer;
import io.cubedash.config.AppConfig;
import io.cubedash.db.Database;
import io.cubedash.gen.RefreshScheduler;
import io.cubedash.summary.SummaryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code cubedash-run}: serves the summary API, and refreshes summaries in the
 * background when a refresh interval is configured.
 */
public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private Main() {
    }

    public static void main(String[] args) throws Exception {
        log.info("Starting cubedash");
        AppConfig cfg = AppConfig.load();

        ObjectMapper om = new ObjectMapper();
        HikariDataSource apiDs = Database.createApiDataSource(cfg);
        HikariDataSource genDs = Database.createGenDataSource(cfg);

        SummaryStore apiStore = SummaryStore.create(cfg, om, apiDs);
        SummaryStore genStore = SummaryStore.create(cfg, om, genDs);

        try {
            log.info("Connected to {} (PostGIS {})", cfg.dbJdbcUrl(), apiStore.schema().postgisVersion());
            if (!apiStore.schema().schemaInitialised())
                log.warn("No cubedash schema yet. Run `cubedash-gen --init --all` to create and fill it.");
            else if (!apiStore.schema().isCompatible(false))
                log.warn("The cubedash schema is out of date. Run `cubedash-gen --init` to update it.");
        } catch (Exception e) {
            log.warn("Could not check the cubedash schema at startup", e);
        }

        RefreshScheduler scheduler = new RefreshScheduler(cfg, genStore);
        scheduler.start();

        ApiServer api = new ApiServer(cfg, om, apiDs, apiStore);
        api.start();
        log.info("API server started on port {}", api.port());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down...");
                api.stop();
                scheduler.stop();
                apiDs.close();
                genDs.close();
            } catch (Exception e) {
                log.error("Shutdown error", e);
            }
        }));
    }
}
