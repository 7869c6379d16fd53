package io.cubedash.gen;

import io.cubedash.config.AppConfig;
import io.cubedash.model.GenerateResult;
import io.cubedash.summary.RefreshOptions;
import io.cubedash.summary.RefreshResult;
import io.cubedash.summary.SummaryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.concurrent.*;

/**
 * Periodically refreshes every product while the server runs. Disabled when
 * the refresh interval is zero.
 */
public final class RefreshScheduler {
    private static final Logger log = LoggerFactory.getLogger(RefreshScheduler.class);

    private final ScheduledExecutorService refreshExec = Executors
            .newSingleThreadScheduledExecutor(r -> new Thread(r, "refresh-summaries"));

    private final AppConfig cfg;
    private final SummaryStore store;

    private ScheduledFuture<?> refreshTask;

    public RefreshScheduler(AppConfig cfg, SummaryStore store) {
        this.cfg = cfg;
        this.store = store;
    }

    public boolean enabled() {
        return !cfg.refreshInterval().isZero() && !cfg.refreshInterval().isNegative();
    }

    public void start() {
        if (!enabled()) {
            log.info("Periodic summary refresh disabled");
            return;
        }
        long seconds = Math.max(1, cfg.refreshInterval().toSeconds());
        refreshTask = refreshExec.scheduleWithFixedDelay(safe("refreshAll", this::refreshAll),
                30, seconds, TimeUnit.SECONDS);
        log.info("Refresh scheduler started, every {}", cfg.refreshInterval());
    }

    /**
     * One pass over every catalog product, then the statistics view.
     */
    void refreshAll() throws Exception {
        int failed = 0;
        int changed = 0;
        for (String name : store.catalogProductNames()) {
            if (Thread.currentThread().isInterrupted())
                return;
            RefreshResult r = store.refresh(name, RefreshOptions.incremental());
            if (r.result() == GenerateResult.ERROR)
                failed++;
            else if (r.result() != GenerateResult.NO_CHANGES)
                changed++;
        }
        store.schema().refreshStats(true);
        log.info("Refresh pass done: {} changed, {} failed", changed, failed);
    }

    public void stop() {
        if (refreshTask != null)
            refreshTask.cancel(true);
        shutdown(refreshExec, "refreshExec");
    }

    private void shutdown(ScheduledExecutorService es, String name) {
        es.shutdownNow();
        try {
            if (!es.awaitTermination(3, TimeUnit.SECONDS)) {
                log.warn("{} did not terminate cleanly", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Runnable safe(String name, ThrowingRunnable r) {
        return () -> {
            MDC.put("job", name);
            try {
                r.run();
            } catch (Exception e) {
                log.error("Scheduled job failed: {}", name, e);
            } finally {
                MDC.remove("job");
            }
        };
    }

    @FunctionalInterface
    interface ThrowingRunnable {
        void run() throws Exception;
    }
}
