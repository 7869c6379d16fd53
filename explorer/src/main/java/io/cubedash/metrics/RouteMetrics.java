package io.cubedash.metrics;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Request counts, server errors and latency per HTTP route.
 *
 * <p>
 * Uses a rolling 60-minute window of per-minute buckets.
 * </p>
 */
public final class RouteMetrics {
    private static final int WINDOW_MINUTES = 60;
    private static final Map<String, RouteBuckets> ROUTES = new ConcurrentHashMap<>();

    private RouteMetrics() {
    }

    /**
     * Records one handled request. A 5xx status counts as a failure.
     */
    public static void record(String route, int status, long millis) {
        if (route == null || route.isBlank())
            return;
        ROUTES.computeIfAbsent(route, k -> new RouteBuckets()).record(status < 500, Math.max(0, millis));
    }

    /**
     * Current figures by route, sorted by route.
     */
    public static Map<String, RouteSnapshot> snapshot() {
        Map<String, RouteSnapshot> out = new TreeMap<>();
        for (var e : ROUTES.entrySet()) {
            out.put(e.getKey(), e.getValue().snapshot());
        }
        return out;
    }

    public static int windowMinutes() {
        return WINDOW_MINUTES;
    }

    /** Forgets everything recorded so far. */
    public static void reset() {
        ROUTES.clear();
    }

    /**
     * Figures for one route over the window.
     */
    public record RouteSnapshot(long requests, long failures, double failurePct, double avgMillis, long maxMillis,
            String status) {
    }

    private static final class RouteBuckets {
        private final long[] total = new long[WINDOW_MINUTES];
        private final long[] fail = new long[WINDOW_MINUTES];
        private final long[] millis = new long[WINDOW_MINUTES];
        private final long[] slowest = new long[WINDOW_MINUTES];
        private final long[] minute = new long[WINDOW_MINUTES];

        private synchronized void record(boolean success, long ms) {
            long nowMin = System.currentTimeMillis() / 60000L;
            int idx = (int) (nowMin % WINDOW_MINUTES);
            if (minute[idx] != nowMin) {
                minute[idx] = nowMin;
                total[idx] = 0L;
                fail[idx] = 0L;
                millis[idx] = 0L;
                slowest[idx] = 0L;
            }
            total[idx] += 1L;
            millis[idx] += ms;
            slowest[idx] = Math.max(slowest[idx], ms);
            if (!success) {
                fail[idx] += 1L;
            }
        }

        private synchronized RouteSnapshot snapshot() {
            long nowMin = System.currentTimeMillis() / 60000L;
            long totalSum = 0L;
            long failSum = 0L;
            long msSum = 0L;
            long max = 0L;
            for (int i = 0; i < WINDOW_MINUTES; i++) {
                long bucketMin = minute[i];
                if (bucketMin == 0L || (nowMin - bucketMin) >= WINDOW_MINUTES)
                    continue;
                totalSum += total[i];
                failSum += fail[i];
                msSum += millis[i];
                max = Math.max(max, slowest[i]);
            }
            double failurePct = totalSum == 0 ? 0.0 : (failSum * 100.0) / totalSum;
            double avg = totalSum == 0 ? 0.0 : (double) msSum / totalSum;
            String status;
            if (totalSum == 0) {
                status = "no-data";
            } else if (failurePct >= 50.0) {
                status = "down";
            } else if (failurePct >= 10.0) {
                status = "degraded";
            } else {
                status = "ok";
            }
            return new RouteSnapshot(totalSum, failSum, failurePct, avg, max, status);
        }
    }
}
