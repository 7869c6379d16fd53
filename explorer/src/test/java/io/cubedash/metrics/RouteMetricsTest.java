package io.cubedash.metrics;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RouteMetricsTest {

    @AfterEach
    void clear() {
        RouteMetrics.reset();
    }

    @Test
    void countsRequestsAndServerErrors() {
        RouteMetrics.record("GET /products", 200, 10);
        RouteMetrics.record("GET /products", 404, 30);
        RouteMetrics.record("GET /products", 500, 50);

        RouteMetrics.RouteSnapshot s = RouteMetrics.snapshot().get("GET /products");

        assertThat(s.requests()).isEqualTo(3);
        assertThat(s.failures()).isEqualTo(1);
        assertThat(s.avgMillis()).isEqualTo(30.0);
        assertThat(s.maxMillis()).isEqualTo(50);
        assertThat(s.status()).isEqualTo("degraded");
    }

    @Test
    void mostlyFailingRouteIsDown() {
        RouteMetrics.record("GET /stac/search", 503, 1);
        RouteMetrics.record("GET /stac/search", 200, 1);

        assertThat(RouteMetrics.snapshot().get("GET /stac/search").status()).isEqualTo("down");
    }

    @Test
    void blankRoutesAreIgnoredAndSnapshotIsSorted() {
        RouteMetrics.record(" ", 200, 1);
        RouteMetrics.record("GET /b", 200, -5);
        RouteMetrics.record("GET /a", 200, 2);

        assertThat(RouteMetrics.snapshot()).containsOnlyKeys("GET /a", "GET /b");
        assertThat(RouteMetrics.snapshot().keySet()).containsExactly("GET /a", "GET /b");
        assertThat(RouteMetrics.snapshot().get("GET /b").maxMillis()).isZero();
    }
}
