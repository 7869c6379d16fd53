package io.cubedash.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cubedash.config.AppConfig;
import io.cubedash.model.DatasetItem;
import io.cubedash.model.EmptyCatalogException;
import io.cubedash.model.NoSummariesException;
import io.cubedash.model.ProductSummary;
import io.cubedash.summary.SummaryStore;
import io.cubedash.summary.TimePeriodOverview;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class ApiServerTest {
    private final ObjectMapper om = new ObjectMapper();
    private final HttpClient http = HttpClient.newHttpClient();
    private SummaryStore store;
    private ApiServer server;

    private static final ProductSummary LS8 = new ProductSummary(1, "ls8_nbar", 2,
            Instant.parse("2017-10-01T00:00:00Z"), Instant.parse("2017-10-02T00:00:00Z"), List.of(), List.of(),
            null, Instant.parse("2020-01-01T00:00:00Z"), Instant.parse("2020-01-01T00:00:00Z"));

    @BeforeEach
    void setUp() {
        store = mock(SummaryStore.class);
        when(store.zone()).thenReturn(ZoneId.of("UTC"));
        AppConfig cfg = AppConfig.from(Map.of("CUBEDASH_BASE_URL", "")::get, new Properties());
        server = new ApiServer(cfg, om, null, store);
        server.start(0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private HttpResponse<String> get(String path, String... headers) throws Exception {
        HttpRequest.Builder b = HttpRequest.newBuilder(URI.create("http://localhost:" + server.port() + path));
        for (int i = 0; i + 1 < headers.length; i += 2)
            b.header(headers[i], headers[i + 1]);
        return http.send(b.GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void unknownProductIsNotFound() throws Exception {
        when(store.getProductSummary("nope")).thenReturn(Optional.empty());

        HttpResponse<String> res = get("/products/nope/2017");

        assertThat(res.statusCode()).isEqualTo(404);
        assertThat(om.readTree(res.body()).path("error").asText()).isEqualTo("not_found");
    }

    @Test
    void badPeriodIsBadRequest() throws Exception {
        HttpResponse<String> res = get("/products/ls8_nbar/2017/13");

        assertThat(res.statusCode()).isEqualTo(400);
        verify(store, never()).get(any(), any(), any(), any());
    }

    @Test
    void productSummaryForAMonth() throws Exception {
        when(store.getProductSummary("ls8_nbar")).thenReturn(Optional.of(LS8));
        when(store.get("ls8_nbar", 2017, 10, null)).thenReturn(Optional.of(TimePeriodOverview.empty()));

        HttpResponse<String> res = get("/products/ls8_nbar/2017/10");

        assertThat(res.statusCode()).isEqualTo(200);
        JsonNode body = om.readTree(res.body());
        assertThat(body.path("product").path("name").asText()).isEqualTo("ls8_nbar");
        assertThat(body.path("period").path("month").asInt()).isEqualTo(10);
        assertThat(body.path("summary").path("dataset_count").asLong()).isZero();
    }

    @Test
    void noSummariesIsServiceUnavailable() throws Exception {
        when(store.listProducts()).thenThrow(new NoSummariesException());

        HttpResponse<String> res = get("/products");

        assertThat(res.statusCode()).isEqualTo(503);
        assertThat(om.readTree(res.body()).path("error").asText()).isEqualTo("no_summaries");
    }

    @Test
    void productListIsCachedWithEtag() throws Exception {
        when(store.listProducts()).thenReturn(List.of(LS8));

        HttpResponse<String> first = get("/products");
        String etag = first.headers().firstValue("ETag").orElseThrow();
        HttpResponse<String> second = get("/products", "If-None-Match", etag);

        assertThat(first.statusCode()).isEqualTo(200);
        assertThat(first.headers().firstValue("Cache-Control")).hasValue("public, max-age=60, stale-while-revalidate=120");
        assertThat(om.readTree(first.body()).path("products").get(0).path("name").asText()).isEqualTo("ls8_nbar");
        assertThat(second.statusCode()).isEqualTo(304);
        verify(store, times(1)).listProducts();
    }

    @Test
    void stacLimitAboveTheHardLimitIsRejected() throws Exception {
        HttpResponse<String> res = get("/stac/search?limit=5000");

        assertThat(res.statusCode()).isEqualTo(400);
        assertThat(om.readTree(res.body()).path("message").asText()).contains("Max page size");
        verify(store, never()).searchDatasets(any());
    }

    @Test
    void stacSearchReturnsFeatureCollection() throws Exception {
        DatasetItem d = new DatasetItem(UUID.fromString("0c5b625b-12d9-4b4e-90e3-f5a5b5f1b3ec"), "ls8_nbar",
                Instant.parse("2017-10-01T00:00:00Z"), null, null, null, null, null, null, null);
        when(store.searchDatasets(any())).thenReturn(List.of(d));
        when(store.countDatasets(any())).thenReturn(1L);

        HttpResponse<String> res = get("/stac/search?collections=ls8_nbar");

        assertThat(res.statusCode()).isEqualTo(200);
        assertThat(res.headers().firstValue("Content-Type").orElse("")).startsWith("application/geo+json");
        JsonNode body = om.readTree(res.body());
        assertThat(body.path("type").asText()).isEqualTo("FeatureCollection");
        assertThat(body.path("features").get(0).path("id").asText()).isEqualTo(d.id().toString());
        assertThat(body.path("features").get(0).path("links").get(0).path("href").asText())
                .startsWith("http://localhost:" + server.port() + "/stac/collections/ls8_nbar/items/");
    }

    @Test
    void malformedDatasetIdIsBadRequest() throws Exception {
        assertThat(get("/dataset/not-a-uuid").statusCode()).isEqualTo(400);
        verify(store, never()).dataset(any());
    }

    @Test
    void datasetListingChecksTheProduct() throws Exception {
        when(store.getProductSummary("ls8_nbar")).thenReturn(Optional.of(LS8));
        when(store.searchFields("ls8_nbar")).thenReturn(Map.of());
        when(store.searchDatasets(any())).thenReturn(List.of());

        HttpResponse<String> res = get("/products/ls8_nbar/datasets?time-begin=2017-10-01&limit=10");

        assertThat(res.statusCode()).isEqualTo(200);
        JsonNode body = om.readTree(res.body());
        assertThat(body.path("time").path("begin").asText()).isEqualTo("2017-10-01T00:00:00Z");
        assertThat(body.path("limit").asInt()).isEqualTo(10);
        assertThat(body.path("has_more").asBoolean()).isFalse();
        verify(store, never()).get(eq("ls8_nbar"), isNull(), isNull(), isNull());
    }

    @Test
    void arrivalsOnAnEmptyCatalogIsAnEmptyList() throws Exception {
        when(store.latestArrivals(any())).thenThrow(new EmptyCatalogException());

        HttpResponse<String> res = get("/arrivals");

        assertThat(res.statusCode()).isEqualTo(200);
        JsonNode body = om.readTree(res.body());
        assertThat(body.path("arrivals").isArray()).isTrue();
        assertThat(body.path("arrivals").size()).isZero();
        assertThat(body.path("empty_catalog").asBoolean()).isTrue();
        assertThat(body.path("period_days").asInt()).isEqualTo(14);
    }

    @Test
    void arrivalDaysAreClamped() throws Exception {
        when(store.latestArrivals(any())).thenReturn(List.of());

        HttpResponse<String> res = get("/arrivals?days=1000");

        assertThat(res.statusCode()).isEqualTo(200);
        assertThat(om.readTree(res.body()).path("period_days").asInt()).isEqualTo(365);
        verify(store).latestArrivals(Duration.ofDays(365));
    }
}
