package io.cubedash.summary;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import io.cubedash.config.AppConfig;
import io.cubedash.db.Database;
import io.cubedash.model.*;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Instant;
import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Refreshes a small seeded catalog against a real PostGIS.
 */
@Testcontainers(disabledWithoutDocker = true)
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class SummaryStorePostgisTest {

    @Container
    static final PostgreSQLContainer<?> POSTGIS = new PostgreSQLContainer<>(
            DockerImageName.parse("postgis/postgis:16-3.4").asCompatibleSubstituteFor("postgres"));

    private static HikariDataSource ds;
    private static SummaryStore store;

    @BeforeAll
    static void seed() throws Exception {
        Map<String, String> env = new HashMap<>();
        env.put("POSTGRES_HOSTNAME", POSTGIS.getHost());
        env.put("POSTGRES_PORT", String.valueOf(POSTGIS.getMappedPort(PostgreSQLContainer.POSTGRESQL_PORT)));
        env.put("POSTGRES_DB", POSTGIS.getDatabaseName());
        env.put("POSTGRES_USER", POSTGIS.getUsername());
        env.put("POSTGRES_PASSWORD", POSTGIS.getPassword());
        AppConfig cfg = AppConfig.from(env::get, new Properties());

        ds = Database.createGenDataSource(cfg);
        try (InputStream in = SummaryStorePostgisTest.class.getResourceAsStream("/db/agdc-catalog.sql");
                Connection c = ds.getConnection();
                Statement st = c.createStatement()) {
            st.execute(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
        store = SummaryStore.create(cfg, new ObjectMapper(), ds);
    }

    @AfterAll
    static void close() {
        if (ds != null)
            ds.close();
    }

    @Test
    @Order(1)
    void initCreatesACompatibleSchema() throws Exception {
        assertThat(store.schema().schemaInitialised()).isFalse();

        store.schema().initSchema(4326);
        store.schema().initSchema(4326);

        assertThat(store.schema().schemaInitialised()).isTrue();
        assertThat(store.schema().isCompatible(true)).isTrue();
        assertThat(store.catalogProductNames()).containsExactly("ls8_level1", "ls8_nbar");
    }

    @Test
    @Order(2)
    void firstRefreshSummarisesEveryPeriod() throws Exception {
        RefreshResult r = store.refresh("ls8_nbar", RefreshOptions.incremental());

        assertThat(r.result()).isEqualTo(GenerateResult.CREATED);
        assertThat(r.summary().datasetCount()).isEqualTo(3);

        TimePeriodOverview all = store.get("ls8_nbar", null, null, null).orElseThrow();
        assertThat(all.datasetCount()).isEqualTo(3);
        assertThat(all.sizeBytes()).isEqualTo(6000);
        assertThat(all.regionDatasetCounts()).containsEntry("090084", 2).containsEntry("091084", 1);
        assertThat(all.footprintSrid()).isEqualTo(4326);
        assertThat(all.crses()).containsExactly("EPSG:4326");

        TimePeriodOverview october = store.get("ls8_nbar", 2017, 10, null).orElseThrow();
        assertThat(october.datasetCount()).isEqualTo(2);
        assertThat(october.timelineDatasetCounts()).hasSize(31);
        assertThat(store.get("ls8_nbar", 2018, null, null).orElseThrow().datasetCount()).isEqualTo(1);
        assertThat(store.get("ls8_nbar", 2017, 10, 20).orElseThrow().datasetCount()).isEqualTo(1);
        assertThat(store.footprintGeoJson("ls8_nbar", null, null, null)).isPresent();
    }

    @Test
    @Order(3)
    void productRecordCarriesLineageAndFixedMetadata() throws Exception {
        ProductSummary p = store.getProductSummary("ls8_nbar").orElseThrow();

        assertThat(p.hasSummary()).isTrue();
        assertThat(p.datasetCount()).isEqualTo(3);
        assertThat(p.timeEarliest()).isEqualTo(Instant.parse("2017-10-01T01:00:00Z"));
        assertThat(p.sourceProducts()).containsExactly("ls8_level1");
        assertThat(p.fixedMetadata().path("eo:platform").asText()).isEqualTo("landsat-8");
        assertThat(p.fixedMetadata().has("eo:cloud_cover")).isFalse();
        assertThat(store.listProducts()).extracting(ProductSummary::name).contains("ls8_nbar");
    }

    @Test
    @Order(4)
    void datasetsCanBeSearched() throws Exception {
        TimeRange october = new TimeRange(Instant.parse("2017-10-01T00:00:00Z"),
                Instant.parse("2017-11-01T00:00:00Z"));
        List<DatasetItem> found = store.searchDatasets(DatasetQuery.forProduct("ls8_nbar", october, 10, 0));
        assertThat(found).hasSize(2);

        SearchField cloud = store.searchFields("ls8_nbar").get("cloud_cover");
        DatasetQuery clear = new DatasetQuery(List.of("ls8_nbar"), List.of(), null, null,
                List.of(new FieldFilter(cloud, null, "50")), 10, 0, true);
        List<DatasetItem> clearOnes = store.searchDatasets(clear);
        assertThat(clearOnes).extracting(d -> d.id().toString())
                .containsExactlyInAnyOrder("1d6c736c-23ea-4c5f-a1f4-06b6c6a2c4fd", "3f8e958e-450c-4e71-83b6-28d8e8c4e61f");
        assertThat(store.countDatasets(clear)).isEqualTo(2);

        DatasetQuery east = new DatasetQuery(List.of(), List.of(), new double[] { 131.5, -12.8, 131.9, -12.2 }, null,
                List.of(), 10, 0, false);
        assertThat(store.searchDatasets(east)).extracting(DatasetItem::regionCode).containsExactly("091084");
    }

    @Test
    @Order(5)
    void datasetDetailsAndLineage() throws Exception {
        UUID id = UUID.fromString("1d6c736c-23ea-4c5f-a1f4-06b6c6a2c4fd");

        DatasetDetail d = store.dataset(id).orElseThrow();
        assertThat(d.productName()).isEqualTo("ls8_nbar");
        assertThat(d.locations()).containsExactly("file:///data/ls8/2017/10/ga-metadata.yaml");
        assertThat(d.regionCode()).isEqualTo("090084");
        assertThat(store.datasetSources(id, 20).datasets()).extracting(LinkedDatasets.Ref::productName)
                .containsExactly("ls8_level1");
        assertThat(store.dataset(UUID.randomUUID())).isEmpty();
    }

    @Test
    @Order(6)
    void unchangedCatalogIsNoChanges() throws Exception {
        // move additions out of the incremental scan window
        exec("UPDATE agdc.dataset SET added = '2018-06-01T00:00:00Z'");

        RefreshResult r = store.refresh("ls8_nbar", RefreshOptions.incremental());

        assertThat(r.result()).isEqualTo(GenerateResult.NO_CHANGES);
        assertThat(r.summary().datasetCount()).isEqualTo(3);
        assertThat(store.get("ls8_nbar", null, null, null).orElseThrow().datasetCount()).isEqualTo(3);
        assertThat(store.recentRuns("ls8_nbar", 10)).hasSize(2);
        assertThat(store.refresh("no_such_product", RefreshOptions.incremental()).result())
                .isEqualTo(GenerateResult.ERROR);

        store.schema().refreshStats(false);
        assertThat(store.spatialQualityStats()).isNotEmpty();
    }

    @Test
    @Order(7)
    void archivedDatasetLeavesTheSummaries() throws Exception {
        exec("UPDATE agdc.dataset SET archived = now() WHERE id = '3f8e958e-450c-4e71-83b6-28d8e8c4e61f'");

        RefreshResult r = store.refresh("ls8_nbar", RefreshOptions.incremental());

        assertThat(r.result()).isEqualTo(GenerateResult.UPDATED);
        assertThat(r.summary().datasetCount()).isEqualTo(2);
        assertThat(store.get("ls8_nbar", 2018, 3, null).orElseThrow().datasetCount()).isZero();
        assertThat(store.get("ls8_nbar", 2018, null, null).map(TimePeriodOverview::datasetCount).orElse(0L))
                .isZero();
        assertThat(store.get("ls8_nbar", 2017, 10, null).orElseThrow().datasetCount()).isEqualTo(2);
        assertThat(store.getProductSummary("ls8_nbar").orElseThrow().datasetCount()).isEqualTo(2);
        assertThat(store.searchDatasets(DatasetQuery.forProduct("ls8_nbar", null, 10, 0)))
                .extracting(d -> d.id().toString())
                .doesNotContain("3f8e958e-450c-4e71-83b6-28d8e8c4e61f");
    }

    private static void exec(String sql) throws Exception {
        try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
            st.execute(sql);
        }
    }
}
