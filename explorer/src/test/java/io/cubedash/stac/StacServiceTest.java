package io.cubedash.stac;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.cubedash.config.AppConfig;
import io.cubedash.model.DatasetItem;
import io.cubedash.model.DatasetQuery;
import io.cubedash.model.ProductSummary;
import io.cubedash.summary.SummaryStore;
import io.cubedash.summary.TimePeriodOverview;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.InputStream;
import java.time.Instant;
import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StacServiceTest {
    private static final String BASE = "http://explorer.test";

    private final ObjectMapper om = new ObjectMapper();
    private SummaryStore store;
    private StacService stac;

    @BeforeEach
    void setUp() {
        store = mock(SummaryStore.class);
        stac = new StacService(AppConfig.from(Map.<String, String>of()::get, new Properties()), om, store);
    }

    private static JsonSchema schema(String name) throws Exception {
        try (InputStream in = StacServiceTest.class.getResourceAsStream("/stac/" + name)) {
            return JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7).getSchema(in);
        }
    }

    private DatasetItem dataset(String id) throws Exception {
        JsonNode geometry = om.readTree("{\"type\":\"Polygon\",\"coordinates\":"
                + "[[[130,-13],[131,-13],[131,-12],[130,-12],[130,-13]]]}");
        JsonNode doc = om.readTree("{\"properties\":{\"eo:platform\":\"landsat-8\",\"created\":\"old\"},"
                + "\"measurements\":{\"blue\":{\"path\":\"band2.tif\"},"
                + "\"red\":{\"path\":\"s3://bucket/other/band4.tif\"}}}");
        return new DatasetItem(UUID.fromString(id), "ls8_nbar", Instant.parse("2017-10-01T01:02:03Z"),
                Instant.parse("2017-11-01T00:00:00Z"), "090084", 1234L, geometry,
                new double[] { 130, -13, 131, -12 }, doc, "file:///data/ls8/2017/ga-metadata.yaml");
    }

    @Test
    void searchPageIsValidStacWithNextLink() throws Exception {
        List<DatasetItem> page = List.of(dataset("0c5b625b-12d9-4b4e-90e3-f5a5b5f1b3ec"),
                dataset("1d6c736c-23ea-4c5f-a1f4-06b6c6a2c4fd"));
        when(store.searchDatasets(any())).thenReturn(page);
        when(store.countDatasets(any())).thenReturn(3L);
        StacSearchRequest req = StacSearchRequest.fromQuery(Map.of("collections", List.of("ls8_nbar"),
                "limit", List.of("2")), 500, 4000);

        ObjectNode out = stac.search(BASE, "/stac/search", req, "GET");

        Set<ValidationMessage> errors = schema("itemcollection.json").validate(out);
        assertThat(errors).isEmpty();
        JsonSchema item = schema("item.json");
        for (JsonNode f : out.path("features"))
            assertThat(item.validate(f)).isEmpty();

        assertThat(out.path("numberMatched").asLong()).isEqualTo(3);
        assertThat(out.path("numberReturned").asInt()).isEqualTo(2);
        assertThat(link(out, "next").path("href").asText())
                .isEqualTo(BASE + "/stac/search?collections=ls8_nbar&limit=2&offset=2");

        ArgumentCaptor<DatasetQuery> q = ArgumentCaptor.forClass(DatasetQuery.class);
        verify(store).searchDatasets(q.capture());
        assertThat(q.getValue().includeDocs()).isTrue();
        assertThat(q.getValue().limit()).isEqualTo(2);
    }

    @Test
    void lastPageHasNoNextLink() throws Exception {
        when(store.searchDatasets(any())).thenReturn(List.of(dataset("0c5b625b-12d9-4b4e-90e3-f5a5b5f1b3ec")));
        when(store.countDatasets(any())).thenReturn(1L);

        ObjectNode out = stac.search(BASE, "/stac/search", StacSearchRequest.fromQuery(Map.of(), 500, 4000), "GET");

        assertThat(link(out, "next").isMissingNode()).isTrue();
    }

    @Test
    void postSearchRepeatsItsBody() throws Exception {
        when(store.searchDatasets(any())).thenReturn(List.of(dataset("0c5b625b-12d9-4b4e-90e3-f5a5b5f1b3ec")));
        when(store.countDatasets(any())).thenReturn(5L);
        StacSearchRequest req = StacSearchRequest.fromJson(om.readTree("{\"limit\":1,\"offset\":2}"), 500, 4000);

        ObjectNode out = stac.search(BASE, "/stac/search", req, "POST");

        JsonNode next = link(out, "next");
        assertThat(next.path("method").asText()).isEqualTo("POST");
        assertThat(next.path("href").asText()).isEqualTo(BASE + "/stac/search");
        assertThat(next.path("body").path("offset").asInt()).isEqualTo(3);
        assertThat(schema("itemcollection.json").validate(out)).isEmpty();
    }

    @Test
    void itemCarriesDocumentPropertiesAndAssets() throws Exception {
        ObjectNode item = stac.item(BASE, dataset("0c5b625b-12d9-4b4e-90e3-f5a5b5f1b3ec"));

        JsonNode props = item.path("properties");
        assertThat(props.path("datetime").asText()).isEqualTo("2017-10-01T01:02:03Z");
        assertThat(props.path("created").asText()).isEqualTo("2017-11-01T00:00:00Z");
        assertThat(props.path("eo:platform").asText()).isEqualTo("landsat-8");
        assertThat(props.path("odc:region_code").asText()).isEqualTo("090084");
        assertThat(item.path("assets").path("blue").path("href").asText())
                .isEqualTo("file:///data/ls8/2017/band2.tif");
        assertThat(item.path("assets").path("red").path("href").asText())
                .isEqualTo("s3://bucket/other/band4.tif");
        assertThat(link(item, "self").path("href").asText())
                .isEqualTo(BASE + "/stac/collections/ls8_nbar/items/0c5b625b-12d9-4b4e-90e3-f5a5b5f1b3ec");
    }

    @Test
    void itemWithoutGeometryIsStillValid() throws Exception {
        DatasetItem bare = new DatasetItem(UUID.fromString("0c5b625b-12d9-4b4e-90e3-f5a5b5f1b3ec"), "ls8_nbar",
                Instant.parse("2017-10-01T00:00:00Z"), null, null, null, null, null, null, null);

        ObjectNode item = stac.item(BASE, bare);

        assertThat(item.path("geometry").isNull()).isTrue();
        assertThat(item.has("bbox")).isFalse();
        assertThat(schema("item.json").validate(item)).isEmpty();
    }

    @Test
    void collectionExtentComesFromTheFootprint() throws Exception {
        ProductSummary p = new ProductSummary(1, "ls8_nbar", 10, Instant.parse("2017-01-01T00:00:00Z"),
                Instant.parse("2017-12-31T00:00:00Z"), List.of("ls8_level1"), List.of(),
                om.readTree("{\"platform\":\"landsat-8\"}"), Instant.now(), Instant.now());
        TimePeriodOverview all = TimePeriodOverview.empty();
        when(store.getProductSummary("ls8_nbar")).thenReturn(Optional.of(p));
        when(store.get(eq("ls8_nbar"), isNull(), isNull(), isNull())).thenReturn(Optional.of(all));
        when(store.footprintGeoJson(all)).thenReturn(Optional.of(
                "{\"type\":\"Polygon\",\"coordinates\":[[[130,-13],[132,-13],[132,-11],[130,-11],[130,-13]]]}"));

        JsonNode c = stac.collection(BASE, "ls8_nbar").orElseThrow();

        assertThat(c.path("type").asText()).isEqualTo("Collection");
        JsonNode bbox = c.path("extent").path("spatial").path("bbox").get(0);
        assertThat(bbox.get(0).asDouble()).isEqualTo(130);
        assertThat(bbox.get(3).asDouble()).isEqualTo(-11);
        assertThat(c.path("summaries").path("platform").get(0).asText()).isEqualTo("landsat-8");
        assertThat(link(c, "derived_from").path("href").asText())
                .isEqualTo(BASE + "/stac/collections/ls8_level1");
    }

    @Test
    void unsummarisedProductHasNoCollection() throws Exception {
        ProductSummary p = new ProductSummary(1, "ls8_nbar", 0, null, null, List.of(), List.of(), null, null, null);
        when(store.getProductSummary("ls8_nbar")).thenReturn(Optional.of(p));
        when(store.getProductSummary("nope")).thenReturn(Optional.empty());

        assertThat(stac.collection(BASE, "ls8_nbar")).isEmpty();
        assertThat(stac.collection(BASE, "nope")).isEmpty();
    }

    private static JsonNode link(JsonNode doc, String rel) {
        for (JsonNode l : doc.path("links")) {
            if (l.path("rel").asText().equals(rel))
                return l;
        }
        return com.fasterxml.jackson.databind.node.MissingNode.getInstance();
    }
}
