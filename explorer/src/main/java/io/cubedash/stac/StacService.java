package io.cubedash.stac;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.cubedash.config.AppConfig;
import io.cubedash.model.DatasetItem;
import io.cubedash.model.DatasetQuery;
import io.cubedash.model.ProductSummary;
import io.cubedash.summary.SummaryStore;
import io.cubedash.summary.TimePeriodOverview;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Builds STAC catalog, collection, item and item-collection documents from the
 * summary store.
 *
 * <p>
 * Collections are summarised products. Items are the datasets of
 * {@code cubedash.dataset_spatial}, with EO3 properties and measurements
 * copied across when the dataset document is loaded.
 * </p>
 */
public class StacService {
    private static final Logger log = LoggerFactory.getLogger(StacService.class);

    public static final String STAC_VERSION = "1.0.0";
    static final double[] WHOLE_WORLD = { -180, -90, 180, 90 };

    private final AppConfig cfg;
    private final ObjectMapper om;
    private final SummaryStore store;

    public StacService(AppConfig cfg, ObjectMapper om, SummaryStore store) {
        this.cfg = cfg;
        this.om = om;
        this.store = store;
    }

    /**
     * The root catalog, linking every collection and the search endpoint.
     */
    public ObjectNode root(String baseUrl) throws Exception {
        String stac = baseUrl + "/stac";
        ObjectNode out = om.createObjectNode();
        out.put("type", "Catalog");
        out.put("stac_version", STAC_VERSION);
        out.putArray("stac_extensions");
        out.put("id", cfg.stacEndpointId());
        out.put("title", cfg.stacEndpointTitle());
        out.put("description", "Datasets of the Open Data Cube catalog, by product");
        ArrayNode conforms = out.putArray("conformsTo");
        conforms.add("https://api.stacspec.org/v1.0.0/core");
        conforms.add("https://api.stacspec.org/v1.0.0/item-search");
        conforms.add("https://api.stacspec.org/v1.0.0/collections");
        ArrayNode links = out.putArray("links");
        link(links, "self", stac, "application/json");
        link(links, "root", stac, "application/json");
        link(links, "data", stac + "/collections", "application/json");
        link(links, "search", stac + "/search", "application/geo+json").put("method", "GET");
        link(links, "search", stac + "/search", "application/geo+json").put("method", "POST");
        for (ProductSummary p : store.listCompleteProducts())
            link(links, "child", stac + "/collections/" + p.name(), "application/json").put("title", p.name());
        return out;
    }

    public ObjectNode collections(String baseUrl) throws Exception {
        String stac = baseUrl + "/stac";
        ObjectNode out = om.createObjectNode();
        ArrayNode collections = out.putArray("collections");
        for (ProductSummary p : store.listCompleteProducts())
            collections.add(collection(baseUrl, p));
        ArrayNode links = out.putArray("links");
        link(links, "self", stac + "/collections", "application/json");
        link(links, "root", stac, "application/json");
        link(links, "parent", stac, "application/json");
        return out;
    }

    public Optional<ObjectNode> collection(String baseUrl, String name) throws Exception {
        Optional<ProductSummary> p = store.getProductSummary(name);
        if (p.isEmpty() || !p.get().hasSummary())
            return Optional.empty();
        return Optional.of(collection(baseUrl, p.get()));
    }

    ObjectNode collection(String baseUrl, ProductSummary p) throws Exception {
        String stac = baseUrl + "/stac";
        ObjectNode out = om.createObjectNode();
        out.put("type", "Collection");
        out.put("stac_version", STAC_VERSION);
        out.putArray("stac_extensions");
        out.put("id", p.name());
        out.put("title", p.name());
        out.put("description", "Datasets of product " + p.name());
        out.put("license", "various");

        ObjectNode extent = out.putObject("extent");
        ArrayNode bbox = extent.putObject("spatial").putArray("bbox").addArray();
        for (double v : productBbox(p.name()))
            bbox.add(v);
        ArrayNode interval = extent.putObject("temporal").putArray("interval").addArray();
        if (p.timeEarliest() == null)
            interval.addNull();
        else
            interval.add(p.timeEarliest().toString());
        if (p.timeLatest() == null)
            interval.addNull();
        else
            interval.add(p.timeLatest().toString());

        ObjectNode props = out.putObject("summaries");
        props.putArray("odc:product").add(p.name());
        if (p.fixedMetadata() != null && p.fixedMetadata().isObject()) {
            p.fixedMetadata().fields().forEachRemaining(e -> props.putArray(e.getKey()).add(e.getValue()));
        }

        ArrayNode links = out.putArray("links");
        String self = stac + "/collections/" + p.name();
        link(links, "self", self, "application/json");
        link(links, "root", stac, "application/json");
        link(links, "parent", stac, "application/json");
        link(links, "items", self + "/items", "application/geo+json");
        for (String source : p.sourceProducts())
            link(links, "derived_from", stac + "/collections/" + source, "application/json");
        return out;
    }

    /**
     * One dataset of a collection, with its document.
     */
    public Optional<ObjectNode> item(String baseUrl, String collection, UUID id) throws Exception {
        DatasetQuery q = new DatasetQuery(List.of(collection), List.of(id), null, null, List.of(), 1, 0, true);
        List<DatasetItem> found = store.searchDatasets(q);
        return found.isEmpty() ? Optional.empty() : Optional.of(item(baseUrl, found.get(0)));
    }

    /**
     * A page of matching items. {@code method} decides how the {@code next}
     * link repeats the search; it is only present when more results exist.
     */
    public ObjectNode search(String baseUrl, String selfPath, StacSearchRequest req, String method) throws Exception {
        DatasetQuery q = req.toDatasetQuery(true);
        List<DatasetItem> items = store.searchDatasets(q);
        long matched = store.countDatasets(q);

        ObjectNode out = om.createObjectNode();
        out.put("type", "FeatureCollection");
        out.put("stac_version", STAC_VERSION);
        out.putArray("stac_extensions");
        ArrayNode features = out.putArray("features");
        for (DatasetItem d : items)
            features.add(item(baseUrl, d));
        out.put("numberMatched", matched);
        out.put("numberReturned", items.size());

        ArrayNode links = out.putArray("links");
        String self = baseUrl + selfPath;
        boolean post = "POST".equalsIgnoreCase(method);
        link(links, "self", post ? self : self + "?" + req.toQueryString(req.offset()), "application/geo+json");
        link(links, "root", baseUrl + "/stac", "application/json");
        int nextOffset = req.offset() + items.size();
        if (!items.isEmpty() && nextOffset < matched) {
            if (post) {
                ObjectNode next = link(links, "next", self, "application/geo+json");
                next.put("method", "POST");
                next.set("body", req.toJson(om, nextOffset));
            } else {
                link(links, "next", self + "?" + req.toQueryString(nextOffset), "application/geo+json")
                        .put("method", "GET");
            }
        }
        log.debug("STAC search {} -> {} of {}", req, items.size(), matched);
        return out;
    }

    ObjectNode item(String baseUrl, DatasetItem d) {
        String stac = baseUrl + "/stac";
        String collectionUrl = stac + "/collections/" + d.productName();
        JsonNode doc = d.metadata();

        ObjectNode out = om.createObjectNode();
        out.put("type", "Feature");
        out.put("stac_version", STAC_VERSION);
        out.putArray("stac_extensions");
        out.put("id", d.id().toString());
        out.put("collection", d.productName());
        if (d.geometry() == null) {
            out.putNull("geometry");
        } else {
            out.set("geometry", d.geometry());
            ArrayNode bbox = out.putArray("bbox");
            for (double v : d.bbox())
                bbox.add(v);
        }

        ObjectNode props = out.putObject("properties");
        if (doc != null && doc.path("properties").isObject())
            props.setAll((ObjectNode) doc.path("properties").deepCopy());
        props.put("datetime", d.centerTime().toString());
        if (d.creationTime() != null)
            props.put("created", d.creationTime().toString());
        else
            props.remove("created");
        props.put("odc:product", d.productName());
        if (d.regionCode() != null)
            props.put("odc:region_code", d.regionCode());
        if (d.sizeBytes() != null)
            props.put("odc:file_size", d.sizeBytes());

        ObjectNode assets = out.putObject("assets");
        if (doc != null && doc.path("measurements").isObject()) {
            doc.path("measurements").fields().forEachRemaining(e -> {
                String path = e.getValue().path("path").asText(null);
                if (path == null)
                    return;
                ObjectNode a = assets.putObject(e.getKey());
                a.put("href", resolve(d.locationUri(), path));
                a.put("title", e.getKey());
                a.putArray("roles").add("data");
            });
        }

        ArrayNode links = out.putArray("links");
        link(links, "self", collectionUrl + "/items/" + d.id(), "application/geo+json");
        link(links, "collection", collectionUrl, "application/json");
        link(links, "parent", collectionUrl, "application/json");
        link(links, "root", stac, "application/json");
        link(links, "odc_dataset", baseUrl + "/dataset/" + d.id(), "application/json");
        if (d.locationUri() != null)
            link(links, "odc_yaml", d.locationUri(), "text/yaml");
        return out;
    }

    /**
     * Measurement paths are relative to the dataset document's location.
     */
    static String resolve(String location, String path) {
        if (location == null || path.contains("://"))
            return path;
        int slash = location.lastIndexOf('/');
        return slash < 0 ? path : location.substring(0, slash + 1) + path;
    }

    private double[] productBbox(String name) throws Exception {
        Optional<TimePeriodOverview> all = store.get(name, null, null, null);
        if (all.isEmpty())
            return WHOLE_WORLD;
        Optional<String> geojson = store.footprintGeoJson(all.get());
        return geojson.isEmpty() ? WHOLE_WORLD : bbox(geojson.get());
    }

    static double[] bbox(String geojson) {
        try {
            Envelope e = new GeoJsonReader().read(geojson).getEnvelopeInternal();
            if (e.isNull())
                return WHOLE_WORLD;
            return new double[] { e.getMinX(), e.getMinY(), e.getMaxX(), e.getMaxY() };
        } catch (ParseException ex) {
            log.warn("Unreadable footprint GeoJSON, using whole-world extent", ex);
            return WHOLE_WORLD;
        }
    }

    private ObjectNode link(ArrayNode links, String rel, String href, String type) {
        ObjectNode l = links.addObject();
        l.put("rel", rel);
        l.put("href", href);
        l.put("type", type);
        return l;
    }
}
