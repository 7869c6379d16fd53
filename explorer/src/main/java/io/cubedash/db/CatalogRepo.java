package io.cubedash.db;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zaxxer.hikari.HikariDataSource;
import io.cubedash.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.*;

/**
 * Read-only queries against the dataset catalog (the ODC index tables).
 */
public class CatalogRepo {
    private static final Logger log = LoggerFactory.getLogger(CatalogRepo.class);

    private final HikariDataSource ds;
    private final ObjectMapper om;
    private final CatalogTables t;

    public CatalogRepo(HikariDataSource ds, ObjectMapper om, CatalogTables tables) {
        this.ds = ds;
        this.om = om;
        this.t = tables;
    }

    /**
     * All products in the catalog, by name.
     */
    public List<CatalogProduct> listProducts() throws Exception {
        String sql = "SELECT p.id, p.name, mt.name AS mt_name, p.definition::text AS definition "
                + "FROM " + t.product() + " p JOIN " + t.metadataType() + " mt ON mt.id = p.metadata_type_ref "
                + "ORDER BY p.name";
        List<CatalogProduct> out = new ArrayList<>();
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(mapProduct(rs));
            }
        }
        return out;
    }

    public Optional<CatalogProduct> productByName(String name) throws Exception {
        String sql = "SELECT p.id, p.name, mt.name AS mt_name, p.definition::text AS definition "
                + "FROM " + t.product() + " p JOIN " + t.metadataType() + " mt ON mt.id = p.metadata_type_ref "
                + "WHERE p.name = ?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapProduct(rs)) : Optional.empty();
            }
        }
    }

    /**
     * Works out whether a product's documents are EO3 or legacy EO, from its
     * metadata type name or else from a sample dataset.
     */
    public DocumentStyle documentStyle(CatalogProduct product) throws Exception {
        if (product.metadataTypeName() != null && product.metadataTypeName().toLowerCase(Locale.ROOT).startsWith("eo3")) {
            return DocumentStyle.EO3;
        }
        String sql = "SELECT coalesce(d.metadata ->> '$schema', '') AS doc_schema, "
                + "(d.metadata -> 'properties') IS NOT NULL AND (d.metadata ->> 'crs') IS NOT NULL AS eo3_shape "
                + "FROM " + t.dataset() + " d WHERE d." + t.datasetProductRef() + " = ? AND d.archived IS NULL LIMIT 1";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, product.id());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next())
                    return DocumentStyle.EO;
                boolean eo3 = rs.getString("doc_schema").contains("eo3") || rs.getBoolean("eo3_shape");
                return eo3 ? DocumentStyle.EO3 : DocumentStyle.EO;
            }
        }
    }

    /**
     * A catalog dataset without its summary-table fields (those are filled in by
     * the caller).
     */
    public Optional<DatasetDetail> dataset(UUID id) throws Exception {
        String sql = "SELECT d.id, p.name, d.metadata::text AS metadata, d.added, d.archived "
                + "FROM " + t.dataset() + " d JOIN " + t.product() + " p ON p.id = d." + t.datasetProductRef() + " "
                + "WHERE d.id = ?";
        String locSql = "SELECT uri_scheme || ':' || uri_body FROM " + t.location() + " "
                + "WHERE dataset_ref = ? AND archived IS NULL ORDER BY added DESC";
        try (Connection c = ds.getConnection()) {
            String productName;
            JsonNode doc;
            Instant added;
            Instant archived;
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setObject(1, id);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next())
                        return Optional.empty();
                    productName = rs.getString("name");
                    doc = om.readTree(rs.getString("metadata"));
                    added = toInstant(rs.getTimestamp("added"));
                    archived = toInstant(rs.getTimestamp("archived"));
                }
            }
            List<String> locations = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(locSql)) {
                ps.setObject(1, id);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next())
                        locations.add(rs.getString(1));
                }
            }
            return Optional.of(new DatasetDetail(id, productName, doc, added, archived, locations, null, null));
        }
    }

    /**
     * Direct source datasets of a dataset, without loading the whole provenance tree.
     */
    public LinkedDatasets datasetSources(UUID id, int limit) throws Exception {
        return linkedDatasets(id, limit, t.lineageSourceRef(), t.lineageDerivedRef());
    }

    /**
     * Datasets directly derived from a dataset.
     */
    public LinkedDatasets datasetsDerived(UUID id, int limit) throws Exception {
        return linkedDatasets(id, limit, t.lineageDerivedRef(), t.lineageSourceRef());
    }

    private LinkedDatasets linkedDatasets(UUID id, int limit, String wantedRef, String givenRef) throws Exception {
        String sql = "SELECT d.id, p.name FROM " + t.lineage() + " l "
                + "JOIN " + t.dataset() + " d ON d.id = l." + wantedRef + " "
                + "JOIN " + t.product() + " p ON p.id = d." + t.datasetProductRef() + " "
                + "WHERE l." + givenRef + " = ? ORDER BY p.name, d.id LIMIT ?";
        String countSql = "SELECT count(*) FROM " + t.lineage() + " l WHERE l." + givenRef + " = ?";
        List<LinkedDatasets.Ref> refs = new ArrayList<>();
        try (Connection c = ds.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setObject(1, id);
                // one extra row tells us whether more exist
                ps.setInt(2, limit + 1);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next())
                        refs.add(new LinkedDatasets.Ref(rs.getObject(1, UUID.class), rs.getString(2)));
                }
            }
            if (refs.size() <= limit)
                return new LinkedDatasets(refs, 0);

            long total;
            try (PreparedStatement ps = c.prepareStatement(countSql)) {
                ps.setObject(1, id);
                try (ResultSet rs = ps.executeQuery()) {
                    total = rs.next() ? rs.getLong(1) : refs.size();
                }
            }
            return new LinkedDatasets(List.copyOf(refs.subList(0, limit)), total - limit);
        }
    }

    /**
     * Datasets added in the {@code period} before the newest addition, grouped
     * by local arrival day and product, newest day first.
     *
     * @throws EmptyCatalogException if the catalog holds no datasets
     */
    public List<ArrivalRow> latestArrivals(Duration period, ZoneId zone) throws Exception {
        Instant latest;
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("SELECT max(added) FROM " + t.dataset());
                ResultSet rs = ps.executeQuery()) {
            latest = rs.next() ? toInstant(rs.getTimestamp(1)) : null;
        }
        if (latest == null)
            throw new EmptyCatalogException();

        String sql = "SELECT (d.added AT TIME ZONE ?)::date AS arrival_date, p.name, count(*) AS n, "
                + "(array_agg(d.id ORDER BY d.added DESC))[1:3] AS sample_ids "
                + "FROM " + t.dataset() + " d JOIN " + t.product() + " p ON p.id = d." + t.datasetProductRef() + " "
                + "WHERE d.added > ? "
                + "GROUP BY arrival_date, p.name ORDER BY arrival_date DESC, p.name";
        List<ArrivalRow> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, zone.getId());
            ps.setTimestamp(2, Timestamp.from(latest.minus(period)));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    List<UUID> ids = new ArrayList<>();
                    Array arr = rs.getArray("sample_ids");
                    if (arr != null) {
                        for (Object o : (Object[]) arr.getArray())
                            ids.add(o instanceof UUID u ? u : UUID.fromString(o.toString()));
                    }
                    out.add(new ArrivalRow(rs.getObject("arrival_date", LocalDate.class), rs.getString("name"),
                            rs.getLong("n"), ids));
                }
            }
        }
        return out;
    }

    /**
     * Ids of products linked to this one through lineage, from a sample of its
     * active datasets. {@code derived=false} finds source products.
     */
    public List<Integer> linkedProducts(int productId, boolean derived, int sampleSize) throws Exception {
        String mine = derived ? t.lineageSourceRef() : t.lineageDerivedRef();
        String theirs = derived ? t.lineageDerivedRef() : t.lineageSourceRef();
        String sql = "WITH sample AS ("
                + "  SELECT id FROM " + t.dataset() + " WHERE " + t.datasetProductRef() + " = ? AND archived IS NULL LIMIT ?"
                + "), linked AS ("
                + "  SELECT DISTINCT l." + theirs + " AS linked_ref FROM " + t.lineage() + " l JOIN sample s ON s.id = l." + mine
                + ") "
                + "SELECT DISTINCT d." + t.datasetProductRef() + " FROM " + t.dataset() + " d "
                + "JOIN linked ON d.id = linked.linked_ref WHERE d.archived IS NULL "
                + "ORDER BY 1";
        List<Integer> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, productId);
            ps.setInt(2, sampleSize);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    out.add(rs.getInt(1));
            }
        }
        return out;
    }

    /**
     * Months (as their first local day) with datasets added, updated or
     * archived after {@code since}.
     */
    public List<LocalDate> outdatedMonths(int productId, DatasetExtentSql ext, Instant since, ZoneId zone)
            throws Exception {
        String sql = "SELECT DISTINCT date_trunc('month', (" + ext.centerTime() + ") AT TIME ZONE ?)::date AS month "
                + "FROM " + t.dataset() + " d WHERE d." + t.datasetProductRef() + " = ? "
                + "AND greatest(d.added, d.updated, d.archived) > ? ORDER BY month";
        List<LocalDate> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, zone.getId());
            ps.setInt(2, productId);
            ps.setTimestamp(3, Timestamp.from(since));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    LocalDate m = rs.getObject("month", LocalDate.class);
                    if (m != null)
                        out.add(m);
                }
            }
        }
        log.debug("outdatedMonths product={} since={} -> {}", productId, since, out.size());
        return out;
    }

    /**
     * Metadata properties that have the same value in every sampled active dataset.
     * Time-like properties are never reported.
     */
    public ObjectNode fixedMetadata(int productId, DocumentStyle style, int sampleSize) throws Exception {
        String props = style == DocumentStyle.EO3
                ? "d.metadata -> 'properties'"
                : "jsonb_strip_nulls(jsonb_build_object("
                        + "'platform', d.metadata #> '{platform,code}', "
                        + "'instrument', d.metadata #> '{instrument,name}', "
                        + "'product_type', d.metadata -> 'product_type', "
                        + "'format', d.metadata #> '{format,name}'))";
        String sql = "WITH sample AS ("
                + "  SELECT " + props + " AS props FROM " + t.dataset() + " d "
                + "  WHERE d." + t.datasetProductRef() + " = ? AND d.archived IS NULL LIMIT ?"
                + "), n AS (SELECT count(*) AS total FROM sample) "
                + "SELECT e.key, min(e.value::text) AS value "
                + "FROM sample CROSS JOIN LATERAL jsonb_each(sample.props) e CROSS JOIN n "
                + "GROUP BY e.key, n.total "
                + "HAVING count(DISTINCT e.value) = 1 AND count(*) = n.total "
                + "ORDER BY e.key";
        ObjectNode out = om.createObjectNode();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, productId);
            ps.setInt(2, sampleSize);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String key = rs.getString("key");
                    if (isTimeLike(key))
                        continue;
                    out.set(key, om.readTree(rs.getString("value")));
                }
            }
        }
        return out;
    }

    /**
     * Search fields declared by a product's metadata type, by name.
     */
    public Map<String, SearchField> searchFields(int productId) throws Exception {
        String sql = "SELECT mt.definition::text FROM " + t.metadataType() + " mt "
                + "JOIN " + t.product() + " p ON p.metadata_type_ref = mt.id WHERE p.id = ?";
        String definition = null;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, productId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next())
                    definition = rs.getString(1);
            }
        }
        Map<String, SearchField> out = new TreeMap<>();
        if (definition == null)
            return out;
        JsonNode fields = om.readTree(definition).path("dataset").path("search_fields");
        fields.fields().forEachRemaining(e -> {
            JsonNode f = e.getValue();
            out.put(e.getKey(), new SearchField(
                    e.getKey(),
                    f.path("type").asText("string"),
                    f.path("description").asText(null),
                    path(f.path("offset")),
                    path(f.path("min_offset").path(0)),
                    path(f.path("max_offset").path(0))));
        });
        return out;
    }

    private static List<String> path(JsonNode node) {
        if (!node.isArray() || node.isEmpty())
            return List.of();
        List<String> out = new ArrayList<>();
        node.forEach(n -> out.add(n.asText()));
        return out;
    }

    private static boolean isTimeLike(String key) {
        return key.endsWith("datetime") || key.endsWith("_dt") || key.equals("created");
    }

    private CatalogProduct mapProduct(ResultSet rs) throws SQLException {
        String def = rs.getString("definition");
        JsonNode definition;
        try {
            definition = def == null ? null : om.readTree(def);
        } catch (Exception e) {
            throw new SQLException("Unreadable product definition for " + rs.getString("name"), e);
        }
        return new CatalogProduct(rs.getInt("id"), rs.getString("name"), rs.getString("mt_name"), definition);
    }

    static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
