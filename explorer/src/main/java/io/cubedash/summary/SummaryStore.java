package io.cubedash.summary;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zaxxer.hikari.HikariDataSource;
import io.cubedash.config.AppConfig;
import io.cubedash.db.*;
import io.cubedash.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.*;

/**
 * Keeps the summary tables in step with the catalog, and answers summary
 * queries from them.
 */
public class SummaryStore {
    private static final Logger log = LoggerFactory.getLogger(SummaryStore.class);

    /** Datasets sampled when looking for linked products and fixed metadata. */
    static final int LINEAGE_SAMPLE_SIZE = 1000;

    private final AppConfig cfg;
    private final ObjectMapper om;
    private final SchemaRepo schema;
    private final CatalogRepo catalog;
    private final DatasetSpatialRepo spatial;
    private final TimeOverviewRepo overviews;
    private final ProductRepo products;
    private final RegionRepo regions;
    private final RefreshLogRepo refreshLog;
    private final Summariser summariser;

    public SummaryStore(AppConfig cfg, ObjectMapper om, SchemaRepo schema, CatalogRepo catalog,
            DatasetSpatialRepo spatial, TimeOverviewRepo overviews, ProductRepo products, RegionRepo regions,
            RefreshLogRepo refreshLog, Summariser summariser) {
        this.cfg = cfg;
        this.om = om;
        this.schema = schema;
        this.catalog = catalog;
        this.spatial = spatial;
        this.overviews = overviews;
        this.products = products;
        this.regions = regions;
        this.refreshLog = refreshLog;
        this.summariser = summariser;
    }

    /**
     * Wires a store and its repos onto one connection pool.
     */
    public static SummaryStore create(AppConfig cfg, ObjectMapper om, HikariDataSource ds) {
        CatalogTables tables = CatalogTables.forDriver(cfg.indexDriver());
        SchemaRepo schema = new SchemaRepo(ds, tables);
        return new SummaryStore(cfg, om, schema,
                new CatalogRepo(ds, om, tables),
                new DatasetSpatialRepo(ds, om, tables),
                new TimeOverviewRepo(ds),
                new ProductRepo(ds, om, tables),
                new RegionRepo(ds, om),
                new RefreshLogRepo(ds),
                new Summariser(ds, schema, cfg.groupingZone(), cfg.groupingEpsg()));
    }

    public ZoneId zone() {
        return summariser.zone();
    }

    public SchemaRepo schema() {
        return schema;
    }

    // --------------------------------------------------------------------
    // Refresh
    // --------------------------------------------------------------------

    /**
     * Names of every product in the catalog.
     */
    public List<String> catalogProductNames() throws Exception {
        List<String> out = new ArrayList<>();
        for (CatalogProduct p : catalog.listProducts())
            out.add(p.name());
        return out;
    }

    /**
     * Brings one product's summaries up to date with the catalog. Failures are
     * logged and reported as {@link GenerateResult#ERROR}, never thrown.
     */
    public RefreshResult refresh(String productName, RefreshOptions opts) {
        MDC.put("product", productName);
        UUID runId = null;
        try {
            Optional<CatalogProduct> found = catalog.productByName(productName);
            if (found.isEmpty()) {
                log.error("Unknown product {}", productName);
                return new RefreshResult(productName, GenerateResult.ERROR, null);
            }
            runId = refreshLog.startRun("refresh", productName);
            MDC.put("runId", runId.toString());

            RefreshResult result = doRefresh(found.get(), opts);
            refreshLog.finishRun(runId, true, result.result().name() + " datasets="
                    + (result.summary() == null ? 0 : result.summary().datasetCount()));
            return result;
        } catch (Exception e) {
            log.error("Refresh failed for {}", productName, e);
            if (runId != null) {
                try {
                    refreshLog.finishRun(runId, false, e.getClass().getSimpleName() + ": " + e.getMessage());
                } catch (Exception logFailure) {
                    log.warn("Could not record failed run {}", runId, logFailure);
                }
            }
            return new RefreshResult(productName, GenerateResult.ERROR, null);
        } finally {
            MDC.remove("runId");
            MDC.remove("product");
        }
    }

    private RefreshResult doRefresh(CatalogProduct product, RefreshOptions opts) throws Exception {
        int id = product.id();
        Instant refreshStart = Instant.now();
        ZoneId zone = zone();
        Duration window = opts.minimumScanWindow() != null ? opts.minimumScanWindow() : cfg.minScanWindow();

        Optional<ProductSummary> previous = products.upsertProductRecord(product);
        if (opts.resetIncrementalPosition()) {
            products.resetRefreshPosition(id);
        }
        boolean firstRun = previous.isEmpty() || !previous.get().hasSummary();
        Instant lastRefresh = opts.resetIncrementalPosition() ? null
                : previous.map(ProductSummary::lastRefreshTime).orElse(null);
        boolean fullScan = opts.forceRefresh() || opts.recreateDatasetExtents() || firstRun || lastRefresh == null;
        Instant scanFrom = fullScan ? null : lastRefresh.minus(window);

        DocumentStyle style = catalog.documentStyle(product);
        DatasetExtentSql ext = new DatasetExtentSql(style, defaultCrs(product));
        log.info("Refreshing {} ({} documents, {})", product.name(), style,
                fullScan ? "full scan" : "changes since " + scanFrom);

        if (opts.forceRefresh()) {
            int dropped = overviews.deleteProduct(id);
            log.debug("{}: cleared {} stored periods", product.name(), dropped);
        }

        // 1. dataset extents
        int changed = spatial.upsertDatasets(id, ext, scanFrom);
        int deleted = spatial.deleteDatasets(id, scanFrom, fullScan);
        log.info("{}: {} extents updated, {} removed", product.name(), changed, deleted);

        // 2. regions
        if (changed > 0 || deleted > 0 || fullScan) {
            int written = regions.upsertProductRegions(id);
            int emptied = regions.deleteEmptyRegions(id);
            log.debug("{}: {} regions written, {} emptied", product.name(), written, emptied);
        }

        // 3. months
        DatasetSpatialRepo.ProductExtent extent = spatial.productExtent(id);
        SortedSet<LocalDate> storedMonths = overviews.alreadySummarised(id, PeriodType.MONTH);
        SortedSet<LocalDate> extentMonths = new TreeSet<>();
        for (YearMonth m : Periods.monthsBetween(extent.earliest(), extent.latest(), zone))
            extentMonths.add(m.atDay(1));

        SortedSet<LocalDate> months = new TreeSet<>();
        if (opts.forceRefresh() || opts.recreateDatasetExtents() || firstRun) {
            // every extent may have moved
            months.addAll(extentMonths);
        } else {
            Instant since = previous.get().lastSuccessfulSummaryTime().minus(window);
            months.addAll(catalog.outdatedMonths(id, ext, since, zone));
            for (LocalDate m : extentMonths) {
                if (!storedMonths.contains(m))
                    months.add(m);
            }
        }
        if (deleted > 0 || fullScan) {
            // months whose datasets have all gone
            for (LocalDate m : storedMonths) {
                if (!extentMonths.contains(m))
                    months.add(m);
            }
        }

        List<LocalDate> outdatedYears = firstRun ? List.of() : overviews.outdatedYears(id);
        if (!firstRun && !opts.forceRefresh() && changed == 0 && deleted == 0 && months.isEmpty()
                && outdatedYears.isEmpty()) {
            products.updateLastRefresh(id, refreshStart);
            log.info("{}: no changes", product.name());
            return new RefreshResult(product.name(), GenerateResult.NO_CHANGES,
                    overviews.get(id, Periods.ALL_START_DAY, PeriodType.ALL).orElse(null));
        }

        for (LocalDate m : months) {
            TimePeriodOverview s = summariser.calculate(id, Periods.monthRange(zone, YearMonth.from(m)))
                    .withProductRefreshTime(refreshStart);
            overviews.put(id, m, PeriodType.MONTH, s);
        }
        log.info("{}: {} months summarised", product.name(), months.size());

        // 4. years, then everything
        SortedSet<Integer> years = new TreeSet<>();
        months.forEach(m -> years.add(m.getYear()));
        outdatedYears.forEach(y -> years.add(y.getYear()));
        SortedSet<LocalDate> storedYears = overviews.alreadySummarised(id, PeriodType.YEAR);
        SortedSet<LocalDate> allMonths = overviews.alreadySummarised(id, PeriodType.MONTH);
        for (LocalDate m : allMonths) {
            if (!storedYears.contains(LocalDate.of(m.getYear(), 1, 1)))
                years.add(m.getYear());
        }
        for (int year : years) {
            List<TimePeriodOverview> children = new ArrayList<>();
            for (LocalDate m : allMonths) {
                if (m.getYear() == year)
                    overviews.get(id, m, PeriodType.MONTH).ifPresent(children::add);
            }
            overviews.put(id, LocalDate.of(year, 1, 1), PeriodType.YEAR,
                    TimePeriodOverview.combine(children).withProductRefreshTime(refreshStart));
        }

        List<TimePeriodOverview> yearSummaries = new ArrayList<>();
        for (LocalDate y : overviews.alreadySummarised(id, PeriodType.YEAR))
            overviews.get(id, y, PeriodType.YEAR).ifPresent(yearSummaries::add);
        TimePeriodOverview all = TimePeriodOverview.combine(yearSummaries).withProductRefreshTime(refreshStart);
        overviews.put(id, Periods.ALL_START_DAY, PeriodType.ALL, all);

        // 5. product-wide fields
        List<Integer> sources = catalog.linkedProducts(id, false, LINEAGE_SAMPLE_SIZE);
        List<Integer> derived = catalog.linkedProducts(id, true, LINEAGE_SAMPLE_SIZE);
        ObjectNode fixed = catalog.fixedMetadata(id, style, LINEAGE_SAMPLE_SIZE);
        products.updateProductFields(id, extent.count(), extent.earliest(), extent.latest(), sources, derived, fixed,
                refreshStart);
        products.updateRefreshTimestamp(id, refreshStart);

        GenerateResult result = firstRun ? GenerateResult.CREATED : GenerateResult.UPDATED;
        log.info("{}: {} ({} datasets, {} years)", product.name(), result, all.datasetCount(), years.size());
        return new RefreshResult(product.name(), result, all);
    }

    /**
     * CRS assumed for documents that give none: the product's storage CRS, if declared.
     */
    static String defaultCrs(CatalogProduct product) {
        if (product.definition() == null)
            return null;
        String crs = product.definition().path("storage").path("crs").asText(null);
        return crs != null && crs.matches(DatasetExtentSql.AUTH_CODE_PATTERN) ? crs : null;
    }

    // --------------------------------------------------------------------
    // Reads
    // --------------------------------------------------------------------

    /**
     * The summary of a product over all time, a year, a month or a day. Day
     * summaries are calculated on demand.
     */
    public Optional<TimePeriodOverview> get(String productName, Integer year, Integer month, Integer day)
            throws Exception {
        Optional<ProductSummary> product = products.get(productName);
        if (product.isEmpty())
            return Optional.empty();
        int id = product.get().id();
        PeriodType type = Periods.typeOf(year, month, day);
        return switch (type) {
            case ALL -> overviews.get(id, Periods.ALL_START_DAY, PeriodType.ALL);
            case YEAR -> overviews.get(id, LocalDate.of(year, 1, 1), PeriodType.YEAR);
            case MONTH -> overviews.get(id, LocalDate.of(year, month, 1), PeriodType.MONTH);
            case DAY -> Optional.of(summariser.calculate(id, Periods.range(zone(), year, month, day)));
        };
    }

    public Optional<ProductSummary> getProductSummary(String productName) throws Exception {
        return products.get(productName);
    }

    /**
     * Every summarised product.
     *
     * @throws NoSummariesException when the catalog has products but none is summarised
     */
    public List<ProductSummary> listProducts() throws Exception {
        List<ProductSummary> complete = listCompleteProducts();
        if (complete.isEmpty() && !catalog.listProducts().isEmpty())
            throw new NoSummariesException();
        return complete;
    }

    /**
     * Products that have had at least one successful summary.
     */
    public List<ProductSummary> listCompleteProducts() throws Exception {
        List<ProductSummary> out = new ArrayList<>();
        for (ProductSummary p : products.list()) {
            if (p.hasSummary())
                out.add(p);
        }
        return out;
    }

    public List<TimeOverviewRepo.PeriodCount> getAllDatasetCounts() throws Exception {
        return overviews.datasetCountsPerPeriod();
    }

    /**
     * GeoJSON geometry (EPSG:4326) of a period's footprint.
     */
    public Optional<String> footprintGeoJson(String productName, Integer year, Integer month, Integer day)
            throws Exception {
        Optional<TimePeriodOverview> s = get(productName, year, month, day);
        return s.isEmpty() ? Optional.empty() : footprintGeoJson(s.get());
    }

    public Optional<String> footprintGeoJson(TimePeriodOverview s) throws Exception {
        if (!s.hasFootprint())
            return Optional.empty();
        return Optional.ofNullable(schema.toWgs84GeoJson(s.footprintGeometry(), s.footprintSrid()));
    }

    /**
     * Region footprints with the period's dataset counts, as a FeatureCollection.
     * Null when the period has no regions, or its only region is "none".
     */
    public ObjectNode regionsGeoJson(String productName, Integer year, Integer month, Integer day) throws Exception {
        Optional<ProductSummary> product = products.get(productName);
        Optional<TimePeriodOverview> s = get(productName, year, month, day);
        if (product.isEmpty() || s.isEmpty())
            return null;
        Map<String, Integer> counts = s.get().regionDatasetCounts();
        if (counts.isEmpty() || (counts.size() == 1 && counts.containsKey(null)))
            return null;

        ObjectNode fc = om.createObjectNode();
        fc.put("type", "FeatureCollection");
        ArrayNode features = fc.putArray("features");
        for (RegionSummary r : regions.productRegions(product.get().id())) {
            if (r.regionCode().isEmpty())
                continue;
            Integer count = counts.get(r.regionCode());
            if (count == null || count == 0)
                continue;
            ObjectNode f = features.addObject();
            f.put("type", "Feature");
            f.set("geometry", r.footprint());
            ObjectNode props = f.putObject("properties");
            props.put("region_code", r.regionCode());
            props.put("count", count);
        }
        return fc;
    }

    public List<ArrivalRow> latestArrivals(Duration period) throws Exception {
        return catalog.latestArrivals(period, zone());
    }

    /** How long one product's day query took. */
    public record DayQueryTime(String productName, long datasetCount, double seconds) {
    }

    /**
     * Times a day summary for the newest day of every summarised product.
     */
    public List<DayQueryTime> dayQueryTimes() throws Exception {
        List<DayQueryTime> out = new ArrayList<>();
        for (ProductSummary p : listCompleteProducts()) {
            if (p.timeLatest() == null)
                continue;
            LocalDate day = p.timeLatest().atZone(zone()).toLocalDate();
            long t0 = System.nanoTime();
            TimePeriodOverview s = summariser.calculate(p.id(),
                    Periods.range(zone(), day.getYear(), day.getMonthValue(), day.getDayOfMonth()));
            double seconds = (System.nanoTime() - t0) / 1e9;
            out.add(new DayQueryTime(p.name(), s.datasetCount(), seconds));
        }
        return out;
    }

    // --------------------------------------------------------------------
    // Datasets
    // --------------------------------------------------------------------

    public List<DatasetItem> searchDatasets(DatasetQuery q) throws Exception {
        return spatial.searchItems(q);
    }

    public long countDatasets(DatasetQuery q) throws Exception {
        return spatial.countItems(q);
    }

    /**
     * Search fields of a summarised product, or empty when unknown.
     */
    public Map<String, SearchField> searchFields(String productName) throws Exception {
        Optional<ProductSummary> p = products.get(productName);
        return p.isEmpty() ? Map.of() : catalog.searchFields(p.get().id());
    }

    public List<DatasetItem> datasetsByRegion(String productName, String regionCode, TimeRange time, int limit,
            int offset) throws Exception {
        Optional<ProductSummary> p = products.get(productName);
        if (p.isEmpty())
            return List.of();
        return spatial.datasetsByRegion(p.get().id(), regionCode, time, limit, offset);
    }

    public List<String> productsByRegion(String regionCode, int limit, int offset) throws Exception {
        return spatial.productsByRegion(regionCode, limit, offset);
    }

    /**
     * A catalog dataset with its footprint and region from the spatial table.
     */
    public Optional<DatasetDetail> dataset(UUID id) throws Exception {
        Optional<DatasetDetail> d = catalog.dataset(id);
        if (d.isEmpty())
            return d;
        Optional<DatasetSpatialRepo.FootprintRegion> fr = spatial.datasetFootprintRegion(id);
        DatasetDetail base = d.get();
        return Optional.of(new DatasetDetail(base.id(), base.productName(), base.metadata(), base.added(),
                base.archived(), base.locations(),
                fr.map(DatasetSpatialRepo.FootprintRegion::footprint).orElse(null),
                fr.map(DatasetSpatialRepo.FootprintRegion::regionCode).orElse(null)));
    }

    public LinkedDatasets datasetSources(UUID id, int limit) throws Exception {
        return catalog.datasetSources(id, limit);
    }

    public LinkedDatasets datasetsDerived(UUID id, int limit) throws Exception {
        return catalog.datasetsDerived(id, limit);
    }

    public List<SpatialQuality> spatialQualityStats() throws Exception {
        return products.spatialQualityStats();
    }

    public List<RefreshRun> recentRuns(String productName, int limit) throws Exception {
        return refreshLog.recentRuns(productName, limit);
    }
}
