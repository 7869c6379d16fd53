package io.cubedash.summary;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cubedash.config.AppConfig;
import io.cubedash.db.*;
import io.cubedash.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

class SummaryStoreTest {
    private static final ZoneId UTC = ZoneId.of("UTC");
    private static final int ID = 2;
    private static final CatalogProduct NBAR = new CatalogProduct(ID, "ls8_nbar", "eo3", null);
    private static final Instant LAST_REFRESH = Instant.parse("2020-01-01T00:00:00Z");
    private static final ProductSummary PREVIOUS = new ProductSummary(ID, "ls8_nbar", 5,
            Instant.parse("2017-10-01T00:00:00Z"), Instant.parse("2017-11-20T00:00:00Z"), List.of(), List.of(),
            null, LAST_REFRESH, LAST_REFRESH);
    private static final LocalDate OCT = LocalDate.of(2017, 10, 1);
    private static final LocalDate NOV = LocalDate.of(2017, 11, 1);
    private static final LocalDate YEAR_2017 = LocalDate.of(2017, 1, 1);
    private static final UUID RUN = UUID.fromString("00000000-0000-0000-0000-000000000001");

    private CatalogRepo catalog;
    private DatasetSpatialRepo spatial;
    private TimeOverviewRepo overviews;
    private ProductRepo products;
    private RegionRepo regions;
    private RefreshLogRepo refreshLog;
    private Summariser summariser;
    private SummaryStore store;

    @BeforeEach
    void setUp() throws Exception {
        catalog = mock(CatalogRepo.class);
        spatial = mock(DatasetSpatialRepo.class);
        overviews = mock(TimeOverviewRepo.class);
        products = mock(ProductRepo.class);
        regions = mock(RegionRepo.class);
        refreshLog = mock(RefreshLogRepo.class);
        summariser = mock(Summariser.class);
        AppConfig cfg = AppConfig.from(Map.<String, String>of()::get, new Properties());
        store = new SummaryStore(cfg, new ObjectMapper(), mock(SchemaRepo.class), catalog, spatial, overviews,
                products, regions, refreshLog, summariser);

        when(summariser.zone()).thenReturn(UTC);
        when(catalog.productByName("ls8_nbar")).thenReturn(Optional.of(NBAR));
        when(catalog.documentStyle(NBAR)).thenReturn(DocumentStyle.EO3);
        when(refreshLog.startRun(anyString(), anyString())).thenReturn(RUN);
        when(products.upsertProductRecord(NBAR)).thenReturn(Optional.of(PREVIOUS));
        when(spatial.productExtent(ID)).thenReturn(new DatasetSpatialRepo.ProductExtent(
                Instant.parse("2017-10-01T00:00:00Z"), Instant.parse("2017-11-20T00:00:00Z"), 5));
        storedMonths(OCT, NOV);
        when(overviews.alreadySummarised(ID, PeriodType.YEAR)).thenReturn(new TreeSet<>(Set.of(YEAR_2017)));
        when(summariser.calculate(eq(ID), any())).thenReturn(summary(OCT, 1));
        when(overviews.get(eq(ID), any(), eq(PeriodType.MONTH))).thenReturn(Optional.of(summary(OCT, 2)));
        when(overviews.get(ID, YEAR_2017, PeriodType.YEAR)).thenReturn(Optional.of(summary(OCT, 5)));
    }

    private void storedMonths(LocalDate... months) throws Exception {
        when(overviews.alreadySummarised(ID, PeriodType.MONTH)).thenReturn(new TreeSet<>(Arrays.asList(months)));
    }

    private static TimePeriodOverview summary(LocalDate day, int count) {
        SortedMap<LocalDate, Integer> timeline = new TreeMap<>();
        timeline.put(day, count);
        Map<String, Integer> regionCounts = new HashMap<>();
        regionCounts.put("091084", count);
        Instant begin = day.atStartOfDay().toInstant(ZoneOffset.UTC);
        return new TimePeriodOverview(count, timeline, PeriodType.DAY, regionCounts,
                new TimeRange(begin, begin.plusSeconds(86400)), null, null, 0, begin,
                new TreeSet<>(Set.of("EPSG:4326")), begin, 100L * count, null);
    }

    private static TimeRange month(LocalDate m) {
        return Periods.monthRange(UTC, YearMonth.from(m));
    }

    private static RefreshOptions force() {
        return new RefreshOptions(true, false, false, null);
    }

    private static RefreshOptions recreateExtents() {
        return new RefreshOptions(false, true, false, null);
    }

    @Test
    void nothingChangedIsNoChanges() throws Exception {
        TimePeriodOverview all = summary(OCT, 5);
        when(overviews.get(ID, Periods.ALL_START_DAY, PeriodType.ALL)).thenReturn(Optional.of(all));

        RefreshResult r = store.refresh("ls8_nbar", RefreshOptions.incremental());

        assertThat(r.result()).isEqualTo(GenerateResult.NO_CHANGES);
        assertThat(r.summary()).isSameAs(all);
        Instant scanFrom = LAST_REFRESH.minusSeconds(3600);
        verify(spatial).upsertDatasets(eq(ID), any(), eq(scanFrom));
        verify(spatial).deleteDatasets(ID, scanFrom, false);
        verify(catalog).outdatedMonths(eq(ID), any(), eq(scanFrom), eq(UTC));
        verify(products).updateLastRefresh(eq(ID), any());
        verify(summariser, never()).calculate(anyInt(), any());
        verify(overviews, never()).put(anyInt(), any(), any(), any());
        verify(regions, never()).upsertProductRegions(anyInt());
        verify(products, never()).updateRefreshTimestamp(anyInt(), any());
        verify(refreshLog).finishRun(eq(RUN), eq(true), startsWith("NO_CHANGES"));
    }

    @Test
    void addedDatasetRegeneratesItsMonthThenRecombines() throws Exception {
        when(spatial.upsertDatasets(eq(ID), any(), any())).thenReturn(1);
        when(catalog.outdatedMonths(eq(ID), any(), any(), eq(UTC))).thenReturn(List.of(NOV));

        RefreshResult r = store.refresh("ls8_nbar", RefreshOptions.incremental());

        assertThat(r.result()).isEqualTo(GenerateResult.UPDATED);
        assertThat(r.summary().datasetCount()).isEqualTo(5);
        verify(summariser).calculate(ID, month(NOV));
        verify(summariser, never()).calculate(ID, month(OCT));
        verify(overviews).put(eq(ID), eq(NOV), eq(PeriodType.MONTH), any());
        verify(overviews, never()).put(eq(ID), eq(OCT), eq(PeriodType.MONTH), any());
        verify(overviews).put(eq(ID), eq(YEAR_2017), eq(PeriodType.YEAR), any());
        verify(overviews).put(eq(ID), eq(Periods.ALL_START_DAY), eq(PeriodType.ALL), any());
        verify(regions).upsertProductRegions(ID);
        verify(products).updateRefreshTimestamp(eq(ID), any());
        verify(overviews, never()).deleteProduct(anyInt());
    }

    @Test
    void yearIsCombinedFromEveryStoredMonth() throws Exception {
        when(catalog.outdatedMonths(eq(ID), any(), any(), eq(UTC))).thenReturn(List.of(NOV));
        when(overviews.get(ID, OCT, PeriodType.MONTH)).thenReturn(Optional.of(summary(OCT, 2)));
        when(overviews.get(ID, NOV, PeriodType.MONTH)).thenReturn(Optional.of(summary(NOV, 3)));

        store.refresh("ls8_nbar", RefreshOptions.incremental());

        verify(overviews).put(eq(ID), eq(YEAR_2017), eq(PeriodType.YEAR),
                argThat(y -> y.datasetCount() == 5 && y.timelineDatasetCounts().size() == 2));
    }

    @Test
    void archivedDatasetRemovesItsExtentAndEmptiedMonth() throws Exception {
        Instant scanFrom = LAST_REFRESH.minusSeconds(3600);
        when(spatial.deleteDatasets(ID, scanFrom, false)).thenReturn(1);
        when(spatial.productExtent(ID)).thenReturn(new DatasetSpatialRepo.ProductExtent(
                Instant.parse("2017-10-01T00:00:00Z"), Instant.parse("2017-10-20T00:00:00Z"), 4));

        RefreshResult r = store.refresh("ls8_nbar", RefreshOptions.incremental());

        assertThat(r.result()).isEqualTo(GenerateResult.UPDATED);
        verify(spatial).deleteDatasets(ID, scanFrom, false);
        verify(regions).deleteEmptyRegions(ID);
        verify(summariser).calculate(ID, month(NOV));
        verify(overviews).put(eq(ID), eq(NOV), eq(PeriodType.MONTH), any());
        verify(products).updateProductFields(eq(ID), eq(4L), any(), any(), any(), any(), any(), any());
    }

    @Test
    void missingMonthIsSummarisedWithoutCatalogChanges() throws Exception {
        storedMonths(OCT);

        RefreshResult r = store.refresh("ls8_nbar", RefreshOptions.incremental());

        assertThat(r.result()).isEqualTo(GenerateResult.UPDATED);
        verify(summariser).calculate(ID, month(NOV));
        verify(summariser, never()).calculate(ID, month(OCT));
    }

    @Test
    void forceRefreshClearsAndRebuildsEveryMonth() throws Exception {
        RefreshResult r = store.refresh("ls8_nbar", force());

        assertThat(r.result()).isEqualTo(GenerateResult.UPDATED);
        verify(overviews).deleteProduct(ID);
        verify(spatial).upsertDatasets(eq(ID), any(), isNull());
        verify(spatial).deleteDatasets(ID, null, true);
        verify(summariser).calculate(ID, month(OCT));
        verify(summariser).calculate(ID, month(NOV));
        verify(catalog, never()).outdatedMonths(anyInt(), any(), any(), any());
    }

    @Test
    void recreatedExtentsResummariseEveryMonth() throws Exception {
        RefreshResult r = store.refresh("ls8_nbar", recreateExtents());

        assertThat(r.result()).isEqualTo(GenerateResult.UPDATED);
        verify(spatial).upsertDatasets(eq(ID), any(), isNull());
        verify(summariser).calculate(ID, month(OCT));
        verify(summariser).calculate(ID, month(NOV));
        verify(overviews, never()).deleteProduct(anyInt());
    }

    @Test
    void firstRefreshIsCreated() throws Exception {
        when(products.upsertProductRecord(NBAR)).thenReturn(Optional.empty());
        storedMonths();

        RefreshResult r = store.refresh("ls8_nbar", RefreshOptions.incremental());

        assertThat(r.result()).isEqualTo(GenerateResult.CREATED);
        verify(spatial).deleteDatasets(ID, null, true);
        verify(summariser).calculate(ID, month(OCT));
        verify(summariser).calculate(ID, month(NOV));
        verify(overviews, never()).outdatedYears(anyInt());
    }

    @Test
    void outdatedYearAloneIsRecombined() throws Exception {
        when(overviews.outdatedYears(ID)).thenReturn(List.of(YEAR_2017));

        RefreshResult r = store.refresh("ls8_nbar", RefreshOptions.incremental());

        assertThat(r.result()).isEqualTo(GenerateResult.UPDATED);
        verify(summariser, never()).calculate(anyInt(), any());
        verify(overviews).put(eq(ID), eq(YEAR_2017), eq(PeriodType.YEAR), any());
        verify(overviews).put(eq(ID), eq(Periods.ALL_START_DAY), eq(PeriodType.ALL), any());
    }

    @Test
    void unknownProductIsAnErrorWithoutARun() throws Exception {
        when(catalog.productByName("nope")).thenReturn(Optional.empty());

        RefreshResult r = store.refresh("nope", RefreshOptions.incremental());

        assertThat(r.result()).isEqualTo(GenerateResult.ERROR);
        verify(refreshLog, never()).startRun(anyString(), anyString());
    }

    @Test
    void failureIsRecordedOnTheRun() throws Exception {
        when(spatial.upsertDatasets(eq(ID), any(), any())).thenThrow(new SQLException("connection reset"));

        RefreshResult r = store.refresh("ls8_nbar", RefreshOptions.incremental());

        assertThat(r.result()).isEqualTo(GenerateResult.ERROR);
        assertThat(r.summary()).isNull();
        verify(refreshLog).finishRun(eq(RUN), eq(false), contains("connection reset"));
        verify(products, never()).updateRefreshTimestamp(anyInt(), any());
    }
}
