package com.asiainfo.dimensional.application.catalog;

import com.asiainfo.dimensional.api.dto.DimensionSearchRequest;
import com.asiainfo.dimensional.api.dto.DimensionValueItem;
import com.asiainfo.dimensional.api.dto.DimensionValueSearchRequest;
import com.asiainfo.dimensional.api.dto.DimensionValuesResponse;
import com.asiainfo.dimensional.api.dto.MetricSearchRequest;
import com.asiainfo.dimensional.api.dto.PageResponse;
import com.asiainfo.dimensional.application.ingest.MetricIngestionService;
import com.asiainfo.dimensional.common.exception.CatalogNotFoundException;
import com.asiainfo.dimensional.common.exception.InvalidRequestException;
import com.asiainfo.dimensional.domain.model.DimensionDefinition;
import com.asiainfo.dimensional.domain.model.MetricCriteria;
import com.asiainfo.dimensional.domain.model.MetricDefinition;
import com.asiainfo.dimensional.support.StoreFixtures;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
public class CatalogQueryServiceTest {

    @Inject
    CatalogQueryService catalogQueryService;

    @Inject
    MetricIngestionService ingestionService;

    @Inject
    StoreFixtures fixtures;

    @BeforeEach
    void setUp() throws SQLException {
        fixtures.clean();
        ingestionService.upload("catalog.csv", StoreFixtures.csv("region,device_type",
                "signups,Signups,Daily new accounts,count,users,up,sum,day,2024-01-01,,10,,,us,mobile",
                "revenue,Net Revenue,Revenue after refunds,currency,usd,up,sum,day,2024-01-01,,500,,,eu,desktop",
                "revenue,Net Revenue,,currency,usd,up,sum,day,2024-02-01,,700,,,de,desktop",
                "churn_rate,Churn Rate,Share of cancelled subscriptions,ratio,pct,down,avg,month,2024-01-01,,0.05,,,us,"));
    }

    @Test
    void listsMetricsSortedByKeyWithFilters() {
        PageResponse<MetricDefinition> all = catalogQueryService.listMetrics(MetricCriteria.none(), Paging.of(null, null));
        assertEquals(List.of("churn_rate", "revenue", "signups"), all.items().stream().map(MetricDefinition::metricKey).toList());
        assertEquals(500, all.limit());

        MetricCriteria sums = new MetricCriteria(null, null, null, null, null, null, List.of("sum"), List.of(true));
        assertEquals(2, catalogQueryService.listMetrics(sums, Paging.of(null, null)).items().size());

        PageResponse<MetricDefinition> page = catalogQueryService.listMetrics(MetricCriteria.none(), Paging.of(1, 1));
        assertEquals(List.of("revenue"), page.items().stream().map(MetricDefinition::metricKey).toList());
    }

    @Test
    void getMetricAndDimension() {
        MetricDefinition revenue = catalogQueryService.getMetric("revenue");
        assertEquals("Net Revenue", revenue.metricName());
        assertEquals("Revenue after refunds", revenue.metricDescription());
        assertEquals("sum", revenue.aggregation());

        DimensionDefinition deviceType = catalogQueryService.getDimension("device_type");
        assertEquals("Device Type", deviceType.dimensionName());

        assertThrows(CatalogNotFoundException.class, () -> catalogQueryService.getMetric("unknown"));
        assertThrows(CatalogNotFoundException.class, () -> catalogQueryService.getDimension("unknown"));
    }

    @Test
    void searchMetricsRanksNameMatchesFirst() {
        PageResponse<MetricDefinition> result = catalogQueryService.searchMetrics(
                new MetricSearchRequest(null, "revenue", null, null, null, null));
        assertFalse(result.items().isEmpty());
        assertEquals("revenue", result.items().get(0).metricKey());
        assertTrue(result.items().stream().noneMatch(m -> m.metricKey().equals("signups")));
    }

    @Test
    void searchMetricsToleratesTypos() {
        PageResponse<MetricDefinition> result = catalogQueryService.searchMetrics(
                new MetricSearchRequest(null, "churm rate", List.of("metric_name"), 0.3, null, null));
        assertEquals(List.of("churn_rate"), result.items().stream().map(MetricDefinition::metricKey).toList());
    }

    @Test
    void searchWithoutQueryFallsBackToListing() {
        MetricSearchRequest.Filters filters = new MetricSearchRequest.Filters(null, null, null,
                List.of("currency"), null, null, null, null);
        PageResponse<MetricDefinition> result = catalogQueryService.searchMetrics(
                new MetricSearchRequest(filters, "  ", null, null, null, null));
        assertEquals(List.of("revenue"), result.items().stream().map(MetricDefinition::metricKey).toList());
    }

    @Test
    void rejectsOutOfRangeSimilarityAndPaging() {
        assertThrows(InvalidRequestException.class, () -> catalogQueryService.searchMetrics(
                new MetricSearchRequest(null, "revenue", null, 1.5, null, null)));
        assertThrows(InvalidRequestException.class, () -> Paging.of(0, 0));
        assertThrows(InvalidRequestException.class, () -> Paging.of(5001, 0));
        assertThrows(InvalidRequestException.class, () -> Paging.of(10, -1));
    }

    @Test
    void searchDimensionsByName() {
        PageResponse<DimensionDefinition> result = catalogQueryService.searchDimensions(
                new DimensionSearchRequest(null, "device", null, null, null, null));
        assertEquals(List.of("device_type"), result.items().stream().map(DimensionDefinition::dimensionKey).toList());
    }

    @Test
    void dimensionValuesScopedByMetricAndTime() {
        DimensionValuesResponse all = catalogQueryService.dimensionValues("region", null, null, null, Paging.of(null, null));
        assertEquals(List.of("de", "eu", "us"), all.items());

        DimensionValuesResponse revenue = catalogQueryService.dimensionValues("region", "revenue", null, null,
                Paging.of(null, null));
        assertEquals(List.of("de", "eu"), revenue.items());

        DimensionValuesResponse january = catalogQueryService.dimensionValues("region", "revenue",
                "2024-01-01", "2024-02-01", Paging.of(null, null));
        assertEquals(List.of("eu"), january.items());
    }

    @Test
    void searchDimensionValues() {
        DimensionValueSearchRequest.Filters filters = new DimensionValueSearchRequest.Filters(
                List.of("device_type"), null, null, null);
        PageResponse<DimensionValueItem> result = catalogQueryService.searchDimensionValues(
                new DimensionValueSearchRequest(filters, "mobil", 0.3, null, null));
        assertEquals(List.of("mobile"), result.items().stream().map(DimensionValueItem::value).toList());
        assertEquals("device_type", result.items().get(0).dimensionKey());

        PageResponse<DimensionValueItem> everything = catalogQueryService.searchDimensionValues(
                new DimensionValueSearchRequest(null, null, null, null, null));
        assertEquals(5, everything.items().size());
    }
}
