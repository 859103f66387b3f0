package com.asiainfo.dimensional.application.ingest;

import com.asiainfo.dimensional.application.catalog.CatalogQueryService;
import com.asiainfo.dimensional.common.exception.ErrorKind;
import com.asiainfo.dimensional.common.exception.InvalidRequestException;
import com.asiainfo.dimensional.domain.model.MetricDefinition;
import com.asiainfo.dimensional.support.StoreFixtures;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CSV 入库集成测试（H2 PostgreSQL 兼容模式）
 */
@QuarkusTest
public class MetricIngestionServiceTest {

    @Inject
    MetricIngestionService ingestionService;

    @Inject
    CatalogQueryService catalogQueryService;

    @Inject
    StoreFixtures fixtures;

    @BeforeEach
    void setUp() throws SQLException {
        fixtures.clean();
    }

    @Test
    void ingestsSignupsFile() throws SQLException {
        IngestionReport report = ingestionService.upload("signups.csv", StoreFixtures.signupsCsv());

        assertEquals(56, report.rows());
        assertEquals(1, report.metricsCreated());
        assertEquals(2, report.dimensionsCreated());
        assertEquals(4, report.dimensionValuesCreated());
        assertEquals(4, report.dimensionSetsCreated());
        assertEquals(4, report.seriesCreated());
        assertEquals(56, report.observationsInserted());
        assertEquals(0, report.observationsSkipped());

        assertEquals(1, fixtures.count("metric_definition"));
        assertEquals(4, fixtures.count("dimension_set"));
        assertEquals(8, fixtures.count("dimension_set_value"));
        assertEquals(4, fixtures.count("metric_series"));
        assertEquals(56, fixtures.count("metric_observation"));
    }

    /**
     * 重复上传同一文件：目录、集合、序列全部命中，观测值全部跳过
     */
    @Test
    void reUploadIsIdempotent() throws SQLException {
        ingestionService.upload("signups.csv", StoreFixtures.signupsCsv());
        IngestionReport second = ingestionService.upload("signups.csv", StoreFixtures.signupsCsv());

        assertEquals(0, second.metricsCreated());
        assertEquals(1, second.metricsMatched());
        assertEquals(0, second.dimensionsCreated());
        assertEquals(2, second.dimensionsMatched());
        assertEquals(0, second.dimensionValuesCreated());
        assertEquals(4, second.dimensionValuesMatched());
        assertEquals(0, second.dimensionSetsCreated());
        assertEquals(4, second.dimensionSetsMatched());
        assertEquals(0, second.seriesCreated());
        assertEquals(4, second.seriesMatched());
        assertEquals(0, second.observationsInserted());
        assertEquals(56, second.observationsSkipped());
        assertEquals(56, fixtures.count("metric_observation"));
    }

    /**
     * 列顺序不同但维度组合相同的行归入同一序列
     */
    @Test
    void columnOrderDoesNotSplitSeries() throws SQLException {
        ingestionService.upload("a.csv", StoreFixtures.csv("region,channel",
                "visits,Visits,,count,,,sum,day,2024-01-01,,1,,,us,web"));
        IngestionReport report = ingestionService.upload("b.csv", StoreFixtures.csv("channel,region",
                "visits,Visits,,count,,,sum,day,2024-01-02,,2,,,web,us"));

        assertEquals(0, report.dimensionSetsCreated());
        assertEquals(0, report.seriesCreated());
        assertEquals(1, report.seriesMatched());
        assertEquals(1, fixtures.count("metric_series"));
        assertEquals(2, fixtures.count("metric_observation"));
    }

    /**
     * 最后一行非法：整个文件被拒绝，库中数据不变
     */
    @Test
    void invalidLastRowRejectsWholeFile() throws SQLException {
        byte[] csv = StoreFixtures.csv("region",
                "orders,Orders,,count,,,sum,day,2024-01-01,,5,,,us",
                "orders,Orders,,count,,,sum,day,2024-01-02,,6,,,us",
                "orders,Orders,,count,,,sum,day,2024-01-03,,not-a-number,,,us");

        InvalidRequestException e = assertThrows(InvalidRequestException.class,
                () -> ingestionService.upload("orders.csv", csv));
        assertTrue(e.getDetail().startsWith("line 4:"));
        assertEquals(0, fixtures.count("metric_definition"));
        assertEquals(0, fixtures.count("metric_observation"));
    }

    /**
     * 超出列宽的维度取值在写库前即被拒绝
     */
    @Test
    void overlongDimensionValueIsInvalidBeforeAnyWrite() throws SQLException {
        byte[] csv = StoreFixtures.csv("campaign",
                "signups,Signups,,count,,,sum,day,2024-01-01,,5,,,spring",
                "signups,Signups,,count,,,sum,day,2024-01-02,,6,,," + "x".repeat(300));

        InvalidRequestException e = assertThrows(InvalidRequestException.class,
                () -> ingestionService.upload("signups.csv", csv));
        assertEquals(ErrorKind.INVALID, e.getKind());
        assertTrue(e.getDetail().startsWith("line 3:"));
        assertEquals(0, fixtures.count("dimension_value"));
        assertEquals(0, fixtures.count("metric_observation"));
    }

    @Test
    void metricWithoutDimensionsUsesEmptySet() throws SQLException {
        IngestionReport report = ingestionService.upload("total.csv", StoreFixtures.csv(null,
                "revenue,Revenue,,currency,usd,up,sum,month,2024-01-01,,1000,,"));
        assertEquals(1, report.dimensionSetsCreated());
        assertEquals(0, fixtures.count("dimension_set_value"));
        assertEquals(1, fixtures.count("metric_observation"));
    }

    @Test
    void blankOptionalFieldsKeepStoredCatalogValues() throws SQLException {
        ingestionService.upload("a.csv", StoreFixtures.csv(null,
                "revenue,Revenue,Gross revenue,currency,usd,up,sum,month,2024-01-01,,1000,,"));
        IngestionReport report = ingestionService.upload("b.csv", StoreFixtures.csv(null,
                "revenue,Revenue,,currency,,,sum,month,2024-02-01,,1200,,"));
        assertEquals(1, report.metricsMatched());
        assertEquals(1, report.observationsInserted());

        MetricDefinition metric = catalogQueryService.getMetric("revenue");
        assertEquals("Gross revenue", metric.metricDescription());
        assertEquals("usd", metric.unit());
        assertEquals("up", metric.directionality());
    }

    @Test
    void rejectsNonCsvAndEmptyUploads() {
        assertThrows(InvalidRequestException.class,
                () -> ingestionService.upload("signups.xlsx", StoreFixtures.signupsCsv()));
        assertThrows(InvalidRequestException.class, () -> ingestionService.upload("empty.csv", new byte[0]));
    }
}
