package com.asiainfo.dimensional.api;

import com.asiainfo.dimensional.support.StoreFixtures;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;

@QuarkusTest
public class MetricCatalogResourceTest {

    @Inject
    StoreFixtures fixtures;

    @BeforeEach
    void setUp() throws SQLException {
        fixtures.clean();
    }

    private void uploadSignups() {
        given()
                .multiPart("file", "signups.csv", StoreFixtures.signupsCsv(), "text/csv")
                .when().post("/v1/metrics/upload")
                .then()
                .statusCode(200);
    }

    @Test
    void uploadReturnsIngestionReport() {
        given()
                .multiPart("file", "signups.csv", StoreFixtures.signupsCsv(), "text/csv")
                .when().post("/v1/metrics/upload")
                .then()
                .statusCode(200)
                .body("rows", equalTo(56))
                .body("metrics_created", equalTo(1))
                .body("series_created", equalTo(4))
                .body("observations_inserted", equalTo(56))
                .body("observations_skipped", equalTo(0));
    }

    @Test
    void invalidUploadIsBadRequest() {
        given()
                .multiPart("file", "bad.csv", StoreFixtures.csv(null,
                        "signups,Signups,,count,,,sum,day,2024-01-01,,oops,,"), "text/csv")
                .when().post("/v1/metrics/upload")
                .then()
                .statusCode(400)
                .body("kind", equalTo("invalid"))
                .body("detail", containsString("line 2"));

        given()
                .multiPart("file", "signups.txt", StoreFixtures.signupsCsv(), "text/plain")
                .when().post("/v1/metrics/upload")
                .then()
                .statusCode(400);
    }

    @Test
    void listAndGetMetrics() {
        uploadSignups();

        given()
                .when().get("/v1/metrics")
                .then()
                .statusCode(200)
                .body("items", hasSize(1))
                .body("items[0].metric_key", equalTo("signups"))
                .body("items[0].is_active", equalTo(true))
                .body("limit", equalTo(500))
                .body("offset", equalTo(0));

        given()
                .queryParam("aggregation", "avg|max")
                .when().get("/v1/metrics")
                .then()
                .statusCode(200)
                .body("items", hasSize(0));

        given()
                .when().get("/v1/metrics/signups")
                .then()
                .statusCode(200)
                .body("metric_name", equalTo("Signups"))
                .body("aggregation", equalTo("sum"));
    }

    @Test
    void unknownMetricIsNotFound() {
        given()
                .when().get("/v1/metrics/nope")
                .then()
                .statusCode(404)
                .body("kind", equalTo("not_found"))
                .body("detail", equalTo("metric_key not found: nope"));
    }

    @Test
    void badPagingAndIdsAreRejected() {
        given().queryParam("limit", 0).when().get("/v1/metrics").then().statusCode(400);
        given().queryParam("metric_id", "abc").when().get("/v1/metrics").then().statusCode(400);
    }

    @Test
    void searchMetrics() {
        uploadSignups();
        given()
                .contentType(ContentType.JSON)
                .body("{\"q\": \"signup\", \"similarity\": 0.3}")
                .when().post("/v1/metrics/search")
                .then()
                .statusCode(200)
                .body("items.metric_key", contains("signups"));
    }

    @Test
    void availabilityAndFreshness() {
        uploadSignups();
        given()
                .queryParam("grain", "day")
                .when().get("/v1/metrics/signups/availability")
                .then()
                .statusCode(200)
                .body("source_grain", equalTo("day"))
                .body("min_time_start_ts", equalTo("2024-01-01T00:00:00Z"))
                .body("max_time_start_ts", equalTo("2024-01-14T00:00:00Z"));

        given()
                .queryParam("grain", "day")
                .when().get("/v1/metrics/signups/freshness")
                .then()
                .statusCode(200)
                .body("latest_time_start_ts", equalTo("2024-01-14T00:00:00Z"))
                .body("latest_ingested_ts", notNullValue());
    }

    @Test
    void availabilityOfMetricWithoutMatchingDataIsEmpty() {
        uploadSignups();
        given()
                .queryParam("grain", "day")
                .queryParam("dimensions", "999999:999999")
                .when().get("/v1/metrics/signups/availability")
                .then()
                .statusCode(200)
                .body("min_time_start_ts", nullValue());
    }
}
