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
import static org.hamcrest.Matchers.equalTo;

@QuarkusTest
public class DimensionCatalogResourceTest {

    @Inject
    StoreFixtures fixtures;

    @BeforeEach
    void setUp() throws SQLException {
        fixtures.clean();
        given()
                .multiPart("file", "signups.csv", StoreFixtures.signupsCsv(), "text/csv")
                .when().post("/v1/metrics/upload")
                .then()
                .statusCode(200);
    }

    @Test
    void listAndGet() {
        given()
                .when().get("/v1/dimensions")
                .then()
                .statusCode(200)
                .body("items.dimension_key", contains("channel", "region"));

        given()
                .when().get("/v1/dimensions/region")
                .then()
                .statusCode(200)
                .body("dimension_name", equalTo("Region"))
                .body("value_type", equalTo("string"));

        given()
                .when().get("/v1/dimensions/planet")
                .then()
                .statusCode(404)
                .body("kind", equalTo("not_found"));
    }

    @Test
    void values() {
        given()
                .queryParam("metric_key", "signups")
                .when().get("/v1/dimensions/region/values")
                .then()
                .statusCode(200)
                .body("dimension_key", equalTo("region"))
                .body("items", contains("eu", "us"));
    }

    @Test
    void searchDimensionsAndValues() {
        given()
                .contentType(ContentType.JSON)
                .body("{\"q\": \"chanel\", \"similarity\": 0.3}")
                .when().post("/v1/dimensions/search")
                .then()
                .statusCode(200)
                .body("items.dimension_key", contains("channel"));

        given()
                .contentType(ContentType.JSON)
                .body("{\"filters\": {\"dimension_key\": [\"channel\"]}, \"q\": \"web\"}")
                .when().post("/v1/dimensions/values/search")
                .then()
                .statusCode(200)
                .body("items.value", contains("web"));
    }
}
