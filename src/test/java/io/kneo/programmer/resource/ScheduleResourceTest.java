package io.kneo.programmer.resource;

import io.kneo.programmer.util.ResourceUtil;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.RestAssured;
import io.restassured.config.EncoderConfig;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;

@QuarkusTest
class ScheduleResourceTest {

    @BeforeAll
    static void registerYamlEncoding() {
        RestAssured.config = RestAssured.config().encoderConfig(
                EncoderConfig.encoderConfig().encodeContentTypeAs("application/yaml", ContentType.TEXT));
    }

    @Test
    void testCompilesConfiguredChannelForDate() {
        given()
                .when().get("/api/schedule/retro-one/2025-01-06")
                .then()
                .statusCode(200)
                .body("channel_id", equalTo("retro-one"))
                .body("broadcast_day", equalTo("2025-01-06"))
                .body("version", equalTo("program-schedule.v2"))
                .body("program_blocks", hasSize(6))
                .body("program_blocks[0].asset_id", equalTo("cheers-401"))
                .body("hash", startsWith("sha256:"));
    }

    @Test
    void testSameDayCompilesToSameHash() {
        String first = given().get("/api/schedule/retro-one/2025-01-07").then().statusCode(200)
                .extract().path("hash");
        given().get("/api/schedule/retro-one/2025-01-07").then().statusCode(200)
                .body("hash", equalTo(first));
    }

    @Test
    void testUnknownChannelAndBadDate() {
        given().get("/api/schedule/nowhere/2025-01-06").then().statusCode(404);
        given().get("/api/schedule/retro-one/06-01-2025").then().statusCode(400);
    }

    @Test
    void testPostedDefinitionIsCompiled() {
        given()
                .contentType("application/yaml")
                .body(ResourceUtil.loadResourceAsString("dsl/network-day.yaml"))
                .when().post("/api/schedule/compile")
                .then()
                .statusCode(200)
                .body("source.dsl_path", equalTo("<request>"))
                .body("program_blocks", not(hasSize(0)));
    }

    @Test
    void testInvalidDefinitionReportsEveryError() {
        given()
                .contentType("application/yaml")
                .body(ResourceUtil.loadResourceAsString("dsl/invalid.yaml"))
                .when().post("/api/schedule/compile")
                .then()
                .statusCode(422)
                .body("error", equalTo("validation"))
                .body("errors", hasItem("Missing required field: timezone"));
    }

    @Test
    void testNonNumericSeedIsAValidationFailure() {
        given()
                .contentType("application/yaml")
                .body(ResourceUtil.loadResourceAsString("dsl/network-day.yaml").replace("seed: 7", "seed: abc"))
                .when().post("/api/schedule/compile")
                .then()
                .statusCode(422)
                .body("error", equalTo("validation"))
                .body("errors", hasItem("all_day: block at 20:00: seed must be an integer, got 'abc'"));
    }

    @Test
    void testBlankDefinitionIsRejected() {
        given()
                .contentType("text/plain")
                .body("  ")
                .when().post("/api/schedule/compile")
                .then()
                .statusCode(400);
    }
}
