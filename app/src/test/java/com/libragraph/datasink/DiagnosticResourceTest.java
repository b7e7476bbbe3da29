package com.libragraph.datasink;

import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

@QuarkusTest
class DiagnosticResourceTest {

    @Test
    void ping_returnsOk() {
        given()
                .when().get("/api/diagnostic/ping")
                .then()
                .statusCode(200)
                .body("status", is("ok"))
                .body("message", is("Datasink is running"));
    }

    @Test
    void info_returnsAppMetadata() {
        given()
                .when().get("/api/diagnostic/info")
                .then()
                .statusCode(200)
                .body("name", is("datasink"))
                .body("version", notNullValue())
                .body("java", notNullValue())
                .body("profile", notNullValue())
                .body("binaryStore", is("filesystem"))
                .body("graphStore", is("memory"));
    }

    @Test
    void heartbeat_returnsText() {
        given()
                .when().get("/heartbeat")
                .then()
                .statusCode(200)
                .body(is("Datasink app up and running"));
    }

    @Test
    void healthReady_returnsUp() {
        given()
                .when().get("/q/health/ready")
                .then()
                .statusCode(200)
                .body("status", is("UP"));
    }

    @Test
    void healthLive_returnsUp() {
        given()
                .when().get("/q/health/live")
                .then()
                .statusCode(200)
                .body("status", is("UP"));
    }
}
