package com.libragraph.datasink.api;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.libragraph.datasink.api.DataResourceTest.TURTLE;
import static com.libragraph.datasink.api.DataResourceTest.createCollection;
import static com.libragraph.datasink.api.DataResourceTest.uniqueName;
import static com.libragraph.datasink.api.DataResourceTest.upload;
import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

@QuarkusTest
class QueryResourceTest {

    @Test
    void metadataQueryFindsCollectionTitle() {
        String collection = uniqueName("q");
        createCollection(collection);

        given()
                .contentType(ContentType.JSON)
                .body(Map.of(
                        "query", "PREFIX dct: <http://purl.org/dc/terms/> "
                                + "SELECT ?s WHERE { ?s dct:title \"" + collection + "\" }",
                        "meta_data", true))
                .when().post("/query")
                .then()
                .statusCode(200)
                .body("form", is("select"))
                .body("variables", contains("s"))
                .body("rows", hasSize(1));
    }

    @Test
    void askQueryOverDatasetSubgraph() {
        String collection = uniqueName("qask");
        createCollection(collection);
        upload(collection, "facts.ttl", TURTLE);

        given()
                .contentType(ContentType.JSON)
                .body(Map.of("query", "ASK { <http://example.org/a> <http://example.org/p> <http://example.org/b> }"))
                .when().post("/query/" + collection + "/facts.ttl")
                .then()
                .statusCode(200)
                .body("form", is("ask"))
                .body("boolean", is(true))
                .body("rows", nullValue());
    }

    @Test
    void rawDatasetCannotBeQueried() {
        String collection = uniqueName("qraw");
        createCollection(collection);
        upload(collection, "blob.bin", "not rdf at all");

        given()
                .contentType(ContentType.JSON)
                .body(Map.of("query", "SELECT * WHERE { ?s ?p ?o }"))
                .when().post("/query/" + collection + "/blob.bin")
                .then()
                .statusCode(400)
                .body("detail", containsString("raw"));
    }

    @Test
    void malformedQueryIsBadRequest() {
        given()
                .contentType(ContentType.JSON)
                .body(Map.of("query", "SELEKT nonsense"))
                .when().post("/query")
                .then()
                .statusCode(400);
    }

    @Test
    void blankQueryIsBadRequest() {
        given()
                .contentType(ContentType.JSON)
                .body(Map.of("query", " "))
                .when().post("/query")
                .then()
                .statusCode(400);
    }
}
