package com.libragraph.datasink.api;

import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static io.restassured.RestAssured.given;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;

@QuarkusTest
class DataResourceTest {

    static final String TURTLE = "@prefix ex: <http://example.org/> .\nex:a ex:p ex:b .\n";

    static String uniqueName(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    static String createCollection(String name) {
        return given()
                .formParam("collection_name", name)
                .when().put("/data")
                .then()
                .statusCode(201)
                .body("collection_id", notNullValue())
                .body("last_modified", notNullValue())
                .extract().path("collection_id");
    }

    static void upload(String collection, String dataset, String content) {
        given()
                .multiPart("dataset_name", dataset)
                .multiPart("file", dataset, content.getBytes(StandardCharsets.UTF_8), "application/octet-stream")
                .when().put("/data/" + collection)
                .then()
                .statusCode(201);
    }

    @Test
    void createCollectionAppearsInListing() {
        String name = uniqueName("listed");
        String id = createCollection(name);

        given()
                .when().get("/data")
                .then()
                .statusCode(200)
                .body("items.find { it.name == '" + name + "' }.id", is(id))
                .body("items.find { it.name == '" + name + "' }.count", is(0))
                .body("items.find { it.name == '" + name + "' }.bytes", is(0));
    }

    @Test
    void duplicateCollectionIsConflict() {
        String name = uniqueName("dup");
        createCollection(name);

        given()
                .formParam("collection_name", name)
                .when().put("/data")
                .then()
                .statusCode(409)
                .body("detail", containsString(name));
    }

    @Test
    void blankCollectionNameIsBadRequest() {
        given()
                .formParam("collection_name", "  ")
                .when().put("/data")
                .then()
                .statusCode(400)
                .body("detail", notNullValue());
    }

    @Test
    void nestedCollectionUnderUnknownParentIsNotFound() {
        given()
                .formParam("collection_name", uniqueName("orphan"))
                .formParam("sub_collection_id", UUID.randomUUID().toString())
                .when().put("/data")
                .then()
                .statusCode(404);
    }

    @Test
    void uploadTurtleDatasetRecordsFormatAndDownloadUrl() {
        String collection = uniqueName("rdf");
        createCollection(collection);

        given()
                .multiPart("dataset_name", "people.ttl")
                .multiPart("file", "people.ttl", TURTLE.getBytes(StandardCharsets.UTF_8), "text/turtle")
                .when().put("/data/" + collection)
                .then()
                .statusCode(201)
                .body("dataset_id", notNullValue())
                .body("format", is("turtle"))
                .body("download_url", endsWith("/data/" + collection + "/people.ttl"));
    }

    @Test
    void uploadedBytesAreReturnedVerbatim() {
        String collection = uniqueName("bytes");
        createCollection(collection);
        upload(collection, "notes.txt", "plain bytes, not RDF");

        byte[] body = given()
                .when().get("/data/" + collection + "/notes.txt")
                .then()
                .statusCode(200)
                .header("Content-Disposition", containsString("notes.txt"))
                .header("ETag", notNullValue())
                .extract().asByteArray();

        assertThat(new String(body, StandardCharsets.UTF_8)).isEqualTo("plain bytes, not RDF");
    }

    @Test
    void listDatasetsIncludesNestedCollectionsAndDatasets() {
        String collection = uniqueName("tree");
        String rootId = createCollection(collection);
        String childId = given()
                .formParam("collection_name", "child")
                .formParam("sub_collection_id", rootId)
                .when().put("/data")
                .then().statusCode(201)
                .extract().path("collection_id");

        given()
                .multiPart("dataset_name", "deep.ttl")
                .multiPart("sub_collection_id", childId)
                .multiPart("file", "deep.ttl", TURTLE.getBytes(StandardCharsets.UTF_8), "text/turtle")
                .when().put("/data/" + collection)
                .then().statusCode(201);

        given()
                .when().get("/data/" + collection)
                .then()
                .statusCode(200)
                .body("items", hasSize(2))
                .body("items.find { it.name == 'child' }.type", is("catalog"))
                .body("items.find { it.name == 'child' }.relative_path", is("./" + collection + "/"))
                .body("items.find { it.name == 'deep.ttl' }.type", is("dataset"))
                .body("items.find { it.name == 'deep.ttl' }.relative_path", is("./" + collection + "/child/"))
                .body("items.find { it.name == 'deep.ttl' }.bytes", is(TURTLE.getBytes(StandardCharsets.UTF_8).length))
                .body("items.find { it.name == 'deep.ttl' }.hash", notNullValue());
    }

    @Test
    void duplicateDatasetIsConflict() {
        String collection = uniqueName("dupds");
        createCollection(collection);
        upload(collection, "a.txt", "first");

        given()
                .multiPart("dataset_name", "a.txt")
                .multiPart("file", "a.txt", "second".getBytes(StandardCharsets.UTF_8), "text/plain")
                .when().put("/data/" + collection)
                .then()
                .statusCode(409);

        String body = given().when().get("/data/" + collection + "/a.txt").then().statusCode(200).extract().asString();
        assertThat(body).isEqualTo("first");
    }

    @Test
    void uploadIntoUnknownCollectionIsNotFound() {
        given()
                .multiPart("dataset_name", "x.txt")
                .multiPart("file", "x.txt", "x".getBytes(StandardCharsets.UTF_8), "text/plain")
                .when().put("/data/" + uniqueName("missing"))
                .then()
                .statusCode(404)
                .body("detail", notNullValue());
    }

    @Test
    void updateReplacesContent() {
        String collection = uniqueName("upd");
        createCollection(collection);
        upload(collection, "data.txt", "old");

        given()
                .multiPart("file", "data.txt", TURTLE.getBytes(StandardCharsets.UTF_8), "text/turtle")
                .when().post("/data/" + collection + "/data.txt")
                .then()
                .statusCode(200)
                .body("format", is("turtle"));

        String body = given().when().get("/data/" + collection + "/data.txt").then().statusCode(200).extract().asString();
        assertThat(body).isEqualTo(TURTLE);
    }

    @Test
    void deleteDatasetThenCollection() {
        String collection = uniqueName("del");
        createCollection(collection);
        upload(collection, "gone.txt", "bye");

        given().when().delete("/data/" + collection).then().statusCode(409);

        given().when().delete("/data/" + collection + "/gone.txt").then().statusCode(204);
        given().when().get("/data/" + collection + "/gone.txt").then().statusCode(404);

        given().when().delete("/data/" + collection).then().statusCode(204);
        given().when().get("/data/" + collection).then().statusCode(404);
    }

    @Test
    void deleteUnknownDatasetIsNotFound() {
        String collection = uniqueName("nods");
        createCollection(collection);

        given().when().delete("/data/" + collection + "/nothing.txt").then().statusCode(404);
    }
}
