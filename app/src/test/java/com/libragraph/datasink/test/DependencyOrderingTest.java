package com.libragraph.datasink.test;

import com.libragraph.datasink.core.engine.CatalogService;
import com.libragraph.datasink.core.graph.GraphStoreService;
import com.libragraph.datasink.core.service.ManagedService;
import com.libragraph.datasink.core.service.ServiceUnavailableException;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import static io.restassured.RestAssured.given;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@QuarkusTest
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class DependencyOrderingTest {

    @Inject
    GraphStoreService graphStoreService;

    @Inject
    CatalogService catalogService;

    @Inject
    TestService testService;

    @Test
    @Order(1)
    void catalogServiceStartsAfterGraphStore() {
        assertThat(graphStoreService.state()).isEqualTo(ManagedService.State.RUNNING);
        assertThat(catalogService.state()).isEqualTo(ManagedService.State.RUNNING);
        assertThat(catalogService.getDependencies()).containsExactly(GraphStoreService.class);
    }

    @Test
    @Order(2)
    void testServiceStartsAfterGraphStore() throws Exception {
        testService.start();
        assertThat(testService.state()).isEqualTo(ManagedService.State.RUNNING);

        testService.forceState(ManagedService.State.STOPPED);
    }

    @Test
    @Order(3)
    void graphStoreFailureCascades() throws Exception {
        testService.start();

        graphStoreService.fail(new RuntimeException("simulated graph store failure"));

        assertThat(testService.state()).isEqualTo(ManagedService.State.FAILED);
        assertThat(catalogService.state()).isEqualTo(ManagedService.State.FAILED);
        assertThat(graphStoreService.isFailed()).isTrue();
        assertThatThrownBy(() -> catalogService.engine()).isInstanceOf(ServiceUnavailableException.class);
        given().when().get("/data").then().statusCode(503);

        // Restore for other tests sharing this application
        graphStoreService.forceState(ManagedService.State.RUNNING);
        catalogService.forceState(ManagedService.State.RUNNING);
        testService.forceState(ManagedService.State.STOPPED);
    }

    @Test
    @Order(4)
    void dependentServiceRefusesToStartWhileGraphStoreIsDown() {
        graphStoreService.forceState(ManagedService.State.FAILED);
        try {
            assertThatThrownBy(() -> testService.start()).isInstanceOf(ServiceUnavailableException.class);
            assertThat(testService.state()).isEqualTo(ManagedService.State.STOPPED);
        } finally {
            graphStoreService.forceState(ManagedService.State.RUNNING);
        }
    }
}
