package com.libragraph.datasink.core.health;

import com.libragraph.datasink.core.graph.GraphStoreService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class GraphStoreHealthCheck implements HealthCheck {

    @Inject
    GraphStoreService graphStoreService;

    @Override
    public HealthCheckResponse call() {
        if (!graphStoreService.isRunning()) {
            return HealthCheckResponse.named("graph-store")
                    .down()
                    .withData("state", graphStoreService.state().name())
                    .build();
        }
        try {
            GraphStoreService.Stats stats = graphStoreService.stats();
            return HealthCheckResponse.named("graph-store")
                    .up()
                    .withData("location", stats.location())
                    .withData("metadataTriples", stats.metadataTriples())
                    .withData("subgraphs", stats.subgraphs())
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named("graph-store")
                    .down()
                    .withData("error", e.getMessage())
                    .build();
        }
    }
}
