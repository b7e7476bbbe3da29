package com.libragraph.datasink.core.health;

import com.libragraph.datasink.core.db.DatabaseService;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
@IfBuildProperty(name = "datasink.binary-store.type", stringValue = "jdbc")
public class DatabaseHealthCheck implements HealthCheck {

    @Inject
    DatabaseService databaseService;

    @Override
    public HealthCheckResponse call() {
        if (databaseService.ping()) {
            return HealthCheckResponse.named("database")
                    .up()
                    .withData("version", databaseService.pgVersion())
                    .build();
        }
        return HealthCheckResponse.named("database")
                .down()
                .withData("state", databaseService.state().name())
                .build();
    }
}
