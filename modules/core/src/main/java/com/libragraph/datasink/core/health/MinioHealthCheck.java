package com.libragraph.datasink.core.health;

import io.minio.BucketExistsArgs;
import io.minio.MinioClient;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
@IfBuildProperty(name = "datasink.binary-store.type", stringValue = "s3")
public class MinioHealthCheck implements HealthCheck {

    @Inject
    MinioClient minioClient;

    @ConfigProperty(name = "datasink.binary-store.bucket", defaultValue = "datasink-content")
    String bucket;

    @Override
    public HealthCheckResponse call() {
        try {
            boolean exists = minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build());
            return HealthCheckResponse.named("minio")
                    .up()
                    .withData("bucket", bucket)
                    .withData("bucketExists", exists)
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named("minio")
                    .down()
                    .withData("error", e.getMessage())
                    .build();
        }
    }
}
