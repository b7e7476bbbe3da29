package com.libragraph.datasink.core.storage;

import io.minio.MinioClient;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * MinIO client for the {@code s3} binary store, where each dataset's bytes are
 * one object in {@code datasink.binary-store.bucket}. Only built when that
 * backend is selected.
 */
@ApplicationScoped
@IfBuildProperty(name = "datasink.binary-store.type", stringValue = "s3")
public class MinioClientProducer {

    private static final Logger log = Logger.getLogger(MinioClientProducer.class);

    @ConfigProperty(name = "datasink.minio.endpoint")
    String endpoint;

    @ConfigProperty(name = "datasink.minio.access-key")
    String accessKey;

    @ConfigProperty(name = "datasink.minio.secret-key")
    String secretKey;

    @Produces
    @Singleton
    public MinioClient minioClient() {
        log.infof("S3 binary store endpoint: %s", endpoint);
        return MinioClient.builder()
                .endpoint(endpoint)
                .credentials(accessKey, secretKey)
                .build();
    }
}
