package com.libragraph.datasink.core.storage;

import com.libragraph.datasink.util.ContentHash;
import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.StatObjectArgs;
import io.minio.errors.ErrorResponseException;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.Optional;

/**
 * S3/MinIO-backed BinaryStore for production use.
 *
 * <p>All datasets share one bucket; the object key is the dataset id.
 */
@ApplicationScoped
@IfBuildProperty(name = "datasink.binary-store.type", stringValue = "s3")
public class S3BinaryStore implements BinaryStore {

    @Inject
    MinioClient minioClient;

    @ConfigProperty(name = "datasink.binary-store.bucket", defaultValue = "datasink-content")
    String bucket;

    private volatile boolean bucketReady;

    private void ensureBucket() {
        if (bucketReady) {
            return;
        }
        try {
            if (!minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build())) {
                minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
            }
            bucketReady = true;
        } catch (ErrorResponseException e) {
            // Concurrent creation by another request
            if ("BucketAlreadyOwnedByYou".equals(e.errorResponse().code())) {
                bucketReady = true;
                return;
            }
            throw new StorageException("Failed to ensure bucket: " + bucket, e);
        } catch (Exception e) {
            throw new StorageException("Failed to ensure bucket: " + bucket, e);
        }
    }

    private static boolean isMissing(ErrorResponseException e) {
        String code = e.errorResponse().code();
        return "NoSuchKey".equals(code) || "NoSuchBucket".equals(code);
    }

    @Override
    public Uni<Optional<BinaryRecord>> get(String datasetId) {
        return Uni.createFrom().item(() -> {
            try (InputStream is = minioClient.getObject(
                    GetObjectArgs.builder().bucket(bucket).object(datasetId).build())) {
                return Optional.of(BinaryRecord.of(datasetId, is.readAllBytes()));
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    return Optional.<BinaryRecord>empty();
                }
                throw StorageException.forDataset("read", datasetId, e);
            } catch (Exception e) {
                throw StorageException.forDataset("read", datasetId, e);
            }
        });
    }

    @Override
    public Uni<ContentHash> put(String datasetId, byte[] data) {
        return Uni.createFrom().item(() -> {
            ensureBucket();
            try (InputStream is = new ByteArrayInputStream(data)) {
                minioClient.putObject(PutObjectArgs.builder()
                        .bucket(bucket)
                        .object(datasetId)
                        .stream(is, data.length, -1)
                        .contentType("application/octet-stream")
                        .build());
                return ContentHash.of(data);
            } catch (Exception e) {
                throw StorageException.forDataset("write", datasetId, e);
            }
        });
    }

    @Override
    public Uni<Void> delete(String datasetId) {
        return Uni.createFrom().voidItem().invoke(() -> {
            // removeObject is silent on missing keys, so stat first
            if (!statObject(datasetId)) {
                throw new ContentNotFoundException(datasetId);
            }
            try {
                minioClient.removeObject(RemoveObjectArgs.builder()
                        .bucket(bucket).object(datasetId).build());
            } catch (Exception e) {
                throw StorageException.forDataset("delete", datasetId, e);
            }
        });
    }

    @Override
    public Uni<Boolean> exists(String datasetId) {
        return Uni.createFrom().item(() -> statObject(datasetId));
    }

    @Override
    public String backend() {
        return "s3";
    }

    private boolean statObject(String datasetId) {
        try {
            minioClient.statObject(StatObjectArgs.builder()
                    .bucket(bucket).object(datasetId).build());
            return true;
        } catch (ErrorResponseException e) {
            if (isMissing(e)) {
                return false;
            }
            throw StorageException.forDataset("check", datasetId, e);
        } catch (Exception e) {
            throw StorageException.forDataset("check", datasetId, e);
        }
    }
}
