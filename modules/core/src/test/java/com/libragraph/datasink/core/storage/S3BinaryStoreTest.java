package com.libragraph.datasink.core.storage;

import com.libragraph.datasink.util.ContentHash;
import io.minio.MinioClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.MinIOContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class S3BinaryStoreTest {

    static {
        // Ryuk has connectivity issues on WSL2; container cleanup handled by stop()
        System.setProperty("testcontainers.ryuk.disabled", "true");
    }

    @Container
    static final MinIOContainer MINIO = new MinIOContainer("minio/minio:RELEASE.2024-11-07T00-52-20Z");

    private S3BinaryStore store;

    @BeforeEach
    void setUp() {
        store = new S3BinaryStore();
        store.minioClient = MinioClient.builder()
                .endpoint(MINIO.getS3URL())
                .credentials(MINIO.getUserName(), MINIO.getPassword())
                .build();
        store.bucket = "datasink-test";
    }

    @Test
    void writeAndReadRoundTrip() {
        String id = UUID.randomUUID().toString();
        byte[] content = "hello minio".getBytes(StandardCharsets.UTF_8);

        ContentHash hash = store.put(id, content).await().indefinitely();

        BinaryRecord read = store.get(id).await().indefinitely().orElseThrow();
        assertThat(read.data()).isEqualTo(content);
        assertThat(read.hash()).isEqualTo(hash);
        assertThat(store.exists(id).await().indefinitely()).isTrue();
    }

    @Test
    void missingObjectReadsAsEmpty() {
        store.put(UUID.randomUUID().toString(), new byte[]{1}).await().indefinitely();

        assertThat(store.get(UUID.randomUUID().toString()).await().indefinitely()).isEmpty();
    }

    @Test
    void deleteRemovesObject() {
        String id = UUID.randomUUID().toString();
        store.put(id, new byte[]{1, 2}).await().indefinitely();

        store.delete(id).await().indefinitely();

        assertThat(store.exists(id).await().indefinitely()).isFalse();
        assertThatThrownBy(() -> store.delete(id).await().indefinitely())
                .isInstanceOf(ContentNotFoundException.class);
    }
}
