package com.libragraph.datasink.core.dao;

import com.libragraph.datasink.core.db.JdbiProducer;
import com.libragraph.datasink.util.ContentHash;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class DatasetContentDaoTest {

    static {
        System.setProperty("testcontainers.ryuk.disabled", "true");
    }

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    private static Jdbi jdbi;

    @BeforeAll
    static void connect() {
        jdbi = JdbiProducer.create(POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
        jdbi.useExtension(DatasetContentDao.class, DatasetContentDao::createTable);
    }

    @BeforeEach
    void clean() {
        jdbi.useHandle(h -> h.execute("DELETE FROM dataset_content"));
    }

    @Test
    void upsertInsertsThenReplaces() {
        String id = UUID.randomUUID().toString();
        byte[] first = "first".getBytes(StandardCharsets.UTF_8);
        byte[] second = "second version".getBytes(StandardCharsets.UTF_8);

        jdbi.useExtension(DatasetContentDao.class, dao -> {
            dao.upsert(id, first, ContentHash.of(first).bytes(), first.length);
            dao.upsert(id, second, ContentHash.of(second).bytes(), second.length);
        });

        DatasetContentRecord row = jdbi.withExtension(DatasetContentDao.class, dao -> dao.findById(id)).orElseThrow();
        assertThat(row.data()).isEqualTo(second);
        assertThat(row.byteSize()).isEqualTo(second.length);
        assertThat(new ContentHash(row.contentHash())).isEqualTo(ContentHash.of(second));
        long rows = jdbi.withExtension(DatasetContentDao.class, DatasetContentDao::count);
        assertThat(rows).isEqualTo(1);
    }

    @Test
    void deleteReportsRemovedRows() {
        String id = UUID.randomUUID().toString();
        byte[] data = {1, 2, 3};
        jdbi.useExtension(DatasetContentDao.class,
                dao -> dao.upsert(id, data, ContentHash.of(data).bytes(), data.length));

        boolean exists = jdbi.withExtension(DatasetContentDao.class, dao -> dao.exists(id));
        assertThat(exists).isTrue();

        int removed = jdbi.withExtension(DatasetContentDao.class, dao -> dao.delete(id));
        assertThat(removed).isEqualTo(1);

        int removedAgain = jdbi.withExtension(DatasetContentDao.class, dao -> dao.delete(id));
        assertThat(removedAgain).isZero();

        Optional<DatasetContentRecord> gone = jdbi.withExtension(DatasetContentDao.class, dao -> dao.findById(id));
        assertThat(gone).isEmpty();
    }

    @Test
    void databaseDaoReportsVersion() {
        String version = jdbi.withExtension(DatabaseDao.class, DatabaseDao::pgVersion);
        assertThat(version).containsIgnoringCase("PostgreSQL");

        int ping = jdbi.withExtension(DatabaseDao.class, DatabaseDao::ping);
        assertThat(ping).isEqualTo(1);

        boolean tableExists = jdbi.withExtension(DatabaseDao.class, DatabaseDao::contentTableExists);
        assertThat(tableExists).isTrue();
    }
}
