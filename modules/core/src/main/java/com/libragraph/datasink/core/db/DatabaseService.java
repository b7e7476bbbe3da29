package com.libragraph.datasink.core.db;

import com.libragraph.datasink.core.dao.DatabaseDao;
import com.libragraph.datasink.core.dao.DatasetContentDao;
import com.libragraph.datasink.core.service.AbstractManagedService;
import io.quarkus.arc.properties.IfBuildProperty;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;

/**
 * Gates access to the PostgreSQL content table of the {@code jdbc} backend.
 * Starts eagerly, verifies connectivity, creates {@code dataset_content} if
 * missing, and exposes {@link #jdbi()} only when RUNNING.
 */
@ApplicationScoped
@Startup
@IfBuildProperty(name = "datasink.binary-store.type", stringValue = "jdbc")
public class DatabaseService extends AbstractManagedService {

    @Inject
    Jdbi jdbi;

    private String pgVersion;

    @Override
    public String serviceId() {
        return "database";
    }

    @Override
    protected void doStart() {
        pgVersion = jdbi.withExtension(DatabaseDao.class, DatabaseDao::pgVersion);
        jdbi.useExtension(DatasetContentDao.class, DatasetContentDao::createTable);
        boolean tableReady = jdbi.withExtension(DatabaseDao.class, DatabaseDao::contentTableExists);
        if (!tableReady) {
            throw new IllegalStateException("Table dataset_content is missing after schema setup");
        }
        long rows = jdbi.withExtension(DatasetContentDao.class, DatasetContentDao::count);
        log.infof("Connected to: %s (%d stored datasets)", pgVersion, rows);
    }

    @Override
    protected void doStop() {
        log.info("DatabaseService stopping");
    }

    /** Returns the Jdbi instance. Throws if service is not RUNNING. */
    public Jdbi jdbi() {
        requireRunning();
        return jdbi;
    }

    /** Executes SELECT 1 to verify connectivity. Calls {@link #fail} on error. */
    public boolean ping() {
        try {
            jdbi.withExtension(DatabaseDao.class, DatabaseDao::ping);
            return true;
        } catch (Exception e) {
            fail(e);
            return false;
        }
    }

    public String pgVersion() {
        return pgVersion;
    }

    @PostConstruct
    void init() {
        startOnBoot();
    }

    @PreDestroy
    void shutdown() {
        stopOnShutdown();
    }
}
