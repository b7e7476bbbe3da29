package com.libragraph.datasink.core.db;

import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.Slf4JSqlLogger;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.postgresql.ds.PGSimpleDataSource;

/**
 * Produces the Jdbi instance for the {@code jdbc} binary store backend.
 */
@ApplicationScoped
@IfBuildProperty(name = "datasink.binary-store.type", stringValue = "jdbc")
public class JdbiProducer {

    @ConfigProperty(name = "datasink.binary-store.jdbc.url")
    String url;

    @ConfigProperty(name = "datasink.binary-store.jdbc.username")
    String username;

    @ConfigProperty(name = "datasink.binary-store.jdbc.password")
    String password;

    @Produces
    @Singleton
    public Jdbi jdbi() {
        return create(url, username, password);
    }

    /** Builds a configured Jdbi over a plain PostgreSQL data source. */
    public static Jdbi create(String url, String username, String password) {
        PGSimpleDataSource dataSource = new PGSimpleDataSource();
        dataSource.setUrl(url);
        dataSource.setUser(username);
        dataSource.setPassword(password);
        return Jdbi.create(dataSource)
                .installPlugin(new PostgresPlugin())
                .installPlugin(new SqlObjectPlugin())
                .setSqlLogger(new Slf4JSqlLogger());
    }
}
