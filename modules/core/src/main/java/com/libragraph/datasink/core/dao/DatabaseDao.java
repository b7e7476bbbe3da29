package com.libragraph.datasink.core.dao;

import org.jdbi.v3.sqlobject.statement.SqlQuery;

/**
 * Server-level checks for the {@code jdbc} binary store: version banner,
 * liveness and presence of the content table.
 */
public interface DatabaseDao {

    @SqlQuery("SELECT version()")
    String pgVersion();

    @SqlQuery("SELECT 1")
    int ping();

    @SqlQuery("SELECT to_regclass('dataset_content') IS NOT NULL")
    boolean contentTableExists();
}
