package com.libragraph.datasink.core.service;

import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Declares that a service needs {@link #value()} RUNNING before it starts and
 * fails when it fails. {@code CatalogService} depends on {@code GraphStoreService}
 * this way. Checked by {@link AbstractManagedService} on start and by
 * {@link ServiceDependencyCascade} on failure.
 */
@Target(TYPE)
@Retention(RUNTIME)
@Repeatable(DependsOn.List.class)
public @interface DependsOn {

    Class<? extends ManagedService> value();

    /** Container for repeated declarations. */
    @Target(TYPE)
    @Retention(RUNTIME)
    @interface List {
        DependsOn[] value();
    }
}
