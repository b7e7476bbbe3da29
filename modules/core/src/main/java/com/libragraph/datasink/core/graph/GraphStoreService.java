package com.libragraph.datasink.core.graph;

import com.libragraph.datasink.core.service.AbstractManagedService;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Root infrastructure service for the metadata graph. Starts eagerly, opens a
 * read transaction to prove the store is usable, and exposes {@link #store()}
 * only when RUNNING.
 */
@ApplicationScoped
@Startup
public class GraphStoreService extends AbstractManagedService {

    @Inject
    GraphStore graphStore;

    @Override
    public String serviceId() {
        return "graph-store";
    }

    @Override
    protected void doStart() {
        Stats stats = stats();
        log.infof("Graph store %s ready: %d metadata triples, %d subgraphs",
                graphStore.location(), stats.metadataTriples(), stats.subgraphs());
    }

    @Override
    protected void doStop() {
        log.infof("Graph store %s stopping", graphStore.location());
    }

    public GraphStore store() {
        requireRunning();
        return graphStore;
    }

    /** Counts metadata triples and subgraphs in a short read transaction. */
    public Stats stats() {
        try (GraphTransaction tx = graphStore.begin(TxnMode.READ)) {
            return new Stats(graphStore.location(), tx.metadataSize(), tx.subgraphCount());
        }
    }

    public record Stats(String location, long metadataTriples, long subgraphs) {}

    @PostConstruct
    void init() {
        startOnBoot();
    }

    @PreDestroy
    void shutdown() {
        stopOnShutdown();
    }
}
