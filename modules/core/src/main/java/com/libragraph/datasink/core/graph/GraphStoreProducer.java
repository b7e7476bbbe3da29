package com.libragraph.datasink.core.graph;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Opens the graph store: TDB2 when {@code datasink.graph-store.location} is set,
 * otherwise a transactional in-memory dataset.
 */
@ApplicationScoped
public class GraphStoreProducer {

    private static final Logger log = Logger.getLogger(GraphStoreProducer.class);

    @ConfigProperty(name = "datasink.graph-store.location")
    Optional<String> location;

    @ConfigProperty(name = "datasink.graph.base-iri", defaultValue = "http://marketplace-datasink.org/")
    String baseIri;

    @Produces
    @Singleton
    public GraphStore graphStore() {
        Optional<String> dir = location.filter(s -> !s.isBlank());
        if (dir.isPresent()) {
            log.infof("Opening TDB2 graph store at %s", dir.get());
            return JenaGraphStore.tdb2(Path.of(dir.get()), baseIri);
        }
        log.info("Using in-memory graph store");
        return JenaGraphStore.inMemory(baseIri);
    }

    void close(@Disposes GraphStore store) {
        store.close();
    }
}
