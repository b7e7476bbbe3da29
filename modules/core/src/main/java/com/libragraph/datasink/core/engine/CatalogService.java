package com.libragraph.datasink.core.engine;

import com.libragraph.datasink.core.graph.GraphStoreService;
import com.libragraph.datasink.core.service.AbstractManagedService;
import com.libragraph.datasink.core.service.DependsOn;
import com.libragraph.datasink.core.storage.BinaryStore;
import com.libragraph.datasink.formats.registry.FormatSniffer;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Clock;
import java.time.Duration;

/**
 * Owns the {@link CatalogEngine}. Starts after the graph store and hands the
 * engine out only while RUNNING.
 */
@ApplicationScoped
@Startup
@DependsOn(GraphStoreService.class)
public class CatalogService extends AbstractManagedService {

    @Inject
    GraphStoreService graphStoreService;

    @Inject
    BinaryStore binaryStore;

    @Inject
    FormatSniffer sniffer;

    @ConfigProperty(name = "datasink.application-url", defaultValue = "http://localhost:8080")
    String applicationUrl;

    @ConfigProperty(name = "datasink.graph.base-iri", defaultValue = "http://marketplace-datasink.org/")
    String baseIri;

    @ConfigProperty(name = "datasink.request.timeout", defaultValue = "PT30S")
    Duration requestTimeout;

    private volatile CatalogEngine engine;

    @Override
    public String serviceId() {
        return "catalog";
    }

    @Override
    protected void doStart() {
        EngineSettings settings = new EngineSettings(baseIri, applicationUrl, requestTimeout);
        engine = new CatalogEngine(graphStoreService.store(), binaryStore, sniffer, settings, Clock.systemUTC());
        log.infof("Catalog engine ready: binary store=%s, sniffing %s, timeout %s",
                binaryStore.backend(), sniffer.priority(), requestTimeout);
    }

    @Override
    protected void doStop() {
        engine = null;
    }

    public CatalogEngine engine() {
        requireRunning();
        return engine;
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
