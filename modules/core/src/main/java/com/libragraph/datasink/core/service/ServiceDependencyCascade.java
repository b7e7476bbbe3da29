package com.libragraph.datasink.core.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Fails every service whose {@code @DependsOn} target has just failed. When the
 * graph store goes down, the catalog engine follows.
 */
@ApplicationScoped
public class ServiceDependencyCascade {

    private static final Logger log = Logger.getLogger(ServiceDependencyCascade.class);

    @Inject
    Instance<ManagedService> allServices;

    void onServiceFailed(@Observes ServiceStateChangedEvent event) {
        if (!event.isFailure()) {
            return;
        }

        for (ManagedService svc : allServices) {
            if (!(svc instanceof AbstractManagedService managed) || svc.isFailed()) {
                continue;
            }
            for (Class<? extends ManagedService> dep : managed.getDependencies()) {
                if (isService(event.serviceId(), dep)) {
                    log.warnf("Dependency '%s' failed, cascading failure to '%s'",
                            event.serviceId(), svc.serviceId());
                    svc.fail(new IllegalStateException(
                            "Dependency '" + event.serviceId() + "' failed: " + event.reason()));
                }
            }
        }
    }

    private boolean isService(String serviceId, Class<? extends ManagedService> depClass) {
        for (ManagedService svc : allServices) {
            if (depClass.isInstance(svc) && svc.serviceId().equals(serviceId)) {
                return true;
            }
        }
        return false;
    }
}
