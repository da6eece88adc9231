package com.chunkvault.core.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Observes {@link ServiceStateChangedEvent} and cascades failures to dependent services.
 * <p>
 * This is a separate bean (not on {@link AbstractManagedService}) to avoid circular
 * bean creation when CDI delivers events during {@code @PostConstruct}.
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
            if (svc instanceof AbstractManagedService managed
                    && !managed.isFailed()
                    && managed.dependsOn(event.serviceId())) {
                log.warnf("Dependency '%s' failed (%s), cascading failure to '%s'",
                        event.serviceId(), event.cause(), svc.serviceId());
                svc.fail(new IllegalStateException(
                        "Dependency '" + event.serviceId() + "' failed: " + event.cause()));
            }
        }
    }
}
