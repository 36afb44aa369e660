package com.libragraph.modelgate.core.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.function.Consumer;

/**
 * Propagates failures and recoveries along {@code @DependsOn} edges: when the
 * database fails the worker pool stops claiming work, and when the database
 * recovers the pool is restarted.
 * <p>
 * Separate from {@link AbstractManagedService} so that event delivery during
 * {@code @PostConstruct} cannot create beans circularly.
 */
@ApplicationScoped
public class ServiceDependencyCascade {

    private static final Logger log = Logger.getLogger(ServiceDependencyCascade.class);

    @Inject
    Instance<ManagedService> services;

    void onTransition(@Observes ServiceTransition transition) {
        if (transition.isFailure()) {
            forEachDependant(transition.serviceId(), dependant -> {
                log.warnf("Dependency '%s' failed, failing '%s'", transition.serviceId(), dependant.serviceId());
                dependant.fail(new IllegalStateException(
                        "Dependency '" + transition.serviceId() + "' failed: " + transition.reason()));
            });
        } else if (transition.isRecovery()) {
            forEachDependant(transition.serviceId(), dependant -> {
                if (dependant.state().isFailed()) {
                    log.infof("Dependency '%s' recovered, restarting '%s'",
                            transition.serviceId(), dependant.serviceId());
                    dependant.recover();
                }
            });
        }
    }

    private void forEachDependant(String serviceId, Consumer<ManagedService> action) {
        ManagedService source = null;
        for (ManagedService svc : services) {
            if (svc.serviceId().equals(serviceId)) {
                source = svc;
                break;
            }
        }
        if (source == null) {
            return;
        }
        for (ManagedService svc : services) {
            if (svc instanceof AbstractManagedService managed && managed.dependsOn(source)) {
                action.accept(svc);
            }
        }
    }
}
