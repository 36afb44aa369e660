package com.libragraph.modelgate.test;

import com.libragraph.modelgate.core.service.AbstractManagedService;
import jakarta.enterprise.context.ApplicationScoped;

/** Lifecycle-only service used to observe state events. */
@ApplicationScoped
public class TestService extends AbstractManagedService {

    @Override
    public String serviceId() {
        return "test-service";
    }

    @Override
    protected void doStart() {
    }

    @Override
    protected void doStop() {
    }
}
