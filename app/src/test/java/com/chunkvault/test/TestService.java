package com.chunkvault.test;

import com.chunkvault.core.queue.WriteQueue;
import com.chunkvault.core.service.AbstractManagedService;
import com.chunkvault.core.service.ManagedService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;

/**
 * Test-only service that depends on the {@link WriteQueue} to validate
 * dependency ordering and failure cascade semantics.
 */
@ApplicationScoped
public class TestService extends AbstractManagedService {

    @Inject
    WriteQueue writeQueue;

    @Override
    public String serviceId() {
        return "test-service";
    }

    @Override
    public List<ManagedService> dependencies() {
        return List.of(writeQueue);
    }

    @Override
    protected void doStart() {
        log.info("TestService started");
    }

    @Override
    protected void doStop() {
        log.info("TestService stopped");
    }
}
