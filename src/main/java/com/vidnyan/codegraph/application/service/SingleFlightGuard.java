package com.vidnyan.codegraph.application.service;

import com.vidnyan.codegraph.exception.ConcurrentOperationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Allows at most one mutating operation (ingestion, update, save) per project
 * at a time. A second attempt is rejected, not queued.
 */
@Slf4j
@Component
public class SingleFlightGuard {

    private final Map<String, String> inFlight = new ConcurrentHashMap<>();

    /**
     * Held while the operation runs; closing it more than once is harmless.
     */
    public final class Permit implements AutoCloseable {
        private final String projectId;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit(String projectId) {
            this.projectId = projectId;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                inFlight.remove(projectId);
            }
        }
    }

    /**
     * @throws ConcurrentOperationException when an operation is already running for the project
     */
    public Permit acquire(String projectId, String operation) {
        String running = inFlight.putIfAbsent(projectId, operation);
        if (running != null) {
            log.warn("Rejecting '{}' for {}: '{}' in flight", operation, projectId, running);
            throw new ConcurrentOperationException(projectId, operation);
        }
        return new Permit(projectId);
    }

    public Optional<String> runningOperation(String projectId) {
        return Optional.ofNullable(inFlight.get(projectId));
    }
}
