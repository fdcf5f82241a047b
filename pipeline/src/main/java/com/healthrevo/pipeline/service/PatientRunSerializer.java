package com.healthrevo.pipeline.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Chains pipeline runs per patient: a run for a patient starts only after the previous run for
 * the same patient has completed, failed or been cancelled. Runs for different patients are
 * independent.
 */
@Component
public class PatientRunSerializer {

    private static final Logger logger = LoggerFactory.getLogger(PatientRunSerializer.class);

    private final ConcurrentMap<String, Mono<Void>> tails = new ConcurrentHashMap<>();

    public <T> Mono<T> serialize(String patientId, Mono<T> work) {
        return Mono.defer(() -> {
            Sinks.Empty<Void> done = Sinks.empty();
            Mono<Void> completion = done.asMono();
            Mono<Void> previous = tails.put(patientId, completion);
            Mono<Void> waitForPrevious = previous == null ? Mono.empty() : previous;
            if (previous != null) {
                logger.debug("Run for patient {} queued behind a running one", patientId);
            }
            return waitForPrevious
                .then(work)
                .doFinally(signal -> {
                    tails.remove(patientId, completion);
                    // a cancelled run may finish before its predecessor; release only after it
                    waitForPrevious.subscribe(null, error -> done.tryEmitEmpty(), done::tryEmitEmpty);
                });
        });
    }

    int pendingPatients() {
        return tails.size();
    }
}
