package com.healthrevo.pipeline.repository;

import com.healthrevo.pipeline.model.VitalsSampleEntity;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface VitalsSampleRepository extends R2dbcRepository<VitalsSampleEntity, String> {

    // Check if a sample already exists (for idempotency)
    Mono<Boolean> existsBySampleId(String sampleId);

    Flux<VitalsSampleEntity> findByPatientIdAndRecordedAtBetweenOrderByRecordedAtAscSampleIdAsc(
        String patientId, LocalDateTime from, LocalDateTime to);
}
