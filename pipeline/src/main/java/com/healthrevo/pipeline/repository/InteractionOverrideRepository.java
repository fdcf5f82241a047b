package com.healthrevo.pipeline.repository;

import com.healthrevo.pipeline.model.InteractionOverride;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface InteractionOverrideRepository extends R2dbcRepository<InteractionOverride, Long> {

    Flux<InteractionOverride> findByPatientId(String patientId);

    Mono<InteractionOverride> findByPatientIdAndPairKey(String patientId, String pairKey);
}
