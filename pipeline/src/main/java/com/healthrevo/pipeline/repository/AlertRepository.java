package com.healthrevo.pipeline.repository;

import com.healthrevo.pipeline.model.Alert;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface AlertRepository extends R2dbcRepository<Alert, Long> {

    Mono<Alert> findByAlertId(String alertId);

    Mono<Alert> findByOpenKey(String openKey);

    Flux<Alert> findByPatientIdOrderByGeneratedAtDesc(String patientId);

    Flux<Alert> findAllByOrderByGeneratedAtDesc();

    @Query("SELECT * FROM alerts WHERE patient_id = :patientId ORDER BY generated_at DESC LIMIT 1")
    Mono<Alert> findLatestByPatientId(String patientId);
}
