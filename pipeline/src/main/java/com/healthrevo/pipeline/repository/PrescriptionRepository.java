package com.healthrevo.pipeline.repository;

import com.healthrevo.pipeline.model.Prescription;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface PrescriptionRepository extends R2dbcRepository<Prescription, Long> {

    Flux<Prescription> findByPatientIdOrderByUploadedAtDesc(String patientId);
}
