package com.healthrevo.pipeline.repository;

import com.healthrevo.pipeline.model.RiskScore;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface RiskScoreRepository extends R2dbcRepository<RiskScore, Long> {

    @Query("SELECT * FROM risk_scores WHERE patient_id = :patientId AND risk_type = :riskType "
        + "ORDER BY computed_at DESC, id DESC LIMIT 1")
    Mono<RiskScore> findCurrent(String patientId, String riskType);

    Flux<RiskScore> findByPatientIdAndRiskTypeOrderByComputedAtDescIdDesc(String patientId, String riskType);

    Flux<RiskScore> findByPatientIdOrderByComputedAtDescIdDesc(String patientId);
}
