package com.healthrevo.pipeline.service;

import com.healthrevo.decision.anomaly.AlertCandidate;
import com.healthrevo.decision.model.VitalMetric;
import com.healthrevo.decision.model.VitalsSample;
import com.healthrevo.decision.risk.RiskAssessment;
import com.healthrevo.pipeline.client.ChatCompletionClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Optional clinician-facing summary of a vitals run. The context sent to the chat collaborator
 * holds measured values, risk drivers and alert titles only: no patient or sample identifiers,
 * no free-text notes and no timestamps.
 */
@Service
public class ClinicalSummaryService {

    private static final Logger logger = LoggerFactory.getLogger(ClinicalSummaryService.class);

    static final String PROMPT = "Summarize the following vital signs and risk indicators for a clinician "
        + "in two or three sentences. Do not give a diagnosis.";

    private final ChatCompletionClient chatClient;

    public ClinicalSummaryService(ChatCompletionClient chatClient) {
        this.chatClient = chatClient;
    }

    public boolean isEnabled() {
        return chatClient.isEnabled();
    }

    /**
     * @return the summary, or empty when summaries are disabled
     */
    public Mono<String> summarize(VitalsSample latest, List<RiskAssessment> assessments, List<AlertCandidate> candidates) {
        if (!chatClient.isEnabled()) {
            return Mono.empty();
        }
        String context = buildContext(latest, assessments, candidates);
        logger.debug("Requesting clinical summary ({} characters of context)", context.length());
        return chatClient.complete(PROMPT, context);
    }

    static String buildContext(VitalsSample latest, List<RiskAssessment> assessments, List<AlertCandidate> candidates) {
        StringBuilder context = new StringBuilder("Latest vitals:\n");
        for (VitalMetric metric : VitalMetric.values()) {
            Double value = metric.valueOf(latest);
            if (value != null) {
                context.append("- ").append(metric.displayName()).append(": ")
                    .append(String.format(Locale.ROOT, "%.1f", value)).append(' ').append(metric.unit()).append('\n');
            }
        }
        if (!assessments.isEmpty()) {
            context.append("Risk scores:\n");
            for (RiskAssessment assessment : assessments) {
                context.append("- ").append(assessment.getRiskType().label()).append(": ")
                    .append(assessment.getScore()).append(" (").append(assessment.getLevel().name().toLowerCase(Locale.ROOT)).append(")");
                for (Map.Entry<String, Double> driver : assessment.getDrivers().entrySet()) {
                    context.append("; ").append(driver.getKey()).append('=').append(driver.getValue());
                }
                context.append('\n');
            }
        }
        if (!candidates.isEmpty()) {
            context.append("Alerts:\n");
            for (AlertCandidate candidate : candidates) {
                context.append("- ").append(candidate.getSeverity().name()).append(": ").append(candidate.getTitle()).append('\n');
            }
        }
        return context.toString();
    }
}
