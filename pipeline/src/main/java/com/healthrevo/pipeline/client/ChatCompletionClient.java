package com.healthrevo.pipeline.client;

import reactor.core.publisher.Mono;

/**
 * Opaque text-completion collaborator used for the optional clinician summary.
 */
public interface ChatCompletionClient {

    boolean isEnabled();

    Mono<String> complete(String prompt, String context);
}
