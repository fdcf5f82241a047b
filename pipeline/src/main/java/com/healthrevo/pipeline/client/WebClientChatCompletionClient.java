package com.healthrevo.pipeline.client;

import com.healthrevo.pipeline.exception.UpstreamUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class WebClientChatCompletionClient implements ChatCompletionClient {

    private static final Logger logger = LoggerFactory.getLogger(WebClientChatCompletionClient.class);

    static final String DEPENDENCY = "chat";

    private final WebClient webClient;

    @Value("${cds.chat.enabled:false}")
    private boolean enabled;

    @Value("${cds.chat.url:http://localhost:8092}")
    private String chatServiceUrl;

    @Value("${cds.chat.timeout-seconds:15}")
    private int timeoutSeconds;

    @Value("${cds.chat.max-retries:1}")
    private int maxRetries;

    @Value("${cds.chat.retry-backoff-millis:200}")
    private long retryBackoffMillis;

    public WebClientChatCompletionClient(WebClient.Builder webClientBuilder) {
        this.webClient = webClientBuilder.build();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public Mono<String> complete(String prompt, String context) {
        Map<String, String> request = new LinkedHashMap<>();
        request.put("prompt", prompt);
        request.put("context", context);

        return webClient
            .post()
            .uri(chatServiceUrl + "/complete")
            .bodyValue(request)
            .retrieve()
            .bodyToMono(Map.class)
            .map(body -> {
                Object completion = body.get("completion");
                return completion == null ? "" : completion.toString();
            })
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .retryWhen(Retry.backoff(maxRetries, Duration.ofMillis(retryBackoffMillis))
                .filter(WebClientTextExtractionClient::isRetryable)
                .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
            .doOnSuccess(completion -> logger.info("Received chat completion ({} characters)", completion.length()))
            .doOnError(error -> logger.error("Chat completion failed: {}", error.getMessage()))
            .onErrorMap(error -> new UpstreamUnavailableException(DEPENDENCY, "Chat completion unavailable: " + error.getMessage(), error));
    }
}
