package com.healthrevo.pipeline.client;

import com.healthrevo.pipeline.exception.UpstreamUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class WebClientTextExtractionClient implements TextExtractionClient {

    private static final Logger logger = LoggerFactory.getLogger(WebClientTextExtractionClient.class);

    static final String DEPENDENCY = "ocr";

    private final WebClient webClient;

    @Value("${cds.ocr.url:http://localhost:8091}")
    private String ocrServiceUrl;

    @Value("${cds.ocr.timeout-seconds:10}")
    private int timeoutSeconds;

    @Value("${cds.ocr.max-retries:2}")
    private int maxRetries;

    @Value("${cds.ocr.retry-backoff-millis:200}")
    private long retryBackoffMillis;

    public WebClientTextExtractionClient(WebClient.Builder webClientBuilder) {
        this.webClient = webClientBuilder.build();
    }

    @Override
    public Mono<String> extractText(String documentBase64, String contentType) {
        Map<String, String> request = new LinkedHashMap<>();
        request.put("document", documentBase64);
        request.put("contentType", contentType);

        return webClient
            .post()
            .uri(ocrServiceUrl + "/extract")
            .bodyValue(request)
            .retrieve()
            .bodyToMono(Map.class)
            .map(body -> {
                Object text = body.get("text");
                return text == null ? "" : text.toString();
            })
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .retryWhen(Retry.backoff(maxRetries, Duration.ofMillis(retryBackoffMillis))
                .filter(WebClientTextExtractionClient::isRetryable)
                .doBeforeRetry(signal -> logger.warn("OCR call failed ({}), retry {}",
                    signal.failure().getMessage(), signal.totalRetries() + 1))
                .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
            .doOnSuccess(text -> logger.info("Extracted {} characters of text from {} document", text.length(), contentType))
            .doOnError(error -> logger.error("Text extraction failed: {}", error.getMessage()))
            .onErrorMap(error -> new UpstreamUnavailableException(DEPENDENCY, "Text extraction unavailable: " + error.getMessage(), error));
    }

    static boolean isRetryable(Throwable error) {
        if (error instanceof WebClientResponseException response) {
            return response.getStatusCode().is5xxServerError();
        }
        return true;
    }
}
