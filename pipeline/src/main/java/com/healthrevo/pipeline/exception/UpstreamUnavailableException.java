package com.healthrevo.pipeline.exception;

/**
 * A collaborator (record store, OCR or chat service) did not answer within its timeout and retry
 * budget. Callers either skip the dependent stage or report the request as retryable.
 */
public class UpstreamUnavailableException extends RuntimeException {

    private final String dependency;

    public UpstreamUnavailableException(String dependency, String message, Throwable cause) {
        super(message, cause);
        this.dependency = dependency;
    }

    public String getDependency() {
        return dependency;
    }
}
