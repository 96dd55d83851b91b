package com.gocomet.tripsafety.common.exception;

import com.gocomet.tripsafety.admission.model.EndpointClass;
import lombok.Getter;

@Getter
public class RateLimitExceededException extends RuntimeException {

    private final EndpointClass endpointClass;
    private final long retryAfterSeconds;

    public RateLimitExceededException(EndpointClass endpointClass, long retryAfterSeconds) {
        super(String.format("Rate limit exceeded for %s endpoints, retry in %ds", endpointClass, retryAfterSeconds));
        this.endpointClass = endpointClass;
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
