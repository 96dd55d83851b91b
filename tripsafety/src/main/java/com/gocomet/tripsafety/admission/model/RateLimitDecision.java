package com.gocomet.tripsafety.admission.model;

public record RateLimitDecision(boolean allowed, long limit, long remaining, long retryAfterSeconds) {

    public static RateLimitDecision allow(long limit, long remaining) {
        return new RateLimitDecision(true, limit, remaining, 0);
    }

    public static RateLimitDecision reject(long limit, long retryAfterSeconds) {
        return new RateLimitDecision(false, limit, 0, retryAfterSeconds);
    }
}
