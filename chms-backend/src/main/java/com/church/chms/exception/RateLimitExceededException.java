package com.church.chms.exception;

import org.springframework.http.HttpStatus;

/**
 * 429 请求过于频繁，retryAfterSeconds 用于 Retry-After 响应头
 */
public class RateLimitExceededException extends ChmsException {

    private final long retryAfterSeconds;

    public RateLimitExceededException(String message, long retryAfterSeconds) {
        super(HttpStatus.TOO_MANY_REQUESTS, message);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
