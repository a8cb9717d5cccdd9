package com.roomkeeper.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * A fault the caller may retry; the handler adds a {@code Retry-After} header.
 */
public class RetryableProblemException extends ProblemException {

    private final long retryAfterSeconds;

    public RetryableProblemException(HttpStatus status, String code, String detail, long retryAfterSeconds) {
        this(status, code, detail, retryAfterSeconds, null);
    }

    public RetryableProblemException(HttpStatus status, String code, String detail, long retryAfterSeconds,
                                     Throwable cause) {
        super(status, code, detail, cause);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
