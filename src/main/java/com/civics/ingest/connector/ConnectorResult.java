package com.civics.ingest.connector;

import java.time.Duration;
import java.util.function.Function;

/**
 * Either a value or a typed connector failure. Connector calls return this instead of
 * throwing, so retry and backoff decisions are plain data.
 *
 * @param value      the value on success, null on failure
 * @param errorKind  the failure kind, null on success
 * @param message    failure detail, null on success
 * @param retryAfter provider-advised delay for {@link ConnectorErrorKind#RATE_LIMITED}, may be null
 * @param <T>        the value type
 */
public record ConnectorResult<T>(T value, ConnectorErrorKind errorKind, String message, Duration retryAfter) {

    public ConnectorResult {
        if ((value == null) == (errorKind == null)) {
            throw new IllegalArgumentException("Exactly one of value or errorKind must be set");
        }
    }

    public static <T> ConnectorResult<T> success(T value) {
        return new ConnectorResult<>(value, null, null, null);
    }

    public static <T> ConnectorResult<T> failure(ConnectorErrorKind kind, String message) {
        return new ConnectorResult<>(null, kind, message, null);
    }

    public static <T> ConnectorResult<T> rateLimited(String message, Duration retryAfter) {
        return new ConnectorResult<>(null, ConnectorErrorKind.RATE_LIMITED, message, retryAfter);
    }

    public static <T> ConnectorResult<T> transientFailure(String message) {
        return failure(ConnectorErrorKind.TRANSIENT, message);
    }

    public static <T> ConnectorResult<T> invalid(String message) {
        return failure(ConnectorErrorKind.INVALID, message);
    }

    public static <T> ConnectorResult<T> exhausted(String message) {
        return failure(ConnectorErrorKind.EXHAUSTED, message);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public <U> ConnectorResult<U> map(Function<T, U> mapper) {
        if (isSuccess()) {
            return success(mapper.apply(value));
        }
        return new ConnectorResult<>(null, errorKind, message, retryAfter);
    }

    /**
     * Re-types a failure. Must not be called on a success.
     */
    public <U> ConnectorResult<U> asFailure() {
        if (isSuccess()) {
            throw new IllegalStateException("Result is a success");
        }
        return new ConnectorResult<>(null, errorKind, message, retryAfter);
    }
}
