/* (C)2026 */
package com.ammann.attention.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of validating a single stored row: either a value or a rejection reason.
 *
 * <p>Aggregation loops consume rows through this type so that one malformed row is discarded
 * (and counted) without aborting the whole report.
 *
 * @param <T> type of the validated value
 */
public final class ParseResult<T> {

    private final T value;
    private final String rejectionReason;

    private ParseResult(T value, String rejectionReason) {
        this.value = value;
        this.rejectionReason = rejectionReason;
    }

    public static <T> ParseResult<T> ok(T value) {
        return new ParseResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> ParseResult<T> rejected(String reason) {
        return new ParseResult<>(null, Objects.requireNonNull(reason, "reason"));
    }

    public boolean isOk() {
        return value != null;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    /**
     * @return short machine-readable reason, or {@code null} for a successful result
     */
    public String rejectionReason() {
        return rejectionReason;
    }

    @Override
    public String toString() {
        return isOk() ? "ParseResult{ok=" + value + "}" : "ParseResult{rejected=" + rejectionReason + "}";
    }
}
