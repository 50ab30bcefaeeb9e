package com.eligibility.fact;

import java.time.Instant;
import java.util.Objects;

/**
 * A single observed attribute of a case.
 * Several facts may share a key; they form an append-only history and only the
 * most recently created one is current.
 *
 * @param key       Fact key referenced by rule expressions (e.g. "min_salary")
 * @param value     Scalar value: String, Number, Boolean or null
 * @param source    Who recorded the fact
 * @param createdAt Creation timestamp
 */
public record Fact(String key, Object value, FactSource source, Instant createdAt) {

    public Fact {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(createdAt, "createdAt");
        if (source == null) {
            source = FactSource.USER;
        }
        if (value != null && !(value instanceof String || value instanceof Number || value instanceof Boolean)) {
            throw new IllegalArgumentException("Fact '" + key + "' must hold a scalar value, got "
                    + value.getClass().getSimpleName());
        }
    }

    public static Fact of(String key, Object value, Instant createdAt) {
        return new Fact(key, value, FactSource.USER, createdAt);
    }
}
