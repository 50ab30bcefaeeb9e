package com.eligibility.fact;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Builds the current fact map for a case and coerces raw values into the
 * types expressions expect.
 * <p>
 * Coercion never fails: a value that cannot be converted passes through
 * unchanged so that only the requirements referencing it are affected, at
 * evaluation time.
 */
public class FactNormalizer {

    private static final Logger log = LoggerFactory.getLogger(FactNormalizer.class);

    private static final Pattern NUMERIC = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    /**
     * Reduce a fact history to the current value per key.
     * The most recently created fact wins; equal timestamps are broken by
     * insertion order (later wins). Keys whose current value is null are absent.
     *
     * @param facts Fact history in insertion order
     * @return Current values
     */
    public NormalizedFacts normalize(Collection<Fact> facts) {
        if (facts == null || facts.isEmpty()) {
            return NormalizedFacts.empty();
        }

        Map<String, Fact> current = new LinkedHashMap<>();
        for (Fact fact : facts) {
            if (fact == null) {
                continue;
            }
            Fact existing = current.get(fact.key());
            if (existing == null || !fact.createdAt().isBefore(existing.createdAt())) {
                current.put(fact.key(), fact);
            }
        }

        Map<String, Object> values = new LinkedHashMap<>();
        for (Fact fact : current.values()) {
            values.put(fact.key(), fact.value());
        }

        NormalizedFacts normalized = NormalizedFacts.of(values);
        log.debug("Normalized {} facts into {} current values", facts.size(), normalized.size());
        return normalized;
    }

    /**
     * Coerce the variables an expression uses into the types its usage implies.
     * Variables without a usage hint, or with {@link ValueType#ANY}, are left as-is.
     *
     * @param facts Current values
     * @param usage Expected type per variable name
     * @return Facts with coerced values
     */
    public NormalizedFacts coerce(NormalizedFacts facts, Map<String, ValueType> usage) {
        if (usage == null || usage.isEmpty() || facts.size() == 0) {
            return facts;
        }

        Map<String, Object> values = new LinkedHashMap<>(facts.asMap());
        boolean changed = false;
        for (Map.Entry<String, ValueType> entry : usage.entrySet()) {
            Object raw = values.get(entry.getKey());
            if (raw == null) {
                continue;
            }
            Object coerced = switch (entry.getValue()) {
                case NUMBER -> toNumber(raw).map(Object.class::cast).orElse(raw);
                case BOOLEAN -> toBoolean(raw).map(Object.class::cast).orElse(raw);
                case ANY -> raw;
            };
            if (coerced != raw) {
                values.put(entry.getKey(), coerced);
                changed = true;
            }
        }
        return changed ? NormalizedFacts.of(values) : facts;
    }

    /**
     * Normalize a history and coerce it for one expression's usage in one step.
     */
    public NormalizedFacts normalize(Collection<Fact> facts, Map<String, ValueType> usage) {
        return coerce(normalize(facts), usage);
    }

    Optional<Double> toNumber(Object value) {
        if (value instanceof Boolean) {
            return Optional.empty();
        }
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (value instanceof String s) {
            String trimmed = s.trim();
            if (!NUMERIC.matcher(trimmed).matches()) {
                return Optional.empty();
            }
            try {
                return Optional.of(Double.parseDouble(trimmed));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    Optional<Boolean> toBoolean(Object value) {
        if (value instanceof Boolean b) {
            return Optional.of(b);
        }
        if (value instanceof String s) {
            String lower = s.trim().toLowerCase(Locale.ROOT);
            if ("true".equals(lower)) {
                return Optional.of(Boolean.TRUE);
            }
            if ("false".equals(lower)) {
                return Optional.of(Boolean.FALSE);
            }
        }
        return Optional.empty();
    }
}
