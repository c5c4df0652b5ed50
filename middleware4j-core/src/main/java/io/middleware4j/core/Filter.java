package io.middleware4j.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A single query filter, either {@code [field, operator, value]} or an {@code ["OR", [...]]} disjunction.
 *
 * <p>This is an API-layer object. Datastores translate it into their own query language, and the in-process
 * filter engine evaluates it against already-extended records.
 */
public record Filter(String field, String operator, Object value, List<Filter> anyOf) {

    public static final Set<String> OPERATORS = Set.of(
            "=", "!=", ">", ">=", "<", "<=", "~", "in", "nin", "rin", "rnin", "^", "!^", "$", "!$"
    );

    public Filter {
        if (anyOf != null) {
            if (anyOf.isEmpty()) {
                throw new IllegalArgumentException("OR filter requires at least one member");
            }
            anyOf = List.copyOf(anyOf);
        } else {
            Objects.requireNonNull(field, "field must not be null");
            Objects.requireNonNull(operator, "operator must not be null");
            if (!OPERATORS.contains(operator)) {
                throw new IllegalArgumentException("Invalid operator: " + operator);
            }
        }
    }

    public static Filter of(String field, String operator, Object value) {
        return new Filter(field, operator, value, null);
    }

    public static Filter eq(String field, Object value) {
        return of(field, "=", value);
    }

    public static Filter or(Filter... filters) {
        return new Filter(null, null, null, Arrays.asList(filters));
    }

    public boolean isOr() {
        return anyOf != null;
    }

    /**
     * Parse the wire form, e.g. {@code [["name", "=", "tank"], ["OR", [["a", "=", 1], ["b", "=", 2]]]]}.
     */
    public static List<Filter> parse(List<?> raw) {
        if (raw == null) {
            return List.of();
        }
        List<Filter> out = new ArrayList<>(raw.size());
        for (Object item : raw) {
            out.add(parseOne(item));
        }
        return out;
    }

    private static Filter parseOne(Object item) {
        if (item instanceof Filter f) {
            return f;
        }
        if (!(item instanceof List<?> parts)) {
            throw new IllegalArgumentException("Filter must be a list: " + item);
        }
        if (parts.size() == 2 && "OR".equals(parts.get(0))) {
            if (!(parts.get(1) instanceof List<?> members)) {
                throw new IllegalArgumentException("OR filter requires a list of filters");
            }
            return new Filter(null, null, null, parse(members));
        }
        if (parts.size() != 3) {
            throw new IllegalArgumentException("Filter must have exactly three elements: " + item);
        }
        return of(String.valueOf(parts.get(0)), String.valueOf(parts.get(1)), parts.get(2));
    }
}
