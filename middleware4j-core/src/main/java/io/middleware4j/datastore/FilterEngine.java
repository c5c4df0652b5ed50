package io.middleware4j.datastore;

import io.middleware4j.core.Filter;
import io.middleware4j.core.QueryOptions;
import io.middleware4j.core.QueryResult;
import io.middleware4j.errors.InstanceNotFoundException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * In-process evaluation of {@link Filter}s and {@link QueryOptions} over already materialized records.
 *
 * <p>Used whenever a store has an extend transform, because extended fields do not exist in storage, and by
 * backends that have no query language of their own.
 */
public final class FilterEngine {

    private FilterEngine() {
    }

    public static QueryResult apply(List<Map<String, Object>> rows, List<Filter> filters, QueryOptions options) {
        Objects.requireNonNull(rows, "rows must not be null");
        QueryOptions opts = options == null ? QueryOptions.defaults() : options;

        List<Map<String, Object>> matched = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            if (matchesAll(row, filters)) {
                matched.add(row);
            }
        }

        if (opts.count()) {
            return QueryResult.ofCount(page(sort(matched, opts.orderBy()), opts).size());
        }

        List<Map<String, Object>> result = page(sort(matched, opts.orderBy()), opts);
        if (!opts.select().isEmpty()) {
            List<Map<String, Object>> selected = new ArrayList<>(result.size());
            for (Map<String, Object> row : result) {
                selected.add(select(row, opts.select()));
            }
            result = selected;
        }

        if (opts.get()) {
            if (result.isEmpty()) {
                throw new InstanceNotFoundException("No entry matches the given filters");
            }
            return QueryResult.ofEntry(result.get(0));
        }
        return QueryResult.ofList(result);
    }

    public static boolean matchesAll(Map<String, Object> row, List<Filter> filters) {
        if (filters == null) {
            return true;
        }
        for (Filter f : filters) {
            if (!matches(row, f)) {
                return false;
            }
        }
        return true;
    }

    public static boolean matches(Map<String, Object> row, Filter filter) {
        if (filter.isOr()) {
            for (Filter member : filter.anyOf()) {
                if (matches(row, member)) {
                    return true;
                }
            }
            return false;
        }

        Object actual = resolve(row, filter.field());
        Object expected = filter.value();
        return switch (filter.operator()) {
            case "=" -> valuesEqual(actual, expected);
            case "!=" -> !valuesEqual(actual, expected);
            case ">" -> bothPresent(actual, expected) && compareNonNull(actual, expected) > 0;
            case ">=" -> bothPresent(actual, expected) && compareNonNull(actual, expected) >= 0;
            case "<" -> bothPresent(actual, expected) && compareNonNull(actual, expected) < 0;
            case "<=" -> bothPresent(actual, expected) && compareNonNull(actual, expected) <= 0;
            case "~" -> actual != null && Pattern.compile(String.valueOf(expected)).matcher(String.valueOf(actual)).find();
            case "in" -> contains(expected, actual);
            case "nin" -> !contains(expected, actual);
            case "rin" -> actual != null && contains(actual, expected);
            case "rnin" -> actual != null && !contains(actual, expected);
            case "^" -> actual instanceof String s && s.startsWith(String.valueOf(expected));
            case "!^" -> actual instanceof String s && !s.startsWith(String.valueOf(expected));
            case "$" -> actual instanceof String s && s.endsWith(String.valueOf(expected));
            case "!$" -> actual instanceof String s && !s.endsWith(String.valueOf(expected));
            default -> throw new IllegalArgumentException("Invalid operator: " + filter.operator());
        };
    }

    /**
     * Resolve a possibly dotted field path. An exact top-level key wins over path traversal.
     */
    @SuppressWarnings("unchecked")
    public static Object resolve(Map<String, Object> row, String path) {
        if (row.containsKey(path)) {
            return row.get(path);
        }
        Object current = row;
        for (String part : path.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<String, Object>) current).get(part);
        }
        return current;
    }

    static boolean valuesEqual(Object a, Object b) {
        if (a instanceof Number na && b instanceof Number nb) {
            return toDecimal(na).compareTo(toDecimal(nb)) == 0;
        }
        return Objects.equals(a, b);
    }

    private static boolean bothPresent(Object a, Object b) {
        return a != null && b != null;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    static int compareNonNull(Object a, Object b) {
        if (a == null || b == null) {
            return a == b ? 0 : (a == null ? -1 : 1);
        }
        if (a instanceof Number na && b instanceof Number nb) {
            return toDecimal(na).compareTo(toDecimal(nb));
        }
        if (a instanceof Comparable ca && a.getClass().isInstance(b)) {
            return ca.compareTo(b);
        }
        return String.valueOf(a).compareTo(String.valueOf(b));
    }

    private static boolean contains(Object container, Object value) {
        if (container instanceof Collection<?> c) {
            for (Object item : c) {
                if (valuesEqual(item, value)) {
                    return true;
                }
            }
            return false;
        }
        if (container instanceof String s && value != null) {
            return s.contains(String.valueOf(value));
        }
        return false;
    }

    private static BigDecimal toDecimal(Number n) {
        if (n instanceof BigDecimal bd) {
            return bd;
        }
        if (n instanceof Double || n instanceof Float) {
            return BigDecimal.valueOf(n.doubleValue());
        }
        return BigDecimal.valueOf(n.longValue());
    }

    private static List<Map<String, Object>> sort(List<Map<String, Object>> rows, List<String> orderBy) {
        if (orderBy.isEmpty()) {
            return rows;
        }
        Comparator<Map<String, Object>> comparator = null;
        for (String spec : orderBy) {
            boolean desc = spec.startsWith("-");
            String field = desc ? spec.substring(1) : spec;
            Comparator<Map<String, Object>> c = (x, y) -> compareNullsLast(resolve(x, field), resolve(y, field));
            if (desc) {
                c = c.reversed();
            }
            comparator = comparator == null ? c : comparator.thenComparing(c);
        }
        List<Map<String, Object>> sorted = new ArrayList<>(rows);
        sorted.sort(comparator);
        return sorted;
    }

    private static int compareNullsLast(Object a, Object b) {
        if (a == null || b == null) {
            return a == b ? 0 : (a == null ? 1 : -1);
        }
        return compareNonNull(a, b);
    }

    private static List<Map<String, Object>> page(List<Map<String, Object>> rows, QueryOptions opts) {
        int from = Math.min(opts.offset(), rows.size());
        int to = opts.limit() > 0 ? Math.min(rows.size(), from + opts.limit()) : rows.size();
        return rows.subList(from, to);
    }

    private static Map<String, Object> select(Map<String, Object> row, List<String> fields) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (String field : fields) {
            if (row.containsKey(field)) {
                out.put(field, row.get(field));
            }
        }
        return out;
    }
}
