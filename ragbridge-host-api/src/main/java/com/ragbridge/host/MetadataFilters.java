package com.ragbridge.host;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Metadata filter grammar shared by every {@link VectorStore}. A filter is a map of metadata key to condition;
 * all conditions must hold (AND):
 * <ul>
 *   <li>{@code "k": scalar} – metadata value equals the scalar</li>
 *   <li>{@code "k": [a, b]} – metadata value is one of the listed values</li>
 *   <li>{@code "k": {"$eq"|"$ne"|"$gt"|"$gte"|"$lt"|"$lte"|"$in": v}} – operator conditions, all must hold</li>
 * </ul>
 * Numbers compare by numeric value (5 equals 5.0). Range operators on a missing or non-numeric value do not match.
 * An empty filter matches everything.
 */
public final class MetadataFilters {

    public static final String EQ = "$eq";
    public static final String NE = "$ne";
    public static final String GT = "$gt";
    public static final String GTE = "$gte";
    public static final String LT = "$lt";
    public static final String LTE = "$lte";
    public static final String IN = "$in";

    private static final Set<String> OPERATORS = Set.of(EQ, NE, GT, GTE, LT, LTE, IN);

    private MetadataFilters() {
    }

    /**
     * Checks that every operator is known and range operands are numbers.
     *
     * @throws IllegalArgumentException on an invalid filter
     */
    public static void validate(Map<String, Object> filters) {
        if (filters == null) return;
        for (Map.Entry<String, Object> e : filters.entrySet()) {
            if (!(e.getValue() instanceof Map)) continue;
            Map<?, ?> ops = (Map<?, ?>) e.getValue();
            for (Map.Entry<?, ?> op : ops.entrySet()) {
                String name = String.valueOf(op.getKey());
                if (!OPERATORS.contains(name)) {
                    throw new IllegalArgumentException("Unknown filter operator '" + name + "' on key " + e.getKey());
                }
                if (isRange(name) && !(op.getValue() instanceof Number)) {
                    throw new IllegalArgumentException("Filter operator " + name + " on key " + e.getKey() + " needs a number");
                }
                if (IN.equals(name) && !(op.getValue() instanceof Collection)) {
                    throw new IllegalArgumentException("Filter operator $in on key " + e.getKey() + " needs a list");
                }
            }
        }
    }

    /** Whether {@code metadata} satisfies every condition in {@code filters}. */
    public static boolean matches(Map<String, Object> filters, Map<String, Object> metadata) {
        if (filters == null || filters.isEmpty()) return true;
        Map<String, Object> md = metadata != null ? metadata : Map.of();
        for (Map.Entry<String, Object> e : filters.entrySet()) {
            Object actual = md.get(e.getKey());
            Object condition = e.getValue();
            if (condition instanceof Map) {
                for (Map.Entry<?, ?> op : ((Map<?, ?>) condition).entrySet()) {
                    if (!matchesOperator(String.valueOf(op.getKey()), op.getValue(), actual)) return false;
                }
            } else if (condition instanceof Collection) {
                if (!containsValue((Collection<?>) condition, actual)) return false;
            } else if (!sameValue(condition, actual)) {
                return false;
            }
        }
        return true;
    }

    static boolean isRange(String op) {
        return GT.equals(op) || GTE.equals(op) || LT.equals(op) || LTE.equals(op);
    }

    private static boolean matchesOperator(String op, Object operand, Object actual) {
        switch (op) {
            case EQ:
                return sameValue(operand, actual);
            case NE:
                return !sameValue(operand, actual);
            case IN:
                return operand instanceof Collection && containsValue((Collection<?>) operand, actual);
            case GT:
            case GTE:
            case LT:
            case LTE:
                if (!(actual instanceof Number) || !(operand instanceof Number)) return false;
                int cmp = Double.compare(((Number) actual).doubleValue(), ((Number) operand).doubleValue());
                if (GT.equals(op)) return cmp > 0;
                if (GTE.equals(op)) return cmp >= 0;
                if (LT.equals(op)) return cmp < 0;
                return cmp <= 0;
            default:
                throw new IllegalArgumentException("Unknown filter operator: " + op);
        }
    }

    private static boolean containsValue(Collection<?> options, Object actual) {
        for (Object o : options) {
            if (sameValue(o, actual)) return true;
        }
        return false;
    }

    private static boolean sameValue(Object expected, Object actual) {
        if (expected instanceof Number && actual instanceof Number) {
            return Double.compare(((Number) expected).doubleValue(), ((Number) actual).doubleValue()) == 0;
        }
        return Objects.equals(expected, actual);
    }
}
