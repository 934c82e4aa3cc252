package work.hostcheck.engine.compare;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Fixed comparator vocabulary. Every comparator receives {@code (expected, actual)} in that order,
 * so {@code lt} passes when {@code expected < actual} and {@code contains} when {@code actual} is in {@code expected}.
 */
public final class ComparatorRegistry {
    private static final ComparatorRegistry STANDARD = new ComparatorRegistry(standardComparators());

    private final Map<String, Comparator> comparators;

    private ComparatorRegistry(Map<String, Comparator> comparators) {
        this.comparators = Collections.unmodifiableMap(new LinkedHashMap<>(comparators));
    }

    public static ComparatorRegistry standard() {
        return STANDARD;
    }

    public Comparator resolve(String name) {
        if (name == null || name.isBlank()) {
            throw new ComparatorNotFoundException(String.valueOf(name));
        }
        Comparator comparator = comparators.get(name);
        if (comparator == null) {
            throw new ComparatorNotFoundException(name);
        }
        return comparator;
    }

    public boolean contains(String name) {
        return name != null && comparators.containsKey(name);
    }

    public Set<String> names() {
        return comparators.keySet();
    }

    private static Map<String, Comparator> standardComparators() {
        var map = new LinkedHashMap<String, Comparator>();
        map.put("eq", ComparatorRegistry::looseEquals);
        map.put("ne", (expected, actual) -> !looseEquals(expected, actual));
        map.put("lt", (expected, actual) -> order(expected, actual, "lt") < 0);
        map.put("le", (expected, actual) -> order(expected, actual, "le") <= 0);
        map.put("gt", (expected, actual) -> order(expected, actual, "gt") > 0);
        map.put("ge", (expected, actual) -> order(expected, actual, "ge") >= 0);
        map.put("is_", ComparatorRegistry::identical);
        map.put("is_not", (expected, actual) -> !identical(expected, actual));
        map.put("contains", ComparatorRegistry::containsItem);
        map.put("search", ComparatorRegistry::search);
        return map;
    }

    static boolean looseEquals(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return compareNumbers(l, r) == 0;
        }
        if (left instanceof List<?> l && right instanceof List<?> r) {
            if (l.size() != r.size()) {
                return false;
            }
            Iterator<?> li = l.iterator();
            Iterator<?> ri = r.iterator();
            while (li.hasNext()) {
                if (!looseEquals(li.next(), ri.next())) {
                    return false;
                }
            }
            return true;
        }
        if (left instanceof Map<?, ?> l && right instanceof Map<?, ?> r) {
            if (!l.keySet().equals(r.keySet())) {
                return false;
            }
            for (var entry : l.entrySet()) {
                if (!looseEquals(entry.getValue(), r.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        if (left instanceof CharSequence l && right instanceof CharSequence r) {
            return l.toString().equals(r.toString());
        }
        return Objects.equals(left, right);
    }

    // null and booleans are singletons in the declaration model, everything else is compared by reference
    private static boolean identical(Object expected, Object actual) {
        if (expected == null || actual == null) {
            return expected == actual;
        }
        if (expected instanceof Boolean && actual instanceof Boolean) {
            return expected.equals(actual);
        }
        return expected == actual;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int order(Object expected, Object actual, String name) {
        if (expected instanceof Number l && actual instanceof Number r) {
            return compareNumbers(l, r);
        }
        if (expected instanceof CharSequence l && actual instanceof CharSequence r) {
            return l.toString().compareTo(r.toString());
        }
        if (expected instanceof Comparable l && actual != null && expected.getClass().equals(actual.getClass())) {
            return l.compareTo(actual);
        }
        throw new IncomparableValuesException(
            "'" + name + "' not supported between " + typeName(expected) + " and " + typeName(actual)
        );
    }

    private static boolean containsItem(Object expected, Object actual) {
        if (expected instanceof Collection<?> items) {
            for (Object item : items) {
                if (looseEquals(item, actual)) {
                    return true;
                }
            }
            return false;
        }
        if (expected instanceof Map<?, ?> map) {
            return map.containsKey(actual);
        }
        if (expected instanceof CharSequence text) {
            if (!(actual instanceof CharSequence needle)) {
                throw new IncomparableValuesException(
                    "'in <string>' requires string as left operand, not " + typeName(actual)
                );
            }
            return text.toString().contains(needle);
        }
        throw new IncomparableValuesException("argument of type " + typeName(expected) + " is not a container");
    }

    private static boolean search(Object expected, Object actual) {
        if (!(expected instanceof CharSequence pattern)) {
            throw new IncomparableValuesException("search pattern must be a string, not " + typeName(expected));
        }
        if (!(actual instanceof CharSequence subject)) {
            throw new IncomparableValuesException("search subject must be a string, not " + typeName(actual));
        }
        try {
            return Pattern.compile(pattern.toString()).matcher(subject).find();
        } catch (PatternSyntaxException ex) {
            throw new IncomparableValuesException("Invalid search pattern " + pattern + ": " + ex.getDescription());
        }
    }

    private static int compareNumbers(Number left, Number right) {
        if (isSpecialFloat(left) || isSpecialFloat(right)) {
            return Double.compare(left.doubleValue(), right.doubleValue());
        }
        return toBigDecimal(left).compareTo(toBigDecimal(right));
    }

    private static boolean isSpecialFloat(Number value) {
        if (value instanceof Double || value instanceof Float) {
            double d = value.doubleValue();
            return Double.isNaN(d) || Double.isInfinite(d);
        }
        return false;
    }

    private static BigDecimal toBigDecimal(Number value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (value instanceof Double || value instanceof Float) {
            return new BigDecimal(value.toString());
        }
        return BigDecimal.valueOf(value.longValue());
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
