package db.repono.storage;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;

/**
 * A single scalar cell. Exactly one {@link Kind} is active and the payload is stored as given:
 * integers are never promoted to floats inside the value, only transiently while ordering.
 *
 * <p>Two notions of sameness live here. {@link #equal(Value, Value)} is the SQL-style comparison
 * where NULL is never equal to anything, itself included. {@link #equals(Object)} is plain
 * structural identity and is what collections and round-trip checks use.
 */
public final class Value {

    /** Kind tags. Declaration order is the fallback order between unrelated kinds. */
    public enum Kind { NULL, INTEGER, FLOAT, TEXT, BOOLEAN }

    public static final Value NULL = new Value(Kind.NULL, null);
    private static final Value TRUE = new Value(Kind.BOOLEAN, Boolean.TRUE);
    private static final Value FALSE = new Value(Kind.BOOLEAN, Boolean.FALSE);

    /** Total order over all values, NULL last. */
    public static final Comparator<Value> ORDER = Value::compare;

    private final Kind kind;
    private final Object payload;

    private Value(Kind kind, Object payload) {
        this.kind = kind;
        this.payload = payload;
    }

    public static Value ofInteger(long v) { return new Value(Kind.INTEGER, v); }
    public static Value ofFloat(double v) { return new Value(Kind.FLOAT, v); }
    public static Value ofBoolean(boolean v) { return v ? TRUE : FALSE; }

    public static Value ofText(String v) {
        return new Value(Kind.TEXT, Objects.requireNonNull(v, "text must not be null (use Value.NULL)"));
    }

    /**
     * Converts a plain Java object: integral boxes map to INTEGER, Double/Float to FLOAT,
     * String to TEXT, Boolean to BOOLEAN and {@code null} to NULL.
     */
    public static Value of(Object o) {
        if (o == null) return NULL;
        if (o instanceof Value v) return v;
        if (o instanceof Long || o instanceof Integer || o instanceof Short || o instanceof Byte) {
            return ofInteger(((Number) o).longValue());
        }
        if (o instanceof Double || o instanceof Float) return ofFloat(((Number) o).doubleValue());
        if (o instanceof String s) return ofText(s);
        if (o instanceof Boolean b) return ofBoolean(b);
        throw new IllegalArgumentException("Unsupported value type: " + o.getClass().getSimpleName());
    }

    public Kind kind() { return kind; }
    public boolean isNull() { return kind == Kind.NULL; }

    public static boolean isNull(Value v) { return v.isNull(); }

    public long asLong() {
        requireKind(Kind.INTEGER);
        return (Long) payload;
    }

    public double asDouble() {
        requireKind(Kind.FLOAT);
        return (Double) payload;
    }

    public String asText() {
        requireKind(Kind.TEXT);
        return (String) payload;
    }

    public boolean asBoolean() {
        requireKind(Kind.BOOLEAN);
        return (Boolean) payload;
    }

    private void requireKind(Kind expected) {
        if (kind != expected) throw new IllegalStateException("Value is " + kind + ", not " + expected);
    }

    /**
     * Display form: NULL, decimal integers, floats with two decimals, text as-is,
     * booleans as true/false.
     */
    public String render() {
        return switch (kind) {
            case NULL -> "NULL";
            case INTEGER -> Long.toString((Long) payload);
            case FLOAT -> String.format(Locale.ROOT, "%.2f", (Double) payload);
            case TEXT -> (String) payload;
            case BOOLEAN -> ((Boolean) payload) ? "true" : "false";
        };
    }

    /**
     * SQL-style equality. Any NULL operand yields false, different kinds are unequal,
     * same kinds compare natively (so NaN is not equal to NaN and 0.0 equals -0.0).
     */
    public static boolean equal(Value a, Value b) {
        if (a.isNull() || b.isNull()) return false;
        if (a.kind != b.kind) return false;
        return switch (a.kind) {
            case INTEGER -> a.asLong() == b.asLong();
            case FLOAT -> a.asDouble() == b.asDouble();
            default -> a.payload.equals(b.payload);
        };
    }

    /** Like {@link #equal} except that two NULLs are treated as the same (IS NOT DISTINCT FROM). */
    public static boolean notDistinct(Value a, Value b) {
        if (a.isNull() && b.isNull()) return true;
        return equal(a, b);
    }

    public static boolean lessThan(Value a, Value b) {
        return compare(a, b) < 0;
    }

    /**
     * Three-way comparison backing {@link #lessThan}. Numbers compare across INTEGER and FLOAT by
     * widening to double; when the widened values tie the INTEGER sorts first so the order stays
     * strict. Floats use {@link Double#compare} so NaN and signed zeros have a fixed place.
     */
    public static int compare(Value a, Value b) {
        if (a.isNull()) return b.isNull() ? 0 : 1;
        if (b.isNull()) return -1;
        if (a.isNumeric() && b.isNumeric()) return compareNumeric(a, b);
        if (a.kind != b.kind) return Integer.compare(a.kind.ordinal(), b.kind.ordinal());
        return switch (a.kind) {
            case TEXT -> a.asText().compareTo(b.asText());
            case BOOLEAN -> Boolean.compare(a.asBoolean(), b.asBoolean());
            default -> throw new IllegalStateException("Unexpected kind " + a.kind);
        };
    }

    private static int compareNumeric(Value a, Value b) {
        if (a.kind == Kind.INTEGER && b.kind == Kind.INTEGER) {
            return Long.compare(a.asLong(), b.asLong());
        }
        int c = Double.compare(a.widen(), b.widen());
        if (c != 0 || a.kind == b.kind) return c;
        return Integer.compare(a.kind.ordinal(), b.kind.ordinal());
    }

    private boolean isNumeric() {
        return kind == Kind.INTEGER || kind == Kind.FLOAT;
    }

    private double widen() {
        return kind == Kind.INTEGER ? (double) asLong() : asDouble();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value other)) return false;
        return kind == other.kind && Objects.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + Objects.hashCode(payload);
    }

    @Override
    public String toString() {
        return kind == Kind.TEXT ? "'" + payload + "'" : render();
    }
}
