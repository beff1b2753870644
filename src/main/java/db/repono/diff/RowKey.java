package db.repono.diff;

import java.util.ArrayList;
import java.util.List;

import db.repono.storage.Row;
import db.repono.storage.Value;

/**
 * Identity of a row for matching across two commits: the values at the key positions,
 * compared kind-sensitively with {@link Value#notDistinct} or bit identity.
 *
 * <p>{@link #of} returns null for rows that can never match anything: a NULL or NaN in a
 * declared primary key. In whole-row mode NULL matches NULL and NaN matches NaN.
 */
final class RowKey {
    private final List<Value> values;
    private final int hash;

    private RowKey(List<Value> values) {
        this.values = values;
        int h = 1;
        for (Value v : values) h = 31 * h + hashOf(v);
        this.hash = h;
    }

    static RowKey of(Row row, int[] positions, boolean nullsMatch) {
        List<Value> out = new ArrayList<>(positions.length);
        for (int p : positions) {
            Value v = row.get(p);
            if (!nullsMatch && (v.isNull() || isNaN(v))) return null;
            out.add(v);
        }
        return new RowKey(out);
    }

    private static boolean isNaN(Value v) {
        return v.kind() == Value.Kind.FLOAT && Double.isNaN(v.asDouble());
    }

    static List<Value> values(Row row, int[] positions) {
        List<Value> out = new ArrayList<>(positions.length);
        for (int p : positions) out.add(row.get(p));
        return out;
    }

    private static int hashOf(Value v) {
        return switch (v.kind()) {
            case NULL -> 0;
            case INTEGER -> Long.hashCode(v.asLong());
            // 0.0 and -0.0 are equal, so they must hash alike
            case FLOAT -> Double.hashCode(v.asDouble() == 0.0 ? 0.0 : v.asDouble());
            case TEXT -> v.asText().hashCode();
            case BOOLEAN -> Boolean.hashCode(v.asBoolean());
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RowKey other) || other.values.size() != values.size()) return false;
        for (int i = 0; i < values.size(); i++) {
            Value a = values.get(i);
            Value b = other.values.get(i);
            if (!Value.notDistinct(a, b) && !a.equals(b)) return false;
        }
        return true;
    }

    @Override
    public int hashCode() { return hash; }
}
