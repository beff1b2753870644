package db.repono.storage;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered sequence of values, one per column of the schema it is read against.
 * A row carries no identity of its own.
 */
public final class Row {
    private final List<Value> values;

    public Row(List<Value> values) {
        this.values = List.copyOf(values);
    }

    /** Builds a row from plain Java objects, see {@link Value#of(Object)}. */
    public static Row of(Object... values) {
        List<Value> out = new ArrayList<>(values.length);
        for (Object o : values) out.add(Value.of(o));
        return new Row(out);
    }

    public int size() { return values.size(); }
    public Value get(int index) { return values.get(index); }
    public List<Value> values() { return values; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof Row other && values.equals(other.values);
    }

    @Override
    public int hashCode() { return values.hashCode(); }

    @Override
    public String toString() { return "Row" + values; }
}
