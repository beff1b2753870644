package db.repono.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import db.repono.storage.Row;
import db.repono.storage.Value;

/**
 * Ordered column definitions plus a name to position index. Column order defines the
 * positions of row values. Columns can only be appended.
 *
 * <p>A schema captured into a commit is an immutable copy (see {@link #immutableCopy()});
 * calling {@link #addColumn} on such a copy fails.
 */
public class TableSchema {
    private final List<ColumnSchema> columns = new ArrayList<>();
    private final Map<String, Integer> positions = new HashMap<>();
    private final boolean frozen;

    public TableSchema() {
        this.frozen = false;
    }

    public TableSchema(List<ColumnSchema> columns) {
        this.frozen = false;
        for (ColumnSchema c : columns) addColumn(c);
    }

    private TableSchema(TableSchema source, boolean frozen) {
        this.frozen = frozen;
        this.columns.addAll(source.columns);
        this.positions.putAll(source.positions);
    }

    public static TableSchema of(ColumnSchema... columns) {
        return new TableSchema(List.of(columns));
    }

    /**
     * Appends a column and registers it at its new position.
     *
     * @throws DuplicateColumnException if a column with the same name already exists
     */
    public void addColumn(ColumnSchema def) {
        if (frozen) throw new UnsupportedOperationException("Schema is immutable");
        if (positions.containsKey(def.name())) throw new DuplicateColumnException(def.name());
        columns.add(def);
        positions.put(def.name(), columns.size() - 1);
    }

    public int columnCount() { return columns.size(); }

    public List<ColumnSchema> columns() { return Collections.unmodifiableList(columns); }

    public OptionalInt indexOf(String name) {
        Integer pos = positions.get(name);
        return pos == null ? OptionalInt.empty() : OptionalInt.of(pos);
    }

    public Optional<ColumnSchema> get(String name) {
        Integer pos = positions.get(name);
        return pos == null ? Optional.empty() : Optional.of(columns.get(pos));
    }

    public boolean hasColumn(String name) { return positions.containsKey(name); }

    /** Positions of the primary-key columns in declaration order; empty when none is declared. */
    public int[] primaryKeyIndexes() {
        int count = 0;
        for (ColumnSchema c : columns) if (c.primaryKey()) count++;
        int[] out = new int[count];
        int k = 0;
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).primaryKey()) out[k++] = i;
        }
        return out;
    }

    public boolean hasPrimaryKey() { return primaryKeyIndexes().length > 0; }

    // Checks arity first, then each column for nullability and type. Reports the first violation.
    public ValidationResult validateRow(Row row) {
        if (row.size() != columns.size()) {
            return ValidationResult.arityMismatch(columns.size(), row.size());
        }
        for (int i = 0; i < columns.size(); i++) {
            ColumnSchema col = columns.get(i);
            Value v = row.get(i);
            if (col.accepts(v)) continue;
            if (v.isNull()) return ValidationResult.nullViolation(col.name());
            return ValidationResult.typeMismatch(col.name(), col.type(), v.kind());
        }
        return ValidationResult.ok();
    }

    public boolean isImmutable() { return frozen; }

    public TableSchema immutableCopy() {
        return frozen ? this : new TableSchema(this, true);
    }

    /** Mutable copy, for deriving an altered schema from a committed one. */
    public TableSchema copy() {
        return new TableSchema(this, false);
    }

    // Structural: same ordered column list (name, type, key flag, nullability).
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof TableSchema other && columns.equals(other.columns);
    }

    @Override
    public int hashCode() { return columns.hashCode(); }

    @Override
    public String toString() { return "TableSchema" + columns; }
}
