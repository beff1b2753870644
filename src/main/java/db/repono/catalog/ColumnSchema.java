package db.repono.catalog;

import java.util.Objects;

import db.repono.storage.Value;

// Immutable column definition. Name is unique within its TableSchema.
public record ColumnSchema(String name, DataType type, boolean primaryKey, boolean nullable) {

    public ColumnSchema {
        Objects.requireNonNull(name, "column name");
        Objects.requireNonNull(type, "column type");
        if (name.isBlank()) throw new IllegalArgumentException("Column name must not be blank");
    }

    /** Nullable, non-key column. */
    public static ColumnSchema column(String name, DataType type) {
        return new ColumnSchema(name, type, false, true);
    }

    public static ColumnSchema notNull(String name, DataType type) {
        return new ColumnSchema(name, type, false, false);
    }

    /** Primary-key column; never nullable. */
    public static ColumnSchema key(String name, DataType type) {
        return new ColumnSchema(name, type, true, false);
    }

    public boolean accepts(Value v) {
        if (v.isNull()) return nullable;
        return type.accepts(v.kind());
    }
}
