package db.repono.commit;

import java.util.List;
import java.util.Objects;

import db.repono.catalog.SchemaMismatchException;
import db.repono.catalog.TableSchema;
import db.repono.catalog.ValidationResult;
import db.repono.storage.Row;

/**
 * A table's schema and full row set at one point in history. Both are captured as immutable
 * copies, so later changes to the caller's schema or row list do not leak into a commit.
 * Row order is kept exactly as supplied.
 */
public record TableSnapshot(TableSchema schema, List<Row> rows) {

    public TableSnapshot {
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(rows, "rows");
        schema = schema.immutableCopy();
        rows = List.copyOf(rows);
    }

    public static TableSnapshot of(TableSchema schema, Row... rows) {
        return new TableSnapshot(schema, List.of(rows));
    }

    public int rowCount() { return rows.size(); }

    /**
     * Re-validates every row against the schema.
     *
     * @throws SchemaMismatchException on the first row that violates the schema
     */
    public void validate(String tableName) {
        for (int i = 0; i < rows.size(); i++) {
            ValidationResult result = schema.validateRow(rows.get(i));
            if (!result.isValid()) throw new SchemaMismatchException(tableName, i, result);
        }
    }
}
