package db.repono.diff;

import java.util.List;
import java.util.Objects;

import db.repono.storage.Row;
import db.repono.storage.Value;

/**
 * One row-level change. {@code key} holds the identity values the row was matched on (the
 * primary-key values, or the whole row for tables without a primary key).
 * {@code oldRow} is null for ADDED, {@code newRow} is null for DELETED.
 * {@code changedColumns} is only populated for MODIFIED.
 */
public record RowDiff(ChangeType type, List<Value> key, Row oldRow, Row newRow, List<String> changedColumns) {

    public enum ChangeType { ADDED, DELETED, MODIFIED }

    public RowDiff {
        Objects.requireNonNull(type, "type");
        key = List.copyOf(key);
        changedColumns = List.copyOf(changedColumns);
    }

    static RowDiff added(List<Value> key, Row row) {
        return new RowDiff(ChangeType.ADDED, key, null, row, List.of());
    }

    static RowDiff deleted(List<Value> key, Row row) {
        return new RowDiff(ChangeType.DELETED, key, row, null, List.of());
    }

    static RowDiff modified(List<Value> key, Row oldRow, Row newRow, List<String> changedColumns) {
        return new RowDiff(ChangeType.MODIFIED, key, oldRow, newRow, changedColumns);
    }
}
