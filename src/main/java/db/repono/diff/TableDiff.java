package db.repono.diff;

import java.util.List;

/**
 * Changes to one table present in both commits. When the schema changed, no row-level
 * comparison is attempted and the row lists are empty.
 */
public record TableDiff(String table, boolean schemaChanged,
                        List<RowDiff> added, List<RowDiff> deleted, List<RowDiff> modified) {

    public TableDiff {
        added = List.copyOf(added);
        deleted = List.copyOf(deleted);
        modified = List.copyOf(modified);
    }

    static TableDiff schemaChanged(String table) {
        return new TableDiff(table, true, List.of(), List.of(), List.of());
    }

    public boolean hasChanges() {
        return schemaChanged || !added.isEmpty() || !deleted.isEmpty() || !modified.isEmpty();
    }
}
