package db.repono.diff;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import db.repono.catalog.ColumnSchema;
import db.repono.catalog.TableSchema;
import db.repono.commit.Commit;
import db.repono.commit.CommitNotFoundException;
import db.repono.commit.TableSnapshot;
import db.repono.storage.CommitStore;
import db.repono.storage.Row;
import db.repono.storage.Value;

/**
 * Computes table, schema and row deltas between two stored commits. Pure read: needs no branch state.
 *
 * <p>Rows are matched by their primary-key values, never by position. Tables without a declared
 * primary key match whole rows, with NULLs matching NULLs; repeated identical rows are paired
 * off one by one in stored order.
 */
public class Differ {
    private final CommitStore store;

    public Differ(CommitStore store) {
        this.store = store;
    }

    /**
     * @throws CommitNotFoundException if either digest is not stored
     */
    public CommitDiff diff(String fromDigest, String toDigest) {
        return diff(store.require(fromDigest), store.require(toDigest));
    }

    public static CommitDiff diff(Commit from, Commit to) {
        SortedSet<String> names = new TreeSet<>(from.tables().keySet());
        names.addAll(to.tables().keySet());

        List<String> added = new ArrayList<>();
        List<String> dropped = new ArrayList<>();
        List<TableDiff> tables = new ArrayList<>();
        for (String name : names) {
            TableSnapshot before = from.tables().get(name);
            TableSnapshot after = to.tables().get(name);
            if (before == null) {
                added.add(name);
            } else if (after == null) {
                dropped.add(name);
            } else {
                tables.add(diffTable(name, before, after));
            }
        }
        return new CommitDiff(from.digest(), to.digest(), added, dropped, tables);
    }

    static TableDiff diffTable(String name, TableSnapshot before, TableSnapshot after) {
        if (!before.schema().equals(after.schema())) return TableDiff.schemaChanged(name);

        TableSchema schema = after.schema();
        boolean wholeRow = !schema.hasPrimaryKey();
        int[] keyPositions = wholeRow ? allPositions(schema.columnCount()) : schema.primaryKeyIndexes();

        List<Row> oldRows = before.rows();
        Map<RowKey, Deque<Integer>> index = new HashMap<>();
        for (int i = 0; i < oldRows.size(); i++) {
            RowKey k = RowKey.of(oldRows.get(i), keyPositions, wholeRow);
            if (k != null) index.computeIfAbsent(k, x -> new ArrayDeque<>()).add(i);
        }

        boolean[] matched = new boolean[oldRows.size()];
        List<RowDiff> added = new ArrayList<>();
        List<RowDiff> modified = new ArrayList<>();
        for (Row newRow : after.rows()) {
            RowKey k = RowKey.of(newRow, keyPositions, wholeRow);
            Deque<Integer> candidates = k == null ? null : index.get(k);
            if (candidates == null || candidates.isEmpty()) {
                added.add(RowDiff.added(RowKey.values(newRow, keyPositions), newRow));
                continue;
            }
            int i = candidates.poll();
            matched[i] = true;
            if (wholeRow) continue;
            Row oldRow = oldRows.get(i);
            List<String> changed = changedColumns(schema, oldRow, newRow);
            if (!changed.isEmpty()) {
                modified.add(RowDiff.modified(RowKey.values(newRow, keyPositions), oldRow, newRow, changed));
            }
        }

        List<RowDiff> deleted = new ArrayList<>();
        for (int i = 0; i < oldRows.size(); i++) {
            if (!matched[i]) deleted.add(RowDiff.deleted(RowKey.values(oldRows.get(i), keyPositions), oldRows.get(i)));
        }
        return new TableDiff(name, false, added, deleted, modified);
    }

    // Non-key columns whose values differ. Two NULLs, or two bit-identical values, are unchanged.
    private static List<String> changedColumns(TableSchema schema, Row oldRow, Row newRow) {
        List<String> out = new ArrayList<>();
        List<ColumnSchema> cols = schema.columns();
        for (int i = 0; i < cols.size(); i++) {
            if (cols.get(i).primaryKey()) continue;
            Value a = oldRow.get(i);
            Value b = newRow.get(i);
            if (!Value.notDistinct(a, b) && !a.equals(b)) out.add(cols.get(i).name());
        }
        return out;
    }

    private static int[] allPositions(int n) {
        int[] out = new int[n];
        for (int i = 0; i < n; i++) out[i] = i;
        return out;
    }
}
