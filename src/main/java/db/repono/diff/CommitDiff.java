package db.repono.diff;

import java.util.List;
import java.util.Optional;

/**
 * Everything that changed going from one commit to another. Table lists are in name order.
 * {@code tables} has an entry for every table present in both commits, changed or not.
 */
public record CommitDiff(String from, String to, List<String> tablesAdded, List<String> tablesDropped,
                         List<TableDiff> tables) {

    public CommitDiff {
        tablesAdded = List.copyOf(tablesAdded);
        tablesDropped = List.copyOf(tablesDropped);
        tables = List.copyOf(tables);
    }

    public Optional<TableDiff> table(String name) {
        return tables.stream().filter(t -> t.table().equals(name)).findFirst();
    }

    public boolean isEmpty() {
        return tablesAdded.isEmpty() && tablesDropped.isEmpty() && tables.stream().noneMatch(TableDiff::hasChanges);
    }
}
