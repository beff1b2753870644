package db.repono;

import java.util.LinkedHashMap;
import java.util.Map;

import db.repono.catalog.ColumnSchema;
import db.repono.catalog.DataType;
import db.repono.catalog.TableSchema;
import db.repono.commit.TableSnapshot;
import db.repono.storage.Row;

/**
 * Shared schemas and snapshots for tests.
 */
public final class Fixtures {
    private Fixtures() {}

    // users(id PK, name, age)
    public static TableSchema usersSchema() {
        return TableSchema.of(
            ColumnSchema.key("id", DataType.INTEGER),
            ColumnSchema.column("name", DataType.TEXT),
            ColumnSchema.column("age", DataType.INTEGER)
        );
    }

    public static TableSnapshot users(Row... rows) {
        return TableSnapshot.of(usersSchema(), rows);
    }

    // tags(label, weight) without a primary key
    public static TableSchema tagsSchema() {
        return TableSchema.of(
            ColumnSchema.column("label", DataType.TEXT),
            ColumnSchema.column("weight", DataType.FLOAT)
        );
    }

    public static TableSnapshot tags(Row... rows) {
        return TableSnapshot.of(tagsSchema(), rows);
    }

    /** Alternating name, snapshot pairs in insertion order. */
    public static Map<String, TableSnapshot> tables(Object... pairs) {
        Map<String, TableSnapshot> out = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            out.put((String) pairs[i], (TableSnapshot) pairs[i + 1]);
        }
        return out;
    }
}
