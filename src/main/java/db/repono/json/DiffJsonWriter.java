package db.repono.json;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import db.repono.diff.CommitDiff;
import db.repono.diff.RowDiff;
import db.repono.diff.TableDiff;
import db.repono.storage.Row;
import db.repono.storage.Value;

/**
 * Renders a {@link CommitDiff} for presentation layers. Keeps the added / deleted / modified
 * grouping; values are written as plain JSON scalars.
 */
public class DiffJsonWriter {
    // Disable HTML escaping so text values stay readable
    private final Gson gson = new GsonBuilder()
        .disableHtmlEscaping()
        .serializeSpecialFloatingPointValues()
        .setPrettyPrinting()
        .create();

    public String toJson(CommitDiff diff) {
        return gson.toJson(toTree(diff));
    }

    public void write(CommitDiff diff, Writer out) throws IOException {
        gson.toJson(toTree(diff), out);
        out.flush();
    }

    Map<String, Object> toTree(CommitDiff diff) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("from", diff.from());
        root.put("to", diff.to());
        root.put("tables_added", diff.tablesAdded());
        root.put("tables_dropped", diff.tablesDropped());
        List<Object> tables = new ArrayList<>();
        for (TableDiff t : diff.tables()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("table", t.table());
            entry.put("schema_changed", t.schemaChanged());
            entry.put("added", rows(t.added()));
            entry.put("deleted", rows(t.deleted()));
            entry.put("modified", rows(t.modified()));
            tables.add(entry);
        }
        root.put("tables", tables);
        return root;
    }

    private static List<Object> rows(List<RowDiff> diffs) {
        List<Object> out = new ArrayList<>(diffs.size());
        for (RowDiff d : diffs) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("key", scalars(d.key()));
            if (d.oldRow() != null) entry.put("old", scalars(d.oldRow()));
            if (d.newRow() != null) entry.put("new", scalars(d.newRow()));
            if (d.type() == RowDiff.ChangeType.MODIFIED) entry.put("changed_columns", d.changedColumns());
            out.add(entry);
        }
        return out;
    }

    private static List<Object> scalars(Row row) {
        return scalars(row.values());
    }

    private static List<Object> scalars(List<Value> values) {
        List<Object> out = new ArrayList<>(values.size());
        for (Value v : values) {
            out.add(switch (v.kind()) {
                case NULL -> null;
                case INTEGER -> v.asLong();
                case FLOAT -> v.asDouble();
                case TEXT -> v.asText();
                case BOOLEAN -> v.asBoolean();
            });
        }
        return out;
    }
}
