package db.repono.json;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;

import db.repono.catalog.ColumnSchema;
import db.repono.catalog.DataType;
import db.repono.catalog.DuplicateColumnException;
import db.repono.catalog.TableSchema;
import db.repono.commit.Commit;
import db.repono.commit.TableSnapshot;
import db.repono.storage.Row;
import db.repono.storage.Value;

/**
 * JSON form of a commit, digest included. Values are tagged with their kind so a decoded
 * commit hashes exactly like the original. Floats travel as strings to keep every bit.
 *
 * <p>Decoding does not verify the digest; hand the result to
 * {@link db.repono.Repository#importCommit} which does.
 */
public class CommitJsonCodec {
    private final Gson gson = new GsonBuilder()
        .registerTypeAdapter(Value.class, new ValueAdapter())
        .registerTypeAdapter(Row.class, new RowAdapter())
        .registerTypeAdapter(Commit.class, new CommitAdapter())
        .disableHtmlEscaping()
        .create();

    public String toJson(Commit commit) {
        return gson.toJson(commit, Commit.class);
    }

    /**
     * @throws JsonParseException if the text is not a well-formed commit
     */
    public Commit fromJson(String json) {
        Commit c = gson.fromJson(json, Commit.class);
        if (c == null) throw new JsonParseException("Empty commit document");
        return c;
    }

    private static final class ValueAdapter implements JsonSerializer<Value>, JsonDeserializer<Value> {
        @Override
        public JsonElement serialize(Value v, Type type, JsonSerializationContext ctx) {
            JsonObject o = new JsonObject();
            o.addProperty("type", v.kind().name());
            switch (v.kind()) {
                case NULL -> { }
                case INTEGER -> o.addProperty("value", v.asLong());
                case FLOAT -> o.addProperty("value", Double.toString(v.asDouble()));
                case TEXT -> o.addProperty("value", v.asText());
                case BOOLEAN -> o.addProperty("value", v.asBoolean());
            }
            return o;
        }

        @Override
        public Value deserialize(JsonElement json, Type type, JsonDeserializationContext ctx) {
            JsonObject o = json.getAsJsonObject();
            Value.Kind kind;
            try {
                kind = Value.Kind.valueOf(o.get("type").getAsString());
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new JsonParseException("Bad value type in " + json, e);
            }
            if (kind == Value.Kind.NULL) return Value.NULL;
            JsonElement v = o.get("value");
            if (v == null || v.isJsonNull()) throw new JsonParseException("Missing value in " + json);
            try {
                return switch (kind) {
                    case INTEGER -> Value.ofInteger(v.getAsLong());
                    case FLOAT -> Value.ofFloat(Double.parseDouble(v.getAsString()));
                    case TEXT -> Value.ofText(v.getAsString());
                    case BOOLEAN -> Value.ofBoolean(v.getAsBoolean());
                    case NULL -> Value.NULL;
                };
            } catch (NumberFormatException | IllegalStateException | UnsupportedOperationException e) {
                throw new JsonParseException("Bad " + kind + " value in " + json, e);
            }
        }
    }

    private static final class RowAdapter implements JsonSerializer<Row>, JsonDeserializer<Row> {
        @Override
        public JsonElement serialize(Row row, Type type, JsonSerializationContext ctx) {
            JsonArray arr = new JsonArray();
            for (Value v : row.values()) arr.add(ctx.serialize(v, Value.class));
            return arr;
        }

        @Override
        public Row deserialize(JsonElement json, Type type, JsonDeserializationContext ctx) {
            List<Value> values = new ArrayList<>();
            for (JsonElement e : json.getAsJsonArray()) values.add(ctx.deserialize(e, Value.class));
            return new Row(values);
        }
    }

    private static final class CommitAdapter implements JsonSerializer<Commit>, JsonDeserializer<Commit> {
        @Override
        public JsonElement serialize(Commit c, Type type, JsonSerializationContext ctx) {
            JsonObject o = new JsonObject();
            o.addProperty("digest", c.digest());
            o.addProperty("parent", c.parentDigest());
            o.addProperty("message", c.message());
            o.addProperty("timestamp", c.timestamp());
            JsonArray tables = new JsonArray();
            for (Map.Entry<String, TableSnapshot> e : c.tables().entrySet()) {
                JsonObject t = new JsonObject();
                t.addProperty("name", e.getKey());
                JsonArray cols = new JsonArray();
                for (ColumnSchema col : e.getValue().schema().columns()) {
                    JsonObject jc = new JsonObject();
                    jc.addProperty("name", col.name());
                    jc.addProperty("type", col.type().name());
                    jc.addProperty("primary_key", col.primaryKey());
                    jc.addProperty("nullable", col.nullable());
                    cols.add(jc);
                }
                t.add("columns", cols);
                JsonArray rows = new JsonArray();
                for (Row r : e.getValue().rows()) rows.add(ctx.serialize(r, Row.class));
                t.add("rows", rows);
                tables.add(t);
            }
            o.add("tables", tables);
            return o;
        }

        @Override
        public Commit deserialize(JsonElement json, Type type, JsonDeserializationContext ctx) {
            JsonObject o = json.getAsJsonObject();
            Map<String, TableSnapshot> tables = new LinkedHashMap<>();
            for (JsonElement te : required(o, "tables").getAsJsonArray()) {
                JsonObject t = te.getAsJsonObject();
                TableSchema schema = new TableSchema();
                for (JsonElement ce : required(t, "columns").getAsJsonArray()) {
                    JsonObject jc = ce.getAsJsonObject();
                    try {
                        schema.addColumn(new ColumnSchema(
                            required(jc, "name").getAsString(),
                            dataType(required(jc, "type").getAsString()),
                            required(jc, "primary_key").getAsBoolean(),
                            required(jc, "nullable").getAsBoolean()));
                    } catch (DuplicateColumnException | IllegalArgumentException e) {
                        throw new JsonParseException(e.getMessage(), e);
                    }
                }
                List<Row> rows = new ArrayList<>();
                for (JsonElement re : required(t, "rows").getAsJsonArray()) rows.add(ctx.deserialize(re, Row.class));
                tables.put(required(t, "name").getAsString(), new TableSnapshot(schema, rows));
            }
            return Commit.restore(
                required(o, "digest").getAsString(),
                required(o, "parent").getAsString(),
                required(o, "message").getAsString(),
                required(o, "timestamp").getAsLong(),
                tables);
        }

        private static DataType dataType(String name) {
            try {
                return DataType.valueOf(name);
            } catch (IllegalArgumentException e) {
                throw new JsonParseException("Unknown column type: " + name, e);
            }
        }

        private static JsonElement required(JsonObject o, String field) {
            JsonElement e = o.get(field);
            if (e == null || e.isJsonNull()) throw new JsonParseException("Missing field '" + field + "'");
            return e;
        }
    }
}
