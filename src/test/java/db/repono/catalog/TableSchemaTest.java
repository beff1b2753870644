package db.repono.catalog;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

import db.repono.Fixtures;
import db.repono.storage.Row;

public class TableSchemaTest {

    @Test
    void lookupFollowsColumnOrder() {
        TableSchema s = Fixtures.usersSchema();
        assertEquals(3, s.columnCount());
        assertEquals(0, s.indexOf("id").getAsInt());
        assertEquals(2, s.indexOf("age").getAsInt());
        assertTrue(s.indexOf("email").isEmpty());
        assertTrue(s.hasColumn("name"));
        assertEquals(DataType.TEXT, s.get("name").orElseThrow().type());
        assertTrue(s.get("email").isEmpty());
        assertArrayEquals(new int[] {0}, s.primaryKeyIndexes());
    }

    @Test
    void addColumnAppends() {
        TableSchema s = Fixtures.usersSchema();
        s.addColumn(ColumnSchema.column("email", DataType.TEXT));
        assertEquals(3, s.indexOf("email").getAsInt());
        assertEquals("email", s.columns().get(3).name());
    }

    @Test
    void duplicateColumnRejected() {
        TableSchema s = Fixtures.usersSchema();
        DuplicateColumnException ex = assertThrows(DuplicateColumnException.class,
            () -> s.addColumn(ColumnSchema.column("name", DataType.INTEGER)));
        assertEquals("name", ex.columnName());
        assertEquals(3, s.columnCount());
    }

    @Test
    void arityMismatchReportsCounts() {
        ValidationResult r = Fixtures.usersSchema().validateRow(Row.of(1, "Neel"));
        assertFalse(r.isValid());
        assertEquals(ValidationResult.Violation.ARITY_MISMATCH, r.violation());
        assertEquals("3", r.expected());
        assertEquals("2", r.actual());
    }

    @Test
    void nullOnlyWhereNullable() {
        TableSchema s = Fixtures.usersSchema();
        assertTrue(s.validateRow(Row.of(1, null, null)).isValid());
        ValidationResult r = s.validateRow(Row.of(null, "x", 1));
        assertEquals(ValidationResult.Violation.NULL_VIOLATION, r.violation());
        assertEquals("id", r.column().orElseThrow());
    }

    @Test
    void typeMismatchNamesColumn() {
        ValidationResult r = Fixtures.usersSchema().validateRow(Row.of(1, "Neel", "nineteen"));
        assertEquals(ValidationResult.Violation.TYPE_MISMATCH, r.violation());
        assertEquals("age", r.column().orElseThrow());
        assertEquals("INTEGER", r.expected());
        assertEquals("TEXT", r.actual());
    }

    @Test
    void floatColumnAcceptsIntegers() {
        TableSchema s = TableSchema.of(ColumnSchema.notNull("price", DataType.FLOAT),
            ColumnSchema.column("at", DataType.TIMESTAMP));
        assertTrue(s.validateRow(Row.of(3, 1700000000000L)).isValid());
        assertTrue(s.validateRow(Row.of(3.5, null)).isValid());
        assertFalse(s.validateRow(Row.of(3.5, 2.0)).isValid());
        assertFalse(s.validateRow(Row.of(true, null)).isValid());
    }

    @Test
    void immutableCopyRejectsChanges() {
        TableSchema frozen = Fixtures.usersSchema().immutableCopy();
        assertTrue(frozen.isImmutable());
        assertThrows(UnsupportedOperationException.class,
            () -> frozen.addColumn(ColumnSchema.column("x", DataType.TEXT)));
        TableSchema altered = frozen.copy();
        altered.addColumn(ColumnSchema.column("x", DataType.TEXT));
        assertEquals(3, frozen.columnCount());
        assertNotEquals(frozen, altered);
    }

    @Test
    void structuralEquality() {
        assertEquals(Fixtures.usersSchema(), new TableSchema(List.of(
            ColumnSchema.key("id", DataType.INTEGER),
            ColumnSchema.column("name", DataType.TEXT),
            ColumnSchema.column("age", DataType.INTEGER))));
        assertNotEquals(Fixtures.usersSchema(), TableSchema.of(
            ColumnSchema.key("id", DataType.INTEGER),
            ColumnSchema.notNull("name", DataType.TEXT),
            ColumnSchema.column("age", DataType.INTEGER)));
    }
}
