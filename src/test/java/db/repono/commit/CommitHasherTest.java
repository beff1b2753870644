package db.repono.commit;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import db.repono.Fixtures;
import db.repono.catalog.ColumnSchema;
import db.repono.catalog.DataType;
import db.repono.catalog.TableSchema;
import db.repono.storage.Row;

public class CommitHasherTest {
    private final CommitHasher hasher = new CommitHasher();

    private Commit commit(Map<String, TableSnapshot> tables) {
        return Commit.create(hasher, Commit.NO_PARENT, "init", 1000L, tables);
    }

    @Test
    void digestIsLowercaseHexOf256Bits() {
        Commit c = commit(Fixtures.tables("users", Fixtures.users(Row.of(1, "Neel", 19))));
        assertEquals(64, c.digest().length());
        assertTrue(c.digest().matches("[0-9a-f]{64}"));
        assertEquals(64, hasher.digestLength());
    }

    @Test
    void hashIsDeterministic() {
        Commit a = commit(Fixtures.tables("users", Fixtures.users(Row.of(1, "Neel", 19))));
        Commit b = commit(Fixtures.tables("users", Fixtures.users(Row.of(1, "Neel", 19))));
        assertEquals(a.digest(), b.digest());
        assertEquals(hasher.computeCommitHash(a), hasher.computeCommitHash(a));
    }

    @Test
    void tableOrderDoesNotMatter() {
        Commit a = commit(Fixtures.tables(
            "users", Fixtures.users(Row.of(1, "Neel", 19)),
            "tags", Fixtures.tags(Row.of("x", 1.0))));
        Commit b = commit(Fixtures.tables(
            "tags", Fixtures.tags(Row.of("x", 1.0)),
            "users", Fixtures.users(Row.of(1, "Neel", 19))));
        assertEquals(a.digest(), b.digest());
    }

    @Test
    void rowOrderMatters() {
        Commit a = commit(Fixtures.tables("users", Fixtures.users(Row.of(1, "Neel", 19), Row.of(2, "Swati", 21))));
        Commit b = commit(Fixtures.tables("users", Fixtures.users(Row.of(2, "Swati", 21), Row.of(1, "Neel", 19))));
        assertNotEquals(a.digest(), b.digest());
    }

    @Test
    void everyFieldFeedsTheDigest() {
        Map<String, TableSnapshot> t = Fixtures.tables("users", Fixtures.users(Row.of(1, "Neel", 19)));
        String base = commit(t).digest();
        assertNotEquals(base, Commit.create(hasher, "ab", "init", 1000L, t).digest());
        assertNotEquals(base, Commit.create(hasher, Commit.NO_PARENT, "other", 1000L, t).digest());
        assertNotEquals(base, Commit.create(hasher, Commit.NO_PARENT, "init", 1001L, t).digest());

        TableSchema looser = TableSchema.of(
            ColumnSchema.column("id", DataType.INTEGER),
            ColumnSchema.column("name", DataType.TEXT),
            ColumnSchema.column("age", DataType.INTEGER));
        assertNotEquals(base, commit(Fixtures.tables("users", TableSnapshot.of(looser, Row.of(1, "Neel", 19)))).digest());
    }

    @Test
    void valueKindsAndSeparatorsAreUnambiguous() {
        TableSchema s = TableSchema.of(ColumnSchema.column("a", DataType.TEXT), ColumnSchema.column("b", DataType.TEXT));
        Commit nullText = commit(Fixtures.tables("t", TableSnapshot.of(s, Row.of(null, "x"))));
        Commit literalNull = commit(Fixtures.tables("t", TableSnapshot.of(s, Row.of("NULL", "x"))));
        assertNotEquals(nullText.digest(), literalNull.digest());

        Commit split = commit(Fixtures.tables("t", TableSnapshot.of(s, Row.of("a|b", "c"))));
        Commit joined = commit(Fixtures.tables("t", TableSnapshot.of(s, Row.of("a", "b|c"))));
        assertNotEquals(split.digest(), joined.digest());
    }

    @Test
    void floatsBeyondDisplayPrecisionStillDiffer() {
        Commit a = commit(Fixtures.tables("tags", Fixtures.tags(Row.of("x", 1.001))));
        Commit b = commit(Fixtures.tables("tags", Fixtures.tags(Row.of("x", 1.002))));
        assertNotEquals(a.digest(), b.digest());
    }

    @Test
    void verifyDetectsTampering() {
        Commit c = commit(Fixtures.tables("users", Fixtures.users(Row.of(1, "Neel", 19))));
        assertTrue(hasher.verify(c));
        Commit forged = Commit.restore(c.digest(), c.parentDigest(), c.message(), c.timestamp(),
            Fixtures.tables("users", Fixtures.users(Row.of(1, "Neel", 99))));
        assertFalse(hasher.verify(forged));
    }

    @Test
    void canonicalFormLayout() {
        Commit c = commit(Fixtures.tables("users", Fixtures.users(Row.of(1, "Neel", null))));
        assertEquals(String.join("\n",
            "parent:",
            "message:init",
            "timestamp:1000",
            "table:users",
            "schema:id INTEGER PK NOTNULL|name TEXT - NULL|age INTEGER - NULL",
            "rows:1",
            "I:1|T:Neel|N",
            ""), hasher.canonicalForm(c));
    }

    @Test
    void escapeHandlesSpecials() {
        assertEquals("plain", CommitHasher.escape("plain"));
        assertEquals("a\\|b\\\\c\\nd", CommitHasher.escape("a|b\\c\nd"));
    }

    @Test
    void alternateAlgorithmsMustBe256Bits() {
        CommitHasher sha3 = new CommitHasher("SHA3-256");
        assertEquals("SHA3-256", sha3.algorithm());
        Commit c = Commit.create(sha3, Commit.NO_PARENT, "m", 1L, Map.of());
        assertEquals(64, c.digest().length());
        assertThrows(IllegalArgumentException.class, () -> new CommitHasher("SHA-1"));
        assertThrows(IllegalArgumentException.class, () -> new CommitHasher("NOPE-256"));
    }

    @Test
    void snapshotIsDetachedFromCallerState() {
        TableSchema s = Fixtures.usersSchema();
        TableSnapshot snap = new TableSnapshot(s, List.of(Row.of(1, "Neel", 19)));
        s.addColumn(ColumnSchema.column("email", DataType.TEXT));
        assertEquals(3, snap.schema().columnCount());
        assertThrows(UnsupportedOperationException.class,
            () -> snap.schema().addColumn(ColumnSchema.column("x", DataType.TEXT)));
    }
}
