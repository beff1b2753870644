package db.repono.storage;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import db.repono.Fixtures;
import db.repono.commit.Commit;
import db.repono.commit.CommitHasher;
import db.repono.commit.CommitNotFoundException;
import db.repono.commit.DigestCollisionException;

public class CommitStoreTest {
    private final CommitHasher hasher = new CommitHasher();

    private Commit sample() {
        return Commit.create(hasher, Commit.NO_PARENT, "init", 1L,
            Fixtures.tables("users", Fixtures.users(Row.of(1, "Neel", 19))));
    }

    @Test
    void putThenGet() {
        CommitStore store = new CommitStore();
        Commit c = sample();
        assertSame(c, store.put(c));
        assertSame(c, store.require(c.digest()));
        assertTrue(store.contains(c.digest()));
        assertEquals(1, store.size());
        assertTrue(store.get("missing").isEmpty());
    }

    @Test
    void identicalContentIsIdempotent() {
        CommitStore store = new CommitStore();
        Commit first = store.put(sample());
        assertSame(first, store.put(sample()));
        assertEquals(1, store.size());
    }

    @Test
    void differentContentUnderSameDigestIsRejected() {
        CommitStore store = new CommitStore();
        Commit c = store.put(sample());
        Commit impostor = Commit.restore(c.digest(), "", "other", 2L, c.tables());
        DigestCollisionException ex = assertThrows(DigestCollisionException.class, () -> store.put(impostor));
        assertEquals(c.digest(), ex.digest());
        assertSame(c, store.require(c.digest()));
    }

    @Test
    void requireMissingThrows() {
        CommitNotFoundException ex = assertThrows(CommitNotFoundException.class,
            () -> new CommitStore().require("abc"));
        assertEquals("abc", ex.digest());
    }
}
