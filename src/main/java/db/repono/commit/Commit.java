package db.repono.commit;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable, content-addressed snapshot of every table at one point in history.
 *
 * <p>The digest is computed last, from the parent digest, message, timestamp and the tables.
 * A root commit has an empty parent digest. Tables are kept sorted by name.
 */
public final class Commit {
    public static final String NO_PARENT = "";

    private final String digest;
    private final String parentDigest;
    private final String message;
    private final long timestamp;
    private final SortedMap<String, TableSnapshot> tables;

    private Commit(String digest, String parentDigest, String message, long timestamp,
                   Map<String, TableSnapshot> tables) {
        this.digest = Objects.requireNonNull(digest, "digest");
        this.parentDigest = Objects.requireNonNull(parentDigest, "parentDigest");
        this.message = Objects.requireNonNull(message, "message");
        this.timestamp = timestamp;
        TreeMap<String, TableSnapshot> sorted = new TreeMap<>();
        for (Map.Entry<String, TableSnapshot> e : tables.entrySet()) {
            String name = Objects.requireNonNull(e.getKey(), "table name");
            if (name.isBlank()) throw new IllegalArgumentException("Table name must not be blank");
            sorted.put(name, Objects.requireNonNull(e.getValue(), "snapshot of " + name));
        }
        this.tables = Collections.unmodifiableSortedMap(sorted);
    }

    /** Builds a commit from its content and mints the digest with the given hasher. */
    public static Commit create(CommitHasher hasher, String parentDigest, String message, long timestamp,
                                Map<String, TableSnapshot> tables) {
        Commit unsealed = new Commit(NO_PARENT, parentDigest, message, timestamp, tables);
        return new Commit(hasher.computeCommitHash(unsealed), parentDigest, message, timestamp, unsealed.tables);
    }

    /**
     * Rebuilds a commit from previously serialized content. The digest is taken as given and
     * must be checked with {@link CommitHasher#verify} before the commit is trusted.
     */
    public static Commit restore(String digest, String parentDigest, String message, long timestamp,
                                 Map<String, TableSnapshot> tables) {
        return new Commit(digest, parentDigest, message, timestamp, tables);
    }

    public String digest() { return digest; }
    public String parentDigest() { return parentDigest; }
    public boolean isRoot() { return parentDigest.isEmpty(); }
    public String message() { return message; }
    public long timestamp() { return timestamp; }
    public SortedMap<String, TableSnapshot> tables() { return tables; }

    /** The table as it was at this commit. */
    public Optional<TableSnapshot> table(String name) { return Optional.ofNullable(tables.get(name)); }

    /** Same logical content, ignoring the stored digest. */
    public boolean sameContent(Commit other) {
        return timestamp == other.timestamp
            && parentDigest.equals(other.parentDigest)
            && message.equals(other.message)
            && tables.equals(other.tables);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof Commit other && digest.equals(other.digest) && sameContent(other);
    }

    @Override
    public int hashCode() { return digest.hashCode(); }

    @Override
    public String toString() {
        String shortDigest = digest.length() > 12 ? digest.substring(0, 12) : digest;
        return "Commit{" + shortDigest + ", parent=" + (isRoot() ? "<root>" : parentDigest) +
            ", message='" + message + "', tables=" + tables.keySet() + "}";
    }
}
