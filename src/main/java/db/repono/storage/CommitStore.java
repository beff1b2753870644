package db.repono.storage;

import java.util.Collections;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import db.repono.commit.Commit;
import db.repono.commit.CommitNotFoundException;
import db.repono.commit.DigestCollisionException;

/**
 * Append-only, content-addressed commit storage. Commits are never replaced or removed.
 * Reads need no coordination; inserts of distinct digests do not contend.
 */
public class CommitStore {
    private final ConcurrentHashMap<String, Commit> commits = new ConcurrentHashMap<>();

    /**
     * Stores a commit under its digest. Storing identical content twice is a no-op that
     * returns the instance already held.
     *
     * @throws DigestCollisionException if different content already occupies the digest
     */
    public Commit put(Commit commit) {
        Commit existing = commits.putIfAbsent(commit.digest(), commit);
        if (existing == null) return commit;
        if (existing.sameContent(commit)) return existing;
        throw new DigestCollisionException(commit.digest());
    }

    public Optional<Commit> get(String digest) {
        return Optional.ofNullable(commits.get(digest));
    }

    /**
     * @throws CommitNotFoundException if nothing is stored under the digest
     */
    public Commit require(String digest) {
        Commit c = commits.get(digest);
        if (c == null) throw new CommitNotFoundException(digest);
        return c;
    }

    public boolean contains(String digest) { return commits.containsKey(digest); }

    public int size() { return commits.size(); }

    public SortedSet<String> digests() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(commits.keySet()));
    }
}
