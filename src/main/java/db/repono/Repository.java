package db.repono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;

import db.repono.catalog.SchemaMismatchException;
import db.repono.commit.BranchTable;
import db.repono.commit.Commit;
import db.repono.commit.CommitHasher;
import db.repono.commit.CommitNotFoundException;
import db.repono.commit.DigestCollisionException;
import db.repono.commit.IntegrityFailureException;
import db.repono.commit.ParentMismatchException;
import db.repono.commit.TableSnapshot;
import db.repono.config.RepositoryConfig;
import db.repono.diff.CommitDiff;
import db.repono.diff.Differ;
import db.repono.storage.CommitStore;

/**
 * Versioned table store: an append-only commit store, a branch table and a differ.
 *
 * <p>{@link #commit} is the single mutation point. It re-validates every row, links the new
 * commit to the branch tip, stores it and advances the branch, all or nothing. Only one commit
 * per branch is in flight at a time; reads and diffs run freely alongside.
 */
public class Repository {
    private final RepositoryConfig config;
    private final CommitHasher hasher;
    private final CommitStore store;
    private final BranchTable branches = new BranchTable();
    private final Differ differ;

    public Repository() {
        this(RepositoryConfig.defaultConfig());
    }

    public Repository(RepositoryConfig config) {
        this(config, new CommitStore());
    }

    /**
     * Opens a repository over an existing commit store. The store's contents are not trusted:
     * {@link #verifyAll()} reports commits whose digest no longer matches their content.
     * Branches start empty; use {@link #createBranch} to point names at stored commits.
     */
    public Repository(RepositoryConfig config, CommitStore store) {
        this.config = Objects.requireNonNull(config, "config");
        this.store = Objects.requireNonNull(store, "store");
        this.hasher = new CommitHasher(config.digestAlgorithm);
        this.differ = new Differ(store);
    }

    /**
     * Commits a new snapshot of all tables onto a branch.
     *
     * @param parentDigest the tip the caller based its changes on; empty for the first commit on an unborn branch
     * @return digest of the new commit, now the branch tip
     * @throws SchemaMismatchException if any row violates its table schema (nothing is committed)
     * @throws ParentMismatchException if {@code parentDigest} is not the current tip
     * @throws DigestCollisionException if different content is already stored under the new digest
     */
    public String commit(String branch, String parentDigest, Map<String, TableSnapshot> tables,
                         String message, long timestamp) {
        Objects.requireNonNull(tables, "tables");
        Objects.requireNonNull(message, "message");
        for (Map.Entry<String, TableSnapshot> e : tables.entrySet()) {
            e.getValue().validate(e.getKey());
        }
        return branches.advance(branch, parentDigest, parent -> {
            Commit c = store.put(Commit.create(hasher, parent, message, timestamp, tables));
            logInfo("Committed " + c.digest() + " on '" + branch + "': " + message);
            return c.digest();
        });
    }

    public Optional<Commit> find(String digest) {
        return store.get(digest);
    }

    /**
     * @throws CommitNotFoundException if nothing is stored under the digest
     */
    public Commit get(String digest) {
        return store.require(digest);
    }

    /** Current tip of a branch; empty if the branch was never created. */
    public Optional<String> branchTip(String branch) {
        return branches.tip(branch);
    }

    public SortedMap<String, String> branches() {
        return branches.snapshot();
    }

    /**
     * Starts a new branch at an already stored commit.
     *
     * @throws CommitNotFoundException if the digest is not stored
     * @throws IllegalArgumentException if the branch already exists
     */
    public void createBranch(String branch, String digest) {
        store.require(digest);
        branches.create(branch, digest);
        logInfo("Created branch '" + branch + "' at " + digest);
    }

    /**
     * Resolves a branch name or a stored digest to a digest. Branch names win.
     *
     * @throws CommitNotFoundException if the reference matches neither
     */
    public String resolve(String ref) {
        Optional<String> tip = branches.tip(ref);
        if (tip.isPresent()) return tip.get();
        if (store.contains(ref)) return ref;
        throw CommitNotFoundException.unresolved(ref);
    }

    /** Commits reachable from {@code ref} by parent links, newest first, ending at the root. */
    public List<Commit> log(String ref) {
        List<Commit> out = new ArrayList<>();
        Commit c = store.require(resolve(ref));
        while (true) {
            out.add(c);
            if (c.isRoot()) break;
            c = store.require(c.parentDigest());
        }
        return out;
    }

    /**
     * @throws CommitNotFoundException if either digest is not stored
     */
    public CommitDiff diff(String fromDigest, String toDigest) {
        return differ.diff(fromDigest, toDigest);
    }

    /** Recomputes the digest of a stored commit and compares it with the stored one. */
    public boolean verify(String digest) {
        return hasher.verify(store.require(digest));
    }

    /** Digests of stored commits whose content no longer matches their digest. */
    public List<String> verifyAll() {
        List<String> bad = new ArrayList<>();
        for (String digest : store.digests()) {
            Commit c = store.require(digest);
            String computed = hasher.computeCommitHash(c);
            if (!computed.equals(digest)) {
                logError("Integrity failure: commit " + digest + " hashes to " + computed, null);
                bad.add(digest);
            }
        }
        return bad;
    }

    /**
     * Adds a commit produced elsewhere (for example decoded from JSON). The commit must verify
     * and its parent must already be stored. Branches are not moved.
     *
     * @throws IntegrityFailureException if the content does not hash to the commit's digest
     * @throws CommitNotFoundException if the parent is not stored
     */
    public Commit importCommit(Commit commit) {
        String computed = hasher.computeCommitHash(commit);
        if (!computed.equals(commit.digest())) {
            IntegrityFailureException ex = new IntegrityFailureException(commit.digest(), computed);
            logError(ex.getMessage(), ex);
            throw ex;
        }
        for (Map.Entry<String, TableSnapshot> e : commit.tables().entrySet()) {
            e.getValue().validate(e.getKey());
        }
        if (!commit.isRoot() && !store.contains(commit.parentDigest())) {
            throw new CommitNotFoundException(commit.parentDigest());
        }
        Commit stored = store.put(commit);
        logInfo("Imported " + stored.digest());
        return stored;
    }

    public CommitHasher hasher() { return hasher; }
    public RepositoryConfig config() { return config; }
    public int commitCount() { return store.size(); }

    private void logInfo(String message) {
        if (config.verbose) System.out.println("[Repository] " + message);
    }

    private void logError(String message, Exception e) {
        System.err.println("[Repository] " + message);
        if (e != null) e.printStackTrace(System.err);
    }
}
