package db.repono.commit;

import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Branch name to tip digest. Each branch has its own lock so advances of one branch are
 * serialized while different branches move independently. Reads take no lock.
 */
public class BranchTable {
    private final ConcurrentHashMap<String, String> tips = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public Optional<String> tip(String branch) {
        return Optional.ofNullable(tips.get(branch));
    }

    public boolean exists(String branch) { return tips.containsKey(branch); }

    public int size() { return tips.size(); }

    /** Point-in-time copy, sorted by branch name. */
    public SortedMap<String, String> snapshot() {
        return new TreeMap<>(tips);
    }

    /**
     * Read-check-advance for one branch, atomic with respect to other advances of that branch.
     * The writer receives the current tip (empty for an unborn branch), stores the new commit
     * and returns its digest, which becomes the tip. If the writer throws, the tip is unchanged.
     *
     * @throws ParentMismatchException if {@code expectedParent} is not the current tip
     */
    public String advance(String branch, String expectedParent, UnaryOperator<String> writer) {
        checkName(branch);
        Objects.requireNonNull(expectedParent, "expectedParent");
        ReentrantLock lock = lockFor(branch);
        lock.lock();
        try {
            String current = tips.getOrDefault(branch, Commit.NO_PARENT);
            if (!current.equals(expectedParent)) {
                throw new ParentMismatchException(branch, expectedParent, current);
            }
            String next = Objects.requireNonNull(writer.apply(current), "new tip");
            tips.put(branch, next);
            return next;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Binds a new branch name to an existing commit.
     *
     * @throws IllegalArgumentException if the branch already exists
     */
    public void create(String branch, String digest) {
        checkName(branch);
        Objects.requireNonNull(digest, "digest");
        ReentrantLock lock = lockFor(branch);
        lock.lock();
        try {
            if (tips.putIfAbsent(branch, digest) != null) {
                throw new IllegalArgumentException("Branch already exists: " + branch);
            }
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(String branch) {
        return locks.computeIfAbsent(branch, k -> new ReentrantLock());
    }

    private static void checkName(String branch) {
        if (branch == null || branch.isBlank()) throw new IllegalArgumentException("Branch name must not be blank");
    }
}
