package db.repono.commit;

import db.repono.ReponoException;

/**
 * The parent a writer based its commit on is no longer the branch tip: the writer is stale
 * or lost a race with another writer on the same branch.
 */
public class ParentMismatchException extends ReponoException {
    private final String branch;
    private final String expectedParent;
    private final String actualTip;

    public ParentMismatchException(String branch, String expectedParent, String actualTip) {
        super("Parent mismatch on branch '" + branch + "': commit is based on " + describe(expectedParent) +
            " but the branch tip is " + describe(actualTip));
        this.branch = branch;
        this.expectedParent = expectedParent;
        this.actualTip = actualTip;
    }

    private static String describe(String digest) {
        return digest.isEmpty() ? "<none>" : digest;
    }

    public String branch() { return branch; }
    public String expectedParent() { return expectedParent; }
    public String actualTip() { return actualTip; }
}
