package db.repono.commit;

import db.repono.ReponoException;

public class CommitNotFoundException extends ReponoException {
    private final String digest;

    public CommitNotFoundException(String digest) {
        this(digest, "Commit not found: " + digest);
    }

    private CommitNotFoundException(String digest, String message) {
        super(message);
        this.digest = digest;
    }

    /** A reference that is neither a stored digest nor a branch name. */
    public static CommitNotFoundException unresolved(String ref) {
        return new CommitNotFoundException(ref, "No commit or branch named: " + ref);
    }

    public String digest() { return digest; }
}
