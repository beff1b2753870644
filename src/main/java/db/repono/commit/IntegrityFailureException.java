package db.repono.commit;

import db.repono.ReponoException;

/**
 * A commit's stored digest disagrees with the hash of its content. Something outside the
 * engine altered the commit (or its serialized form).
 */
public class IntegrityFailureException extends ReponoException {
    private final String storedDigest;
    private final String computedDigest;

    public IntegrityFailureException(String storedDigest, String computedDigest) {
        super("Integrity failure: stored digest " + storedDigest + " but content hashes to " + computedDigest);
        this.storedDigest = storedDigest;
        this.computedDigest = computedDigest;
    }

    public String storedDigest() { return storedDigest; }
    public String computedDigest() { return computedDigest; }
}
