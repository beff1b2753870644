package db.repono.commit;

import db.repono.ReponoException;

public class DigestCollisionException extends ReponoException {
    private final String digest;

    public DigestCollisionException(String digest) {
        super("Digest collision: a different commit is already stored under " + digest);
        this.digest = digest;
    }

    public String digest() { return digest; }
}
