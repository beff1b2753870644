package db.repono;

/**
 * Root of every error the versioned store reports. All of them are recoverable:
 * the failing operation has left no partial state behind.
 */
public class ReponoException extends RuntimeException {
    public ReponoException(String message) {
        super(message);
    }

    public ReponoException(String message, Throwable cause) {
        super(message, cause);
    }
}
