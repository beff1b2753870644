package db.repono.config;

import java.io.Reader;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import db.repono.commit.CommitHasher;

public class RepositoryConfig {
    public final String digestAlgorithm;
    public final boolean verbose;

    public RepositoryConfig(String digestAlgorithm, boolean verbose) {
        CommitHasher.checkAlgorithm(digestAlgorithm);
        this.digestAlgorithm = digestAlgorithm;
        this.verbose = verbose;
    }

    public static RepositoryConfig defaultConfig() {
        return new RepositoryConfig(CommitHasher.DEFAULT_ALGORITHM, false);
    }

    // Recognized: --digest=<algorithm>, --verbose. Unknown arguments are ignored.
    public static RepositoryConfig fromArgs(String[] args) {
        String digest = CommitHasher.DEFAULT_ALGORITHM;
        boolean verbose = false;
        for (String a : args) {
            if (a == null) continue;
            String s = a.trim();
            if (s.startsWith("--digest=")) {
                digest = s.substring("--digest=".length());
            } else if (s.equals("--verbose")) {
                verbose = true;
            }
        }
        return new RepositoryConfig(digest, verbose);
    }

    /**
     * Reads {@code {"digestAlgorithm": "...", "verbose": true}}; missing fields take defaults.
     *
     * @throws JsonParseException if the document is malformed
     */
    public static RepositoryConfig fromJson(Reader reader) {
        Raw raw = new Gson().fromJson(reader, Raw.class);
        if (raw == null) return defaultConfig();
        return new RepositoryConfig(
            raw.digestAlgorithm != null ? raw.digestAlgorithm : CommitHasher.DEFAULT_ALGORITHM,
            raw.verbose != null && raw.verbose);
    }

    private static final class Raw {
        String digestAlgorithm;
        Boolean verbose;
    }

    @Override
    public String toString() {
        return "RepositoryConfig{digest=" + digestAlgorithm + ", verbose=" + verbose + "}";
    }
}
