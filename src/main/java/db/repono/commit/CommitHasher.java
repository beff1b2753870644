package db.repono.commit;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

import db.repono.catalog.ColumnSchema;
import db.repono.storage.Row;
import db.repono.storage.Value;

/**
 * Canonical serializer and digest for commits.
 *
 * <p>Canonical text, one item per line:
 * <pre>
 * parent:&lt;digest&gt;
 * message:&lt;escaped&gt;
 * timestamp:&lt;decimal&gt;
 * table:&lt;escaped name&gt;      (tables in name order)
 * schema:&lt;col&gt;|&lt;col&gt;...
 * rows:&lt;count&gt;
 * &lt;value&gt;|&lt;value&gt;...       (rows in stored order)
 * </pre>
 * Values are a kind tag, a colon and the rendered value. Floats are written with
 * {@link Double#toString} rather than the two-decimal display form.
 */
public class CommitHasher {
    public static final String DEFAULT_ALGORITHM = "SHA-256";
    public static final int DIGEST_BITS = 256;

    private static final HexFormat HEX = HexFormat.of();

    private final String algorithm;
    private final ThreadLocal<MessageDigest> workDigest;

    public CommitHasher() {
        this(DEFAULT_ALGORITHM);
    }

    public CommitHasher(String algorithm) {
        checkAlgorithm(algorithm);
        this.algorithm = algorithm;
        this.workDigest = ThreadLocal.withInitial(() -> newDigest(algorithm));
    }

    /**
     * @throws IllegalArgumentException if the algorithm is unknown or is not a 256-bit hash
     */
    public static void checkAlgorithm(String algorithm) {
        if (algorithm == null) throw new IllegalArgumentException("Digest algorithm must not be null");
        int bits = newDigest(algorithm).getDigestLength() * 8;
        if (bits != DIGEST_BITS) {
            throw new IllegalArgumentException("Digest algorithm " + algorithm + " produces " + bits +
                " bits, expected " + DIGEST_BITS);
        }
    }

    private static MessageDigest newDigest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Unknown digest algorithm: " + algorithm, e);
        }
    }

    public String algorithm() { return algorithm; }

    /** Length of a hex digest produced by this hasher. */
    public int digestLength() { return DIGEST_BITS / 4; }

    public byte[] canonicalize(Commit commit) {
        return canonicalForm(commit).getBytes(StandardCharsets.UTF_8);
    }

    public String canonicalForm(Commit commit) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("parent:").append(commit.parentDigest()).append('\n');
        sb.append("message:").append(escape(commit.message())).append('\n');
        sb.append("timestamp:").append(commit.timestamp()).append('\n');
        // tables() is a sorted map, so iteration is already in name order
        for (Map.Entry<String, TableSnapshot> e : commit.tables().entrySet()) {
            TableSnapshot snap = e.getValue();
            sb.append("table:").append(escape(e.getKey())).append('\n');
            appendSchema(sb, snap.schema().columns());
            sb.append("rows:").append(snap.rowCount()).append('\n');
            for (Row row : snap.rows()) appendRow(sb, row);
        }
        return sb.toString();
    }

    public String digest(byte[] bytes) {
        MessageDigest md = workDigest.get();
        md.reset();
        return HEX.formatHex(md.digest(bytes));
    }

    public String computeCommitHash(Commit commit) {
        return digest(canonicalize(commit));
    }

    /** True when the commit's stored digest matches the hash of its own content. */
    public boolean verify(Commit commit) {
        return computeCommitHash(commit).equals(commit.digest());
    }

    private static void appendSchema(StringBuilder sb, List<ColumnSchema> columns) {
        sb.append("schema:");
        for (int i = 0; i < columns.size(); i++) {
            ColumnSchema c = columns.get(i);
            if (i > 0) sb.append('|');
            sb.append(escape(c.name())).append(' ')
              .append(c.type().name()).append(' ')
              .append(c.primaryKey() ? "PK" : "-").append(' ')
              .append(c.nullable() ? "NULL" : "NOTNULL");
        }
        sb.append('\n');
    }

    private static void appendRow(StringBuilder sb, Row row) {
        for (int i = 0; i < row.size(); i++) {
            if (i > 0) sb.append('|');
            appendValue(sb, row.get(i));
        }
        sb.append('\n');
    }

    private static void appendValue(StringBuilder sb, Value v) {
        switch (v.kind()) {
            case NULL -> sb.append('N');
            case INTEGER -> sb.append("I:").append(v.render());
            case FLOAT -> sb.append("F:").append(Double.toString(v.asDouble()));
            case TEXT -> sb.append("T:").append(escape(v.render()));
            case BOOLEAN -> sb.append("B:").append(v.render());
        }
    }

    static String escape(String s) {
        StringBuilder out = null;
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            String rep = switch (ch) {
                case '\\' -> "\\\\";
                case '|' -> "\\|";
                case '\n' -> "\\n";
                case '\r' -> "\\r";
                default -> null;
            };
            if (rep == null) {
                if (out != null) out.append(ch);
                continue;
            }
            if (out == null) out = new StringBuilder(s.length() + 8).append(s, 0, i);
            out.append(rep);
        }
        return out == null ? s : out.toString();
    }
}
