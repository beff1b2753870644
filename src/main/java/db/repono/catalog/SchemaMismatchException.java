package db.repono.catalog;

import db.repono.ReponoException;

/**
 * A row failed validation against its table schema. The whole operation carrying the row is aborted.
 */
public class SchemaMismatchException extends ReponoException {
    private final String table;
    private final int rowIndex;
    private final transient ValidationResult result;

    public SchemaMismatchException(String table, int rowIndex, ValidationResult result) {
        super("Row " + rowIndex + " of table '" + table + "': " + result.message());
        this.table = table;
        this.rowIndex = rowIndex;
        this.result = result;
    }

    public String table() { return table; }
    public int rowIndex() { return rowIndex; }
    public ValidationResult result() { return result; }
}
