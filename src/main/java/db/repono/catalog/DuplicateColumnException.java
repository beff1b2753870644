package db.repono.catalog;

import db.repono.ReponoException;

public class DuplicateColumnException extends ReponoException {
    private final String columnName;

    public DuplicateColumnException(String columnName) {
        super("Duplicate column name: " + columnName);
        this.columnName = columnName;
    }

    public String columnName() { return columnName; }
}
