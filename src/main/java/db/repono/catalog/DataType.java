package db.repono.catalog;

import db.repono.storage.Value;

/**
 * Declared column types. TIMESTAMP is stored as an integer (epoch based) and validates like one.
 */
public enum DataType {
    INTEGER,
    FLOAT,
    TEXT,
    BOOLEAN,
    TIMESTAMP;

    /** Whether a non-null value of the given kind may be stored in a column of this type. */
    public boolean accepts(Value.Kind kind) {
        return switch (this) {
            case INTEGER, TIMESTAMP -> kind == Value.Kind.INTEGER;
            case FLOAT -> kind == Value.Kind.FLOAT || kind == Value.Kind.INTEGER; // implicit widening
            case TEXT -> kind == Value.Kind.TEXT;
            case BOOLEAN -> kind == Value.Kind.BOOLEAN;
        };
    }
}
