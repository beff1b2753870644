package db.repono.catalog;

import java.util.Optional;

import db.repono.storage.Value;

/**
 * Outcome of validating a row against a schema: success, or the first violated constraint
 * with enough detail (column, expected, actual) to build a diagnostic.
 */
public final class ValidationResult {

    public enum Violation { NONE, ARITY_MISMATCH, NULL_VIOLATION, TYPE_MISMATCH }

    private static final ValidationResult OK = new ValidationResult(Violation.NONE, null, null, null);

    private final Violation violation;
    private final String column;
    private final String expected;
    private final String actual;

    private ValidationResult(Violation violation, String column, String expected, String actual) {
        this.violation = violation;
        this.column = column;
        this.expected = expected;
        this.actual = actual;
    }

    public static ValidationResult ok() { return OK; }

    public static ValidationResult arityMismatch(int expected, int actual) {
        return new ValidationResult(Violation.ARITY_MISMATCH, null, Integer.toString(expected), Integer.toString(actual));
    }

    public static ValidationResult nullViolation(String column) {
        return new ValidationResult(Violation.NULL_VIOLATION, column, "NOT NULL", "NULL");
    }

    public static ValidationResult typeMismatch(String column, DataType expected, Value.Kind actual) {
        return new ValidationResult(Violation.TYPE_MISMATCH, column, expected.name(), actual.name());
    }

    public boolean isValid() { return violation == Violation.NONE; }
    public Violation violation() { return violation; }
    public Optional<String> column() { return Optional.ofNullable(column); }
    public String expected() { return expected; }
    public String actual() { return actual; }

    public String message() {
        return switch (violation) {
            case NONE -> "ok";
            case ARITY_MISMATCH -> "Arity mismatch: expected " + expected + " values, got " + actual;
            case NULL_VIOLATION -> "Null value for non-nullable column '" + column + "'";
            case TYPE_MISMATCH -> "Type mismatch for column '" + column + "' expected " + expected + ", got " + actual;
        };
    }

    @Override
    public String toString() { return message(); }
}
