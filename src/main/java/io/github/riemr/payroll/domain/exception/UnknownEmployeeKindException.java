package io.github.riemr.payroll.domain.exception;

/**
 * Raised when a stored or submitted employee type is neither "full-time" nor "part-time".
 */
public class UnknownEmployeeKindException extends RuntimeException {
    private final String kind;

    public UnknownEmployeeKindException(String kind) {
        super("Unknown employee type: " + kind);
        this.kind = kind;
    }

    public String getKind() {
        return kind;
    }
}
