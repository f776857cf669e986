package io.github.riemr.payroll.application.exception;

public class DuplicateEmailException extends RuntimeException {
    private final String email;

    public DuplicateEmailException(String email) {
        super("Employee with this email already exists");
        this.email = email;
    }

    public String getEmail() {
        return email;
    }
}
