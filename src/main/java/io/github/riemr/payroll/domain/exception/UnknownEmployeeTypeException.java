package io.github.riemr.payroll.domain.exception;

public class UnknownEmployeeTypeException extends RuntimeException {
    public UnknownEmployeeTypeException(String message) {
        super(message);
    }
}
