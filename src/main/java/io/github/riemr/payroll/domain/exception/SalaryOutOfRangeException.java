package io.github.riemr.payroll.domain.exception;

import io.github.riemr.payroll.domain.model.SalaryRange;

import java.math.BigDecimal;

public class SalaryOutOfRangeException extends RuntimeException {
    private final BigDecimal salary;
    private final SalaryRange range;

    public SalaryOutOfRangeException(BigDecimal salary, SalaryRange range) {
        super("Salary must be between " + range.getMin().toPlainString()
                + " and " + range.getMax().toPlainString() + " for this role");
        this.salary = salary;
        this.range = range;
    }

    public BigDecimal getSalary() {
        return salary;
    }

    public SalaryRange getRange() {
        return range;
    }
}
