package io.github.riemr.payroll.domain.payslip;

import io.github.riemr.payroll.domain.model.Employee;

import java.math.BigDecimal;

/**
 * Shared payslip algorithm. Variants supply base and overtime pay; gross and net are
 * aggregated here. Inputs are expected to be non-negative; the request layer rejects
 * negative values before they get here.
 */
public abstract class PayslipCalculator {
    protected static final BigDecimal OVERTIME_MULTIPLIER = new BigDecimal("1.5");

    private final Employee employee;

    protected PayslipCalculator(Employee employee) {
        this.employee = employee;
    }

    public Employee getEmployee() {
        return employee;
    }

    public PayslipResult calculate(BigDecimal hoursWorked) {
        return calculate(hoursWorked, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public PayslipResult calculate(BigDecimal hoursWorked, BigDecimal overtimeHours) {
        return calculate(hoursWorked, overtimeHours, BigDecimal.ZERO);
    }

    public final PayslipResult calculate(BigDecimal hoursWorked, BigDecimal overtimeHours, BigDecimal deductions) {
        BigDecimal overtime = overtimeHours == null ? BigDecimal.ZERO : overtimeHours;
        BigDecimal deducted = deductions == null ? BigDecimal.ZERO : deductions;
        BigDecimal basePay = basePay(hoursWorked);
        BigDecimal overtimePay = overtimePay(overtime);
        return new PayslipResult(basePay, overtimePay, deducted, hoursWorked, overtime);
    }

    protected abstract BigDecimal basePay(BigDecimal hoursWorked);

    protected abstract BigDecimal overtimePay(BigDecimal overtimeHours);
}
