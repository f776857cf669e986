package io.github.riemr.payroll.domain.payslip;

import io.github.riemr.payroll.domain.model.PartTimeEmployee;

import java.math.BigDecimal;

public class PartTimePayslipCalculator extends PayslipCalculator {
    private final PartTimeEmployee employee;

    public PartTimePayslipCalculator(PartTimeEmployee employee) {
        super(employee);
        this.employee = employee;
    }

    @Override
    protected BigDecimal basePay(BigDecimal hoursWorked) {
        return employee.payForHours(hoursWorked);
    }

    @Override
    protected BigDecimal overtimePay(BigDecimal overtimeHours) {
        if (overtimeHours.signum() <= 0) return BigDecimal.ZERO;
        return overtimeHours.multiply(employee.getHourlyRate()).multiply(OVERTIME_MULTIPLIER);
    }
}
