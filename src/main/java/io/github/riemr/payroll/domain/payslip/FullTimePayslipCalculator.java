package io.github.riemr.payroll.domain.payslip;

import io.github.riemr.payroll.domain.model.FullTimeEmployee;

import java.math.BigDecimal;
import java.math.MathContext;

public class FullTimePayslipCalculator extends PayslipCalculator {
    // 52 weeks * 40 hours
    static final BigDecimal STANDARD_HOURS_PER_YEAR = BigDecimal.valueOf(52 * 40);

    private final FullTimeEmployee employee;

    public FullTimePayslipCalculator(FullTimeEmployee employee) {
        super(employee);
        this.employee = employee;
    }

    /** Salaried staff get the monthly salary whatever hours were logged. */
    @Override
    protected BigDecimal basePay(BigDecimal hoursWorked) {
        return employee.monthlyBaseSalary();
    }

    @Override
    protected BigDecimal overtimePay(BigDecimal overtimeHours) {
        if (overtimeHours.signum() <= 0) return BigDecimal.ZERO;
        BigDecimal hourlyEquivalent = employee.getAnnualSalary()
                .divide(STANDARD_HOURS_PER_YEAR, MathContext.DECIMAL64);
        return overtimeHours.multiply(hourlyEquivalent).multiply(OVERTIME_MULTIPLIER);
    }
}
