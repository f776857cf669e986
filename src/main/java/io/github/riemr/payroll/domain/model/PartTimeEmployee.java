package io.github.riemr.payroll.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public class PartTimeEmployee extends Employee {
    public static final int DEFAULT_HOURS_PER_MONTH = 80;

    private final BigDecimal hourlyRate;
    // only used for the monthly estimate, never for payslips
    private final int defaultHoursPerMonth;

    public PartTimeEmployee(Long id, String firstName, String lastName, String email, Role role,
                            LocalDate startDate, BigDecimal hourlyRate) {
        this(id, firstName, lastName, email, role, startDate, hourlyRate, DEFAULT_HOURS_PER_MONTH);
    }

    public PartTimeEmployee(Long id, String firstName, String lastName, String email, Role role,
                            LocalDate startDate, BigDecimal hourlyRate, int defaultHoursPerMonth) {
        super(id, firstName, lastName, email, role, startDate);
        if (defaultHoursPerMonth < 1) {
            throw new IllegalArgumentException("defaultHoursPerMonth must be >= 1");
        }
        this.hourlyRate = hourlyRate;
        this.defaultHoursPerMonth = defaultHoursPerMonth;
    }

    @Override
    public BigDecimal monthlyBaseSalary() {
        return hourlyRate.multiply(BigDecimal.valueOf(defaultHoursPerMonth));
    }

    @Override
    public EmploymentKind employmentKind() {
        return EmploymentKind.PART_TIME;
    }

    @Override
    public boolean benefitsEligible() {
        return false;
    }

    public BigDecimal payForHours(BigDecimal hours) {
        return hourlyRate.multiply(hours);
    }

    public BigDecimal getHourlyRate() {
        return hourlyRate;
    }

    public int getDefaultHoursPerMonth() {
        return defaultHoursPerMonth;
    }
}
