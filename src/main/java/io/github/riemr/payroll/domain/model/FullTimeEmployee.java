package io.github.riemr.payroll.domain.model;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;

public class FullTimeEmployee extends Employee {
    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);

    private final BigDecimal annualSalary;

    public FullTimeEmployee(Long id, String firstName, String lastName, String email, Role role,
                            LocalDate startDate, BigDecimal annualSalary) {
        super(id, firstName, lastName, email, role, startDate);
        this.annualSalary = annualSalary;
    }

    @Override
    public BigDecimal monthlyBaseSalary() {
        return annualSalary.divide(MONTHS_PER_YEAR, MathContext.DECIMAL64);
    }

    @Override
    public EmploymentKind employmentKind() {
        return EmploymentKind.FULL_TIME;
    }

    @Override
    public boolean benefitsEligible() {
        return true;
    }

    public BigDecimal getAnnualSalary() {
        return annualSalary;
    }
}
