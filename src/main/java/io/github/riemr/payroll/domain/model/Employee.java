package io.github.riemr.payroll.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Transient view of a stored employee, rebuilt per request by {@link EmployeeFactory}.
 * The role is a read-only snapshot; the employee does not own it.
 */
public abstract class Employee {
    private final Long id;
    private final String firstName;
    private final String lastName;
    private final String email;
    private final Role role;
    private final LocalDate startDate;

    protected Employee(Long id, String firstName, String lastName, String email, Role role, LocalDate startDate) {
        this.id = id;
        this.firstName = firstName;
        this.lastName = lastName;
        this.email = email;
        this.role = role;
        this.startDate = startDate;
    }

    public abstract BigDecimal monthlyBaseSalary();

    public abstract EmploymentKind employmentKind();

    public abstract boolean benefitsEligible();

    public String getFullName() {
        return firstName + " " + lastName;
    }

    public Long getId() { return id; }
    public String getFirstName() { return firstName; }
    public String getLastName() { return lastName; }
    public String getEmail() { return email; }
    public Role getRole() { return role; }
    public LocalDate getStartDate() { return startDate; }
}
