package io.github.riemr.payroll.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public final class EmployeeFactory {
    private EmployeeFactory() {
    }

    /**
     * Builds the variant named by {@code kind}. The compensation is the annual salary for
     * full-time staff and the hourly rate for part-time staff.
     *
     * @throws io.github.riemr.payroll.domain.exception.UnknownEmployeeKindException for any other kind
     */
    public static Employee create(String kind, Long id, String firstName, String lastName, String email,
                                  Role role, LocalDate startDate, BigDecimal compensation) {
        switch (EmploymentKind.fromCode(kind)) {
            case FULL_TIME:
                return new FullTimeEmployee(id, firstName, lastName, email, role, startDate, compensation);
            case PART_TIME:
                return new PartTimeEmployee(id, firstName, lastName, email, role, startDate, compensation);
            default:
                throw new IllegalStateException("unhandled kind " + kind);
        }
    }
}
