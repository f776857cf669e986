package io.github.riemr.payroll.application.service;

import io.github.riemr.payroll.domain.model.Employee;
import io.github.riemr.payroll.domain.model.EmployeeFactory;
import io.github.riemr.payroll.domain.model.Role;

import java.util.List;

/**
 * Rebuilds domain objects from stored rows. Domain objects are transient and never written back.
 */
public final class DomainAssembler {
    private DomainAssembler() {
    }

    public static Role toRole(io.github.riemr.payroll.infrastructure.persistence.entity.Role row) {
        List<String> responsibilities = row.getResponsibilities() == null ? List.of() : row.getResponsibilities();
        int level = row.getLevel() == null ? 1 : row.getLevel();
        return new Role(row.getId(), row.getTitle(), row.getDescription(), row.getDepartment(), level,
                row.getMinSalary(), row.getMaxSalary(), responsibilities);
    }

    public static Employee toEmployee(io.github.riemr.payroll.infrastructure.persistence.entity.Employee row,
                                      io.github.riemr.payroll.infrastructure.persistence.entity.Role roleRow) {
        Role role = roleRow == null ? null : toRole(roleRow);
        return EmployeeFactory.create(row.getType(), row.getId(), row.getFirstName(), row.getLastName(),
                row.getEmail(), role, row.getStartDate(), row.getSalary());
    }

    /** Copies a domain role back onto a row, keeping the row's id. */
    public static void copyInto(Role role, io.github.riemr.payroll.infrastructure.persistence.entity.Role row) {
        row.setTitle(role.getTitle());
        row.setDescription(role.getDescription());
        row.setDepartment(role.getDepartment());
        row.setLevel(role.getLevel());
        row.setMinSalary(role.getMinSalary());
        row.setMaxSalary(role.getMaxSalary());
        row.setResponsibilities(role.getResponsibilities());
    }
}
