package io.github.riemr.payroll.application.service;

import io.github.riemr.payroll.domain.exception.SalaryOutOfRangeException;
import io.github.riemr.payroll.domain.model.Role;
import io.github.riemr.payroll.infrastructure.persistence.entity.Employee;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Admission gate for employee salaries against the role's band.
 */
@Component
@Slf4j
public class SalaryBandValidator {

    public void validate(io.github.riemr.payroll.infrastructure.persistence.entity.Role roleRow, BigDecimal salary) {
        Role role = DomainAssembler.toRole(roleRow);
        if (!role.isSalaryInRange(salary)) {
            log.warn("Rejected salary {} for role {} ({}), band {}..{}", salary, role.getId(), role.getTitle(),
                    role.getMinSalary(), role.getMaxSalary());
            throw new SalaryOutOfRangeException(salary, role.getSalaryRange());
        }
    }

    public void validate(io.github.riemr.payroll.infrastructure.persistence.entity.Role roleRow, Employee candidate) {
        validate(roleRow, candidate.getSalary());
    }
}
