package io.github.riemr.payroll.application.service;

import io.github.riemr.payroll.application.dto.PayrollStatsDto;
import io.github.riemr.payroll.application.repository.EmployeeRepository;
import io.github.riemr.payroll.domain.model.Employee;
import io.github.riemr.payroll.domain.model.EmploymentKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class PayrollStatsService {
    private final EmployeeRepository employeeRepository;

    /** Head counts and the estimated monthly payroll of active employees. */
    public PayrollStatsDto getStats() {
        List<Employee> active = new ArrayList<>();
        for (io.github.riemr.payroll.infrastructure.persistence.entity.Employee row
                : employeeRepository.findByStatus(EmployeeService.STATUS_ACTIVE)) {
            if (!EmploymentKind.isKnown(row.getType())) {
                log.warn("Skipping employee {} with unknown type '{}' in payroll stats", row.getId(), row.getType());
                continue;
            }
            active.add(DomainAssembler.toEmployee(row, null));
        }

        int fullTime = 0;
        int partTime = 0;
        BigDecimal payroll = BigDecimal.ZERO;
        for (Employee e : active) {
            if (e.employmentKind() == EmploymentKind.FULL_TIME) fullTime++;
            else partTime++;
            payroll = payroll.add(e.monthlyBaseSalary());
        }
        return PayrollStatsDto.builder()
                .totalEmployees(active.size())
                .fullTimeEmployees(fullTime)
                .partTimeEmployees(partTime)
                .monthlyPayroll(payroll.setScale(0, RoundingMode.HALF_UP).longValueExact())
                .build();
    }
}
