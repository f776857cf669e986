package io.github.riemr.payroll.application.service;

import io.github.riemr.payroll.application.dto.PayslipCalculationRequest;
import io.github.riemr.payroll.application.dto.PayslipCreateRequest;
import io.github.riemr.payroll.application.dto.PayslipWithEmployee;
import io.github.riemr.payroll.application.exception.ResourceNotFoundException;
import io.github.riemr.payroll.application.repository.EmployeeRepository;
import io.github.riemr.payroll.application.repository.PayslipRepository;
import io.github.riemr.payroll.application.repository.RoleRepository;
import io.github.riemr.payroll.domain.payslip.CalculatorFactory;
import io.github.riemr.payroll.domain.payslip.PayslipCalculator;
import io.github.riemr.payroll.domain.payslip.PayslipResult;
import io.github.riemr.payroll.infrastructure.persistence.entity.Employee;
import io.github.riemr.payroll.infrastructure.persistence.entity.Payslip;
import io.github.riemr.payroll.infrastructure.persistence.entity.Role;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class PayslipService {
    static final String STATUS_GENERATED = "generated";
    // pay columns are NUMERIC(10,2)
    static final BigDecimal MAX_STORED_AMOUNT = new BigDecimal("100000000");

    private final PayslipRepository repository;
    private final EmployeeRepository employeeRepository;
    private final RoleRepository roleRepository;

    public List<PayslipWithEmployee> findAll() {
        Map<Long, Employee> employees = employeeRepository.findAll().stream()
                .collect(Collectors.toMap(Employee::getId, Function.identity()));
        return repository.findAll().stream()
                .map(p -> new PayslipWithEmployee(p, employees.get(p.getEmployeeId())))
                .collect(Collectors.toList());
    }

    public PayslipWithEmployee find(Long id) {
        Payslip p = repository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Payslip not found"));
        return new PayslipWithEmployee(p, employeeRepository.findById(p.getEmployeeId()).orElse(null));
    }

    /**
     * Runs the calculator for a stored employee. The result is rounded to cents for
     * presentation; nothing is persisted.
     */
    public PayslipResult calculate(PayslipCalculationRequest req) {
        return calculate(req.getEmployeeId(), req.getHoursWorked(), req.getOvertimeHours(), req.getDeductions())
                .rounded();
    }

    @Transactional
    public Payslip generate(PayslipCreateRequest req) {
        if (req.getPayPeriodTo().isBefore(req.getPayPeriodFrom())) {
            throw new IllegalArgumentException("payPeriodTo must not be before payPeriodFrom");
        }
        PayslipResult result = calculate(req.getEmployeeId(), req.getHoursWorked(), req.getOvertimeHours(),
                req.getDeductions()).rounded();
        if (result.getGrossPay().compareTo(MAX_STORED_AMOUNT) >= 0) {
            throw new IllegalArgumentException("Gross pay exceeds the storable amount");
        }

        Payslip p = new Payslip();
        p.setEmployeeId(req.getEmployeeId());
        p.setPayPeriodFrom(req.getPayPeriodFrom());
        p.setPayPeriodTo(req.getPayPeriodTo());
        p.setHoursWorked(result.getHoursWorked());
        p.setOvertimeHours(result.getOvertimeHours());
        p.setBasePay(result.getBasePay());
        p.setOvertimePay(result.getOvertimePay());
        p.setDeductions(result.getDeductions());
        p.setGrossPay(result.getGrossPay());
        p.setNetPay(result.getNetPay());
        p.setStatus(req.getStatus() == null ? STATUS_GENERATED : req.getStatus());
        repository.save(p);
        log.info("Generated payslip {} for employee {} ({} .. {}), net {}", p.getId(), p.getEmployeeId(),
                p.getPayPeriodFrom(), p.getPayPeriodTo(), p.getNetPay());
        return p;
    }

    private PayslipResult calculate(Long employeeId, BigDecimal hoursWorked, BigDecimal overtimeHours,
                                    BigDecimal deductions) {
        Employee row = employeeRepository.findById(employeeId)
                .orElseThrow(() -> new ResourceNotFoundException("Employee not found"));
        Role roleRow = row.getRoleId() == null ? null : roleRepository.findById(row.getRoleId()).orElse(null);

        io.github.riemr.payroll.domain.model.Employee employee = DomainAssembler.toEmployee(row, roleRow);
        PayslipCalculator calculator = CalculatorFactory.create(employee);
        PayslipResult result = calculator.calculate(hoursWorked, overtimeHours, deductions);
        log.debug("Payslip for employee {} ({}): {}", employeeId, employee.employmentKind(), result);
        return result;
    }
}
