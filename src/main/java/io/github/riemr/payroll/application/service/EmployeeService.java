package io.github.riemr.payroll.application.service;

import io.github.riemr.payroll.application.dto.EmployeeRequest;
import io.github.riemr.payroll.application.dto.EmployeeWithRole;
import io.github.riemr.payroll.application.exception.DuplicateEmailException;
import io.github.riemr.payroll.application.exception.ResourceNotFoundException;
import io.github.riemr.payroll.application.repository.EmployeeRepository;
import io.github.riemr.payroll.application.repository.PayslipRepository;
import io.github.riemr.payroll.application.repository.RoleRepository;
import io.github.riemr.payroll.domain.model.EmploymentKind;
import io.github.riemr.payroll.infrastructure.persistence.entity.Employee;
import io.github.riemr.payroll.infrastructure.persistence.entity.Payslip;
import io.github.riemr.payroll.infrastructure.persistence.entity.Role;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class EmployeeService {
    static final String STATUS_ACTIVE = "active";

    private final EmployeeRepository repository;
    private final RoleRepository roleRepository;
    private final PayslipRepository payslipRepository;
    private final SalaryBandValidator salaryBandValidator;

    // creation is always gated; updates only when enabled
    @Value("${payroll.employee.validate-salary-on-update:false}")
    private boolean validateSalaryOnUpdate;

    public List<EmployeeWithRole> findAll() {
        Map<Long, Role> roles = roleRepository.findAll().stream()
                .collect(Collectors.toMap(Role::getId, Function.identity()));
        return repository.findAll().stream()
                .map(e -> new EmployeeWithRole(e, roles.get(e.getRoleId())))
                .collect(Collectors.toList());
    }

    public EmployeeWithRole find(Long id) {
        Employee e = repository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Employee not found"));
        Role role = e.getRoleId() == null ? null : roleRepository.findById(e.getRoleId()).orElse(null);
        return new EmployeeWithRole(e, role);
    }

    @Transactional
    public Employee create(EmployeeRequest req) {
        EmploymentKind.fromCode(req.getType());
        String email = req.getEmail() == null ? null : req.getEmail().trim();
        if (repository.findByEmail(email).isPresent()) {
            throw new DuplicateEmailException(email);
        }
        Role role = roleRepository.findById(req.getRoleId())
                .orElseThrow(() -> new IllegalArgumentException("Invalid role ID"));

        Employee e = new Employee();
        e.setFirstName(req.getFirstName());
        e.setLastName(req.getLastName());
        e.setEmail(email);
        e.setPhone(req.getPhone());
        e.setType(req.getType());
        e.setDepartment(req.getDepartment());
        e.setRoleId(req.getRoleId());
        e.setSalary(req.getSalary());
        e.setStartDate(req.getStartDate());
        e.setStatus(req.getStatus() == null ? STATUS_ACTIVE : req.getStatus());

        salaryBandValidator.validate(role, e);
        repository.save(e);
        log.info("Created {} employee {} ({})", e.getType(), e.getId(), e.getEmail());
        return e;
    }

    /** Partial update: only non-null request fields overwrite the stored employee. */
    @Transactional
    public Employee update(Long id, EmployeeRequest req) {
        Employee existing = repository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Employee not found"));
        if (req.getType() != null) {
            EmploymentKind.fromCode(req.getType());
            existing.setType(req.getType());
        }
        if (req.getEmail() != null && !Objects.equals(req.getEmail().trim(), existing.getEmail())) {
            String email = req.getEmail().trim();
            if (repository.findByEmail(email).isPresent()) {
                throw new DuplicateEmailException(email);
            }
            existing.setEmail(email);
        }
        if (req.getFirstName() != null) existing.setFirstName(req.getFirstName());
        if (req.getLastName() != null) existing.setLastName(req.getLastName());
        if (req.getPhone() != null) existing.setPhone(req.getPhone());
        if (req.getDepartment() != null) existing.setDepartment(req.getDepartment());
        if (req.getStartDate() != null) existing.setStartDate(req.getStartDate());
        if (req.getStatus() != null) existing.setStatus(req.getStatus());
        boolean compensationChanged = req.getSalary() != null || req.getRoleId() != null;
        if (req.getRoleId() != null) existing.setRoleId(req.getRoleId());
        if (req.getSalary() != null) existing.setSalary(req.getSalary());

        if (validateSalaryOnUpdate && compensationChanged) {
            Role role = roleRepository.findById(existing.getRoleId())
                    .orElseThrow(() -> new IllegalArgumentException("Invalid role ID"));
            salaryBandValidator.validate(role, existing);
        }
        repository.update(existing);
        log.info("Updated employee {}", id);
        return existing;
    }

    @Transactional
    public void delete(Long id) {
        if (repository.findById(id).isEmpty()) {
            throw new ResourceNotFoundException("Employee not found");
        }
        payslipRepository.deleteByEmployee(id);
        repository.delete(id);
        log.info("Deleted employee {}", id);
    }

    public List<Payslip> findPayslips(Long employeeId) {
        return payslipRepository.findByEmployee(employeeId);
    }
}
