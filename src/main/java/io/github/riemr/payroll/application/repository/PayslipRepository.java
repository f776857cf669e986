package io.github.riemr.payroll.application.repository;

import io.github.riemr.payroll.infrastructure.persistence.entity.Payslip;

import java.util.List;
import java.util.Optional;

public interface PayslipRepository {
    List<Payslip> findAll();
    Optional<Payslip> findById(Long id);
    List<Payslip> findByEmployee(Long employeeId);
    void save(Payslip payslip);
    void deleteByEmployee(Long employeeId);
}
