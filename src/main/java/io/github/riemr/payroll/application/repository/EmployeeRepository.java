package io.github.riemr.payroll.application.repository;

import io.github.riemr.payroll.infrastructure.persistence.entity.Employee;

import java.util.List;
import java.util.Optional;

public interface EmployeeRepository {
    List<Employee> findAll();
    Optional<Employee> findById(Long id);
    Optional<Employee> findByEmail(String email);
    List<Employee> findByStatus(String status);
    void save(Employee employee);
    void update(Employee employee);
    boolean delete(Long id);
}
