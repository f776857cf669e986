package io.github.riemr.payroll.infrastructure.repository;

import io.github.riemr.payroll.application.repository.EmployeeRepository;
import io.github.riemr.payroll.infrastructure.mapper.EmployeeMapper;
import io.github.riemr.payroll.infrastructure.persistence.entity.Employee;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class EmployeeRepositoryImpl implements EmployeeRepository {
    private final EmployeeMapper mapper;

    public EmployeeRepositoryImpl(EmployeeMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public List<Employee> findAll() {
        return mapper.selectAll();
    }

    @Override
    public Optional<Employee> findById(Long id) {
        return Optional.ofNullable(mapper.selectByPrimaryKey(id));
    }

    @Override
    public Optional<Employee> findByEmail(String email) {
        return Optional.ofNullable(mapper.selectByEmail(email));
    }

    @Override
    public List<Employee> findByStatus(String status) {
        return mapper.selectByStatus(status);
    }

    @Override
    public void save(Employee employee) {
        mapper.insert(employee);
    }

    @Override
    public void update(Employee employee) {
        mapper.updateByPrimaryKey(employee);
    }

    @Override
    public boolean delete(Long id) {
        return mapper.deleteByPrimaryKey(id) > 0;
    }
}
