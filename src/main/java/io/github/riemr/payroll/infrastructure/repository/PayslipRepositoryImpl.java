package io.github.riemr.payroll.infrastructure.repository;

import io.github.riemr.payroll.application.repository.PayslipRepository;
import io.github.riemr.payroll.infrastructure.mapper.PayslipMapper;
import io.github.riemr.payroll.infrastructure.persistence.entity.Payslip;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class PayslipRepositoryImpl implements PayslipRepository {
    private final PayslipMapper mapper;

    public PayslipRepositoryImpl(PayslipMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public List<Payslip> findAll() {
        return mapper.selectAll();
    }

    @Override
    public Optional<Payslip> findById(Long id) {
        return Optional.ofNullable(mapper.selectByPrimaryKey(id));
    }

    @Override
    public List<Payslip> findByEmployee(Long employeeId) {
        return mapper.selectByEmployee(employeeId);
    }

    @Override
    public void save(Payslip payslip) {
        mapper.insert(payslip);
    }

    @Override
    public void deleteByEmployee(Long employeeId) {
        mapper.deleteByEmployee(employeeId);
    }
}
