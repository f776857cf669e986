package io.github.riemr.payroll.application.service;

import io.github.riemr.payroll.application.dto.RoleRequest;
import io.github.riemr.payroll.application.exception.ResourceNotFoundException;
import io.github.riemr.payroll.application.repository.RoleRepository;
import io.github.riemr.payroll.infrastructure.persistence.entity.Role;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class RoleService {
    private final RoleRepository repository;

    public List<Role> findAll() {
        return repository.findAll();
    }

    public Role find(Long id) {
        return repository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Role not found"));
    }

    @Transactional
    public Role create(RoleRequest req) {
        // build the domain role first so band and dedup rules apply before anything is stored
        io.github.riemr.payroll.domain.model.Role role = new io.github.riemr.payroll.domain.model.Role(
                null, req.getTitle(), req.getDescription(), req.getDepartment(), req.getLevel(),
                req.getMinSalary(), req.getMaxSalary(), req.getResponsibilities());
        Role row = new Role();
        DomainAssembler.copyInto(role, row);
        repository.save(row);
        log.info("Created role {} ({})", row.getId(), row.getTitle());
        return row;
    }

    /** Partial update: only non-null request fields overwrite the stored role. */
    @Transactional
    public Role update(Long id, RoleRequest req) {
        Role existing = find(id);
        if (req.getTitle() != null) existing.setTitle(req.getTitle());
        if (req.getDescription() != null) existing.setDescription(req.getDescription());
        if (req.getDepartment() != null) existing.setDepartment(req.getDepartment());
        if (req.getLevel() != null) existing.setLevel(req.getLevel());
        if (req.getMinSalary() != null) existing.setMinSalary(req.getMinSalary());
        if (req.getMaxSalary() != null) existing.setMaxSalary(req.getMaxSalary());
        if (req.getResponsibilities() != null) existing.setResponsibilities(req.getResponsibilities());

        io.github.riemr.payroll.domain.model.Role role = DomainAssembler.toRole(existing);
        DomainAssembler.copyInto(role, existing);
        repository.save(existing);
        log.info("Updated role {}", id);
        return existing;
    }

    @Transactional
    public void delete(Long id) {
        if (!repository.delete(id)) {
            throw new ResourceNotFoundException("Role not found");
        }
        log.info("Deleted role {}", id);
    }

    @Transactional
    public Role addResponsibility(Long id, String text) {
        Role existing = find(id);
        io.github.riemr.payroll.domain.model.Role role = DomainAssembler.toRole(existing);
        role.addResponsibility(text);
        existing.setResponsibilities(role.getResponsibilities());
        repository.save(existing);
        return existing;
    }

    @Transactional
    public Role removeResponsibility(Long id, String text) {
        Role existing = find(id);
        io.github.riemr.payroll.domain.model.Role role = DomainAssembler.toRole(existing);
        role.removeResponsibility(text);
        existing.setResponsibilities(role.getResponsibilities());
        repository.save(existing);
        return existing;
    }
}
