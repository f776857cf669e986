package io.github.riemr.payroll.application.repository;

import io.github.riemr.payroll.infrastructure.persistence.entity.Role;

import java.util.List;
import java.util.Optional;

public interface RoleRepository {
    List<Role> findAll();
    Optional<Role> findById(Long id);
    /** Inserts when the id is null, otherwise updates. Responsibilities are replaced. */
    void save(Role role);
    boolean delete(Long id);
    long count();
}
