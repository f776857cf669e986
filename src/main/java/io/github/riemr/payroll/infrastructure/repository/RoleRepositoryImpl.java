package io.github.riemr.payroll.infrastructure.repository;

import io.github.riemr.payroll.application.repository.RoleRepository;
import io.github.riemr.payroll.infrastructure.mapper.RoleMapper;
import io.github.riemr.payroll.infrastructure.mapper.RoleResponsibilityMapper;
import io.github.riemr.payroll.infrastructure.persistence.entity.Role;
import io.github.riemr.payroll.infrastructure.persistence.entity.RoleResponsibility;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
public class RoleRepositoryImpl implements RoleRepository {
    private final RoleMapper mapper;
    private final RoleResponsibilityMapper responsibilityMapper;

    public RoleRepositoryImpl(RoleMapper mapper, RoleResponsibilityMapper responsibilityMapper) {
        this.mapper = mapper;
        this.responsibilityMapper = responsibilityMapper;
    }

    @Override
    public List<Role> findAll() {
        List<Role> roles = mapper.selectAll();
        Map<Long, List<String>> byRole = responsibilityMapper.selectAll().stream()
                .collect(Collectors.groupingBy(RoleResponsibility::getRoleId,
                        Collectors.mapping(RoleResponsibility::getResponsibility, Collectors.toList())));
        for (Role r : roles) {
            r.setResponsibilities(new ArrayList<>(byRole.getOrDefault(r.getId(), List.of())));
        }
        return roles;
    }

    @Override
    public Optional<Role> findById(Long id) {
        Role role = mapper.selectByPrimaryKey(id);
        if (role == null) return Optional.empty();
        role.setResponsibilities(responsibilityMapper.selectByRole(id).stream()
                .map(RoleResponsibility::getResponsibility)
                .collect(Collectors.toList()));
        return Optional.of(role);
    }

    @Override
    public void save(Role role) {
        if (role.getId() == null) {
            mapper.insert(role);
        } else {
            mapper.updateByPrimaryKey(role);
        }
        // Replace responsibilities
        responsibilityMapper.deleteByRole(role.getId());
        int position = 0;
        for (String text : role.getResponsibilities()) {
            responsibilityMapper.insert(new RoleResponsibility(role.getId(), position++, text));
        }
    }

    @Override
    public boolean delete(Long id) {
        responsibilityMapper.deleteByRole(id);
        return mapper.deleteByPrimaryKey(id) > 0;
    }

    @Override
    public long count() {
        return mapper.count();
    }
}
