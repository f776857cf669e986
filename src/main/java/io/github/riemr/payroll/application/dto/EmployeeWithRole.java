package io.github.riemr.payroll.application.dto;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import io.github.riemr.payroll.infrastructure.persistence.entity.Employee;
import io.github.riemr.payroll.infrastructure.persistence.entity.Role;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmployeeWithRole {
    @JsonUnwrapped
    private Employee employee;
    private Role role;
}
