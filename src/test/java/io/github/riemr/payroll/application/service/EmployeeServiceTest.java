package io.github.riemr.payroll.application.service;

import io.github.riemr.payroll.application.dto.EmployeeRequest;
import io.github.riemr.payroll.application.exception.DuplicateEmailException;
import io.github.riemr.payroll.application.exception.ResourceNotFoundException;
import io.github.riemr.payroll.application.repository.EmployeeRepository;
import io.github.riemr.payroll.application.repository.PayslipRepository;
import io.github.riemr.payroll.application.repository.RoleRepository;
import io.github.riemr.payroll.domain.exception.SalaryOutOfRangeException;
import io.github.riemr.payroll.domain.exception.UnknownEmployeeKindException;
import io.github.riemr.payroll.infrastructure.persistence.entity.Employee;
import io.github.riemr.payroll.infrastructure.persistence.entity.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EmployeeServiceTest {

    @Mock
    EmployeeRepository repository;
    @Mock
    RoleRepository roleRepository;
    @Mock
    PayslipRepository payslipRepository;

    EmployeeService service;

    @BeforeEach
    void setup() {
        service = new EmployeeService(repository, roleRepository, payslipRepository, new SalaryBandValidator());
    }

    static Role developerRole() {
        Role r = new Role();
        r.setId(1L);
        r.setTitle("Senior Developer");
        r.setDescription("d");
        r.setDepartment("engineering");
        r.setLevel(3);
        r.setMinSalary(new BigDecimal("75000.00"));
        r.setMaxSalary(new BigDecimal("95000.00"));
        r.setResponsibilities(List.of("Code review"));
        return r;
    }

    static EmployeeRequest request(String salary) {
        EmployeeRequest req = new EmployeeRequest();
        req.setFirstName("Ada");
        req.setLastName("Lovelace");
        req.setEmail("ada@example.com");
        req.setType("full-time");
        req.setDepartment("engineering");
        req.setRoleId(1L);
        req.setSalary(new BigDecimal(salary));
        req.setStartDate(LocalDate.of(2024, 2, 1));
        return req;
    }

    static Employee stored() {
        Employee e = new Employee();
        e.setId(5L);
        e.setFirstName("Ada");
        e.setLastName("Lovelace");
        e.setEmail("ada@example.com");
        e.setType("full-time");
        e.setDepartment("engineering");
        e.setRoleId(1L);
        e.setSalary(new BigDecimal("80000"));
        e.setStartDate(LocalDate.of(2024, 2, 1));
        e.setStatus("active");
        return e;
    }

    @Test
    void create_withinBand_persistsActiveEmployee() {
        when(repository.findByEmail("ada@example.com")).thenReturn(Optional.empty());
        when(roleRepository.findById(1L)).thenReturn(Optional.of(developerRole()));

        Employee created = service.create(request("95000"));

        ArgumentCaptor<Employee> captor = ArgumentCaptor.forClass(Employee.class);
        verify(repository).save(captor.capture());
        assertThat(captor.getValue().getStatus()).isEqualTo("active");
        assertThat(captor.getValue().getSalary()).isEqualByComparingTo("95000");
        assertThat(created).isSameAs(captor.getValue());
    }

    @Test
    void create_outsideBand_isRejectedWithBandInMessage() {
        when(repository.findByEmail(any())).thenReturn(Optional.empty());
        when(roleRepository.findById(1L)).thenReturn(Optional.of(developerRole()));

        assertThatThrownBy(() -> service.create(request("95000.01")))
                .isInstanceOf(SalaryOutOfRangeException.class)
                .hasMessage("Salary must be between 75000.00 and 95000.00 for this role");
        verify(repository, never()).save(any());
    }

    @Test
    void create_duplicateEmail_isRejected() {
        when(repository.findByEmail("ada@example.com")).thenReturn(Optional.of(stored()));

        assertThatThrownBy(() -> service.create(request("80000")))
                .isInstanceOf(DuplicateEmailException.class)
                .hasMessage("Employee with this email already exists");
        verify(repository, never()).save(any());
    }

    @Test
    void create_paddedEmailMatchingExisting_isRejected() {
        when(repository.findByEmail("ada@example.com")).thenReturn(Optional.of(stored()));
        EmployeeRequest req = request("80000");
        req.setEmail("  ada@example.com ");

        assertThatThrownBy(() -> service.create(req))
                .isInstanceOf(DuplicateEmailException.class)
                .hasMessage("Employee with this email already exists");
        verify(repository, never()).save(any());
    }

    @Test
    void create_unknownRole_isRejected() {
        when(repository.findByEmail(any())).thenReturn(Optional.empty());
        when(roleRepository.findById(1L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.create(request("80000")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid role ID");
    }

    @Test
    void create_unknownType_isRejectedBeforeAnyLookup() {
        EmployeeRequest req = request("80000");
        req.setType("contractor");

        assertThatThrownBy(() -> service.create(req)).isInstanceOf(UnknownEmployeeKindException.class);
        verifyNoInteractions(roleRepository);
        verify(repository, never()).save(any());
    }

    @Test
    void update_outsideBand_isAcceptedByDefault() {
        when(repository.findById(5L)).thenReturn(Optional.of(stored()));
        EmployeeRequest req = new EmployeeRequest();
        req.setSalary(new BigDecimal("200000"));

        Employee updated = service.update(5L, req);

        assertThat(updated.getSalary()).isEqualByComparingTo("200000");
        verify(repository).update(updated);
        verifyNoInteractions(roleRepository);
    }

    @Test
    void update_outsideBand_isRejectedWhenRevalidationEnabled() {
        ReflectionTestUtils.setField(service, "validateSalaryOnUpdate", true);
        when(repository.findById(5L)).thenReturn(Optional.of(stored()));
        when(roleRepository.findById(1L)).thenReturn(Optional.of(developerRole()));
        EmployeeRequest req = new EmployeeRequest();
        req.setSalary(new BigDecimal("200000"));

        assertThatThrownBy(() -> service.update(5L, req)).isInstanceOf(SalaryOutOfRangeException.class);
        verify(repository, never()).update(any());
    }

    @Test
    void update_changingEmailToTakenAddress_isRejected() {
        when(repository.findById(5L)).thenReturn(Optional.of(stored()));
        Employee other = stored();
        other.setId(6L);
        other.setEmail("grace@example.com");
        when(repository.findByEmail("grace@example.com")).thenReturn(Optional.of(other));
        EmployeeRequest req = new EmployeeRequest();
        req.setEmail("grace@example.com");

        assertThatThrownBy(() -> service.update(5L, req)).isInstanceOf(DuplicateEmailException.class);
    }

    @Test
    void update_missingEmployee_isNotFound() {
        when(repository.findById(99L)).thenReturn(Optional.empty());
        assertThatThrownBy(() -> service.update(99L, new EmployeeRequest()))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void delete_removesPayslipsFirst() {
        when(repository.findById(5L)).thenReturn(Optional.of(stored()));
        when(repository.delete(5L)).thenReturn(true);

        service.delete(5L);

        var inOrder = inOrder(payslipRepository, repository);
        inOrder.verify(payslipRepository).deleteByEmployee(5L);
        inOrder.verify(repository).delete(5L);
    }
}
