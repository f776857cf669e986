package io.github.riemr.payroll.application.service;

import io.github.riemr.payroll.application.dto.PayrollStatsDto;
import io.github.riemr.payroll.application.repository.EmployeeRepository;
import io.github.riemr.payroll.infrastructure.persistence.entity.Employee;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PayrollStatsServiceTest {

    private static Employee row(long id, String type, String salary) {
        Employee e = new Employee();
        e.setId(id);
        e.setFirstName("f" + id);
        e.setLastName("l" + id);
        e.setEmail(id + "@example.com");
        e.setType(type);
        e.setSalary(new BigDecimal(salary));
        e.setStatus("active");
        return e;
    }

    @Test
    void stats_countActiveEmployeesAndEstimateMonthlyPayroll() {
        EmployeeRepository repository = mock(EmployeeRepository.class);
        when(repository.findByStatus("active")).thenReturn(List.of(
                row(1, "full-time", "96000"),
                row(2, "full-time", "50000"),
                row(3, "part-time", "25")));

        PayrollStatsDto stats = new PayrollStatsService(repository).getStats();

        assertThat(stats.getTotalEmployees()).isEqualTo(3);
        assertThat(stats.getFullTimeEmployees()).isEqualTo(2);
        assertThat(stats.getPartTimeEmployees()).isEqualTo(1);
        // 8000 + 4166.67 + 2000
        assertThat(stats.getMonthlyPayroll()).isEqualTo(14167L);
    }

    @Test
    void stats_skipRowsWithUnknownType() {
        EmployeeRepository repository = mock(EmployeeRepository.class);
        when(repository.findByStatus("active")).thenReturn(List.of(
                row(1, "full-time", "96000"),
                row(2, "contractor", "50000"),
                row(3, "part-time", "25")));

        PayrollStatsDto stats = new PayrollStatsService(repository).getStats();

        assertThat(stats.getTotalEmployees()).isEqualTo(2);
        assertThat(stats.getFullTimeEmployees()).isEqualTo(1);
        assertThat(stats.getPartTimeEmployees()).isEqualTo(1);
        assertThat(stats.getMonthlyPayroll()).isEqualTo(10000L);
    }

    @Test
    void stats_emptyWorkforce() {
        EmployeeRepository repository = mock(EmployeeRepository.class);
        when(repository.findByStatus("active")).thenReturn(List.of());

        PayrollStatsDto stats = new PayrollStatsService(repository).getStats();

        assertThat(stats.getTotalEmployees()).isZero();
        assertThat(stats.getMonthlyPayroll()).isZero();
    }
}
