package io.github.riemr.payroll.application.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PayrollStatsDto {
    private int totalEmployees;
    private int fullTimeEmployees;
    private int partTimeEmployees;
    // whole currency units
    private long monthlyPayroll;
}
