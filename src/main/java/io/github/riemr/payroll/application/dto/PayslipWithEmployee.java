package io.github.riemr.payroll.application.dto;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import io.github.riemr.payroll.infrastructure.persistence.entity.Employee;
import io.github.riemr.payroll.infrastructure.persistence.entity.Payslip;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PayslipWithEmployee {
    @JsonUnwrapped
    private Payslip payslip;
    private Employee employee;
}
