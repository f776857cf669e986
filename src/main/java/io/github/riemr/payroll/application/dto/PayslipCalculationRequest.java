package io.github.riemr.payroll.application.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class PayslipCalculationRequest {
    @NotNull(message = "Employee ID is required")
    private Long employeeId;

    @NotNull(message = "Hours worked is required")
    @DecimalMin(value = "0", message = "hoursWorked must not be negative")
    private BigDecimal hoursWorked;

    @DecimalMin(value = "0", message = "overtimeHours must not be negative")
    private BigDecimal overtimeHours = BigDecimal.ZERO;

    @DecimalMin(value = "0", message = "deductions must not be negative")
    private BigDecimal deductions = BigDecimal.ZERO;
}
