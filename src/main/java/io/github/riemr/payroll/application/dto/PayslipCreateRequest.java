package io.github.riemr.payroll.application.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class PayslipCreateRequest {
    @NotNull
    private Long employeeId;

    @NotNull
    private LocalDate payPeriodFrom;

    @NotNull
    private LocalDate payPeriodTo;

    @NotNull
    @DecimalMin("0")
    @Digits(integer = 5, fraction = 2)
    private BigDecimal hoursWorked;

    @DecimalMin("0")
    @Digits(integer = 5, fraction = 2)
    private BigDecimal overtimeHours = BigDecimal.ZERO;

    @DecimalMin("0")
    @Digits(integer = 8, fraction = 2)
    private BigDecimal deductions = BigDecimal.ZERO;

    private String status;
}
