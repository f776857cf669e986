package io.github.riemr.payroll.application.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
public class EmployeeRequest {
    @NotBlank(groups = OnCreate.class)
    private String firstName;

    @NotBlank(groups = OnCreate.class)
    private String lastName;

    @NotBlank(groups = OnCreate.class)
    @Email
    private String email;

    private String phone;

    @NotBlank(groups = OnCreate.class)
    private String type; // full-time | part-time

    @NotBlank(groups = OnCreate.class)
    private String department;

    @NotNull(groups = OnCreate.class)
    private Long roleId;

    // annual salary for full-time, hourly rate for part-time
    @NotNull(groups = OnCreate.class)
    @DecimalMin("0")
    @Digits(integer = 8, fraction = 2)
    private BigDecimal salary;

    @NotNull(groups = OnCreate.class)
    private LocalDate startDate;

    private String status;
}
