package io.github.riemr.payroll.application.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

@Data
public class RoleRequest {
    @NotBlank(groups = OnCreate.class)
    private String title;

    @NotBlank(groups = OnCreate.class)
    private String description;

    @NotBlank(groups = OnCreate.class)
    private String department;

    @NotNull(groups = OnCreate.class)
    @Min(1)
    private Integer level;

    @NotNull(groups = OnCreate.class)
    @DecimalMin("0")
    @Digits(integer = 8, fraction = 2)
    private BigDecimal minSalary;

    @NotNull(groups = OnCreate.class)
    @DecimalMin("0")
    @Digits(integer = 8, fraction = 2)
    private BigDecimal maxSalary;

    private List<String> responsibilities;
}
