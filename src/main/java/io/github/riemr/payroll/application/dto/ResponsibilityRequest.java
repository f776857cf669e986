package io.github.riemr.payroll.application.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ResponsibilityRequest {
    @NotBlank
    private String text;
}
