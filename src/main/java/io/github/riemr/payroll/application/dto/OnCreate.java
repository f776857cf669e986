package io.github.riemr.payroll.application.dto;

import jakarta.validation.groups.Default;

/**
 * Validation group for create requests. Update requests are validated with the default
 * group only, so every field becomes optional there.
 */
public interface OnCreate extends Default {
}
