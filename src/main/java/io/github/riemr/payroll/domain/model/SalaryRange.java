package io.github.riemr.payroll.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class SalaryRange {
    private final BigDecimal min;
    private final BigDecimal max;

    public boolean contains(BigDecimal candidate) {
        if (candidate == null) return false;
        return candidate.compareTo(min) >= 0 && candidate.compareTo(max) <= 0;
    }
}
