package io.github.riemr.payroll.domain.payslip;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Breakdown of one payslip calculation. Gross and net are always derived from the other
 * figures, never supplied.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class PayslipResult {
    public static final int PRESENTATION_SCALE = 2;

    private final BigDecimal basePay;
    private final BigDecimal overtimePay;
    private final BigDecimal grossPay;
    private final BigDecimal deductions;
    private final BigDecimal netPay;
    private final BigDecimal hoursWorked;
    private final BigDecimal overtimeHours;

    public PayslipResult(BigDecimal basePay, BigDecimal overtimePay, BigDecimal deductions,
                         BigDecimal hoursWorked, BigDecimal overtimeHours) {
        this.basePay = basePay;
        this.overtimePay = overtimePay;
        this.grossPay = basePay.add(overtimePay);
        this.deductions = deductions;
        this.netPay = grossPay.subtract(deductions);
        this.hoursWorked = hoursWorked;
        this.overtimeHours = overtimeHours;
    }

    private PayslipResult(BigDecimal basePay, BigDecimal overtimePay, BigDecimal grossPay, BigDecimal deductions,
                          BigDecimal netPay, BigDecimal hoursWorked, BigDecimal overtimeHours) {
        this.basePay = basePay;
        this.overtimePay = overtimePay;
        this.grossPay = grossPay;
        this.deductions = deductions;
        this.netPay = netPay;
        this.hoursWorked = hoursWorked;
        this.overtimeHours = overtimeHours;
    }

    /**
     * Two-decimal copy for responses and storage. Each figure is rounded from the exact
     * value, so the rounded gross may differ from rounded base + overtime by a cent.
     */
    public PayslipResult rounded() {
        return new PayslipResult(scale(basePay), scale(overtimePay), scale(grossPay), scale(deductions),
                scale(netPay), scale(hoursWorked), scale(overtimeHours));
    }

    private static BigDecimal scale(BigDecimal value) {
        return value.setScale(PRESENTATION_SCALE, RoundingMode.HALF_UP);
    }
}
