package io.github.riemr.payroll.domain.payslip;

import io.github.riemr.payroll.domain.model.FullTimeEmployee;
import io.github.riemr.payroll.domain.model.PartTimeEmployee;
import io.github.riemr.payroll.domain.model.Role;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PayslipCalculatorTest {
    private static final Role ROLE = new Role(1L, "Developer", "d", "engineering", 2,
            new BigDecimal("20"), new BigDecimal("100000"), List.of());

    private static FullTimeEmployee salaried() {
        return new FullTimeEmployee(1L, "Ada", "Lovelace", "ada@example.com", ROLE,
                LocalDate.of(2023, 3, 1), new BigDecimal("96000"));
    }

    private static PartTimeEmployee hourly() {
        return new PartTimeEmployee(2L, "Alan", "Turing", "alan@example.com", ROLE,
                LocalDate.of(2023, 3, 1), new BigDecimal("25"));
    }

    @Test
    void fullTime_basePayIgnoresHours() {
        PayslipCalculator calc = new FullTimePayslipCalculator(salaried());

        PayslipResult none = calc.calculate(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
        PayslipResult many = calc.calculate(new BigDecimal("200"));

        assertThat(none.getBasePay()).isEqualByComparingTo("8000.00");
        assertThat(none.getOvertimePay()).isEqualByComparingTo("0");
        assertThat(none.getGrossPay()).isEqualByComparingTo("8000.00");
        assertThat(none.getNetPay()).isEqualByComparingTo("8000.00");
        assertThat(many.getBasePay()).isEqualByComparingTo(none.getBasePay());
    }

    @Test
    void fullTime_overtimeAtTimeAndAHalfOfHourlyEquivalent() {
        PayslipResult r = new FullTimePayslipCalculator(salaried())
                .calculate(new BigDecimal("160"), BigDecimal.TEN);

        // 96000 / 2080 = 46.1538..., * 10 * 1.5
        assertThat(r.getOvertimePay().setScale(2, RoundingMode.HALF_UP)).isEqualByComparingTo("692.31");
        assertThat(r.getOvertimePay().scale()).isGreaterThan(2);
        assertThat(r.rounded().getOvertimePay()).isEqualByComparingTo("692.31");
        assertThat(r.rounded().getGrossPay()).isEqualByComparingTo("8692.31");
    }

    @Test
    void partTime_actualHoursDrivePay() {
        PayslipResult r = new PartTimePayslipCalculator(hourly())
                .calculate(new BigDecimal("80"), new BigDecimal("5"), new BigDecimal("50"));

        assertThat(r.getBasePay()).isEqualByComparingTo("2000");
        assertThat(r.getOvertimePay()).isEqualByComparingTo("187.5");
        assertThat(r.getGrossPay()).isEqualByComparingTo("2187.5");
        assertThat(r.getDeductions()).isEqualByComparingTo("50");
        assertThat(r.getNetPay()).isEqualByComparingTo("2137.5");
        assertThat(r.getHoursWorked()).isEqualByComparingTo("80");
        assertThat(r.getOvertimeHours()).isEqualByComparingTo("5");
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "-1", "-0.5"})
    void nonPositiveOvertime_paysNothing(String overtime) {
        BigDecimal ot = new BigDecimal(overtime);
        assertThat(new FullTimePayslipCalculator(salaried()).calculate(BigDecimal.TEN, ot).getOvertimePay())
                .isEqualByComparingTo("0");
        assertThat(new PartTimePayslipCalculator(hourly()).calculate(BigDecimal.TEN, ot).getOvertimePay())
                .isEqualByComparingTo("0");
    }

    @Test
    void missingOvertimeAndDeductions_defaultToZero() {
        PayslipResult r = new PartTimePayslipCalculator(hourly()).calculate(new BigDecimal("4"), null, null);
        assertThat(r.getOvertimeHours()).isEqualByComparingTo("0");
        assertThat(r.getDeductions()).isEqualByComparingTo("0");
        assertThat(r.getNetPay()).isEqualByComparingTo("100");
    }

    @Test
    void grossAndNet_areAlgebraicallyDerived() {
        List<PayslipCalculator> calculators = List.of(
                new FullTimePayslipCalculator(salaried()), new PartTimePayslipCalculator(hourly()));
        String[][] inputs = {{"0", "0", "0"}, {"37.5", "3.25", "120.40"}, {"160", "12", "999.99"}};
        for (PayslipCalculator calc : calculators) {
            for (String[] in : inputs) {
                PayslipResult r = calc.calculate(new BigDecimal(in[0]), new BigDecimal(in[1]), new BigDecimal(in[2]));
                assertThat(r.getGrossPay()).isEqualByComparingTo(r.getBasePay().add(r.getOvertimePay()));
                assertThat(r.getNetPay()).isEqualByComparingTo(r.getGrossPay().subtract(r.getDeductions()));
            }
        }
    }

    @Test
    void deductionsAboveGross_yieldNegativeNet() {
        PayslipResult r = new PartTimePayslipCalculator(hourly())
                .calculate(BigDecimal.ONE, BigDecimal.ZERO, new BigDecimal("100"));
        assertThat(r.getNetPay()).isEqualByComparingTo("-75");
    }
}
