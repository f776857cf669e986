package io.github.riemr.payroll.domain.payslip;

import io.github.riemr.payroll.domain.exception.UnknownEmployeeTypeException;
import io.github.riemr.payroll.domain.model.Employee;
import io.github.riemr.payroll.domain.model.EmployeeFactory;
import io.github.riemr.payroll.domain.model.EmploymentKind;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CalculatorFactoryTest {

    @Test
    void selectsCalculatorMatchingEmploymentKind() {
        Employee ft = EmployeeFactory.create("full-time", 1L, "a", "b", "a@example.com", null,
                LocalDate.of(2024, 1, 1), new BigDecimal("60000"));
        Employee pt = EmployeeFactory.create("part-time", 2L, "c", "d", "c@example.com", null,
                LocalDate.of(2024, 1, 1), new BigDecimal("20"));

        PayslipCalculator ftCalc = CalculatorFactory.create(ft);
        PayslipCalculator ptCalc = CalculatorFactory.create(pt);

        assertThat(ftCalc).isInstanceOf(FullTimePayslipCalculator.class);
        assertThat(ftCalc.getEmployee()).isSameAs(ft);
        assertThat(ptCalc).isInstanceOf(PartTimePayslipCalculator.class);
        assertThat(ptCalc.getEmployee()).isSameAs(pt);
    }

    @Test
    void employeeWithoutKind_isRejected() {
        Employee unknown = new Employee(3L, "x", "y", "x@example.com", null, LocalDate.now()) {
            @Override
            public BigDecimal monthlyBaseSalary() {
                return BigDecimal.ZERO;
            }

            @Override
            public EmploymentKind employmentKind() {
                return null;
            }

            @Override
            public boolean benefitsEligible() {
                return false;
            }
        };

        assertThatThrownBy(() -> CalculatorFactory.create(unknown))
                .isInstanceOf(UnknownEmployeeTypeException.class);
        assertThatThrownBy(() -> CalculatorFactory.create(null))
                .isInstanceOf(UnknownEmployeeTypeException.class);
    }

    @Test
    void employeeClaimingKnownKindOutsideVariants_isRejected() {
        for (EmploymentKind claimed : EmploymentKind.values()) {
            Employee impostor = new Employee(4L, "x", "y", "x@example.com", null, LocalDate.now()) {
                @Override
                public BigDecimal monthlyBaseSalary() {
                    return BigDecimal.ONE;
                }

                @Override
                public EmploymentKind employmentKind() {
                    return claimed;
                }

                @Override
                public boolean benefitsEligible() {
                    return false;
                }
            };

            assertThatThrownBy(() -> CalculatorFactory.create(impostor))
                    .isInstanceOf(UnknownEmployeeTypeException.class)
                    .hasMessageContaining(claimed.getCode());
        }
    }
}
