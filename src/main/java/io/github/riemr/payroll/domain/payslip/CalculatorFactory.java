package io.github.riemr.payroll.domain.payslip;

import io.github.riemr.payroll.domain.exception.UnknownEmployeeTypeException;
import io.github.riemr.payroll.domain.model.Employee;
import io.github.riemr.payroll.domain.model.EmploymentKind;
import io.github.riemr.payroll.domain.model.FullTimeEmployee;
import io.github.riemr.payroll.domain.model.PartTimeEmployee;

public final class CalculatorFactory {
    private CalculatorFactory() {
    }

    public static PayslipCalculator create(Employee employee) {
        EmploymentKind kind = employee == null ? null : employee.employmentKind();
        if (kind == null) {
            throw new UnknownEmployeeTypeException("Unknown employee type");
        }
        switch (kind) {
            case FULL_TIME:
                if (employee instanceof FullTimeEmployee) {
                    return new FullTimePayslipCalculator((FullTimeEmployee) employee);
                }
                break;
            case PART_TIME:
                if (employee instanceof PartTimeEmployee) {
                    return new PartTimePayslipCalculator((PartTimeEmployee) employee);
                }
                break;
            default:
                break;
        }
        // kind claimed by a class outside the known variants
        throw new UnknownEmployeeTypeException("Unknown employee type: " + kind.getCode()
                + " (" + employee.getClass().getName() + ")");
    }
}
