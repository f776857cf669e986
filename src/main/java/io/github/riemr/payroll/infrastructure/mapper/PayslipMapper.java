package io.github.riemr.payroll.infrastructure.mapper;

import io.github.riemr.payroll.infrastructure.persistence.entity.Payslip;
import org.apache.ibatis.annotations.*;

import java.util.List;

@Mapper
public interface PayslipMapper {
    String COLUMNS = "id, employee_id, pay_period_from, pay_period_to, hours_worked, overtime_hours, base_pay, " +
            "overtime_pay, deductions, gross_pay, net_pay, status, created_at";

    @Select("SELECT " + COLUMNS + " FROM payslips ORDER BY created_at DESC, id DESC")
    @Results(id = "payslipResult", value = {
        @Result(property = "id", column = "id", id = true),
        @Result(property = "employeeId", column = "employee_id"),
        @Result(property = "payPeriodFrom", column = "pay_period_from"),
        @Result(property = "payPeriodTo", column = "pay_period_to"),
        @Result(property = "hoursWorked", column = "hours_worked"),
        @Result(property = "overtimeHours", column = "overtime_hours"),
        @Result(property = "basePay", column = "base_pay"),
        @Result(property = "overtimePay", column = "overtime_pay"),
        @Result(property = "deductions", column = "deductions"),
        @Result(property = "grossPay", column = "gross_pay"),
        @Result(property = "netPay", column = "net_pay"),
        @Result(property = "status", column = "status"),
        @Result(property = "createdAt", column = "created_at")
    })
    List<Payslip> selectAll();

    @Select("SELECT " + COLUMNS + " FROM payslips WHERE id = #{id}")
    @ResultMap("payslipResult")
    Payslip selectByPrimaryKey(Long id);

    @Select("SELECT " + COLUMNS + " FROM payslips WHERE employee_id = #{employeeId} ORDER BY pay_period_from DESC, id DESC")
    @ResultMap("payslipResult")
    List<Payslip> selectByEmployee(Long employeeId);

    @Insert("INSERT INTO payslips (employee_id, pay_period_from, pay_period_to, hours_worked, overtime_hours, base_pay, " +
            "overtime_pay, deductions, gross_pay, net_pay, status) VALUES (#{employeeId}, #{payPeriodFrom}, #{payPeriodTo}, " +
            "#{hoursWorked}, #{overtimeHours}, #{basePay}, #{overtimePay}, #{deductions}, #{grossPay}, #{netPay}, " +
            "COALESCE(#{status}, 'generated'))")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insert(Payslip row);

    @Delete("DELETE FROM payslips WHERE employee_id = #{employeeId}")
    int deleteByEmployee(Long employeeId);
}
