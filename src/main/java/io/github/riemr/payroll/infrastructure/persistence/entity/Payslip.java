package io.github.riemr.payroll.infrastructure.persistence.entity;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

public class Payslip implements Serializable {
    private Long id;
    private Long employeeId;
    private LocalDate payPeriodFrom;
    private LocalDate payPeriodTo;
    private BigDecimal hoursWorked;
    private BigDecimal overtimeHours;
    private BigDecimal basePay;
    private BigDecimal overtimePay;
    private BigDecimal deductions;
    private BigDecimal grossPay;
    private BigDecimal netPay;
    private String status;
    private LocalDateTime createdAt;

    private static final long serialVersionUID = 1L;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getEmployeeId() { return employeeId; }
    public void setEmployeeId(Long employeeId) { this.employeeId = employeeId; }
    public LocalDate getPayPeriodFrom() { return payPeriodFrom; }
    public void setPayPeriodFrom(LocalDate payPeriodFrom) { this.payPeriodFrom = payPeriodFrom; }
    public LocalDate getPayPeriodTo() { return payPeriodTo; }
    public void setPayPeriodTo(LocalDate payPeriodTo) { this.payPeriodTo = payPeriodTo; }
    public BigDecimal getHoursWorked() { return hoursWorked; }
    public void setHoursWorked(BigDecimal hoursWorked) { this.hoursWorked = hoursWorked; }
    public BigDecimal getOvertimeHours() { return overtimeHours; }
    public void setOvertimeHours(BigDecimal overtimeHours) { this.overtimeHours = overtimeHours; }
    public BigDecimal getBasePay() { return basePay; }
    public void setBasePay(BigDecimal basePay) { this.basePay = basePay; }
    public BigDecimal getOvertimePay() { return overtimePay; }
    public void setOvertimePay(BigDecimal overtimePay) { this.overtimePay = overtimePay; }
    public BigDecimal getDeductions() { return deductions; }
    public void setDeductions(BigDecimal deductions) { this.deductions = deductions; }
    public BigDecimal getGrossPay() { return grossPay; }
    public void setGrossPay(BigDecimal grossPay) { this.grossPay = grossPay; }
    public BigDecimal getNetPay() { return netPay; }
    public void setNetPay(BigDecimal netPay) { this.netPay = netPay; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }
}
