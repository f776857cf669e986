package io.github.riemr.payroll.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class SchemaInitializer {
    private final JdbcTemplate jdbc;

    @PostConstruct
    public void ensureTables() {
        jdbc.execute("CREATE TABLE IF NOT EXISTS roles (" +
                "id BIGSERIAL PRIMARY KEY, " +
                "title TEXT NOT NULL, " +
                "description TEXT NOT NULL, " +
                "department TEXT NOT NULL, " +
                "level INTEGER NOT NULL, " +
                "min_salary NUMERIC(10,2) NOT NULL, " +
                "max_salary NUMERIC(10,2) NOT NULL, " +
                "CONSTRAINT chk_roles_salary_band CHECK (min_salary >= 0 AND min_salary <= max_salary), " +
                "CONSTRAINT chk_roles_level CHECK (level >= 1)" +
                ")");
        jdbc.execute("CREATE TABLE IF NOT EXISTS role_responsibility (" +
                "role_id BIGINT NOT NULL REFERENCES roles(id) ON DELETE CASCADE, " +
                "position INTEGER NOT NULL, " +
                "responsibility TEXT NOT NULL, " +
                "PRIMARY KEY (role_id, position)" +
                ")");
        jdbc.execute("CREATE TABLE IF NOT EXISTS employees (" +
                "id BIGSERIAL PRIMARY KEY, " +
                "first_name TEXT NOT NULL, " +
                "last_name TEXT NOT NULL, " +
                "email TEXT NOT NULL UNIQUE, " +
                "phone TEXT, " +
                "type TEXT NOT NULL, " +
                "department TEXT NOT NULL, " +
                "role_id BIGINT NOT NULL REFERENCES roles(id), " +
                "salary NUMERIC(10,2) NOT NULL, " +
                "start_date DATE NOT NULL, " +
                "status TEXT NOT NULL DEFAULT 'active', " +
                "created_at TIMESTAMP NOT NULL DEFAULT now()" +
                ")");
        jdbc.execute("CREATE TABLE IF NOT EXISTS payslips (" +
                "id BIGSERIAL PRIMARY KEY, " +
                "employee_id BIGINT NOT NULL REFERENCES employees(id), " +
                "pay_period_from DATE NOT NULL, " +
                "pay_period_to DATE NOT NULL, " +
                "hours_worked NUMERIC(7,2) NOT NULL, " +
                "overtime_hours NUMERIC(7,2) NOT NULL DEFAULT 0, " +
                "base_pay NUMERIC(10,2) NOT NULL, " +
                "overtime_pay NUMERIC(10,2) NOT NULL DEFAULT 0, " +
                "deductions NUMERIC(10,2) NOT NULL DEFAULT 0, " +
                "gross_pay NUMERIC(10,2) NOT NULL, " +
                "net_pay NUMERIC(10,2) NOT NULL, " +
                "status TEXT NOT NULL DEFAULT 'generated', " +
                "created_at TIMESTAMP NOT NULL DEFAULT now()" +
                ")");
        jdbc.execute("CREATE INDEX IF NOT EXISTS idx_employees_status ON employees (status)");
        jdbc.execute("CREATE INDEX IF NOT EXISTS idx_payslips_employee ON payslips (employee_id, pay_period_from)");
        log.info("Payroll schema ensured");
    }
}
