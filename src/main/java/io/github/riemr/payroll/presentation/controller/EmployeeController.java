package io.github.riemr.payroll.presentation.controller;

import io.github.riemr.payroll.application.dto.EmployeeRequest;
import io.github.riemr.payroll.application.dto.EmployeeWithRole;
import io.github.riemr.payroll.application.dto.OnCreate;
import io.github.riemr.payroll.application.service.EmployeeService;
import io.github.riemr.payroll.infrastructure.persistence.entity.Employee;
import io.github.riemr.payroll.infrastructure.persistence.entity.Payslip;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/employees")
@RequiredArgsConstructor
public class EmployeeController {
    private final EmployeeService service;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<EmployeeWithRole> list() {
        return service.findAll();
    }

    @GetMapping(path = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public EmployeeWithRole get(@PathVariable("id") Long id) {
        return service.find(id);
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Employee> create(@Validated(OnCreate.class) @RequestBody EmployeeRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.create(req));
    }

    @PutMapping(path = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Employee update(@PathVariable("id") Long id, @Valid @RequestBody EmployeeRequest req) {
        return service.update(id, req);
    }

    @DeleteMapping("/{id}")
    public Map<String, String> delete(@PathVariable("id") Long id) {
        service.delete(id);
        return Map.of("message", "Employee deleted successfully");
    }

    @GetMapping(path = "/{id}/payslips", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Payslip> payslips(@PathVariable("id") Long id) {
        return service.findPayslips(id);
    }
}
