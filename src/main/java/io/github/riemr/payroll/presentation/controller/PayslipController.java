package io.github.riemr.payroll.presentation.controller;

import io.github.riemr.payroll.application.dto.PayslipCalculationRequest;
import io.github.riemr.payroll.application.dto.PayslipCreateRequest;
import io.github.riemr.payroll.application.dto.PayslipWithEmployee;
import io.github.riemr.payroll.application.service.PayslipService;
import io.github.riemr.payroll.domain.payslip.PayslipResult;
import io.github.riemr.payroll.infrastructure.persistence.entity.Payslip;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/payslips")
@RequiredArgsConstructor
public class PayslipController {
    private final PayslipService service;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<PayslipWithEmployee> list() {
        return service.findAll();
    }

    @GetMapping(path = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public PayslipWithEmployee get(@PathVariable("id") Long id) {
        return service.find(id);
    }

    @PostMapping(path = "/calculate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public PayslipResult calculate(@Valid @RequestBody PayslipCalculationRequest req) {
        return service.calculate(req);
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Payslip> create(@Valid @RequestBody PayslipCreateRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.generate(req));
    }
}
