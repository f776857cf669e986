package io.github.riemr.payroll.presentation.controller;

import io.github.riemr.payroll.application.dto.PayrollStatsDto;
import io.github.riemr.payroll.application.service.PayrollStatsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/stats")
@RequiredArgsConstructor
public class StatsController {
    private final PayrollStatsService statsService;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public PayrollStatsDto stats() {
        return statsService.getStats();
    }
}
