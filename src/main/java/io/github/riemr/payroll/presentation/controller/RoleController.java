package io.github.riemr.payroll.presentation.controller;

import io.github.riemr.payroll.application.dto.OnCreate;
import io.github.riemr.payroll.application.dto.ResponsibilityRequest;
import io.github.riemr.payroll.application.dto.RoleRequest;
import io.github.riemr.payroll.application.service.RoleService;
import io.github.riemr.payroll.infrastructure.persistence.entity.Role;
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
@RequestMapping("/api/roles")
@RequiredArgsConstructor
public class RoleController {
    private final RoleService service;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Role> list() {
        return service.findAll();
    }

    @GetMapping(path = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Role get(@PathVariable("id") Long id) {
        return service.find(id);
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Role> create(@Validated(OnCreate.class) @RequestBody RoleRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.create(req));
    }

    @PutMapping(path = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Role update(@PathVariable("id") Long id, @Valid @RequestBody RoleRequest req) {
        return service.update(id, req);
    }

    @DeleteMapping("/{id}")
    public Map<String, String> delete(@PathVariable("id") Long id) {
        service.delete(id);
        return Map.of("message", "Role deleted successfully");
    }

    @PostMapping(path = "/{id}/responsibilities", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Role addResponsibility(@PathVariable("id") Long id, @Valid @RequestBody ResponsibilityRequest req) {
        return service.addResponsibility(id, req.getText());
    }

    @DeleteMapping("/{id}/responsibilities")
    public Role removeResponsibility(@PathVariable("id") Long id, @RequestParam("text") String text) {
        return service.removeResponsibility(id, text);
    }
}
