package io.github.riemr.payroll.config;

import io.github.riemr.payroll.application.dto.RoleRequest;
import io.github.riemr.payroll.application.repository.RoleRepository;
import io.github.riemr.payroll.application.service.RoleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Seeds a few starter roles into an empty database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SampleRoleSeeder implements ApplicationRunner {
    private final RoleRepository roleRepository;
    private final RoleService roleService;

    @Value("${payroll.seed-sample-roles:true}")
    private boolean enabled;

    @Override
    public void run(ApplicationArguments args) {
        if (!enabled || roleRepository.count() > 0) {
            return;
        }
        roleService.create(role("Senior Developer",
                "Responsible for developing and maintaining software applications",
                "engineering", 3, "75000", "95000",
                List.of("Code development and review", "Technical documentation", "Mentoring junior developers")));
        roleService.create(role("Product Manager",
                "Oversees product development and strategy",
                "marketing", 4, "85000", "110000",
                List.of("Product roadmap planning", "Stakeholder management", "Market research")));
        // hourly band, for part-time staff
        roleService.create(role("UI Designer",
                "Creates user interface designs and prototypes",
                "engineering", 2, "25", "45",
                List.of("UI/UX design", "Prototyping", "Design systems")));
        log.info("Seeded sample roles");
    }

    private static RoleRequest role(String title, String description, String department, int level,
                                    String min, String max, List<String> responsibilities) {
        RoleRequest r = new RoleRequest();
        r.setTitle(title);
        r.setDescription(description);
        r.setDepartment(department);
        r.setLevel(level);
        r.setMinSalary(new BigDecimal(min));
        r.setMaxSalary(new BigDecimal(max));
        r.setResponsibilities(responsibilities);
        return r;
    }
}
