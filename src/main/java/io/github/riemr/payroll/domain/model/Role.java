package io.github.riemr.payroll.domain.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Job position with a salary band. Responsibilities keep insertion order and never
 * hold the same entry twice.
 */
public class Role {
    private final Long id;
    private final String title;
    private final String description;
    private final String department;
    private final int level;
    private final SalaryRange salaryRange;
    private final List<String> responsibilities = new ArrayList<>();

    public Role(Long id, String title, String description, String department, int level,
                BigDecimal minSalary, BigDecimal maxSalary, List<String> responsibilities) {
        Objects.requireNonNull(minSalary, "minSalary");
        Objects.requireNonNull(maxSalary, "maxSalary");
        if (minSalary.signum() < 0 || maxSalary.signum() < 0) {
            throw new IllegalArgumentException("salary bounds must not be negative");
        }
        if (minSalary.compareTo(maxSalary) > 0) {
            throw new IllegalArgumentException("minSalary must not exceed maxSalary");
        }
        if (level < 1) {
            throw new IllegalArgumentException("level must be >= 1");
        }
        this.id = id;
        this.title = title;
        this.description = description;
        this.department = department;
        this.level = level;
        this.salaryRange = new SalaryRange(minSalary, maxSalary);
        if (responsibilities != null) {
            responsibilities.forEach(this::addResponsibility);
        }
    }

    public Long getId() { return id; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public String getDepartment() { return department; }
    public int getLevel() { return level; }
    public SalaryRange getSalaryRange() { return salaryRange; }
    public BigDecimal getMinSalary() { return salaryRange.getMin(); }
    public BigDecimal getMaxSalary() { return salaryRange.getMax(); }

    public List<String> getResponsibilities() {
        return new ArrayList<>(responsibilities);
    }

    /** Inclusive at both ends. */
    public boolean isSalaryInRange(BigDecimal salary) {
        return salaryRange.contains(salary);
    }

    public void addResponsibility(String responsibility) {
        if (!responsibilities.contains(responsibility)) {
            responsibilities.add(responsibility);
        }
    }

    public void removeResponsibility(String responsibility) {
        responsibilities.remove(responsibility);
    }
}
