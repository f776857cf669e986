package io.github.riemr.payroll.infrastructure.persistence.entity;

import java.io.Serializable;

public class RoleResponsibility implements Serializable {
    private Long roleId;
    private Integer position;
    private String responsibility;

    private static final long serialVersionUID = 1L;

    public RoleResponsibility() {
    }

    public RoleResponsibility(Long roleId, Integer position, String responsibility) {
        this.roleId = roleId;
        this.position = position;
        this.responsibility = responsibility;
    }

    public Long getRoleId() { return roleId; }
    public void setRoleId(Long roleId) { this.roleId = roleId; }
    public Integer getPosition() { return position; }
    public void setPosition(Integer position) { this.position = position; }
    public String getResponsibility() { return responsibility; }
    public void setResponsibility(String responsibility) { this.responsibility = responsibility; }
}
