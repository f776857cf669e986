package io.github.riemr.payroll.infrastructure.mapper;

import io.github.riemr.payroll.infrastructure.persistence.entity.RoleResponsibility;
import org.apache.ibatis.annotations.*;

import java.util.List;

@Mapper
public interface RoleResponsibilityMapper {
    @Select("SELECT role_id, position, responsibility FROM role_responsibility WHERE role_id = #{roleId} ORDER BY position")
    @Results(id = "roleResponsibilityResult", value = {
        @Result(property = "roleId", column = "role_id"),
        @Result(property = "position", column = "position"),
        @Result(property = "responsibility", column = "responsibility")
    })
    List<RoleResponsibility> selectByRole(Long roleId);

    @Select("SELECT role_id, position, responsibility FROM role_responsibility ORDER BY role_id, position")
    @ResultMap("roleResponsibilityResult")
    List<RoleResponsibility> selectAll();

    @Insert("INSERT INTO role_responsibility (role_id, position, responsibility) " +
            "VALUES (#{roleId}, #{position}, #{responsibility})")
    int insert(RoleResponsibility row);

    @Delete("DELETE FROM role_responsibility WHERE role_id = #{roleId}")
    int deleteByRole(Long roleId);
}
