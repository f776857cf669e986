package io.github.riemr.payroll.infrastructure.mapper;

import io.github.riemr.payroll.infrastructure.persistence.entity.Role;
import org.apache.ibatis.annotations.*;

import java.util.List;

@Mapper
public interface RoleMapper {
    @Select("SELECT id, title, description, department, level, min_salary, max_salary FROM roles ORDER BY id")
    @Results(id = "roleResult", value = {
        @Result(property = "id", column = "id", id = true),
        @Result(property = "title", column = "title"),
        @Result(property = "description", column = "description"),
        @Result(property = "department", column = "department"),
        @Result(property = "level", column = "level"),
        @Result(property = "minSalary", column = "min_salary"),
        @Result(property = "maxSalary", column = "max_salary")
    })
    List<Role> selectAll();

    @Select("SELECT id, title, description, department, level, min_salary, max_salary FROM roles WHERE id = #{id}")
    @ResultMap("roleResult")
    Role selectByPrimaryKey(Long id);

    @Insert("INSERT INTO roles (title, description, department, level, min_salary, max_salary) " +
            "VALUES (#{title}, #{description}, #{department}, #{level}, #{minSalary}, #{maxSalary})")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insert(Role row);

    @Update("UPDATE roles SET title = #{title}, description = #{description}, department = #{department}, " +
            "level = #{level}, min_salary = #{minSalary}, max_salary = #{maxSalary} WHERE id = #{id}")
    int updateByPrimaryKey(Role row);

    @Delete("DELETE FROM roles WHERE id = #{id}")
    int deleteByPrimaryKey(Long id);

    @Select("SELECT COUNT(*) FROM roles")
    long count();
}
