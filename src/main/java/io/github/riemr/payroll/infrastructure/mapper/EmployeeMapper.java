package io.github.riemr.payroll.infrastructure.mapper;

import io.github.riemr.payroll.infrastructure.persistence.entity.Employee;
import org.apache.ibatis.annotations.*;

import java.util.List;

@Mapper
public interface EmployeeMapper {
    String COLUMNS = "id, first_name, last_name, email, phone, type, department, role_id, salary, start_date, status, created_at";

    @Select("SELECT " + COLUMNS + " FROM employees ORDER BY id")
    @Results(id = "employeeResult", value = {
        @Result(property = "id", column = "id", id = true),
        @Result(property = "firstName", column = "first_name"),
        @Result(property = "lastName", column = "last_name"),
        @Result(property = "email", column = "email"),
        @Result(property = "phone", column = "phone"),
        @Result(property = "type", column = "type"),
        @Result(property = "department", column = "department"),
        @Result(property = "roleId", column = "role_id"),
        @Result(property = "salary", column = "salary"),
        @Result(property = "startDate", column = "start_date"),
        @Result(property = "status", column = "status"),
        @Result(property = "createdAt", column = "created_at")
    })
    List<Employee> selectAll();

    @Select("SELECT " + COLUMNS + " FROM employees WHERE id = #{id}")
    @ResultMap("employeeResult")
    Employee selectByPrimaryKey(Long id);

    @Select("SELECT " + COLUMNS + " FROM employees WHERE email = #{email}")
    @ResultMap("employeeResult")
    Employee selectByEmail(String email);

    @Select("SELECT " + COLUMNS + " FROM employees WHERE status = #{status} ORDER BY id")
    @ResultMap("employeeResult")
    List<Employee> selectByStatus(String status);

    @Insert("INSERT INTO employees (first_name, last_name, email, phone, type, department, role_id, salary, start_date, status) " +
            "VALUES (#{firstName}, #{lastName}, #{email}, #{phone}, #{type}, #{department}, #{roleId}, #{salary}, " +
            "#{startDate}, COALESCE(#{status}, 'active'))")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insert(Employee row);

    @Update("UPDATE employees SET first_name = #{firstName}, last_name = #{lastName}, email = #{email}, phone = #{phone}, " +
            "type = #{type}, department = #{department}, role_id = #{roleId}, salary = #{salary}, " +
            "start_date = #{startDate}, status = #{status} WHERE id = #{id}")
    int updateByPrimaryKey(Employee row);

    @Delete("DELETE FROM employees WHERE id = #{id}")
    int deleteByPrimaryKey(Long id);
}
