package com.astrolitetech.directory.repository;

import com.astrolitetech.directory.model.Employee;
import com.astrolitetech.directory.model.EmployeeForm;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Slf4j
@Repository
@RequiredArgsConstructor
@DependsOn("schemaLifecycleManager")
public class EmployeeRepository {

  private static final String EXISTS_SQL = "SELECT id FROM employees WHERE id = ?";

  private static final String INSERT_SQL =
      """
      INSERT INTO employees (id, name, role, gender, dob, location, email, phone,
                             join_date, experience, skills, achievement, profile_image)
      VALUES (?, ?, ?, ?, CAST(? AS DATE), ?, ?, ?, CAST(? AS DATE), CAST(? AS INTEGER), ?, ?, ?)
      """;

  private static final String UPDATE_SQL =
      """
      UPDATE employees SET
        name = ?, role = ?, gender = ?, dob = CAST(? AS DATE), location = ?, email = ?,
        phone = ?, join_date = CAST(? AS DATE), experience = CAST(? AS INTEGER), skills = ?,
        achievement = ?, profile_image = ?
      WHERE id = ?
      """;

  private static final String SELECT_ALL_SQL = "SELECT * FROM employees";

  private static final String DELETE_SQL = "DELETE FROM employees WHERE id = ?";

  private final JdbcTemplate jdbcTemplate;

  public boolean existsById(String id) {
    return !jdbcTemplate.queryForList(EXISTS_SQL, String.class, id).isEmpty();
  }

  public void insert(EmployeeForm form, String profileImage) {
    jdbcTemplate.update(
        INSERT_SQL,
        form.getId(),
        form.getName(),
        form.getRole(),
        form.getGender(),
        form.getDob(),
        form.getLocation(),
        form.getEmail(),
        form.getPhone(),
        form.getJoinDate(),
        form.getExperience(),
        form.getSkills(),
        form.getAchievement(),
        profileImage);
  }

  /** Overwrites every column but the id, {@code profile_image} included. */
  public int update(EmployeeForm form, String profileImage) {
    return jdbcTemplate.update(
        UPDATE_SQL,
        form.getName(),
        form.getRole(),
        form.getGender(),
        form.getDob(),
        form.getLocation(),
        form.getEmail(),
        form.getPhone(),
        form.getJoinDate(),
        form.getExperience(),
        form.getSkills(),
        form.getAchievement(),
        profileImage,
        form.getId());
  }

  public List<Employee> findAll() {
    List<Employee> employees = jdbcTemplate.query(SELECT_ALL_SQL, new EmployeeRowMapper());
    log.debug("Fetched {} employees", employees.size());
    return employees;
  }

  public int deleteById(String id) {
    return jdbcTemplate.update(DELETE_SQL, id);
  }

  static class EmployeeRowMapper implements RowMapper<Employee> {
    @Override
    public Employee mapRow(ResultSet rs, int rowNum) throws SQLException {
      return Employee.builder()
          .id(rs.getString("id"))
          .name(rs.getString("name"))
          .role(rs.getString("role"))
          .gender(rs.getString("gender"))
          .dob(rs.getObject("dob", LocalDate.class))
          .location(rs.getString("location"))
          .email(rs.getString("email"))
          .phone(rs.getString("phone"))
          .joinDate(rs.getObject("join_date", LocalDate.class))
          .experience(rs.getObject("experience", Integer.class))
          .skills(rs.getString("skills"))
          .achievement(rs.getString("achievement"))
          .profileImage(rs.getString("profile_image"))
          .build();
    }
  }
}
