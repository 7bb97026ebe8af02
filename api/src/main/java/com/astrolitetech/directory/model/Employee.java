package com.astrolitetech.directory.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A row of the employees table, rendered with the table's column names. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Employee {

  private String id;

  private String name;

  private String role;

  private String gender;

  private LocalDate dob;

  private String location;

  private String email;

  private String phone;

  private LocalDate joinDate;

  private Integer experience;

  private String skills;

  private String achievement;

  private String profileImage;
}
