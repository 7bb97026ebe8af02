package com.astrolitetech.directory.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fields of an add-employee request exactly as the caller sent them. Dates and experience stay
 * strings here; the store casts them when the row is written.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class EmployeeForm {

  private String id;

  private String name;

  private String role;

  private String gender;

  private String dob;

  private String location;

  private String email;

  private String phone;

  private String joinDate;

  private String experience;

  private String skills;

  private String achievement;
}
