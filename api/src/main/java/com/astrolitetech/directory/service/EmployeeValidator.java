package com.astrolitetech.directory.service;

import com.astrolitetech.directory.exception.DirectoryException;
import com.astrolitetech.directory.exception.ErrorKind;
import com.astrolitetech.directory.model.EmployeeForm;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Field rules applied to every write. Checks run in a fixed order and stop at the first failure:
 * required fields, then id, email and phone formats.
 */
@Component
public class EmployeeValidator {

  static final Pattern ID_PATTERN = Pattern.compile("^[A-Z]{3}[0-9]{4}$");
  static final Pattern PHONE_PATTERN = Pattern.compile("^[0-9]{10}$");

  private final Pattern emailPattern;

  public EmployeeValidator(
      @Value("${directory.employee.email-domain:astrolitetech.com}") String emailDomain) {
    this.emailPattern =
        Pattern.compile(
            "^[a-zA-Z][a-zA-Z0-9._-]*[a-zA-Z0-9]@" + Pattern.quote(emailDomain) + "$");
  }

  public void validate(EmployeeForm form) {
    if (form == null || hasMissingField(form)) {
      throw DirectoryException.of(ErrorKind.MISSING_FIELD);
    }
    if (!ID_PATTERN.matcher(form.getId()).matches()) {
      throw DirectoryException.of(ErrorKind.INVALID_ID_FORMAT);
    }
    if (!emailPattern.matcher(form.getEmail()).matches()) {
      throw DirectoryException.of(ErrorKind.INVALID_EMAIL_FORMAT);
    }
    if (!PHONE_PATTERN.matcher(form.getPhone()).matches()) {
      throw DirectoryException.of(ErrorKind.INVALID_PHONE_FORMAT);
    }
  }

  private static boolean hasMissingField(EmployeeForm form) {
    return Stream.of(
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
            form.getAchievement())
        .anyMatch(value -> !StringUtils.hasLength(value));
  }
}
