package com.astrolitetech.directory.service;

import com.astrolitetech.directory.exception.DirectoryException;
import com.astrolitetech.directory.exception.ErrorKind;
import com.astrolitetech.directory.model.Employee;
import com.astrolitetech.directory.model.EmployeeForm;
import com.astrolitetech.directory.model.UpsertResult;
import com.astrolitetech.directory.repository.EmployeeRepository;
import com.astrolitetech.directory.storage.MediaAttachmentHandler;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

@Slf4j
@Service
@RequiredArgsConstructor
public class EmployeeService {

  private final EmployeeRepository employeeRepository;
  private final EmployeeValidator employeeValidator;
  private final MediaAttachmentHandler mediaAttachmentHandler;

  /**
   * Creates the employee, or overwrites every field of the existing one with the same id.
   *
   * <p>The photo is checked first and the fields second; nothing is written until both pass. An
   * update without a photo clears the stored {@code profile_image}.
   */
  @Transactional
  public UpsertResult upsertEmployee(EmployeeForm form, MultipartFile profileImage) {
    mediaAttachmentHandler.validate(profileImage);
    employeeValidator.validate(form);

    String imageRef = mediaAttachmentHandler.store(profileImage).orElse(null);

    if (employeeRepository.existsById(form.getId())) {
      employeeRepository.update(form, imageRef);
      log.info("Updated employee {} (profile image: {})", form.getId(), imageRef);
      return UpsertResult.updated(imageRef);
    }

    employeeRepository.insert(form, imageRef);
    log.info("Created employee {} (profile image: {})", form.getId(), imageRef);
    return UpsertResult.created(imageRef);
  }

  public List<Employee> listEmployees() {
    return employeeRepository.findAll();
  }

  /** Removes the row only; a stored photo stays in the upload directory. */
  public void deleteEmployee(String id) {
    int removed = employeeRepository.deleteById(id);
    if (removed == 0) {
      log.warn("Employee {} not found for deletion", id);
      throw DirectoryException.of(ErrorKind.NOT_FOUND);
    }
    log.info("Deleted employee {}", id);
  }
}
