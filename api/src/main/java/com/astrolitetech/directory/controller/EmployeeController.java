package com.astrolitetech.directory.controller;

import com.astrolitetech.directory.model.ApiResponse;
import com.astrolitetech.directory.model.Employee;
import com.astrolitetech.directory.model.EmployeeForm;
import com.astrolitetech.directory.model.UpsertResult;
import com.astrolitetech.directory.service.EmployeeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
@Tag(name = "Employee Management", description = "APIs for managing employees")
public class EmployeeController {

  private final EmployeeService employeeService;

  @GetMapping("/employees")
  @Operation(summary = "Get all employees")
  public ResponseEntity<List<Employee>> getAllEmployees() {
    return ResponseEntity.ok(employeeService.listEmployees());
  }

  @PostMapping("/add-employee")
  @Operation(summary = "Create an employee, or replace the one with the same ID")
  public ResponseEntity<ApiResponse.Upsert> addEmployee(
      @ModelAttribute EmployeeForm form,
      @Parameter(description = "JPEG or PNG photo, at most 5 MB")
          @RequestParam(value = "profileImage", required = false)
          MultipartFile profileImage) {
    UpsertResult result = employeeService.upsertEmployee(form, profileImage);
    return ResponseEntity.status(result.outcome().getStatus())
        .body(ApiResponse.Upsert.from(result));
  }

  @DeleteMapping("/delete-employee/{id}")
  @Operation(summary = "Delete employee by ID")
  public ResponseEntity<ApiResponse.Message> deleteEmployee(
      @Parameter(description = "Employee ID", required = true) @PathVariable String id) {
    employeeService.deleteEmployee(id);
    return ResponseEntity.ok(new ApiResponse.Message("Employee deleted successfully"));
  }
}
