package com.astrolitetech.directory.controller;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import com.astrolitetech.directory.exception.DirectoryException;
import com.astrolitetech.directory.exception.ErrorKind;
import com.astrolitetech.directory.model.Employee;
import com.astrolitetech.directory.model.UpsertResult;
import com.astrolitetech.directory.service.EmployeeService;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMultipartHttpServletRequestBuilder;

@WebMvcTest(controllers = EmployeeController.class)
class EmployeeControllerTest {
  private static final String ID = "ABC1234";

  @Autowired private MockMvc mockMvc;

  @MockBean private EmployeeService employeeService;

  private Employee sampleEmployee;

  @BeforeEach
  void setup() {
    sampleEmployee =
        Employee.builder()
            .id(ID)
            .name("Jane Doe")
            .role("Engineer")
            .gender("Female")
            .dob(LocalDate.of(1990, 4, 12))
            .location("Hyderabad")
            .email("jane.doe@astrolitetech.com")
            .phone("9876543210")
            .joinDate(LocalDate.of(2021, 6, 1))
            .experience(5)
            .skills("Java")
            .achievement("Spot award")
            .build();
  }

  private MockMultipartHttpServletRequestBuilder employeeForm() {
    return (MockMultipartHttpServletRequestBuilder)
        multipart("/api/add-employee")
            .param("id", ID)
            .param("name", "Jane Doe")
            .param("role", "Engineer")
            .param("gender", "Female")
            .param("dob", "1990-04-12")
            .param("location", "Hyderabad")
            .param("email", "jane.doe@astrolitetech.com")
            .param("phone", "9876543210")
            .param("joinDate", "2021-06-01")
            .param("experience", "5")
            .param("skills", "Java")
            .param("achievement", "Spot award");
  }

  @Test
  void getAllEmployees_ShouldReturnRowsWithColumnNames() throws Exception {
    Mockito.when(employeeService.listEmployees()).thenReturn(List.of(sampleEmployee));

    mockMvc
        .perform(get("/api/employees"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(1)))
        .andExpect(jsonPath("$[0].id", is(ID)))
        .andExpect(jsonPath("$[0].name", is("Jane Doe")))
        .andExpect(jsonPath("$[0].join_date", is("2021-06-01")))
        .andExpect(jsonPath("$[0].experience", is(5)))
        .andExpect(jsonPath("$[0].profile_image", nullValue()));
  }

  @Test
  void getAllEmployees_ShouldReturnEmptyList_WhenNoEmployees() throws Exception {
    Mockito.when(employeeService.listEmployees()).thenReturn(Collections.emptyList());

    mockMvc
        .perform(get("/api/employees"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(0)));
  }

  @Test
  void getAllEmployees_ShouldReturn500WithDetails_WhenStoreFails() throws Exception {
    Mockito.when(employeeService.listEmployees())
        .thenThrow(new DataIntegrityViolationException("relation \"employees\" does not exist"));

    mockMvc
        .perform(get("/api/employees"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error", is("Server error")))
        .andExpect(jsonPath("$.details", containsString("does not exist")));
  }

  @Test
  void addEmployee_ShouldReturnCreated_WithNullImage_WhenNoFile() throws Exception {
    Mockito.when(employeeService.upsertEmployee(any(), isNull()))
        .thenReturn(UpsertResult.created(null));

    mockMvc
        .perform(employeeForm())
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.message", is("Employee added successfully")))
        .andExpect(jsonPath("$.profile_image").value(nullValue()))
        .andExpect(content().string(containsString("\"profile_image\":null")));

    Mockito.verify(employeeService)
        .upsertEmployee(
            argThat(
                form ->
                    ID.equals(form.getId())
                        && "2021-06-01".equals(form.getJoinDate())
                        && "5".equals(form.getExperience())),
            isNull());
  }

  @Test
  void addEmployee_ShouldReturnOk_WhenUpdatingWithImage() throws Exception {
    MockMultipartFile photo =
        new MockMultipartFile("profileImage", "jane.jpg", "image/jpeg", new byte[] {1, 2});
    Mockito.when(employeeService.upsertEmployee(any(), any()))
        .thenReturn(UpsertResult.updated("uploads/1700000000000-42-jane.jpg"));

    mockMvc
        .perform(employeeForm().file(photo))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message", is("Employee updated successfully")))
        .andExpect(jsonPath("$.profile_image", is("uploads/1700000000000-42-jane.jpg")));

    Mockito.verify(employeeService)
        .upsertEmployee(
            any(), argThat(file -> file != null && "jane.jpg".equals(file.getOriginalFilename())));
  }

  @Test
  void addEmployee_ShouldAcceptUrlEncodedForm() throws Exception {
    Mockito.when(employeeService.upsertEmployee(any(), isNull()))
        .thenReturn(UpsertResult.created(null));

    mockMvc
        .perform(
            post("/api/add-employee")
                .param("id", ID)
                .param("name", "Jane Doe")
                .param("email", "jane.doe@astrolitetech.com"))
        .andExpect(status().isCreated());
  }

  @Test
  void addEmployee_ShouldReturn400_ForEachValidationKind() throws Exception {
    assertRejected(ErrorKind.MISSING_FIELD, "All fields are required");
    assertRejected(ErrorKind.INVALID_ID_FORMAT, "Invalid Employee ID format");
    assertRejected(ErrorKind.INVALID_EMAIL_FORMAT, "Invalid email format");
    assertRejected(ErrorKind.INVALID_PHONE_FORMAT, "Phone number must be 10 digits");
    assertRejected(ErrorKind.UNSUPPORTED_MEDIA_TYPE, "Only JPEG or PNG images are allowed");
    assertRejected(ErrorKind.PAYLOAD_TOO_LARGE, "File too large");
  }

  private void assertRejected(ErrorKind kind, String message) throws Exception {
    Mockito.when(employeeService.upsertEmployee(any(), any()))
        .thenThrow(DirectoryException.of(kind));

    mockMvc
        .perform(employeeForm())
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error", is(message)))
        .andExpect(jsonPath("$.details").doesNotExist());

    Mockito.reset(employeeService);
  }

  @Test
  void deleteEmployee_ShouldReturnOk_WhenDeleted() throws Exception {
    mockMvc
        .perform(delete("/api/delete-employee/" + ID))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message", is("Employee deleted successfully")));

    Mockito.verify(employeeService).deleteEmployee(eq(ID));
  }

  @Test
  void deleteEmployee_ShouldReturn404_WhenNotFound() throws Exception {
    Mockito.doThrow(DirectoryException.of(ErrorKind.NOT_FOUND))
        .when(employeeService)
        .deleteEmployee("ZZZ9999");

    mockMvc
        .perform(delete("/api/delete-employee/ZZZ9999"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error", is("Employee not found")));
  }

  @Test
  void deleteEmployee_ShouldHandleUnexpectedException() throws Exception {
    Mockito.doThrow(new RuntimeException("Service error"))
        .when(employeeService)
        .deleteEmployee(any());

    mockMvc
        .perform(delete("/api/delete-employee/" + ID))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error", is("An unexpected error occurred")));
  }
}
