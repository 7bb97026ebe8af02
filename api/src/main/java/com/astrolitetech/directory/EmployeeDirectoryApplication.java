package com.astrolitetech.directory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EmployeeDirectoryApplication {

  public static void main(String[] args) {
    SpringApplication.run(EmployeeDirectoryApplication.class, args);
  }
}
