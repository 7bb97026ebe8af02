package com.astrolitetech.directory.controller;

import com.astrolitetech.directory.feed.ChangeFeedTracker;
import com.astrolitetech.directory.model.UserView;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
@Tag(name = "User Feed", description = "Read-only view of registered user accounts")
public class UserFeedController {

  private final ChangeFeedTracker changeFeedTracker;

  @GetMapping("/new-users")
  @Operation(summary = "Users registered since the previous call")
  public ResponseEntity<List<UserView>> getNewUsers() {
    return ResponseEntity.ok(changeFeedTracker.pollNewUsers());
  }

  @GetMapping("/all-users")
  @Operation(summary = "All users, newest first")
  public ResponseEntity<List<UserView>> getAllUsers() {
    return ResponseEntity.ok(changeFeedTracker.listAllUsers());
  }
}
