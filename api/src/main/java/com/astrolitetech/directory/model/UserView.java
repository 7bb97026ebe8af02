package com.astrolitetech.directory.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Read-only projection of an account owned by the user registration subsystem. */
public record UserView(
    String username, String email, @JsonProperty("profile_image") String profileImage) {}
