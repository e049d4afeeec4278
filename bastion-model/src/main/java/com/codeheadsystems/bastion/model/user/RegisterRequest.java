package com.codeheadsystems.bastion.model.user;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Self-registration request.
 *
 * @param username desired username, at least three characters
 * @param email    email address, unique across principals
 * @param password plaintext password, at least six characters
 * @param roles    optional initial roles; {@code user} when absent
 */
public record RegisterRequest(@JsonProperty("username") String username,
                              @JsonProperty("email") String email,
                              @JsonProperty("password") String password,
                              @JsonProperty("roles") List<String> roles) {

  public RegisterRequest(String username, String email, String password) {
    this(username, email, password, null);
  }
}
