package com.codeheadsystems.bastion.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/**
 * A principal registered when the bundle starts, unless one with the same username or email
 * already exists.
 */
public class BootstrapPrincipal {

  @NotEmpty
  private String username;

  @NotEmpty
  private String email;

  @NotEmpty
  private String password;

  private List<String> roles = List.of();

  @JsonProperty
  public String getUsername() {
    return username;
  }

  @JsonProperty
  public void setUsername(String username) {
    this.username = username;
  }

  @JsonProperty
  public String getEmail() {
    return email;
  }

  @JsonProperty
  public void setEmail(String email) {
    this.email = email;
  }

  @JsonProperty
  public String getPassword() {
    return password;
  }

  @JsonProperty
  public void setPassword(String password) {
    this.password = password;
  }

  @JsonProperty
  public List<String> getRoles() {
    return roles;
  }

  @JsonProperty
  public void setRoles(List<String> roles) {
    this.roles = roles;
  }
}
