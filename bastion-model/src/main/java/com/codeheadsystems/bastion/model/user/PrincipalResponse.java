package com.codeheadsystems.bastion.model.user;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Public view of a principal. Never carries the password hash.
 *
 * @param id       stable principal identifier
 * @param username the username
 * @param email    the email address
 * @param roles    role labels, sorted
 * @param active   whether the account may authenticate
 */
public record PrincipalResponse(@JsonProperty("id") String id,
                                @JsonProperty("username") String username,
                                @JsonProperty("email") String email,
                                @JsonProperty("roles") List<String> roles,
                                @JsonProperty("is_active") boolean active) {
}
