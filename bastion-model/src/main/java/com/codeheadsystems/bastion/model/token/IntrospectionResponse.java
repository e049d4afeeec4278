package com.codeheadsystems.bastion.model.token;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Token introspection result. An inactive token carries only {@code active=false}; the
 * remaining fields are omitted from the JSON body.
 *
 * @param active   whether the token verified and is unexpired
 * @param sub      principal identifier
 * @param username principal username, access tokens only
 * @param email    principal email, access tokens only
 * @param roles    role labels, access tokens only
 * @param type     token kind claim
 * @param exp      expiry in epoch seconds
 * @param iat      issued-at in epoch seconds
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IntrospectionResponse(@JsonProperty("active") boolean active,
                                    @JsonProperty("sub") String sub,
                                    @JsonProperty("username") String username,
                                    @JsonProperty("email") String email,
                                    @JsonProperty("roles") List<String> roles,
                                    @JsonProperty("type") String type,
                                    @JsonProperty("exp") Long exp,
                                    @JsonProperty("iat") Long iat) {

  /**
   * Inactive introspection response.
   *
   * @return the response
   */
  public static IntrospectionResponse inactive() {
    return new IntrospectionResponse(false, null, null, null, null, null, null, null);
  }
}
