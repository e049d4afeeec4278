package com.codeheadsystems.bastion.model.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Error body returned for every failed request.
 *
 * @param error      machine-readable error code, e.g. {@code invalid_grant}
 * @param message    human-readable description, never containing key material or internals
 * @param violations individual validation failures, present only for validation errors
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(@JsonProperty("error") String error,
                            @JsonProperty("message") String message,
                            @JsonProperty("violations") List<String> violations) {

  public ErrorResponse(String error, String message) {
    this(error, message, List.of());
  }
}
