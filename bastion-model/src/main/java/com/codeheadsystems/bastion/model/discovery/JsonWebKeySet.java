package com.codeheadsystems.bastion.model.discovery;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * The published key set: { keys: [...] }.
 *
 * @param keys the keys
 */
public record JsonWebKeySet(@JsonProperty("keys") List<JsonWebKey> keys) {

  public JsonWebKeySet {
    keys = List.copyOf(keys);
  }
}
