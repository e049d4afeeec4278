package com.codeheadsystems.bastion.server.exception;

import java.util.List;

/**
 * Input failed validation. Carries every violation found, not only the first.
 */
public class ValidationFailedException extends BastionException {

  private final List<String> violations;

  public ValidationFailedException(List<String> violations) {
    super(String.join("; ", violations));
    this.violations = List.copyOf(violations);
  }

  /**
   * Gets the violations.
   *
   * @return the violations, in the order they were detected
   */
  public List<String> getViolations() {
    return violations;
  }
}
