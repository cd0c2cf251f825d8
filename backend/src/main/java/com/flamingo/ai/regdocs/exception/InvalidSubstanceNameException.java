package com.flamingo.ai.regdocs.exception;

/** Exception thrown when a substance name cannot be normalised into a usable slug. */
public class InvalidSubstanceNameException extends RuntimeException {

  private final String substanceName;

  public InvalidSubstanceNameException(String substanceName) {
    super("Invalid substance name: '" + substanceName + "'");
    this.substanceName = substanceName;
  }

  public String getSubstanceName() {
    return substanceName;
  }
}
