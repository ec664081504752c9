package com.mk.fx.qa.stress.execution.exception;

/** The stress request violates a limit or cannot be interpreted. */
public class StressValidationException extends IllegalArgumentException {

  public StressValidationException(String message) {
    super(message);
  }

  public StressValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
