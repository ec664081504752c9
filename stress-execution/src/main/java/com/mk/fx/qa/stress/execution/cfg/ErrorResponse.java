package com.mk.fx.qa.stress.execution.cfg;

import java.time.Instant;

/**
 * Body returned for every rejected or failed request.
 *
 * @param error short error title, e.g. {@code "Conflict"}
 * @param details human readable explanation
 * @param timestamp when the error was produced
 */
public record ErrorResponse(String error, String details, Instant timestamp) {

  public static ErrorResponse of(String error, String details) {
    return new ErrorResponse(error, details, Instant.now());
  }
}
