package com.mk.fx.qa.stress.execution.service;

import com.mk.fx.qa.stress.execution.cfg.StressProcessingCfg;
import com.mk.fx.qa.stress.execution.exception.StressValidationException;
import com.mk.fx.qa.stress.execution.model.StressRequest;
import com.mk.fx.qa.stress.execution.utils.StressUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Enforces the limits a stress request must respect before anything is launched.
 *
 * <p>Checks, in order: non-negative worker counts within {@code stress.max-workers}, at least one
 * worker, a positive duration not above {@code stress.max-duration-seconds}, and a parseable
 * memory size.
 */
@Slf4j
@Component
public class StressRequestValidator {

  private final StressProcessingCfg properties;

  public StressRequestValidator(StressProcessingCfg properties) {
    this.properties = properties;
  }

  /**
   * @throws StressValidationException describing the first violated rule
   */
  public void validate(StressRequest request) {
    if (request == null) {
      throw reject("Stress request must not be null");
    }
    validateWorkers("cpu_workers", request.cpuWorkers());
    validateWorkers("memory_workers", request.memoryWorkers());
    if (request.cpuWorkers() == 0 && request.memoryWorkers() == 0) {
      throw reject("At least one of cpu_workers or memory_workers must be greater than 0");
    }

    if (request.duration() <= 0) {
      throw reject("duration must be a positive number of seconds");
    }
    if (request.duration() > properties.getMaxDurationSeconds()) {
      throw reject(
          "Maximum duration is "
              + properties.getMaxDurationSeconds()
              + " seconds, requested "
              + request.duration());
    }

    try {
      StressUtils.parseByteSize(request.memorySize());
    } catch (IllegalArgumentException ex) {
      log.warn("Stress request rejected: {}", ex.getMessage());
      throw new StressValidationException("Invalid memory_size: " + ex.getMessage(), ex);
    }
  }

  private void validateWorkers(String field, int count) {
    if (count < 0) {
      throw reject(field + " must not be negative");
    }
    if (count > properties.getMaxWorkers()) {
      throw reject(field + " must not exceed " + properties.getMaxWorkers());
    }
  }

  private StressValidationException reject(String message) {
    log.warn("Stress request rejected: {}", message);
    return new StressValidationException(message);
  }
}
