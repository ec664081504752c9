package com.mk.fx.qa.stress.execution.service;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mk.fx.qa.stress.execution.cfg.StressProcessingCfg;
import com.mk.fx.qa.stress.execution.exception.StressValidationException;
import com.mk.fx.qa.stress.execution.model.StressRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StressRequestValidatorTest {

  private StressRequestValidator validator;

  @BeforeEach
  void setUp() {
    StressProcessingCfg cfg = new StressProcessingCfg();
    cfg.setMaxDurationSeconds(3600);
    cfg.setMaxWorkers(16);
    validator = new StressRequestValidator(cfg);
  }

  @Test
  void validate_acceptsTypicalRequest() {
    assertThatCode(() -> validator.validate(new StressRequest(4, 2, 60, "512M")))
        .doesNotThrowAnyException();
  }

  @Test
  void validate_acceptsDurationAtCeiling() {
    assertThatCode(() -> validator.validate(new StressRequest(1, 0, 3600, "256M")))
        .doesNotThrowAnyException();
  }

  @Test
  void validate_rejectsBothWorkerCountsZero() {
    assertThatThrownBy(() -> validator.validate(new StressRequest(0, 0, 60, "512M")))
        .isInstanceOf(StressValidationException.class)
        .hasMessageContaining("At least one");
  }

  @Test
  void validate_rejectsDurationAboveCeiling() {
    assertThatThrownBy(() -> validator.validate(new StressRequest(1, 1, 7200, "512M")))
        .isInstanceOf(StressValidationException.class)
        .hasMessageContaining("3600");
  }

  @Test
  void validate_rejectsNonPositiveDuration() {
    assertThatThrownBy(() -> validator.validate(new StressRequest(1, 1, 0, "512M")))
        .isInstanceOf(StressValidationException.class);
  }

  @Test
  void validate_rejectsUnparseableMemorySize() {
    assertThatThrownBy(() -> validator.validate(new StressRequest(1, 1, 60, "lots")))
        .isInstanceOf(StressValidationException.class)
        .hasMessageContaining("memory_size");
  }

  @Test
  void validate_rejectsNegativeAndExcessiveWorkers() {
    assertThatThrownBy(() -> validator.validate(new StressRequest(-1, 1, 60, "512M")))
        .isInstanceOf(StressValidationException.class)
        .hasMessageContaining("cpu_workers");
    assertThatThrownBy(() -> validator.validate(new StressRequest(1, 17, 60, "512M")))
        .isInstanceOf(StressValidationException.class)
        .hasMessageContaining("memory_workers");
  }

  @Test
  void validate_rejectsNull() {
    assertThatThrownBy(() -> validator.validate(null))
        .isInstanceOf(StressValidationException.class);
  }
}
