package com.mk.fx.qa.stress.execution.dto.controllerresponse;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * Body of {@code POST /stress}. Omitted fields fall back to the defaults applied by
 * {@link com.mk.fx.qa.stress.execution.resource.StressMapper}.
 */
@Data
public class StressSubmissionRequest {

  @Min(0)
  @JsonProperty("cpu_workers")
  private Integer cpuWorkers;

  @Min(0)
  @JsonProperty("memory_workers")
  private Integer memoryWorkers;

  @Positive
  @JsonProperty("duration")
  private Integer duration;

  @JsonProperty("memory_size")
  private String memorySize;
}
