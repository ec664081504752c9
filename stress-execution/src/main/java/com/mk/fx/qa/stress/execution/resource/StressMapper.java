package com.mk.fx.qa.stress.execution.resource;

import com.mk.fx.qa.stress.execution.dto.controllerresponse.StressStatusResponse;
import com.mk.fx.qa.stress.execution.dto.controllerresponse.StressSubmissionRequest;
import com.mk.fx.qa.stress.execution.model.StressRequest;
import com.mk.fx.qa.stress.execution.model.StressRunSnapshot;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/** Converts between the wire DTOs and the domain. Omitted request fields get stock defaults. */
@Mapper(componentModel = "spring")
public interface StressMapper {

  @Mapping(target = "cpuWorkers", source = "cpuWorkers", defaultValue = "2")
  @Mapping(target = "memoryWorkers", source = "memoryWorkers", defaultValue = "1")
  @Mapping(target = "duration", source = "duration", defaultValue = "30")
  @Mapping(target = "memorySize", source = "memorySize", defaultValue = "256M")
  StressRequest toDomain(StressSubmissionRequest request);

  @Mapping(target = "runId", source = "id")
  StressStatusResponse toStatusResponse(StressRunSnapshot snapshot);

  List<StressStatusResponse> toStatusResponses(List<StressRunSnapshot> snapshots);
}
