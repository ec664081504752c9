package com.mk.fx.qa.stress.execution.cfg;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiCfg {

  @Bean
  public OpenAPI openApi(@Value("${app.version:1.0.0}") String version) {
    return new OpenAPI()
        .info(
            new Info()
                .title("Stress Execution API")
                .version(version)
                .description(
                    "Starts and stops CPU/memory stress runs, reports their status and exposes"
                        + " host metrics and health probes."));
  }
}
