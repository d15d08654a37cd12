package com.ospicorp.opscopilot.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Health")
public class RootController {

  @GetMapping("/")
  public Map<String, Object> root() {
    return Map.of("service", "ops-copilot", "status", "ok");
  }

  @GetMapping("/v1/health")
  @Operation(summary = "Service health")
  public Map<String, Object> health() {
    return Map.of("status", "ok", "time", Instant.now().toString());
  }
}
