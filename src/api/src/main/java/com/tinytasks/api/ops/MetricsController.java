package com.tinytasks.api.ops;

import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Prometheus text exposition of every meter in the registry, including the per-request
 * counters and latency histograms recorded by {@link com.tinytasks.api.infra.HttpMetricsFilter}.
 */
@RestController
@RequiredArgsConstructor
public class MetricsController {

  static final MediaType EXPOSITION_TYPE = MediaType.parseMediaType("text/plain;version=0.0.4;charset=utf-8");

  private final PrometheusMeterRegistry registry;

  @GetMapping("/metrics")
  public ResponseEntity<String> metrics() {
    return ResponseEntity.ok().contentType(EXPOSITION_TYPE).body(registry.scrape());
  }
}
