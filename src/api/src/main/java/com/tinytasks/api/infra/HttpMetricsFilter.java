package com.tinytasks.api.infra;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerMapping;

import java.io.IOException;
import java.time.Duration;

/**
 * Records request count and latency for every request, labelled by method, route template and status.
 *
 * <p>The route template ({@code /api/tasks/{taskId}}) is used instead of the raw path so task ids
 * never become label values. Requests that matched no handler are labelled {@value #UNMATCHED}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@RequiredArgsConstructor
public class HttpMetricsFilter extends OncePerRequestFilter {

  public static final String REQUESTS_METRIC = "http.requests";
  public static final String DURATION_METRIC = "http.request.duration";
  public static final String UNMATCHED = "UNMATCHED";

  private static final Duration[] LATENCY_BUCKETS = {
      Duration.ofMillis(5),
      Duration.ofMillis(10),
      Duration.ofMillis(25),
      Duration.ofMillis(50),
      Duration.ofMillis(100),
      Duration.ofMillis(250),
      Duration.ofMillis(500),
      Duration.ofSeconds(1),
      Duration.ofSeconds(2),
      Duration.ofSeconds(5)
  };

  private final MeterRegistry registry;

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    long start = System.nanoTime();
    int status = HttpServletResponse.SC_INTERNAL_SERVER_ERROR;
    try {
      filterChain.doFilter(request, response);
      status = response.getStatus();
    } finally {
      record(request.getMethod(), routeOf(request), status, System.nanoTime() - start);
    }
  }

  private void record(String method, String path, int status, long elapsedNanos) {
    String statusLabel = Integer.toString(status);
    Counter.builder(REQUESTS_METRIC)
        .description("Total HTTP requests")
        .tag("method", method)
        .tag("path", path)
        .tag("status", statusLabel)
        .register(registry)
        .increment();
    Timer.builder(DURATION_METRIC)
        .description("HTTP request latency")
        .tag("method", method)
        .tag("path", path)
        .tag("status", statusLabel)
        .serviceLevelObjectives(LATENCY_BUCKETS)
        .register(registry)
        .record(Duration.ofNanos(elapsedNanos));
  }

  static String routeOf(HttpServletRequest request) {
    Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
    if (pattern == null) return UNMATCHED;
    String route = pattern.toString();
    if (route.isEmpty() || route.equals("/**")) return UNMATCHED;
    return route;
  }
}
