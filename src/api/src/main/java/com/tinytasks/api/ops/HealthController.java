package com.tinytasks.api.ops;

import com.tinytasks.api.infra.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {

  private final StoreHealthRepository storeHealthRepository;

  @GetMapping("/healthz")
  public Map<String, String> healthz() {
    return Map.of("status", "ok");
  }

  @GetMapping("/db/healthz")
  public Map<String, String> dbHealthz() {
    try {
      storeHealthRepository.ping();
    } catch (DataAccessException e) {
      throw new StoreUnavailableException(e);
    }
    return Map.of("db", "ok");
  }
}
