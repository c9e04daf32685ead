package com.tinytasks.api.ops;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ServiceInfoController {

  @Value("${tinytasks.service.name:TinyTasks API}")
  private String serviceName;

  @Value("${tinytasks.service.version:0.0.0}")
  private String serviceVersion;

  @GetMapping("/")
  public ServiceInfoResponse root() {
    return new ServiceInfoResponse(serviceName, serviceVersion);
  }
}
