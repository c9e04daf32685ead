package com.tinytasks.api.infra;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter implements Filter {

  public static final String REQ_ID_ATTR = "requestId";
  public static final String REQ_ID_HEADER = "X-Request-Id";
  public static final String REQ_ID_MDC_KEY = "requestId";

  private static final int MAX_INBOUND_LENGTH = 128;

  @Override
  public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
      throws IOException, ServletException {

    HttpServletRequest req = (HttpServletRequest) request;
    HttpServletResponse resp = (HttpServletResponse) response;

    String rid = req.getHeader(REQ_ID_HEADER);
    if (rid == null || rid.isBlank() || rid.length() > MAX_INBOUND_LENGTH) {
      rid = UUID.randomUUID().toString();
    }
    req.setAttribute(REQ_ID_ATTR, rid);
    resp.setHeader(REQ_ID_HEADER, rid);

    MDC.put(REQ_ID_MDC_KEY, rid);
    try {
      chain.doFilter(request, response);
    } finally {
      MDC.remove(REQ_ID_MDC_KEY);
    }
  }
}
