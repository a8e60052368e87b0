/*
 * Where: Notification web layer
 * What: Tags each API request's log lines with request, trace and notification keys
 * Why: Operator actions on a notification must be traceable to the request that made them
 */
package com.pimapos.notification.config;

import com.pimapos.common.TraceIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String REQUEST_ID_HEADER = "X-Request-Id";
  static final String TRACE_ID_HEADER = "X-Trace-Id";
  static final String OPERATOR_HEADER = "X-Operator-Id";

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final Map<String, String> entries = new LinkedHashMap<>();
    final String requestId = TraceIds.resolve(request.getHeader(REQUEST_ID_HEADER));
    entries.put("request_id", requestId);
    entries.put("trace_id", TraceIds.resolve(request.getHeader(TRACE_ID_HEADER)));
    entries.put("http_method", request.getMethod());
    entries.put("http_path", request.getRequestURI());
    entries.put("operator", request.getHeader(OPERATOR_HEADER));
    final Map<String, String> pathVariables = pathVariables(request);
    entries.put("feed", pathVariables.get("feed"));
    entries.put("transaction_id", pathVariables.get("transactionId"));

    final Map<String, String> applied = new LinkedHashMap<>();
    entries.forEach(
        (key, value) -> {
          if (value != null && !value.isBlank()) {
            applied.put(key, MDC.get(key));
            MDC.put(key, value);
          }
        });
    request.setAttribute(ATTRIBUTE_KEYS, applied);
    response.setHeader(REQUEST_ID_HEADER, requestId);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (!(request.getAttribute(ATTRIBUTE_KEYS) instanceof Map<?, ?> applied)) {
      return;
    }
    // restore whatever the servlet thread carried before this request
    applied.forEach(
        (key, previous) -> {
          if (previous == null) {
            MDC.remove((String) key);
          } else {
            MDC.put((String) key, (String) previous);
          }
        });
  }

  @SuppressWarnings("unchecked")
  private Map<String, String> pathVariables(HttpServletRequest request) {
    final Object attribute = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
    if (attribute instanceof Map<?, ?> variables) {
      return (Map<String, String>) variables;
    }
    return Map.of();
  }
}
