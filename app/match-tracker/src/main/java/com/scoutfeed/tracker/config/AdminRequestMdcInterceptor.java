/*
 * Where: Match tracker web configuration
 * What: puts request_id, method and path into the MDC for admin requests
 * Why: a poll cycle triggered over HTTP logs under the caller's request id
 */
package com.scoutfeed.tracker.config;

import com.scoutfeed.common.CorrelationIds;
import com.scoutfeed.common.MdcScope;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class AdminRequestMdcInterceptor implements HandlerInterceptor {

  private static final String ATTRIBUTE_SCOPE =
      AdminRequestMdcInterceptor.class.getName() + ".MDC_SCOPE";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final MdcScope scope =
        MdcScope.open()
            .put("request_id", resolveRequestId(request))
            .put("http_method", request.getMethod())
            .put("http_path", request.getRequestURI());
    request.setAttribute(ATTRIBUTE_SCOPE, scope);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (request.getAttribute(ATTRIBUTE_SCOPE) instanceof MdcScope scope) {
      scope.close();
    }
  }

  private String resolveRequestId(HttpServletRequest request) {
    final String requestId = request.getHeader("X-Request-Id");
    if (requestId != null && !requestId.isBlank()) {
      return requestId;
    }
    return CorrelationIds.newRequestId();
  }
}
