/*
 * Where: Match tracker web configuration
 * What: applies AdminRequestMdcInterceptor to the /admin endpoints
 * Why: admin calls can trigger a poll cycle, and their logs need the request id
 */
package com.scoutfeed.tracker.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final AdminRequestMdcInterceptor adminRequestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(adminRequestMdcInterceptor).addPathPatterns("/admin/**");
  }
}
