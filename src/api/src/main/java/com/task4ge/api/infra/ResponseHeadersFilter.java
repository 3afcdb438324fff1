package com.task4ge.api.infra;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Adds the caching and vendor headers every response carries, including 401s written by the auth
 * filter.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class ResponseHeadersFilter extends OncePerRequestFilter {

  public static final String DEVELOPED_BY_HEADER = "X-Developed-By";

  private final String cacheControl;
  private final String developedBy;

  public ResponseHeadersFilter(
      @Value("${task4ge.http.cache-control:private, max-age=3600, must-revalidate}") String cacheControl,
      @Value("${task4ge.http.developed-by:DevConn Software}") String developedBy) {
    this.cacheControl = cacheControl;
    this.developedBy = developedBy;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    response.setHeader("Cache-Control", cacheControl);
    response.setHeader(DEVELOPED_BY_HEADER, developedBy);
    filterChain.doFilter(request, response);
  }
}
