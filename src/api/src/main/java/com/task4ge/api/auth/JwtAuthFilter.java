package com.task4ge.api.auth;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class JwtAuthFilter extends OncePerRequestFilter {

  private final JwtService jwtService;

  public JwtAuthFilter(JwtService jwtService) {
    this.jwtService = jwtService;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    if ("OPTIONS".equalsIgnoreCase(request.getMethod())) return true;
    String path = request.getRequestURI();
    if (path == null) return false;
    return path.equals("/status")
        || path.equals("/favicon.ico")
        || path.startsWith("/v3/api-docs")
        || path.startsWith("/swagger-ui");
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    String auth = request.getHeader("Authorization");
    if (auth == null || !auth.startsWith("Bearer ")) {
      response.setStatus(401);
      response.setContentType("application/json");
      response.getWriter().write("{\"code\":\"UNAUTHORIZED\",\"message\":\"Authentication is required.\"}");
      return;
    }

    String token = auth.substring("Bearer ".length());
    AuthPrincipal principal;
    try {
      principal = jwtService.parsePrincipal(jwtService.verify(token));
    } catch (Exception ex) {
      log.warn("Rejected bearer token for {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
      response.setStatus(401);
      response.setContentType("application/json");
      response.getWriter().write("{\"code\":\"INVALID_TOKEN\",\"message\":\"Token is invalid or expired.\"}");
      return;
    }

    AuthContext.set(principal);
    try {
      filterChain.doFilter(request, response);
    } finally {
      AuthContext.clear();
    }
  }
}
