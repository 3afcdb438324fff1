package com.task4ge.api.audit;

import com.task4ge.api.auth.AuthPrincipal;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Who performed a mutation and from which network address.
 */
public record AuditActor(String userId, String ip) {

  public static AuditActor of(AuthPrincipal principal, HttpServletRequest req) {
    String ip = req.getRemoteAddr();
    return new AuditActor(principal.userId(), ip == null ? "" : ip);
  }
}
