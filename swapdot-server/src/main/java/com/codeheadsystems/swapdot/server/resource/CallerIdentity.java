package com.codeheadsystems.swapdot.server.resource;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import java.security.Principal;

/**
 * Reads the caller's user id from the request's security context.
 */
final class CallerIdentity {

  private CallerIdentity() {
  }

  static String userId(SecurityContext securityContext) {
    Principal principal = securityContext == null ? null : securityContext.getUserPrincipal();
    if (principal == null || principal.getName() == null || principal.getName().isBlank()) {
      throw new WebApplicationException("Authentication required", Response.Status.UNAUTHORIZED);
    }
    return principal.getName();
  }
}
