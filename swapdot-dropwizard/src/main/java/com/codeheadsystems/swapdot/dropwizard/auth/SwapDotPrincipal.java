package com.codeheadsystems.swapdot.dropwizard.auth;

import java.security.Principal;

/**
 * Principal representing an authenticated caller.
 *
 * @param userId user id from the JWT subject
 * @param jti    JWT ID
 */
public record SwapDotPrincipal(String userId, String jti) implements Principal {

  @Override
  public String getName() {
    return userId;
  }
}
