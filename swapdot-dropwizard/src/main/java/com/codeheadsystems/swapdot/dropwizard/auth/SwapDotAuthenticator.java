package com.codeheadsystems.swapdot.dropwizard.auth;

import com.codeheadsystems.swapdot.server.auth.CallerTokenVerifier;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;

/**
 * Dropwizard {@link Authenticator} that validates bearer tokens using {@link CallerTokenVerifier}.
 */
public class SwapDotAuthenticator implements Authenticator<String, SwapDotPrincipal> {

  private final CallerTokenVerifier verifier;

  public SwapDotAuthenticator(CallerTokenVerifier verifier) {
    this.verifier = verifier;
  }

  @Override
  public Optional<SwapDotPrincipal> authenticate(String token) throws AuthenticationException {
    return verifier.verify(token)
        .map(caller -> new SwapDotPrincipal(caller.userId(), caller.jti()));
  }
}
