package com.codeheadsystems.swapdot.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies the bearer tokens that identify callers. The JWT subject is the user id.
 * <p>
 * Tokens are signed with HMAC-SHA256 by the identity provider. {@link #issue(String)} produces
 * compatible tokens for tests and local development.
 */
public class CallerTokenVerifier {

  private static final Logger log = LoggerFactory.getLogger(CallerTokenVerifier.class);

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final String issuer;
  private final long ttlSeconds;
  private final Clock clock;

  /**
   * Creates a new CallerTokenVerifier.
   *
   * @param secret     HMAC-SHA256 secret shared with the identity provider
   * @param issuer     required issuer claim
   * @param ttlSeconds lifetime of tokens from {@link #issue(String)}
   * @param clock      time source for issued tokens
   */
  public CallerTokenVerifier(byte[] secret, String issuer, long ttlSeconds, Clock clock) {
    this.algorithm = Algorithm.HMAC256(secret);
    this.verifier = JWT.require(algorithm).withIssuer(issuer).build();
    this.issuer = issuer;
    this.ttlSeconds = ttlSeconds;
    this.clock = clock;
  }

  /**
   * Issues a token for a user.
   *
   * @param userId the subject
   * @return signed JWT string
   */
  public String issue(String userId) {
    Instant now = clock.instant();
    return JWT.create()
        .withIssuer(issuer)
        .withJWTId(UUID.randomUUID().toString())
        .withSubject(userId)
        .withIssuedAt(now)
        .withExpiresAt(now.plusSeconds(ttlSeconds))
        .sign(algorithm);
  }

  /**
   * Result of a successful verification.
   *
   * @param userId the JWT subject
   * @param jti    the JWT ID
   */
  public record Caller(String userId, String jti) {
  }

  /**
   * Verifies signature, issuer and expiry.
   *
   * @param token JWT string
   * @return the caller, or empty if the token is invalid or has no subject
   */
  public Optional<Caller> verify(String token) {
    try {
      DecodedJWT decoded = verifier.verify(token);
      if (decoded.getSubject() == null || decoded.getSubject().isBlank()) {
        log.debug("JWT jti={} has no subject", decoded.getId());
        return Optional.empty();
      }
      return Optional.of(new Caller(decoded.getSubject(), decoded.getId()));
    } catch (JWTVerificationException e) {
      log.debug("JWT verification failed: {}", e.getMessage());
      return Optional.empty();
    }
  }
}
