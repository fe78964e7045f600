package com.codeheadsystems.swapdot.server.auth;

/**
 * Pre-check run before every mutating operation: rate limits, anti-spoofing, app version
 * gating. Implementations throw
 * {@link com.codeheadsystems.swapdot.server.exception.PermissionException} to reject a call.
 * The services never depend on a gate having run.
 */
@FunctionalInterface
public interface AdmissionGate {

  /**
   * Admits everything.
   */
  AdmissionGate ALLOW_ALL = (userId, operation) -> {
  };

  /**
   * Admits or rejects a call.
   *
   * @param userId    the caller
   * @param operation operation name, such as {@code "transfers.initiate"}
   */
  void admit(String userId, String operation);
}
