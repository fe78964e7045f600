package com.codeheadsystems.swapdot.server.resource;

import com.codeheadsystems.swapdot.model.WireBytes;
import com.codeheadsystems.swapdot.model.auth.BeginAuthRequest;
import com.codeheadsystems.swapdot.model.auth.BeginAuthResponse;
import com.codeheadsystems.swapdot.model.auth.ContinueAuthRequest;
import com.codeheadsystems.swapdot.model.auth.ContinueAuthResponse;
import com.codeheadsystems.swapdot.server.auth.AdmissionGate;
import com.codeheadsystems.swapdot.server.manager.AuthProtocolManager;
import jakarta.annotation.security.PermitAll;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource relaying the card authentication handshake.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /auth/begin}: first APDU for the card</li>
 *   <li>{@code POST /auth/continue}: card response in, next APDU out</li>
 * </ul>
 */
@PermitAll
@Path("/auth")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthResource {

  private static final Logger log = LoggerFactory.getLogger(AuthResource.class);

  private final AuthProtocolManager authProtocolManager;
  private final AdmissionGate admissionGate;

  public AuthResource(AuthProtocolManager authProtocolManager, AdmissionGate admissionGate) {
    this.authProtocolManager = authProtocolManager;
    this.admissionGate = admissionGate;
  }

  @POST
  @Path("/begin")
  public BeginAuthResponse begin(@Context SecurityContext securityContext, BeginAuthRequest req) {
    String userId = CallerIdentity.userId(securityContext);
    admissionGate.admit(userId, "auth.begin");
    log.debug("begin(tokenId={})", req.tokenId());
    AuthProtocolManager.BeginResult result;
    try {
      result = authProtocolManager.begin(
          req.requiredTokenId(), userId, req.keyNoOrDefault(), req.allowUnownedOrDefault());
    } catch (IllegalStateException e) {
      log.warn("Rejecting auth begin: {}", e.getMessage());
      throw new WebApplicationException("Too many pending sessions", Response.Status.SERVICE_UNAVAILABLE);
    }
    return new BeginAuthResponse(result.sessionId(), WireBytes.encode(result.apdu()),
        result.expiresAt().toString());
  }

  @POST
  @Path("/continue")
  public ContinueAuthResponse continueAuth(@Context SecurityContext securityContext, ContinueAuthRequest req) {
    String userId = CallerIdentity.userId(securityContext);
    admissionGate.admit(userId, "auth.continue");
    AuthProtocolManager.ContinueResult result = authProtocolManager.continueAuth(
        req.requiredSessionId(), userId, req.cardResponse());
    return new ContinueAuthResponse(result.sessionId(), result.phase().name(),
        WireBytes.encode(result.apdu()), result.authenticated());
  }
}
