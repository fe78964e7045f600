package com.codeheadsystems.swapdot.server.resource;

import com.codeheadsystems.swapdot.model.token.RegisterTokenRequest;
import com.codeheadsystems.swapdot.model.token.TokenResponse;
import com.codeheadsystems.swapdot.server.auth.AdmissionGate;
import com.codeheadsystems.swapdot.server.manager.TokenRegistryManager;
import com.codeheadsystems.swapdot.server.model.Token;
import jakarta.annotation.security.PermitAll;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.SecurityContext;

/**
 * JAX-RS resource for token registration and lookup. Key hashes are never returned.
 */
@PermitAll
@Path("/tokens")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class TokenResource {

  private final TokenRegistryManager tokenRegistryManager;
  private final AdmissionGate admissionGate;

  public TokenResource(TokenRegistryManager tokenRegistryManager, AdmissionGate admissionGate) {
    this.tokenRegistryManager = tokenRegistryManager;
    this.admissionGate = admissionGate;
  }

  @POST
  public TokenResponse register(@Context SecurityContext securityContext, RegisterTokenRequest req) {
    String userId = CallerIdentity.userId(securityContext);
    admissionGate.admit(userId, "tokens.register");
    return toResponse(tokenRegistryManager.register(req.requiredTokenId(), userId, req.requiredKeyHash(),
        req.tagUid(), req.forceOverwriteOrDefault()));
  }

  @GET
  @Path("/{tokenId}")
  public TokenResponse get(@Context SecurityContext securityContext, @PathParam("tokenId") String tokenId) {
    CallerIdentity.userId(securityContext);
    return toResponse(tokenRegistryManager.get(tokenId));
  }

  static TokenResponse toResponse(Token token) {
    return new TokenResponse(token.tokenId(), token.ownerUid(), token.previousOwners(), token.counter(),
        token.status().name(), token.tagUid());
  }
}
