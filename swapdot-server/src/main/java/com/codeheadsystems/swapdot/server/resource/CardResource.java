package com.codeheadsystems.swapdot.server.resource;

import com.codeheadsystems.swapdot.desfire.CommMode;
import com.codeheadsystems.swapdot.model.WireBytes;
import com.codeheadsystems.swapdot.model.card.CardFramesResponse;
import com.codeheadsystems.swapdot.model.card.ChangeKeyRequest;
import com.codeheadsystems.swapdot.model.card.ReadFileRequest;
import com.codeheadsystems.swapdot.model.card.ReadFileResponse;
import com.codeheadsystems.swapdot.model.card.WriteTransferDataRequest;
import com.codeheadsystems.swapdot.server.auth.AdmissionGate;
import com.codeheadsystems.swapdot.server.manager.CardCommandManager;
import jakarta.annotation.security.PermitAll;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.SecurityContext;
import java.util.Locale;

/**
 * JAX-RS resource producing secure-messaging frames for an authenticated card.
 */
@PermitAll
@Path("/card")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class CardResource {

  private final CardCommandManager cardCommandManager;
  private final AdmissionGate admissionGate;

  public CardResource(CardCommandManager cardCommandManager, AdmissionGate admissionGate) {
    this.cardCommandManager = cardCommandManager;
    this.admissionGate = admissionGate;
  }

  @POST
  @Path("/change-key")
  public CardFramesResponse changeKey(@Context SecurityContext securityContext, ChangeKeyRequest req) {
    String userId = CallerIdentity.userId(securityContext);
    admissionGate.admit(userId, "card.changeKey");
    CardCommandManager.CardFrames frames = cardCommandManager.changeKey(
        req.requiredSessionId(), userId, req.keyNoOrDefault(), req.keyVersionOrDefault());
    return new CardFramesResponse(WireBytes.encodeAll(frames.frames()), frames.keyHash());
  }

  @POST
  @Path("/write-transfer-data")
  public CardFramesResponse writeTransferData(@Context SecurityContext securityContext,
                                              WriteTransferDataRequest req) {
    String userId = CallerIdentity.userId(securityContext);
    admissionGate.admit(userId, "card.writeTransferData");
    CardCommandManager.CardFrames frames = cardCommandManager.writeTransferData(
        req.requiredSessionId(), req.requiredTransferSessionId(), userId, parseMode(req.modeOrDefault()));
    return new CardFramesResponse(WireBytes.encodeAll(frames.frames()), frames.keyHash());
  }

  @POST
  @Path("/read-file")
  public ReadFileResponse readFile(@Context SecurityContext securityContext, ReadFileRequest req) {
    CallerIdentity.userId(securityContext);
    CardCommandManager.ReadFrames frames = cardCommandManager.readFile(req.fileNoOrDefault(), req.lengthOrDefault());
    return new ReadFileResponse(WireBytes.encode(frames.apdu()), WireBytes.encode(frames.continuation()));
  }

  private static CommMode parseMode(String mode) {
    try {
      return CommMode.valueOf(mode.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid communication mode: " + mode, e);
    }
  }
}
