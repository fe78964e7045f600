package com.codeheadsystems.swapdot.server.resource;

import com.codeheadsystems.swapdot.model.transfer.CommitTransferRequest;
import com.codeheadsystems.swapdot.model.transfer.FinalizeTransferRequest;
import com.codeheadsystems.swapdot.model.transfer.InitiateTransferRequest;
import com.codeheadsystems.swapdot.model.transfer.InitiateTransferResponse;
import com.codeheadsystems.swapdot.model.transfer.OpenTransferSessionRequest;
import com.codeheadsystems.swapdot.model.transfer.RollbackTransferRequest;
import com.codeheadsystems.swapdot.model.transfer.RollbackTransferResponse;
import com.codeheadsystems.swapdot.model.transfer.StageTransferRequest;
import com.codeheadsystems.swapdot.model.transfer.StageTransferResponse;
import com.codeheadsystems.swapdot.model.transfer.TransferResultResponse;
import com.codeheadsystems.swapdot.model.transfer.TransferSessionResponse;
import com.codeheadsystems.swapdot.model.transfer.ValidateCardKeyRequest;
import com.codeheadsystems.swapdot.server.auth.AdmissionGate;
import com.codeheadsystems.swapdot.server.manager.TransferLedgerManager;
import com.codeheadsystems.swapdot.server.manager.TwoPhaseTransferManager;
import com.codeheadsystems.swapdot.server.model.PendingTransfer;
import com.codeheadsystems.swapdot.server.model.StagedTransfer;
import com.codeheadsystems.swapdot.server.model.Token;
import com.codeheadsystems.swapdot.server.model.TransferSession;
import jakarta.annotation.security.PermitAll;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.SecurityContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for both transfer protocols.
 * <p>
 * Legacy: {@code /transfers/initiate} then {@code /transfers/finalize}.
 * <p>
 * Two-phase: {@code /transfers/sessions}, {@code /transfers/sessions/validate-key},
 * {@code /transfers/stage}, then {@code /transfers/commit} or {@code /transfers/rollback}.
 */
@PermitAll
@Path("/transfers")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class TransferResource {

  private static final Logger log = LoggerFactory.getLogger(TransferResource.class);

  private final TransferLedgerManager transferLedgerManager;
  private final TwoPhaseTransferManager twoPhaseTransferManager;
  private final AdmissionGate admissionGate;

  public TransferResource(TransferLedgerManager transferLedgerManager,
                          TwoPhaseTransferManager twoPhaseTransferManager,
                          AdmissionGate admissionGate) {
    this.transferLedgerManager = transferLedgerManager;
    this.twoPhaseTransferManager = twoPhaseTransferManager;
    this.admissionGate = admissionGate;
  }

  // ── Legacy ────────────────────────────────────────────────────────────────

  @POST
  @Path("/initiate")
  public InitiateTransferResponse initiate(@Context SecurityContext securityContext, InitiateTransferRequest req) {
    String userId = admit(securityContext, "transfers.initiate");
    PendingTransfer pending = transferLedgerManager.initiate(req.requiredTokenId(), userId);
    return new InitiateTransferResponse(pending.tokenId(), pending.nextCounter(), pending.expiresAt().toString());
  }

  @POST
  @Path("/finalize")
  public TransferResultResponse finalizeTransfer(@Context SecurityContext securityContext,
                                                 FinalizeTransferRequest req) {
    String userId = admit(securityContext, "transfers.finalize");
    Token token = transferLedgerManager.finalizeTransfer(req.requiredTokenId(), userId, req.tagUid());
    return new TransferResultResponse(token.tokenId(), token.ownerUid(), token.counter());
  }

  // ── Two-phase ─────────────────────────────────────────────────────────────

  @POST
  @Path("/sessions")
  public TransferSessionResponse openSession(@Context SecurityContext securityContext,
                                             OpenTransferSessionRequest req) {
    String userId = admit(securityContext, "transfers.openSession");
    return toResponse(twoPhaseTransferManager.openSession(req.requiredTokenId(), userId, req.toUid()));
  }

  @POST
  @Path("/sessions/validate-key")
  public TransferSessionResponse validateCardKey(@Context SecurityContext securityContext,
                                                 ValidateCardKeyRequest req) {
    String userId = admit(securityContext, "transfers.validateCardKey");
    TwoPhaseTransferManager.KeyValidation validation = twoPhaseTransferManager.validateCardKey(
        req.requiredAuthSessionId(), req.requiredTransferSessionId(), userId, req.cardData());
    return toResponse(validation.session());
  }

  @POST
  @Path("/stage")
  public StageTransferResponse stage(@Context SecurityContext securityContext, StageTransferRequest req) {
    String userId = admit(securityContext, "transfers.stage");
    StagedTransfer staged = twoPhaseTransferManager.stage(
        req.requiredSessionId(), userId, req.requiredNewKeyHash(), req.toUid());
    return new StageTransferResponse(staged.stagedId(), staged.expiresAt().toString());
  }

  @POST
  @Path("/commit")
  public TransferResultResponse commit(@Context SecurityContext securityContext, CommitTransferRequest req) {
    String userId = admit(securityContext, "transfers.commit");
    Token token = twoPhaseTransferManager.commit(req.requiredStagedId(), userId);
    return new TransferResultResponse(token.tokenId(), token.ownerUid(), token.counter());
  }

  @POST
  @Path("/rollback")
  public RollbackTransferResponse rollback(@Context SecurityContext securityContext, RollbackTransferRequest req) {
    String userId = admit(securityContext, "transfers.rollback");
    StagedTransfer staged = twoPhaseTransferManager.rollback(req.requiredStagedId(), userId, req.reasonOrDefault());
    return new RollbackTransferResponse(staged.stagedId(), staged.sessionId());
  }

  private String admit(SecurityContext securityContext, String operation) {
    String userId = CallerIdentity.userId(securityContext);
    admissionGate.admit(userId, operation);
    log.debug("{}()", operation);
    return userId;
  }

  private static TransferSessionResponse toResponse(TransferSession session) {
    return new TransferSessionResponse(session.sessionId(), session.tokenId(), session.state().name(),
        session.challengeValidated(), session.expiresAt().toString());
  }
}
