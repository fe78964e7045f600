package com.codeheadsystems.swapdot.dropwizard;

import com.codeheadsystems.swapdot.server.manager.LedgerSettings;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.time.Duration;

/**
 * Dropwizard configuration for the SwapDot transfer server.
 * <p>
 * For production, supply {@code masterKeyHex} (the 16-byte card master key) and
 * {@code jwtSecretHex}. Omitting the master key falls back to the all-zero factory key, which
 * the {@code master-key} health check reports as unhealthy. Omitting the JWT secret causes a
 * random one to be generated on each startup (dev/test only).
 * <p>
 * Generate secrets with: {@code openssl rand -hex 32}
 */
public class SwapDotConfiguration extends Configuration {

  /**
   * Hex-encoded card master key: 8, 16 or 24 bytes. Leave empty for the factory zero key
   * (dev only).
   */
  private String masterKeyHex = "";

  /**
   * Lifetime of a card authentication session.
   */
  @Min(1)
  private long authSessionTtlSeconds = 60;

  /**
   * Lifetime of the lease taken on a token while a caller authenticates against it.
   */
  @Min(1)
  private long tokenLeaseSeconds = 15;

  /**
   * Lifetime of a legacy pending transfer.
   */
  @Min(1)
  private long pendingTransferTtlSeconds = 600;

  /**
   * Time allowed between staging and committing a two-phase transfer.
   */
  @Min(1)
  private long stagedTransferTtlSeconds = 600;

  /**
   * Lifetime of a two-phase transfer session that has not been staged.
   */
  @Min(1)
  private long transferSessionTtlSeconds = 300;

  /**
   * Period of the background janitor. 0 disables the scheduled sweep.
   */
  @Min(0)
  private long janitorIntervalSeconds = 900;

  /**
   * Maximum documents the janitor handles per step and sweep.
   */
  @Min(1)
  private int janitorBatchSize = 100;

  /**
   * Capacity of the in-memory authentication session store.
   */
  @Min(1)
  private int maxPendingAuthSessions = 10_000;

  /**
   * Attempts made for one ledger transaction before a conflict is reported.
   */
  @Min(1)
  private int transactionMaxAttempts = 5;

  /**
   * Hex-encoded HMAC-SHA256 signing secret for caller JWTs.
   * Leave empty for random generation (dev only, tokens become invalid on restart).
   */
  private String jwtSecretHex = "";

  /**
   * JWT issuer claim.
   */
  @NotEmpty
  private String jwtIssuer = "swapdot";

  /**
   * JWT time-to-live in seconds.
   */
  @Min(1)
  private long jwtTtlSeconds = 3600;

  /**
   * Builds the service settings from this configuration.
   *
   * @return the settings
   */
  public LedgerSettings toLedgerSettings() {
    return new LedgerSettings(
        Duration.ofSeconds(authSessionTtlSeconds),
        Duration.ofSeconds(tokenLeaseSeconds),
        Duration.ofSeconds(pendingTransferTtlSeconds),
        Duration.ofSeconds(stagedTransferTtlSeconds),
        Duration.ofSeconds(transferSessionTtlSeconds),
        janitorBatchSize,
        maxPendingAuthSessions,
        transactionMaxAttempts);
  }

  /**
   * Gets master key hex.
   *
   * @return the master key hex
   */
  @JsonProperty
  public String getMasterKeyHex() {
    return masterKeyHex;
  }

  /**
   * Sets master key hex.
   *
   * @param masterKeyHex the master key hex
   */
  @JsonProperty
  public void setMasterKeyHex(String masterKeyHex) {
    this.masterKeyHex = masterKeyHex;
  }

  @JsonProperty
  public long getAuthSessionTtlSeconds() {
    return authSessionTtlSeconds;
  }

  @JsonProperty
  public void setAuthSessionTtlSeconds(long authSessionTtlSeconds) {
    this.authSessionTtlSeconds = authSessionTtlSeconds;
  }

  @JsonProperty
  public long getTokenLeaseSeconds() {
    return tokenLeaseSeconds;
  }

  @JsonProperty
  public void setTokenLeaseSeconds(long tokenLeaseSeconds) {
    this.tokenLeaseSeconds = tokenLeaseSeconds;
  }

  @JsonProperty
  public long getPendingTransferTtlSeconds() {
    return pendingTransferTtlSeconds;
  }

  @JsonProperty
  public void setPendingTransferTtlSeconds(long pendingTransferTtlSeconds) {
    this.pendingTransferTtlSeconds = pendingTransferTtlSeconds;
  }

  @JsonProperty
  public long getStagedTransferTtlSeconds() {
    return stagedTransferTtlSeconds;
  }

  @JsonProperty
  public void setStagedTransferTtlSeconds(long stagedTransferTtlSeconds) {
    this.stagedTransferTtlSeconds = stagedTransferTtlSeconds;
  }

  @JsonProperty
  public long getTransferSessionTtlSeconds() {
    return transferSessionTtlSeconds;
  }

  @JsonProperty
  public void setTransferSessionTtlSeconds(long transferSessionTtlSeconds) {
    this.transferSessionTtlSeconds = transferSessionTtlSeconds;
  }

  /**
   * Gets janitor interval seconds.
   *
   * @return the janitor interval seconds, 0 when disabled
   */
  @JsonProperty
  public long getJanitorIntervalSeconds() {
    return janitorIntervalSeconds;
  }

  @JsonProperty
  public void setJanitorIntervalSeconds(long janitorIntervalSeconds) {
    this.janitorIntervalSeconds = janitorIntervalSeconds;
  }

  @JsonProperty
  public int getJanitorBatchSize() {
    return janitorBatchSize;
  }

  @JsonProperty
  public void setJanitorBatchSize(int janitorBatchSize) {
    this.janitorBatchSize = janitorBatchSize;
  }

  @JsonProperty
  public int getMaxPendingAuthSessions() {
    return maxPendingAuthSessions;
  }

  @JsonProperty
  public void setMaxPendingAuthSessions(int maxPendingAuthSessions) {
    this.maxPendingAuthSessions = maxPendingAuthSessions;
  }

  @JsonProperty
  public int getTransactionMaxAttempts() {
    return transactionMaxAttempts;
  }

  @JsonProperty
  public void setTransactionMaxAttempts(int transactionMaxAttempts) {
    this.transactionMaxAttempts = transactionMaxAttempts;
  }

  /**
   * Gets jwt secret hex.
   *
   * @return the jwt secret hex
   */
  @JsonProperty
  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  /**
   * Sets jwt secret hex.
   *
   * @param jwtSecretHex the jwt secret hex
   */
  @JsonProperty
  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  /**
   * Gets jwt issuer.
   *
   * @return the jwt issuer
   */
  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  /**
   * Sets jwt issuer.
   *
   * @param jwtIssuer the jwt issuer
   */
  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  /**
   * Gets jwt ttl seconds.
   *
   * @return the jwt ttl seconds
   */
  @JsonProperty
  public long getJwtTtlSeconds() {
    return jwtTtlSeconds;
  }

  /**
   * Sets jwt ttl seconds.
   *
   * @param jwtTtlSeconds the jwt ttl seconds
   */
  @JsonProperty
  public void setJwtTtlSeconds(long jwtTtlSeconds) {
    this.jwtTtlSeconds = jwtTtlSeconds;
  }
}
