package com.codeheadsystems.swapdot.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.swapdot.server.store.LedgerStore;

/**
 * Reports whether the ledger store can serve transactions.
 */
public class LedgerStoreHealthCheck extends HealthCheck {

  private final LedgerStore ledgerStore;

  public LedgerStoreHealthCheck(LedgerStore ledgerStore) {
    this.ledgerStore = ledgerStore;
  }

  @Override
  protected Result check() {
    if (!ledgerStore.isHealthy()) {
      return Result.unhealthy("Ledger store is not serving transactions");
    }
    return Result.healthy();
  }
}
