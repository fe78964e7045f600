package com.codeheadsystems.swapdot.dropwizard;

import com.codeheadsystems.swapdot.server.manager.LedgerJanitor;
import io.dropwizard.lifecycle.Managed;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link LedgerJanitor#sweep()} on a fixed schedule for the lifetime of the application.
 */
public class LedgerJanitorService implements Managed {

  private static final Logger log = LoggerFactory.getLogger(LedgerJanitorService.class);

  private final LedgerJanitor janitor;
  private final long intervalSeconds;
  private ScheduledExecutorService scheduler;

  public LedgerJanitorService(LedgerJanitor janitor, long intervalSeconds) {
    if (intervalSeconds < 1) {
      throw new IllegalArgumentException("intervalSeconds must be positive");
    }
    this.janitor = janitor;
    this.intervalSeconds = intervalSeconds;
  }

  @Override
  public void start() {
    scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "ledger-janitor");
      t.setDaemon(true);
      return t;
    });
    scheduler.scheduleWithFixedDelay(this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    log.info("Ledger janitor scheduled every {}s", intervalSeconds);
  }

  @Override
  public void stop() throws InterruptedException {
    if (scheduler == null) {
      return;
    }
    scheduler.shutdown();
    if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
      log.warn("Ledger janitor did not stop in time; interrupting");
      scheduler.shutdownNow();
    }
  }

  /**
   * One sweep. Failures are logged so that the schedule keeps running.
   */
  void runOnce() {
    try {
      janitor.sweep();
    } catch (RuntimeException e) {
      log.error("Ledger janitor sweep failed", e);
    }
  }
}
