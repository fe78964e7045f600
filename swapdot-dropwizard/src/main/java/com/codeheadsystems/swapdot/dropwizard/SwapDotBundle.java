package com.codeheadsystems.swapdot.dropwizard;

import com.codeheadsystems.swapdot.desfire.DesKey;
import com.codeheadsystems.swapdot.desfire.IsoAuthentication;
import com.codeheadsystems.swapdot.desfire.RandomProvider;
import com.codeheadsystems.swapdot.desfire.SecureMessaging;
import com.codeheadsystems.swapdot.dropwizard.auth.SwapDotAuthenticator;
import com.codeheadsystems.swapdot.dropwizard.auth.SwapDotPrincipal;
import com.codeheadsystems.swapdot.dropwizard.health.LedgerStoreHealthCheck;
import com.codeheadsystems.swapdot.dropwizard.health.MasterKeyHealthCheck;
import com.codeheadsystems.swapdot.server.auth.AdmissionGate;
import com.codeheadsystems.swapdot.server.auth.CallerTokenVerifier;
import com.codeheadsystems.swapdot.server.manager.AuthProtocolManager;
import com.codeheadsystems.swapdot.server.manager.CardCommandManager;
import com.codeheadsystems.swapdot.server.manager.LedgerJanitor;
import com.codeheadsystems.swapdot.server.manager.LedgerSettings;
import com.codeheadsystems.swapdot.server.manager.TokenRegistryManager;
import com.codeheadsystems.swapdot.server.manager.TransferLedgerManager;
import com.codeheadsystems.swapdot.server.manager.TwoPhaseTransferManager;
import com.codeheadsystems.swapdot.server.resource.AuthResource;
import com.codeheadsystems.swapdot.server.resource.CardResource;
import com.codeheadsystems.swapdot.server.resource.SwapDotExceptionMapper;
import com.codeheadsystems.swapdot.server.resource.TokenResource;
import com.codeheadsystems.swapdot.server.resource.TransferResource;
import com.codeheadsystems.swapdot.server.store.InMemoryLedgerStore;
import com.codeheadsystems.swapdot.server.store.InMemorySessionStore;
import com.codeheadsystems.swapdot.server.store.LedgerStore;
import com.codeheadsystems.swapdot.server.store.SessionStore;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the SwapDot transfer server into an existing Dropwizard
 * application.
 * <p>
 * Registers the auth, card, token and transfer resources, the error mapper, the health checks,
 * the JWT authentication filter and the scheduled ledger janitor. Requires a
 * {@link SwapDotConfiguration} block in the application's YAML config.
 * <p>
 * Embed in your application with in-memory stores (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new SwapDotBundle<>());
 * }</pre>
 * <p>
 * Or supply persistent stores and an admission gate:
 * <pre>{@code
 *   bootstrap.addBundle(new SwapDotBundle<>(myLedgerStore, mySessionStore, myGate));
 * }</pre>
 */
@Singleton
public class SwapDotBundle<C extends SwapDotConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(SwapDotBundle.class);

  private final LedgerStore suppliedLedgerStore;
  private final SessionStore suppliedSessionStore;
  private final AdmissionGate admissionGate;
  private final Clock clock;

  /**
   * Creates a bundle backed by in-memory stores that admits every call.
   * <p>
   * For dev/test only. All tokens, transfers and sessions are lost on restart.
   */
  public SwapDotBundle() {
    this.suppliedLedgerStore = null;
    this.suppliedSessionStore = null;
    this.admissionGate = AdmissionGate.ALLOW_ALL;
    this.clock = Clock.systemUTC();
    log.warn("""
        #################################################################
        # WARNING: Using ephemeral in-memory ledger and session stores. #
        # All data will be lost on restart.                             #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied stores.
   *
   * @param ledgerStore   transactional store for tokens and transfers
   * @param sessionStore  store for card authentication sessions
   * @param admissionGate pre-check run before every mutating call
   */
  @Inject
  public SwapDotBundle(LedgerStore ledgerStore,
                       SessionStore sessionStore,
                       AdmissionGate admissionGate) {
    this.suppliedLedgerStore = ledgerStore;
    this.suppliedSessionStore = sessionStore;
    this.admissionGate = admissionGate;
    this.clock = Clock.systemUTC();
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // nothing to initialize
  }

  @Override
  public void run(C configuration, Environment environment) {
    LedgerSettings settings = configuration.toLedgerSettings();
    LedgerStore ledgerStore = suppliedLedgerStore != null
        ? suppliedLedgerStore
        : new InMemoryLedgerStore(environment.getObjectMapper(), settings.transactionMaxAttempts());
    SessionStore sessionStore = suppliedSessionStore != null
        ? suppliedSessionStore
        : new InMemorySessionStore(settings.maxPendingAuthSessions(), clock);
    DesKey masterKey = buildMasterKey(configuration);
    RandomProvider randomProvider = new RandomProvider();

    AuthProtocolManager authProtocolManager = new AuthProtocolManager(sessionStore, ledgerStore,
        new IsoAuthentication(randomProvider), masterKey, settings, clock);
    CardCommandManager cardCommandManager = new CardCommandManager(authProtocolManager, ledgerStore,
        new SecureMessaging(), randomProvider, masterKey, clock);
    TokenRegistryManager tokenRegistryManager = new TokenRegistryManager(ledgerStore, clock);
    TransferLedgerManager transferLedgerManager = new TransferLedgerManager(ledgerStore, settings, clock);
    TwoPhaseTransferManager twoPhaseTransferManager = new TwoPhaseTransferManager(ledgerStore,
        authProtocolManager, randomProvider, settings, clock);

    environment.jersey().register(new AuthResource(authProtocolManager, admissionGate));
    environment.jersey().register(new CardResource(cardCommandManager, admissionGate));
    environment.jersey().register(new TokenResource(tokenRegistryManager, admissionGate));
    environment.jersey().register(new TransferResource(transferLedgerManager, twoPhaseTransferManager,
        admissionGate));
    environment.jersey().register(new SwapDotExceptionMapper());

    environment.healthChecks().register("ledger-store", new LedgerStoreHealthCheck(ledgerStore));
    environment.healthChecks().register("master-key", new MasterKeyHealthCheck(masterKey));

    CallerTokenVerifier verifier = buildVerifier(configuration);
    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<SwapDotPrincipal>()
            .setAuthenticator(new SwapDotAuthenticator(verifier))
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(SwapDotPrincipal.class));

    if (configuration.getJanitorIntervalSeconds() > 0) {
      LedgerJanitor janitor = new LedgerJanitor(ledgerStore, sessionStore, transferLedgerManager,
          twoPhaseTransferManager, settings, clock);
      environment.lifecycle().manage(new LedgerJanitorService(janitor, configuration.getJanitorIntervalSeconds()));
    } else {
      log.warn("Ledger janitor disabled. Expired records are only cleaned up when next touched.");
    }
  }

  private DesKey buildMasterKey(C configuration) {
    String keyHex = configuration.getMasterKeyHex();
    if (keyHex == null || keyHex.isEmpty()) {
      log.warn("No card master key configured. Using the factory zero key. Do not use in production.");
      return DesKey.of(new byte[16]);
    }
    return DesKey.of(HexFormat.of().parseHex(keyHex));
  }

  private CallerTokenVerifier buildVerifier(C configuration) {
    String secretHex = configuration.getJwtSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No JWT secret configured. Generating randomly. "
          + "Tokens will be invalidated on restart. Do not use in production.");
      secret = new byte[32];
      new SecureRandom().nextBytes(secret);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
    }
    return new CallerTokenVerifier(secret, configuration.getJwtIssuer(), configuration.getJwtTtlSeconds(), clock);
  }
}
