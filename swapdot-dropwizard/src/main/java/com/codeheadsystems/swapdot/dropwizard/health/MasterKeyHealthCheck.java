package com.codeheadsystems.swapdot.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.swapdot.desfire.DesKey;
import java.util.Arrays;

/**
 * Checks the card master key. The all-zero factory key is reported as unhealthy so that a
 * development configuration does not go unnoticed in production.
 */
public class MasterKeyHealthCheck extends HealthCheck {

  private final DesKey masterKey;

  public MasterKeyHealthCheck(DesKey masterKey) {
    this.masterKey = masterKey;
  }

  @Override
  protected Result check() {
    byte[] material = masterKey.material();
    // parity adjustment turns zero bytes into 0x01
    byte[] factory = new byte[material.length];
    Arrays.fill(factory, (byte) 0x01);
    if (Arrays.equals(material, factory)) {
      return Result.unhealthy("Master key is the factory default");
    }
    return Result.healthy("key length=%d", material.length);
  }
}
