package com.codeheadsystems.swapdot.dropwizard;

import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Minimal Dropwizard application used only in integration tests.
 * Not part of the library's public API.
 */
public class SwapDotApplication extends Application<SwapDotConfiguration> {

  public static void main(String[] args) throws Exception {
    new SwapDotApplication().run(args);
  }

  @Override
  public String getName() {
    return "swapdot-test";
  }

  @Override
  public void initialize(Bootstrap<SwapDotConfiguration> bootstrap) {
    bootstrap.addBundle(new SwapDotBundle<>());
  }

  @Override
  public void run(SwapDotConfiguration configuration, Environment environment) {
    // everything is registered by the bundle
  }
}
