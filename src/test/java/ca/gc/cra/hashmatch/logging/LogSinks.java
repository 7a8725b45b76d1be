package ca.gc.cra.hashmatch.logging;

/**
 * Test helper giving tests outside this package access to the sink reset hook.
 */
public final class LogSinks {
  private LogSinks() {}

  /** Detaches any file sink attached by a previous test. */
  public static void reset() {
    LoggingConfigurator.resetSinkForTesting();
  }
}
