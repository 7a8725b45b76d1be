package ca.gc.cra.hashmatch.api;

/**
 * Process exit codes returned by the CLI commands.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Run completed and the report was written. */
  SUCCESS(0),
  /** Arguments or configuration were rejected before any work started. */
  INVALID_ARGS(2),
  /** The candidate file, configuration file, log or report could not be read or written. */
  IO_ERROR(3),
  /** Setup failed after arguments were accepted, for example a digest the JVM does not provide. */
  CONFIG_ERROR(4),
  /** A worker failed or the result store was inconsistent. */
  RUNTIME_FAILURE(5),
  /** The run was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process exit code.
   *
   * @return exit code
   */
  public int code() {
    return code;
  }
}
