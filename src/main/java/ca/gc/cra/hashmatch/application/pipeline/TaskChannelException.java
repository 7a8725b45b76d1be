package ca.gc.cra.hashmatch.application.pipeline;

/**
 * Raised when a worker cannot communicate with the task channel, for example because its thread was
 * interrupted while waiting for a task. Workers treat it as fatal and exit.
 *
 * @since 0.1.0
 */
public final class TaskChannelException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message description of the failed channel operation
   * @param cause underlying failure
   */
  public TaskChannelException(String message, Throwable cause) {
    super(message, cause);
  }
}
