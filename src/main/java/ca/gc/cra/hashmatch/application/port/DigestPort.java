package ca.gc.cra.hashmatch.application.port;

/**
 * <strong>What:</strong> Pluggable digest capability invoked by workers for every candidate.
 * <p><strong>Why:</strong> Keeps concrete algorithms (JCA, native, remote) out of the worker loop.</p>
 * <p><strong>Role:</strong> Output port implemented by {@code JcaDigestAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Instances are NOT required to be thread-safe; each worker obtains its own
 * instance through {@link Factory#create()}.</p>
 * <p><strong>Performance:</strong> Hot path; implementations should reuse engines between calls.</p>
 *
 * @since 0.1.0
 */
public interface DigestPort {
  /**
   * Computes the digest of a single candidate.
   *
   * @param candidate candidate text; never {@code null}
   * @return digest rendered in the same textual form as the normalized target
   * @throws Exception if the candidate cannot be digested; the caller skips the candidate
   */
  String digest(String candidate) throws Exception;

  /**
   * Creates per-worker digest instances.
   *
   * <p><strong>Concurrency:</strong> {@link #create()} may be called from several worker threads at once.</p>
   */
  @FunctionalInterface
  interface Factory {
    /**
     * Creates a fresh digest instance for exclusive use by one worker.
     *
     * @return digest port
     */
    DigestPort create();
  }
}
