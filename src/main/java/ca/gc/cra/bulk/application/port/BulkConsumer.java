package ca.gc.cra.bulk.application.port;

import ca.gc.cra.bulk.domain.command.Bulk;

/**
 * <strong>What:</strong> Output port receiving completed bulks from the batching engine.
 * <p><strong>Why:</strong> Lets the engine fan a bulk out to consoles, files, or brokers without knowing
 * what each output does with it.</p>
 * <p><strong>Role:</strong> Output port on the sink side; implemented by adapters in
 * {@code ca.gc.cra.bulk.infrastructure.output}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Record the bulk to act on via {@link #update(Bulk)}.</li>
 *   <li>Perform the output effect in {@link #process()}.</li>
 *   <li>Release resources in {@link #close()}.</li>
 * </ul>
 * <p><strong>Lifecycle:</strong> per bulk, {@code update} is always delivered before {@code process};
 * the engine never calls {@code update} for the next bulk before {@code process} for the previous one
 * has returned.</p>
 * <p><strong>Thread-safety:</strong> {@code update} runs on the ingesting thread and {@code process} on a
 * dispatch worker; implementations publish the recorded bulk through a {@code volatile} field or
 * equivalent.</p>
 *
 * @since 0.1.0
 */
public interface BulkConsumer extends AutoCloseable {
  /**
   * Records the bulk that the next {@link #process()} call must act on.
   *
   * @param bulk immutable snapshot; never {@code null}
   *
   * <p><strong>Performance:</strong> Must be cheap and must not block on I/O.</p>
   */
  void update(Bulk bulk);

  /**
   * Renders or persists the most recently recorded bulk.
   *
   * @throws Exception if the output fails; the failure stays local to this consumer
   *
   * <p><strong>Concurrency:</strong> Runs concurrently with other consumers' {@code process} calls for
   * the same bulk.</p>
   */
  void process() throws Exception;

  /**
   * Observes the in-progress buffer after each submitted command.
   *
   * @param pending snapshot of commands accumulated so far
   */
  default void observe(Bulk pending) {}

  /**
   * Name used in logs and metrics.
   *
   * @return short consumer name
   */
  default String name() {
    return getClass().getSimpleName();
  }

  /**
   * Releases resources held by the consumer.
   *
   * @throws Exception if shutdown fails
   */
  @Override
  default void close() throws Exception {}
}
