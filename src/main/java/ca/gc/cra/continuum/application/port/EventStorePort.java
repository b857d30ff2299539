package ca.gc.cra.continuum.application.port;

import java.io.IOException;

/**
 * <strong>What:</strong> Port to the append-only remote store that receives audit events.
 * <p><strong>Why:</strong> Durability is best effort; adapters write one object per event and never read back.</p>
 * <p><strong>Role:</strong> Implemented by GitHub content, Kafka and local directory adapters.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent writes of distinct paths.</p>
 *
 * @since 0.1.0
 */
public interface EventStorePort extends AutoCloseable {
  /**
   * Writes one object.
   *
   * @param path store-relative path such as {@code events/2025/01/31/analysis_<id>.json}
   * @param payload serialized event
   * @throws IOException when the single write attempt fails
   */
  void write(String path, byte[] payload) throws IOException;

  /**
   * Short backend name reported by health and stats.
   *
   * @return backend kind such as {@code github}
   */
  String kind();

  /**
   * Releases client resources.
   *
   * @throws IOException when shutdown fails
   */
  @Override
  default void close() throws IOException {}
}
