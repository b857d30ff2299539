package ca.gc.cra.continuum.infrastructure.store;

import ca.gc.cra.continuum.application.port.EventStorePort;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Writes events under a local directory using the same relative layout as the remote stores.
 *
 * @since 0.1.0
 */
public final class FileEventStore implements EventStorePort {
  private final Path root;

  /**
   * Creates a store rooted at {@code root}; the directory is created on first write.
   *
   * @param root base directory
   */
  public FileEventStore(Path root) {
    this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
  }

  @Override
  public void write(String path, byte[] payload) throws IOException {
    Objects.requireNonNull(payload, "payload");
    Path target = resolve(path);
    Files.createDirectories(target.getParent());
    // CREATE_NEW: every event owns a fresh path.
    Files.write(target, payload, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
  }

  @Override
  public String kind() {
    return "file";
  }

  Path root() {
    return root;
  }

  private Path resolve(String path) throws IOException {
    Objects.requireNonNull(path, "path");
    Path target = root.resolve(path).normalize();
    if (!target.startsWith(root) || target.equals(root)) {
      throw new IOException("Event path escapes store root: " + path);
    }
    return target;
  }
}
