package ca.gc.cra.relay.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Optional;

/**
 * <strong>What:</strong> Filesystem validation utilities for the static file handler and its configuration.
 * <p><strong>Why:</strong> Request URIs are attacker controlled; files must only be served from inside the configured
 * base directory.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods; filesystem state may change between checks.</p>
 *
 * @implNote Resolution checks run on normalized paths and again on the real path, so symlinks cannot escape the base.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that {@code path} is an existing, readable directory.
   *
   * @param name logical name for diagnostics
   * @param path candidate directory
   * @return real path of the directory
   * @throws IllegalArgumentException if the directory is missing or unreadable
   */
  public static Path requireReadableDir(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    if (containsControl(raw)) {
      throw new IllegalArgumentException(name + " must not contain control characters");
    }
    try {
      Path real = path.toAbsolutePath().normalize().toRealPath();
      if (!Files.isDirectory(real)) {
        throw new IllegalArgumentException(name + " is not a directory: " + path);
      }
      if (!Files.isReadable(real)) {
        throw new IllegalArgumentException(name + " is not readable: " + path);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to access " + name + " " + path + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Resolves a relative request path under {@code base} and returns it only if it names a regular file inside it.
   *
   * @param base real path of the base directory
   * @param relative path taken from a request, without a leading slash
   * @return the real file path, or empty when the path escapes {@code base} or is not a readable regular file
   */
  public static Optional<Path> resolveRegularFile(Path base, String relative) {
    if (base == null || relative == null || relative.isEmpty() || containsControl(relative)) {
      return Optional.empty();
    }
    try {
      Path candidate = base.resolve(relative).normalize();
      if (!candidate.startsWith(base)) {
        return Optional.empty();
      }
      if (!Files.isRegularFile(candidate) || !Files.isReadable(candidate)) {
        return Optional.empty();
      }
      Path real = candidate.toRealPath();
      return real.startsWith(base.toRealPath(LinkOption.NOFOLLOW_LINKS)) ? Optional.of(real) : Optional.empty();
    } catch (InvalidPathException | IOException ex) {
      return Optional.empty();
    }
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
