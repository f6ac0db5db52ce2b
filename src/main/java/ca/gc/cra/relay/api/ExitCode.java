package ca.gc.cra.relay.api;

/**
 * <strong>What:</strong> Process exit codes returned by RELAY commands.
 * <p><strong>Why:</strong> Lets scripts and service managers tell bad arguments from bind failures or interrupts.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** The listener could not be bound or the config file could not be read. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to {@link System#exit(int)}.
   */
  public int code() {
    return code;
  }
}
