package ca.gc.cra.dem.api;

/**
 * <strong>What:</strong> Process exit codes shared by every {@code dem} command.
 * <p><strong>Role:</strong> Returned by the CLI entry points and handed to {@link System#exit(int)} by
 * {@link Main}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** The command finished; a grid run that found no data also ends here. */
  SUCCESS(0),
  /** Arguments could not be parsed or a required key is missing. */
  INVALID_ARGS(2),
  /** An input could not be read or an output could not be written. */
  IO_ERROR(3),
  /** Settings parsed but were rejected while building the run. */
  CONFIG_ERROR(4),
  /** An interpolation engine or another collaborator failed. */
  RUNTIME_FAILURE(5),
  /** The run was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
