package dungeom.assembly;

/**
 * Thrown when no attempt managed to consume every edge of the graph before
 * the retry budget ran out.
 */
public class NoEulerianTrailException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final int attempts;
  private final boolean deadlineExceeded;

  public NoEulerianTrailException(
      String message, int attempts, boolean deadlineExceeded) {
    super(message);
    this.attempts = attempts;
    this.deadlineExceeded = deadlineExceeded;
  }

  /**
   * Number of traversals which were tried.
   */
  public int getAttempts() {
    return attempts;
  }

  /**
   * True if we stopped because of the deadline rather than the attempt
   * limit.
   */
  public boolean isDeadlineExceeded() {
    return deadlineExceeded;
  }
}
