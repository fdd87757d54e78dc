package dungeom.graph;

/**
 * A tour is complete once the residual occurrence counts sum to zero,
 * i.e. every edge was consumed.
 */
public class ZeroResidualCheck implements CompletionCheck {
  @Override
  public boolean isComplete(TraversalAttempt attempt) {
    return attempt.getResidual().total() == 0;
  }
}
