package dungeom.graph;

/**
 * Decides whether a traversal attempt produced a complete tour.
 */
public interface CompletionCheck {
  boolean isComplete(TraversalAttempt attempt);
}
