package dungeom.graph;

import java.util.Collections;
import java.util.List;

/**
 * The outcome of a single traversal of the graph.
 */
public class TraversalAttempt {
  private final List<String> tour;
  private final int consumedEdges;
  private final int totalEdges;
  private final EdgeFrequencies.Residual residual;

  public TraversalAttempt(
      List<String> tour, int consumedEdges, int totalEdges,
      EdgeFrequencies.Residual residual) {
    this.tour = Collections.unmodifiableList(tour);
    this.consumedEdges = consumedEdges;
    this.totalEdges = totalEdges;
    this.residual = residual;
  }

  /**
   * The nodes in the order they are visited. Contains consumedEdges + 1
   * nodes.
   */
  public List<String> getTour() {
    return tour;
  }

  public int getConsumedEdges() {
    return consumedEdges;
  }

  public int getTotalEdges() {
    return totalEdges;
  }

  public int getRemainingEdges() {
    return totalEdges - consumedEdges;
  }

  public EdgeFrequencies.Residual getResidual() {
    return residual;
  }
}
