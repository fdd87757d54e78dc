package dungeom.graph;

import java.util.List;
import java.util.Set;

/**
 * Chooses the node at which the traversal starts.
 */
public interface StartSelector {
  /**
   * @param shuffledEdges: The edges in the order they will be explored.
   * @param nodes: The nodes of the graph.
   * @return The kmer to start the tour at.
   */
  String selectStart(List<KMerEdge> shuffledEdges, Set<String> nodes);
}
