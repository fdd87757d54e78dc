package dungeom.graph;

import java.util.List;
import java.util.Set;

/**
 * Starts at the source of the first edge.
 *
 * Together with EdgeShuffler this starts the tour at the first kmer of the
 * input sequence. A selector based on unbalanced in/out degree could
 * replace this one for graphs whose start isn't known.
 */
public class PinnedFirstEdgeStart implements StartSelector {
  @Override
  public String selectStart(List<KMerEdge> shuffledEdges, Set<String> nodes) {
    if (shuffledEdges.isEmpty()) {
      throw new IllegalArgumentException(
          "Can't select a start node for a graph without edges.");
    }
    return shuffledEdges.get(0).source;
  }
}
