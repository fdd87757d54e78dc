package dungeom.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A de Bruijn graph built from a single sequence.
 *
 * The edges are kept in the order they were emitted while sliding the
 * window over the sequence. Both views returned by this class are
 * unmodifiable; code which needs to reorder or consume edges must make its
 * own copy.
 */
public class DeBruijnGraph {
  private final int K;
  private final Set<String> nodes;
  private final List<KMerEdge> edges;

  public DeBruijnGraph(int K, Set<String> nodes, List<KMerEdge> edges) {
    this.K = K;
    this.nodes = Collections.unmodifiableSet(
        new LinkedHashSet<String>(nodes));
    this.edges = Collections.unmodifiableList(
        new ArrayList<KMerEdge>(edges));
  }

  public int getK() {
    return K;
  }

  /**
   * The unique kmers in the graph.
   */
  public Set<String> getNodes() {
    return nodes;
  }

  /**
   * The edges in emission order.
   */
  public List<KMerEdge> getEdges() {
    return edges;
  }

  public int numEdges() {
    return edges.size();
  }

  public int numNodes() {
    return nodes.size();
  }
}
