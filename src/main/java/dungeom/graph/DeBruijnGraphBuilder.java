package dungeom.graph;

import java.util.ArrayList;
import java.util.LinkedHashSet;

/**
 * Simple in memory graph builder.
 *
 * Divides a sequence into kmers and adds an edge between every pair of
 * consecutive kmers. The first edge emitted is the one starting at offset
 * zero; downstream code relies on that order to find the start of the
 * assembly.
 */
public class DeBruijnGraphBuilder {
  /**
   * Build the graph for the sequence.
   *
   * The caller is responsible for normalizing the sequence. K is checked
   * again here because a bad K silently yields an empty edge list.
   *
   * @param sequence: The sequence to decompose.
   * @param K: Length of the kmers.
   * @return The graph with length(sequence) - K edges.
   */
  public DeBruijnGraph build(String sequence, int K) {
    if (K <= 0 || K >= sequence.length()) {
      throw new IllegalArgumentException(String.format(
          "Kmer size must satisfy 0 < K < %d but K=%d.",
          sequence.length(), K));
    }

    ArrayList<KMerEdge> edges = new ArrayList<KMerEdge>();
    LinkedHashSet<String> nodes = new LinkedHashSet<String>();

    int start = 0;
    while (start + K < sequence.length()) {
      String src = sequence.substring(start, start + K);
      String dest = sequence.substring(start + 1, start + K + 1);
      addEdge(edges, nodes, src, dest, K - 1);
      start += 1;
    }
    return new DeBruijnGraph(K, nodes, edges);
  }

  private void addEdge(
      ArrayList<KMerEdge> edges, LinkedHashSet<String> nodes, String src,
      String dest, int overlap) {
    if (!src.substring(src.length() - overlap).equals(
        dest.substring(0, overlap))) {
      throw new RuntimeException("Sequences don't overlap by: " + overlap);
    }
    edges.add(new KMerEdge(src, dest));
    nodes.add(src);
    nodes.add(dest);
  }
}
