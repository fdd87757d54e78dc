package dungeom.assembly;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import dungeom.graph.DeBruijnGraph;
import dungeom.graph.KMerEdge;

/**
 * The outcome of a successful assembly along with the intermediate data
 * of the attempt which succeeded.
 */
public class AssemblyResult {
  private final String original;
  private final DeBruijnGraph graph;
  private final List<KMerEdge> shuffledEdges;
  private final Map<String, Integer> frequencies;
  private final List<String> tour;
  private final String assembled;
  private final Verdict verdict;
  private final int attempts;

  public AssemblyResult(
      String original, DeBruijnGraph graph, List<KMerEdge> shuffledEdges,
      Map<String, Integer> frequencies, List<String> tour, String assembled,
      Verdict verdict, int attempts) {
    this.original = original;
    this.graph = graph;
    this.shuffledEdges = Collections.unmodifiableList(shuffledEdges);
    this.frequencies = frequencies;
    this.tour = tour;
    this.assembled = assembled;
    this.verdict = verdict;
    this.attempts = attempts;
  }

  public String getOriginal() {
    return original;
  }

  public DeBruijnGraph getGraph() {
    return graph;
  }

  /**
   * The edges in the order the successful attempt explored them.
   */
  public List<KMerEdge> getShuffledEdges() {
    return shuffledEdges;
  }

  /**
   * Occurrence counts computed from the full shuffled edge list.
   */
  public Map<String, Integer> getFrequencies() {
    return frequencies;
  }

  public List<String> getTour() {
    return tour;
  }

  public String getAssembled() {
    return assembled;
  }

  public Verdict getVerdict() {
    return verdict;
  }

  public boolean isIdentical() {
    return verdict == Verdict.IDENTICAL;
  }

  /**
   * Number of traversals, including the successful one.
   */
  public int getAttempts() {
    return attempts;
  }

  /**
   * Render the graph, the frequencies and the tour as text.
   */
  public String formatDiagnostics() {
    ArrayList<String> nodes = new ArrayList<String>(graph.getNodes());
    Collections.sort(nodes);

    StringBuilder builder = new StringBuilder();
    builder.append("Nodes: ").append(StringUtils.join(nodes, ", "));
    builder.append("\n");
    builder.append("Edges: ").append(StringUtils.join(graph.getEdges(), ", "));
    builder.append("\n");
    builder.append("Shuffled edges: ")
        .append(StringUtils.join(shuffledEdges, ", "));
    builder.append("\n");

    ArrayList<String> counts = new ArrayList<String>();
    for (String node : nodes) {
      counts.add(node + "=" + frequencies.get(node));
    }
    builder.append("Frequencies: ").append(StringUtils.join(counts, ", "));
    builder.append("\n");
    builder.append("Tour: ").append(StringUtils.join(tour, " -> "));
    builder.append("\n");
    builder.append("Attempts: ").append(attempts);
    return builder.toString();
  }
}
