package dungeom.graph;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import org.junit.Test;

public class TestEdgeFrequencies {
  @Test
  public void testCompute() {
    DeBruijnGraph graph = new DeBruijnGraphBuilder().build("ATCGATCCCTGA", 3);
    Map<String, Integer> counts =
        EdgeFrequencies.compute(graph.getEdges(), graph.getNodes());

    assertEquals(graph.getNodes(), counts.keySet());
    // ATC is the source of two edges and the destination of one.
    assertEquals(3, (int) counts.get("ATC"));
    assertEquals(2, (int) counts.get("TCG"));
    // The last kmer only has an incoming edge.
    assertEquals(1, (int) counts.get("TGA"));
    assertEquals(2 * graph.numEdges(), EdgeFrequencies.sum(counts));
  }

  @Test
  public void testSelfLoopCountsTwice() {
    DeBruijnGraph graph = new DeBruijnGraphBuilder().build("AAAA", 2);
    Map<String, Integer> counts =
        EdgeFrequencies.compute(graph.getEdges(), graph.getNodes());
    assertEquals(4, (int) counts.get("AA"));
  }

  @Test
  public void testNodesWithoutEdges() {
    List<KMerEdge> edges = new ArrayList<KMerEdge>();
    Map<String, Integer> counts = EdgeFrequencies.compute(
        edges, new HashSet<String>(Arrays.asList("ACG", "CGT")));
    assertEquals(0, (int) counts.get("ACG"));
    assertEquals(0, (int) counts.get("CGT"));
    assertEquals(0, EdgeFrequencies.sum(counts));
  }

  @Test
  public void testResidual() {
    DeBruijnGraph graph = new DeBruijnGraphBuilder().build("ACGTA", 2);
    Map<String, Integer> counts =
        EdgeFrequencies.compute(graph.getEdges(), graph.getNodes());
    EdgeFrequencies.Residual residual = EdgeFrequencies.residualOf(counts);

    assertEquals(6, residual.total());
    for (KMerEdge edge : graph.getEdges()) {
      residual.consume(edge);
    }
    assertEquals(0, residual.total());
    assertEquals(0, residual.get("CG"));

    // The counts the residual was created from are untouched.
    assertEquals(6, EdgeFrequencies.sum(counts));

    try {
      residual.consume(graph.getEdges().get(0));
      fail("Consuming more edges than exist should fail.");
    } catch (IllegalStateException e) {
      // Expected.
    }
  }
}
