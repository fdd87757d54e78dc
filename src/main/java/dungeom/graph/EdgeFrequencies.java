/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dungeom.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Counts how often each node occurs in a list of edges.
 *
 * A node is counted once for every edge in which it is the source and once
 * for every edge in which it is the destination; a self loop therefore
 * counts twice. The counts aren't the residual out degree of a node. They
 * are only used to tell whether any edge is left: the sum of the counts is
 * zero if and only if the edge list is empty.
 */
public class EdgeFrequencies {
  private EdgeFrequencies() {
  }

  /**
   * Compute the occurrence count for every node.
   *
   * @param edges: The edges to count.
   * @param nodes: The nodes of the graph. Nodes which don't appear in
   *   any edge map to 0.
   * @return An unmodifiable map from node to count.
   */
  public static Map<String, Integer> compute(
      List<KMerEdge> edges, Set<String> nodes) {
    LinkedHashMap<String, Integer> counts =
        new LinkedHashMap<String, Integer>();
    for (String node : nodes) {
      counts.put(node, 0);
    }
    for (KMerEdge edge : edges) {
      increment(counts, edge.source);
      increment(counts, edge.dest);
    }
    return Collections.unmodifiableMap(counts);
  }

  /**
   * Total of all the counts.
   */
  public static int sum(Map<String, Integer> counts) {
    return sum(counts.values());
  }

  private static int sum(Collection<Integer> values) {
    int total = 0;
    for (Integer value : values) {
      total += value;
    }
    return total;
  }

  private static void increment(Map<String, Integer> counts, String node) {
    Integer count = counts.get(node);
    counts.put(node, count == null ? 1 : count + 1);
  }

  /**
   * Create a residual counter initialized from the counts.
   */
  public static Residual residualOf(Map<String, Integer> counts) {
    return new Residual(counts);
  }

  /**
   * A mutable copy of the counts which the traversal decrements as it
   * consumes edges. Each attempt owns its own copy.
   */
  public static class Residual {
    private final HashMap<String, Integer> remaining;
    private int total;

    private Residual(Map<String, Integer> counts) {
      remaining = new HashMap<String, Integer>(counts);
      total = EdgeFrequencies.sum(counts.values());
    }

    /**
     * Record that the edge has been used.
     */
    public void consume(KMerEdge edge) {
      decrement(edge.source);
      decrement(edge.dest);
    }

    private void decrement(String node) {
      Integer count = remaining.get(node);
      if (count == null || count <= 0) {
        throw new IllegalStateException(
            "Node " + node + " has no remaining occurrences to consume.");
      }
      remaining.put(node, count - 1);
      --total;
    }

    public int get(String node) {
      Integer count = remaining.get(node);
      return count == null ? 0 : count;
    }

    /**
     * Sum of the remaining counts.
     */
    public int total() {
      return total;
    }
  }
}
