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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

/**
 * Walks the graph consuming every edge it can reach from a start node.
 *
 * This is Hierholzer's algorithm. From the current node we always take the
 * first unused outgoing edge in the order of the edge list we were given.
 * When a node has no unused outgoing edges left it is prepended to the tour.
 * If the graph has an Eulerian trail starting at the start node the result
 * uses every edge exactly once; otherwise some edges are left over and the
 * residual counts of the attempt are non zero.
 *
 * The walk uses an explicit stack so the depth isn't limited by the call
 * stack. The edge list passed in is never modified; each call drains its
 * own per node queues of outgoing edges.
 */
public class EulerianTourFinder {
  private static final Logger sLogger =
      Logger.getLogger(EulerianTourFinder.class);

  /**
   * Run one traversal.
   *
   * @param edges: The edges in the order they should be explored.
   * @param start: The node to start at.
   * @param frequencies: Occurrence counts of the nodes in edges. A
   *   residual copy is decremented as edges are consumed.
   * @return The attempt.
   */
  public TraversalAttempt findTour(
      List<KMerEdge> edges, String start, Map<String, Integer> frequencies) {
    Map<String, ArrayDeque<KMerEdge>> outgoing = buildOutgoingQueues(edges);
    EdgeFrequencies.Residual residual =
        EdgeFrequencies.residualOf(frequencies);

    LinkedList<String> tour = new LinkedList<String>();
    ArrayDeque<String> stack = new ArrayDeque<String>();
    stack.push(start);
    int consumed = 0;

    while (!stack.isEmpty()) {
      String current = stack.peek();
      ArrayDeque<KMerEdge> queue = outgoing.get(current);
      if (queue != null && !queue.isEmpty()) {
        KMerEdge edge = queue.poll();
        residual.consume(edge);
        ++consumed;
        stack.push(edge.dest);
      } else {
        tour.addFirst(stack.pop());
      }
    }

    if (sLogger.isDebugEnabled()) {
      sLogger.debug(String.format(
          "Tour from %s consumed %d of %d edges.", start, consumed,
          edges.size()));
    }
    return new TraversalAttempt(
        new ArrayList<String>(tour), consumed, edges.size(), residual);
  }

  /**
   * Group the edges by source keeping the relative order of the list.
   */
  protected Map<String, ArrayDeque<KMerEdge>> buildOutgoingQueues(
      List<KMerEdge> edges) {
    HashMap<String, ArrayDeque<KMerEdge>> outgoing =
        new HashMap<String, ArrayDeque<KMerEdge>>();
    for (KMerEdge edge : edges) {
      ArrayDeque<KMerEdge> queue = outgoing.get(edge.source);
      if (queue == null) {
        queue = new ArrayDeque<KMerEdge>();
        outgoing.put(edge.source, queue);
      }
      queue.add(edge);
    }
    return outgoing;
  }
}
