/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package kara.karac.frontend.dataflow;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Set;

import com.google.common.collect.SetMultimap;
import com.google.common.collect.TreeMultimap;

import kara.karac.common.exceptions.KaracRuntimeError;

/**
 * Producer to consumer edges over the statements of one block.  There is
 * an edge from A to B when B reads a name A binds, or when B shadows an
 * outer name that A reads.  Statements with no
 * path between them in either direction can be reordered or run in
 * parallel.
 *
 * Immutable once built.
 */
public class DependencyGraph {

  public static class NodePair {
    private final StatementNode first;
    private final StatementNode second;

    public NodePair(StatementNode first, StatementNode second) {
      this.first = first;
      this.second = second;
    }

    public StatementNode getFirst() {
      return first;
    }

    public StatementNode getSecond() {
      return second;
    }

    @Override
    public String toString() {
      return "(" + first.getIndex() + ", " + second.getIndex() + ")";
    }
  }

  private final String flowName;
  private final List<String> parameters;
  private final List<StatementNode> nodes;

  /** Edges by node index, kept sorted */
  private final SetMultimap<Integer, Integer> successors =
                                              TreeMultimap.create();
  private final SetMultimap<Integer, Integer> predecessors =
                                              TreeMultimap.create();

  DependencyGraph(String flowName, List<String> parameters,
                  List<StatementNode> nodes) {
    this.flowName = flowName;
    this.parameters = Collections.unmodifiableList(
                                      new ArrayList<String>(parameters));
    this.nodes = Collections.unmodifiableList(
                                      new ArrayList<StatementNode>(nodes));
  }

  void addEdge(int from, int to) {
    if (from >= to) {
      throw new KaracRuntimeError("Edge " + from + " -> " + to +
                    " in " + flowName + " goes against program order");
    }
    successors.put(from, to);
    predecessors.put(to, from);
  }

  public String getFlowName() {
    return flowName;
  }

  /**
   * Names the graph reads without binding them: parameters for the
   * body graph, or names from enclosing scopes for a branch.
   */
  public List<String> getParameters() {
    return parameters;
  }

  public List<StatementNode> getNodes() {
    return nodes;
  }

  public StatementNode getNode(int index) {
    return nodes.get(index);
  }

  public int size() {
    return nodes.size();
  }

  public int edgeCount() {
    return successors.size();
  }

  public List<StatementNode> successors(StatementNode node) {
    return toNodes(successors.get(node.getIndex()));
  }

  public List<StatementNode> predecessors(StatementNode node) {
    return toNodes(predecessors.get(node.getIndex()));
  }

  public boolean hasEdge(StatementNode from, StatementNode to) {
    return successors.containsEntry(from.getIndex(), to.getIndex());
  }

  /**
   * @return true if there is a directed path of at least one edge
   */
  public boolean hasPath(StatementNode from, StatementNode to) {
    Set<Integer> visited = new HashSet<Integer>();
    Deque<Integer> stack = new ArrayDeque<Integer>();
    stack.push(from.getIndex());
    while (!stack.isEmpty()) {
      int curr = stack.pop();
      for (int succ: successors.get(curr)) {
        if (succ == to.getIndex()) {
          return true;
        }
        if (visited.add(succ)) {
          stack.push(succ);
        }
      }
    }
    return false;
  }

  public boolean areIndependent(StatementNode a, StatementNode b) {
    return a.getIndex() != b.getIndex() && !hasPath(a, b) && !hasPath(b, a);
  }

  /**
   * @return every pair of independent nodes, lower index first
   */
  public List<NodePair> independentPairs() {
    List<NodePair> result = new ArrayList<NodePair>();
    for (int i = 0; i < nodes.size(); i++) {
      for (int j = i + 1; j < nodes.size(); j++) {
        if (areIndependent(nodes.get(i), nodes.get(j))) {
          result.add(new NodePair(nodes.get(i), nodes.get(j)));
        }
      }
    }
    return result;
  }

  /**
   * Order consistent with all edges.  Among ready nodes the lowest index
   * goes first, so the order is program order whenever that is valid.
   */
  public List<StatementNode> topologicalOrder() {
    int[] waiting = new int[nodes.size()];
    PriorityQueue<Integer> ready = new PriorityQueue<Integer>();
    for (int i = 0; i < nodes.size(); i++) {
      waiting[i] = predecessors.get(i).size();
      if (waiting[i] == 0) {
        ready.add(i);
      }
    }
    List<StatementNode> order = new ArrayList<StatementNode>(nodes.size());
    while (!ready.isEmpty()) {
      int curr = ready.poll();
      order.add(nodes.get(curr));
      for (int succ: successors.get(curr)) {
        waiting[succ]--;
        if (waiting[succ] == 0) {
          ready.add(succ);
        }
      }
    }
    if (order.size() != nodes.size()) {
      List<Integer> cycle = new ArrayList<Integer>();
      for (int i = 0; i < nodes.size(); i++) {
        if (waiting[i] > 0) {
          cycle.add(i);
        }
      }
      throw new KaracRuntimeError("Circular dependency in " + flowName +
                                  ": " + cycle);
    }
    return order;
  }

  private List<StatementNode> toNodes(Set<Integer> indices) {
    List<StatementNode> result = new ArrayList<StatementNode>(indices.size());
    for (int i: indices) {
      result.add(nodes.get(i));
    }
    return result;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    dump(sb, 0);
    return sb.toString();
  }

  private void dump(StringBuilder sb, int indent) {
    String pad = indentation(indent);
    sb.append(pad).append("graph ").append(flowName)
      .append(parameters).append('\n');
    for (StatementNode node: nodes) {
      sb.append(pad).append("  ").append(node);
      if (!successors.get(node.getIndex()).isEmpty()) {
        sb.append(" -> ").append(successors.get(node.getIndex()));
      }
      sb.append('\n');
      for (DependencyGraph branch: node.getNested()) {
        branch.dump(sb, indent + 2);
      }
    }
  }

  private static String indentation(int n) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < n; i++) {
      sb.append("  ");
    }
    return sb.toString();
  }
}
