/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.dag;

import com.google.common.base.Preconditions;
import com.google.common.graph.ElementOrder;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.Graphs;
import com.google.common.graph.ImmutableGraph;
import com.google.common.graph.MutableGraph;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable DAG of the operators recorded while a pipeline ran. Edges point from an operator to
 * the operators consuming its output. Nodes keep the order in which they were recorded.
 */
public class PipelineGraph {

  private final ImmutableGraph<OperatorNode> graph;

  private PipelineGraph(ImmutableGraph<OperatorNode> graph) {
    this.graph = graph;
  }

  /** Returns all nodes in recorded order. */
  public Set<OperatorNode> nodes() {
    return graph.nodes();
  }

  /** Returns the nodes whose output {@code node} consumes. */
  public Set<OperatorNode> predecessors(OperatorNode node) {
    return graph.predecessors(node);
  }

  /** Returns the nodes consuming the output of {@code node}. */
  public Set<OperatorNode> successors(OperatorNode node) {
    return graph.successors(node);
  }

  /** Returns every node {@code node} transitively depends on, excluding itself. */
  public Set<OperatorNode> ancestors(OperatorNode node) {
    return Graphs.reachableNodes(Graphs.transpose(graph), node).stream()
        .filter(ancestor -> !ancestor.equals(node))
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  /** Returns the largest node id in the graph, or -1 for an empty graph. */
  public long maxNodeId() {
    return graph.nodes().stream().mapToLong(OperatorNode::getNodeId).max().orElse(-1L);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Collects nodes and edges; {@link #build()} rejects cycles. */
  public static class Builder {

    private final MutableGraph<OperatorNode> graph =
        GraphBuilder.directed().allowsSelfLoops(false).nodeOrder(ElementOrder.insertion()).build();

    public Builder addNode(OperatorNode node) {
      graph.addNode(node);
      return this;
    }

    /** Adds the nodes in order, each one consuming the output of the previous one. */
    public Builder addChain(List<OperatorNode> nodes) {
      for (int i = 0; i < nodes.size(); i++) {
        addNode(nodes.get(i));
        if (i > 0) {
          putEdge(nodes.get(i - 1), nodes.get(i));
        }
      }
      return this;
    }

    public Builder putEdge(OperatorNode from, OperatorNode to) {
      graph.putEdge(from, to);
      return this;
    }

    public PipelineGraph build() {
      Preconditions.checkArgument(!Graphs.hasCycle(graph), "Pipeline graph must be acyclic");
      return new PipelineGraph(ImmutableGraph.copyOf(graph));
    }
  }
}
