/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.dag;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.experimental.UtilityClass;

/** Read-only queries over a {@link PipelineGraph}. */
@UtilityClass
public class DagQueries {

  /**
   * Finds all nodes of one operator type.
   *
   * @return the matching nodes in recorded order
   */
  public List<OperatorNode> findNodesByType(PipelineGraph graph, OperatorType operatorType) {
    return graph.nodes().stream()
        .filter(node -> node.getOperatorType() == operatorType)
        .collect(Collectors.toList());
  }

  /**
   * Returns the columns the model is trained on. These are the columns selected by the projections
   * that feed a feature transformer upstream of the training data; when the training data is built
   * without a transformer, the projections feeding it directly are used.
   */
  public Set<String> getColumnsUsedAsFeature(PipelineGraph graph) {
    Set<String> featureColumns = new LinkedHashSet<>();
    for (OperatorNode trainData : findNodesByType(graph, OperatorType.TRAIN_DATA)) {
      Set<OperatorNode> ancestors = graph.ancestors(trainData);
      List<OperatorNode> transformers =
          ancestors.stream()
              .filter(node -> node.getOperatorType() == OperatorType.TRANSFORMER)
              .collect(Collectors.toList());
      if (transformers.isEmpty()) {
        collectProjectedColumns(graph, trainData, featureColumns);
      } else {
        transformers.forEach(
            transformer -> collectProjectedColumns(graph, transformer, featureColumns));
      }
    }
    return featureColumns;
  }

  private void collectProjectedColumns(
      PipelineGraph graph, OperatorNode consumer, Set<String> featureColumns) {
    graph.predecessors(consumer).stream()
        .filter(node -> node.getOperatorType() == OperatorType.PROJECTION)
        .forEach(projection -> featureColumns.addAll(projection.getColumns()));
  }
}
