/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.analysis;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.cleanlearn.analysis.exception.AmbiguousScoreNodeIdentityException;
import org.cleanlearn.analysis.exception.MultiplePredictNodesException;
import org.cleanlearn.analysis.exception.UnsupportedErrorKindException;
import org.cleanlearn.dag.DagQueries;
import org.cleanlearn.dag.OperatorNode;
import org.cleanlearn.dag.OperatorType;
import org.cleanlearn.dag.PipelineGraph;

/** Checks that a pipeline graph and a cleaning spec can be turned into plans. */
public class PlanValidator {

  /**
   * Validates the graph and the cleaning spec.
   *
   * @return the score operators of the graph with their source lines, in recorded order
   * @throws MultiplePredictNodesException if the graph does not have exactly one predict operator
   * @throws AmbiguousScoreNodeIdentityException if two score operators share a source line or one
   *     has none
   * @throws UnsupportedErrorKindException if the error kind is not {@link ErrorType#OUTLIER}
   */
  public List<ScoreNodeLine> validate(PipelineGraph graph, CleaningSpec spec) {
    int predictCount = DagQueries.findNodesByType(graph, OperatorType.PREDICT).size();
    if (predictCount != 1) {
      throw new MultiplePredictNodesException(
          String.format(
              "The data cleaning analysis only supports pipelines with exactly one predict"
                  + " operator, found %d",
              predictCount));
    }
    List<ScoreNodeLine> scoreNodeLines = findScoreNodeLines(graph);
    Map<Integer, ScoreNodeLine> byLine = new HashMap<>();
    for (ScoreNodeLine scoreNodeLine : scoreNodeLines) {
      ScoreNodeLine previous = byLine.putIfAbsent(scoreNodeLine.getLineNumber(), scoreNodeLine);
      if (previous != null) {
        throw new AmbiguousScoreNodeIdentityException(
            String.format(
                "Score operators '%s' and '%s' are both on line %d, their results cannot be told"
                    + " apart",
                previous.getDescription(),
                scoreNodeLine.getDescription(),
                scoreNodeLine.getLineNumber()));
      }
    }
    if (spec.getErrorType() != ErrorType.OUTLIER) {
      throw new UnsupportedErrorKindException(
          "The data cleaning analysis only supports the error kind "
              + ErrorType.OUTLIER.getValue()
              + ", got "
              + spec.getErrorType());
    }
    return scoreNodeLines;
  }

  /**
   * Returns the score operators of the graph with their source lines, in recorded order.
   *
   * @throws AmbiguousScoreNodeIdentityException if a score operator has no source line
   */
  public static List<ScoreNodeLine> findScoreNodeLines(PipelineGraph graph) {
    List<ScoreNodeLine> scoreNodeLines = new ArrayList<>();
    for (OperatorNode node : DagQueries.findNodesByType(graph, OperatorType.SCORE)) {
      int lineNumber =
          node.getCodeLocation()
              .getLineNumber()
              .orElseThrow(
                  () ->
                      new AmbiguousScoreNodeIdentityException(
                          "Score operator '" + node.getDescription() + "' has no source line"));
      scoreNodeLines.add(new ScoreNodeLine(node, lineNumber));
    }
    return scoreNodeLines;
  }
}
