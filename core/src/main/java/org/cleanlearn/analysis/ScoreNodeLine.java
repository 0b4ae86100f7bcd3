/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.analysis;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.cleanlearn.dag.OperatorNode;

/**
 * A score operator together with the source line it was called on. Extracted results are labelled
 * by the line alone, so a pipeline may have at most one score operator per line.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class ScoreNodeLine {

  private final OperatorNode node;
  private final int lineNumber;

  public String getDescription() {
    return node.getDescription();
  }

  public ScoreColumn toScoreColumn() {
    return new ScoreColumn(node.getDescription(), lineNumber);
  }
}
