/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.patch;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.cleanlearn.analysis.AnalysisId;
import org.cleanlearn.dag.OperatorNode;

/**
 * Captures the output of a node into the results mapping under {@code label}. Does not change the
 * pipeline.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class Extraction extends PipelinePatch {

  private final OperatorNode extractionNode;
  private final String label;

  public Extraction(
      long patchId, AnalysisId analysisId, OperatorNode extractionNode, String label) {
    super(patchId, analysisId, false);
    this.extractionNode = extractionNode;
    this.label = label;
  }

  @Override
  public <R, C> R accept(PatchVisitor<R, C> visitor, C context) {
    return visitor.visitExtraction(this, context);
  }
}
