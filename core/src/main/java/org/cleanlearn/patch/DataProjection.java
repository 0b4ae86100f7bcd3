/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.patch;

import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.cleanlearn.analysis.AnalysisId;
import org.cleanlearn.dag.OperatorNode;

/** Inserts a value-rewriting projection into the train and/or test branch of the pipeline. */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class DataProjection extends PipelinePatch {

  private final OperatorNode projectionOperator;
  private final BranchScope scope;
  private final List<String> readColumns;
  private final List<String> writtenColumns;

  public DataProjection(
      long patchId,
      AnalysisId analysisId,
      boolean changesFollowingResults,
      OperatorNode projectionOperator,
      BranchScope scope,
      List<String> readColumns,
      List<String> writtenColumns) {
    super(patchId, analysisId, changesFollowingResults);
    this.projectionOperator = projectionOperator;
    this.scope = scope;
    this.readColumns = List.copyOf(readColumns);
    this.writtenColumns = List.copyOf(writtenColumns);
  }

  public boolean isTrainApplicable() {
    return scope.isTrain();
  }

  public boolean isTestApplicable() {
    return scope.isTest();
  }

  @Override
  public <R, C> R accept(PatchVisitor<R, C> visitor, C context) {
    return visitor.visitDataProjection(this, context);
  }
}
