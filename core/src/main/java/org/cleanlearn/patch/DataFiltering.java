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

/** Inserts a row filter into the train and/or test branch of the pipeline. */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class DataFiltering extends PipelinePatch {

  private final OperatorNode filterOperator;
  private final BranchScope scope;

  /** Columns that must still be present where the filter is inserted. */
  private final List<String> requiredColumns;

  public DataFiltering(
      long patchId,
      AnalysisId analysisId,
      boolean changesFollowingResults,
      OperatorNode filterOperator,
      BranchScope scope,
      List<String> requiredColumns) {
    super(patchId, analysisId, changesFollowingResults);
    this.filterOperator = filterOperator;
    this.scope = scope;
    this.requiredColumns = List.copyOf(requiredColumns);
  }

  public boolean isTrainApplicable() {
    return scope.isTrain();
  }

  public boolean isTestApplicable() {
    return scope.isTest();
  }

  @Override
  public <R, C> R accept(PatchVisitor<R, C> visitor, C context) {
    return visitor.visitDataFiltering(this, context);
  }
}
