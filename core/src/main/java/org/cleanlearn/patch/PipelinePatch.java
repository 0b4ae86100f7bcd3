/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.patch;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.cleanlearn.analysis.AnalysisId;

/**
 * A modification of the recorded pipeline, applied by the execution engine before it re-runs a
 * plan variant. Patches never touch the recorded graph; they only reference its nodes and bring
 * their own synthetic ones.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract sealed class PipelinePatch permits DataFiltering, DataProjection, Extraction {

  private final long patchId;
  private final AnalysisId analysisId;

  /** Whether applying the patch changes the results of the operators that follow it. */
  private final boolean changesFollowingResults;

  protected PipelinePatch(long patchId, AnalysisId analysisId, boolean changesFollowingResults) {
    this.patchId = patchId;
    this.analysisId = analysisId;
    this.changesFollowingResults = changesFollowingResults;
  }

  /**
   * Accept the PatchVisitor.
   *
   * @param visitor visitor
   * @param context visitor context
   * @param <R> returned object type
   * @param <C> context type
   * @return returned object
   */
  public abstract <R, C> R accept(PatchVisitor<R, C> visitor, C context);
}
