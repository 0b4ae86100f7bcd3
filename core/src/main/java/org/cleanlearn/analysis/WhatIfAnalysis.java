/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.analysis;

import java.util.List;
import org.cleanlearn.dag.PipelineGraph;
import org.cleanlearn.patch.PlanVariant;

/**
 * A question about a recorded pipeline that is answered by re-running patched variants of it.
 *
 * <p>Lifecycle: {@link #generatePlansToTry(PipelineGraph)}, then the execution engine runs every
 * variant and stores the extracted results, then {@link #resultsAvailable()}, then {@link
 * #generateFinalReport()}. Each step runs exactly once.
 */
public interface WhatIfAnalysis {

  /** Returns the identity of the question this analysis asks. */
  AnalysisId getAnalysisId();

  /** Generates the plan variants the execution engine has to run. */
  List<PlanVariant> generatePlansToTry(PipelineGraph graph);

  /** Signals that the results of every generated variant have been stored. */
  void resultsAvailable();

  /** Builds the final report from the stored results. */
  Report generateFinalReport();
}
