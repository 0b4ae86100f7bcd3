/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.patch;

import java.util.List;
import org.cleanlearn.analysis.AnalysisId;
import org.cleanlearn.analysis.ScoreNodeLine;

/** Builds the patches that capture score results of a plan variant into the results mapping. */
public interface ExtractionPatchBuilder {

  /**
   * Builds one extraction per score operator.
   *
   * @param analysisId the analysis the patches belong to
   * @param labelPrefix the prefix of every label; each label is {@code {labelPrefix}_L{line}}
   * @param scoreNodes the score operators and their source lines
   * @return one extraction per score operator, in the given order
   */
  List<Extraction> buildExtractionPatches(
      AnalysisId analysisId, String labelPrefix, List<ScoreNodeLine> scoreNodes);
}
