/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.patch;

import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.cleanlearn.analysis.AnalysisContext;
import org.cleanlearn.analysis.AnalysisId;
import org.cleanlearn.analysis.Labels;
import org.cleanlearn.analysis.ScoreNodeLine;

/** Extracts the output of each score operator, right after it ran. */
@RequiredArgsConstructor
public class ScoreExtractionPatchBuilder implements ExtractionPatchBuilder {

  private final AnalysisContext context;

  @Override
  public List<Extraction> buildExtractionPatches(
      AnalysisId analysisId, String labelPrefix, List<ScoreNodeLine> scoreNodes) {
    return scoreNodes.stream()
        .map(
            scoreNode ->
                new Extraction(
                    context.getNextPatchId(),
                    analysisId,
                    scoreNode.getNode(),
                    Labels.forLine(labelPrefix, scoreNode.getLineNumber())))
        .collect(Collectors.toList());
  }
}
