/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.patch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.cleanlearn.analysis.AnalysisContext;
import org.cleanlearn.analysis.AnalysisId;
import org.cleanlearn.analysis.CleaningMethod;
import org.cleanlearn.analysis.ErrorType;
import org.cleanlearn.analysis.ScoreNodeLine;
import org.cleanlearn.dag.OperatorNode;
import org.cleanlearn.dag.OperatorType;
import org.cleanlearn.dag.PipelineFixtures;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ScoreExtractionPatchBuilderTest {

  private final AnalysisId analysisId =
      new AnalysisId("age", ErrorType.OUTLIER, 40, List.of(CleaningMethod.FILTER));

  private final AnalysisContext context = new AnalysisContext();

  private final ScoreExtractionPatchBuilder builder = new ScoreExtractionPatchBuilder(context);

  @Test
  void should_build_one_extraction_per_score_operator() {
    OperatorNode f1 = PipelineFixtures.node(15, 43, OperatorType.SCORE, "f1", "array");
    List<ScoreNodeLine> scoreNodes =
        List.of(new ScoreNodeLine(PipelineFixtures.SCORE, 42), new ScoreNodeLine(f1, 43));

    List<Extraction> extractions =
        builder.buildExtractionPatches(analysisId, "original", scoreNodes);

    assertEquals(2, extractions.size());
    assertEquals("original_L42", extractions.get(0).getLabel());
    assertEquals(PipelineFixtures.SCORE, extractions.get(0).getExtractionNode());
    assertEquals("original_L43", extractions.get(1).getLabel());
    assertEquals(f1, extractions.get(1).getExtractionNode());
  }

  @Test
  void should_build_extractions_that_do_not_change_results() {
    Extraction extraction =
        builder
            .buildExtractionPatches(
                analysisId,
                "data-cleaning-age-filter",
                List.of(new ScoreNodeLine(PipelineFixtures.SCORE, 42)))
            .get(0);

    assertFalse(extraction.isChangesFollowingResults());
    assertEquals(analysisId, extraction.getAnalysisId());
    assertEquals(0L, extraction.getPatchId());
  }

  @Test
  void should_build_nothing_without_score_operators() {
    assertTrue(builder.buildExtractionPatches(analysisId, "original", List.of()).isEmpty());
    assertEquals(0L, context.getNextPatchId());
  }
}
