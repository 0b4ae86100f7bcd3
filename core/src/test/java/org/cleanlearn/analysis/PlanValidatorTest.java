/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.analysis;

import static org.cleanlearn.dag.PipelineFixtures.CONCAT;
import static org.cleanlearn.dag.PipelineFixtures.FIT;
import static org.cleanlearn.dag.PipelineFixtures.PREDICT;
import static org.cleanlearn.dag.PipelineFixtures.SCORE;
import static org.cleanlearn.dag.PipelineFixtures.TEST_DATA;
import static org.cleanlearn.dag.PipelineFixtures.node;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.cleanlearn.analysis.exception.AmbiguousScoreNodeIdentityException;
import org.cleanlearn.analysis.exception.MultiplePredictNodesException;
import org.cleanlearn.analysis.exception.UnsupportedErrorKindException;
import org.cleanlearn.dag.CodeLocation;
import org.cleanlearn.dag.OperatorNode;
import org.cleanlearn.dag.OperatorType;
import org.cleanlearn.dag.PipelineFixtures;
import org.cleanlearn.dag.PipelineGraph;
import org.cleanlearn.data.transform.RangeOutlierPredicate;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PlanValidatorTest {

  private final PlanValidator validator = new PlanValidator();

  private final CleaningSpec spec =
      new CleaningSpec(
          "age",
          ErrorType.OUTLIER,
          List.of(CleaningMethod.FILTER, CleaningMethod.IMPUTE),
          new RangeOutlierPredicate(0, 120),
          40);

  @Test
  void should_return_the_score_operators_of_a_valid_pipeline() {
    List<ScoreNodeLine> scoreNodeLines =
        validator.validate(PipelineFixtures.incomePipeline(), spec);

    assertEquals(1, scoreNodeLines.size());
    assertEquals(SCORE, scoreNodeLines.get(0).getNode());
    assertEquals(42, scoreNodeLines.get(0).getLineNumber());
    assertEquals(new ScoreColumn("accuracy", 42), scoreNodeLines.get(0).toScoreColumn());
  }

  @Test
  void should_reject_a_pipeline_with_two_predict_operators() {
    OperatorNode secondPredict = node(20, 50, OperatorType.PREDICT, "Decision Tree", "array");
    PipelineGraph graph =
        PipelineFixtures.incomePipelineBuilder()
            .putEdge(TEST_DATA, secondPredict)
            .putEdge(FIT, secondPredict)
            .build();

    MultiplePredictNodesException exception =
        assertThrows(MultiplePredictNodesException.class, () -> validator.validate(graph, spec));
    assertTrue(exception.getMessage().contains("found 2"));
  }

  @Test
  void should_reject_a_pipeline_without_predict_operator() {
    PipelineGraph graph =
        PipelineGraph.builder()
            .addChain(List.of(PipelineFixtures.SOURCE, PipelineFixtures.SPLIT, CONCAT))
            .build();

    assertThrows(MultiplePredictNodesException.class, () -> validator.validate(graph, spec));
  }

  @Test
  void should_reject_two_score_operators_with_the_same_description_and_line() {
    OperatorNode duplicate = node(21, 42, OperatorType.SCORE, "accuracy", "array");
    PipelineGraph graph =
        PipelineFixtures.incomePipelineBuilder().putEdge(PREDICT, duplicate).build();

    assertThrows(AmbiguousScoreNodeIdentityException.class, () -> validator.validate(graph, spec));
  }

  @Test
  void should_reject_two_different_score_operators_on_the_same_line() {
    OperatorNode f1 = node(21, 42, OperatorType.SCORE, "f1", "array");
    PipelineGraph graph = PipelineFixtures.incomePipelineBuilder().putEdge(PREDICT, f1).build();

    AmbiguousScoreNodeIdentityException exception =
        assertThrows(
            AmbiguousScoreNodeIdentityException.class, () -> validator.validate(graph, spec));
    assertTrue(exception.getMessage().contains("'accuracy' and 'f1' are both on line 42"));
  }

  @Test
  void should_accept_two_score_operators_on_different_lines() {
    OperatorNode f1 = node(21, 43, OperatorType.SCORE, "f1", "array");
    PipelineGraph graph = PipelineFixtures.incomePipelineBuilder().putEdge(PREDICT, f1).build();

    List<ScoreNodeLine> scoreNodeLines = validator.validate(graph, spec);

    assertEquals(2, scoreNodeLines.size());
    assertEquals(43, scoreNodeLines.get(1).getLineNumber());
  }

  @Test
  void should_reject_a_score_operator_without_source_line() {
    OperatorNode unplaced =
        new OperatorNode(
            22, new CodeLocation("income_pipeline.py", null), OperatorType.SCORE, "f1", null, null);
    PipelineGraph graph =
        PipelineFixtures.incomePipelineBuilder().putEdge(PREDICT, unplaced).build();

    assertThrows(AmbiguousScoreNodeIdentityException.class, () -> validator.validate(graph, spec));
  }

  @Test
  void should_reject_a_missing_error_kind() {
    CleaningSpec withoutError =
        new CleaningSpec(
            "age", null, List.of(CleaningMethod.FILTER), new RangeOutlierPredicate(0, 1), null);

    assertThrows(
        UnsupportedErrorKindException.class,
        () -> validator.validate(PipelineFixtures.incomePipeline(), withoutError));
  }

  @Test
  void should_check_predict_operators_before_the_error_kind() {
    CleaningSpec withoutError =
        new CleaningSpec(
            "age", null, List.of(CleaningMethod.FILTER), new RangeOutlierPredicate(0, 1), null);
    PipelineGraph graph = PipelineGraph.builder().addNode(PipelineFixtures.SOURCE).build();

    assertThrows(
        MultiplePredictNodesException.class, () -> validator.validate(graph, withoutError));
  }
}
