/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import java.util.List;
import org.cleanlearn.analysis.DataCleaningAnalysis.Status;
import org.cleanlearn.analysis.exception.AmbiguousScoreNodeIdentityException;
import org.cleanlearn.analysis.exception.MissingExtractedResultException;
import org.cleanlearn.analysis.exception.MultiplePredictNodesException;
import org.cleanlearn.config.AnalysisSettings;
import org.cleanlearn.dag.OperatorNode;
import org.cleanlearn.dag.OperatorType;
import org.cleanlearn.dag.PipelineFixtures;
import org.cleanlearn.dag.PipelineGraph;
import org.cleanlearn.data.transform.RangeOutlierPredicate;
import org.cleanlearn.patch.PlanVariant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class DataCleaningAnalysisTest {

  private final CleaningSpec spec =
      new CleaningSpec(
          "age",
          ErrorType.OUTLIER,
          List.of(CleaningMethod.FILTER, CleaningMethod.IMPUTE),
          new RangeOutlierPredicate(0, 120),
          40);

  @Mock private PlanGenerator planGenerator;

  private PipelineGraph graph;

  private AnalysisContext context;

  private DataCleaningAnalysis analysis;

  @BeforeEach
  void setUp() {
    graph = PipelineFixtures.incomePipeline();
    context = AnalysisContext.forGraph(graph);
    analysis = new DataCleaningAnalysis(spec, context, AnalysisSettings.defaults());
  }

  @Test
  void should_run_the_whole_lifecycle() {
    assertEquals(Status.CREATED, analysis.getStatus());

    List<PlanVariant> plans = analysis.generatePlansToTry(graph);
    assertEquals(2, plans.size());
    assertEquals(Status.PLANS_GENERATED, analysis.getStatus());

    context.putResult(Labels.original(42), 0.80);
    context.putResult(plans.get(0).getExtractions().get(0).getLabel(), 0.83);
    context.putResult(plans.get(1).getExtractions().get(0).getLabel(), 0.81);
    analysis.resultsAvailable();
    assertEquals(Status.RESULTS_AVAILABLE, analysis.getStatus());

    Report report = analysis.generateFinalReport();
    assertEquals(Status.REPORT_GENERATED, analysis.getStatus());
    assertEquals(List.of(0.80, 0.83, 0.81), report.getColumn("accuracy_L42"));
  }

  @Test
  void should_identify_itself_by_its_cleaning_spec() {
    AnalysisId analysisId = analysis.getAnalysisId();

    assertEquals("age", analysisId.getColumn());
    assertEquals(ErrorType.OUTLIER, analysisId.getErrorType());
    assertEquals(40, analysisId.getImputeConstant());
    assertEquals(List.of(CleaningMethod.FILTER, CleaningMethod.IMPUTE), analysisId.getCleanings());
  }

  @Test
  void should_not_build_a_report_before_results_are_available() {
    analysis.generatePlansToTry(graph);

    assertThrows(IllegalStateException.class, () -> analysis.generateFinalReport());
    assertEquals(Status.PLANS_GENERATED, analysis.getStatus());
  }

  @Test
  void should_not_accept_results_before_plans_are_generated() {
    assertThrows(IllegalStateException.class, () -> analysis.resultsAvailable());
  }

  @Test
  void should_not_generate_plans_twice() {
    analysis.generatePlansToTry(graph);

    assertThrows(IllegalStateException.class, () -> analysis.generatePlansToTry(graph));
  }

  @Test
  void should_fail_on_an_invalid_pipeline() {
    PipelineGraph invalid = PipelineGraph.builder().addNode(PipelineFixtures.SOURCE).build();

    assertThrows(MultiplePredictNodesException.class, () -> analysis.generatePlansToTry(invalid));
    assertEquals(Status.FAILED, analysis.getStatus());
    assertThrows(IllegalStateException.class, () -> analysis.generatePlansToTry(graph));
  }

  @Test
  void should_fail_when_two_score_operators_share_a_line() {
    OperatorNode f1 = PipelineFixtures.node(15, 42, OperatorType.SCORE, "f1", "array");
    PipelineGraph sharedLine =
        PipelineFixtures.incomePipelineBuilder().putEdge(PipelineFixtures.PREDICT, f1).build();

    assertThrows(
        AmbiguousScoreNodeIdentityException.class, () -> analysis.generatePlansToTry(sharedLine));
    assertEquals(Status.FAILED, analysis.getStatus());
  }

  @Test
  void should_fail_when_a_result_is_missing() {
    analysis.generatePlansToTry(graph);
    context.putResult(Labels.original(42), 0.80);
    analysis.resultsAvailable();

    assertThrows(MissingExtractedResultException.class, () -> analysis.generateFinalReport());
    assertEquals(Status.FAILED, analysis.getStatus());
  }

  @Test
  void should_fail_when_the_plan_generator_fails() {
    when(planGenerator.generatePlans(any(), any()))
        .thenThrow(new IllegalArgumentException("broken graph"));
    DataCleaningAnalysis mocked =
        new DataCleaningAnalysis(spec, context, planGenerator, new ResultAggregator());

    assertThrows(IllegalArgumentException.class, () -> mocked.generatePlansToTry(graph));
    assertEquals(Status.FAILED, mocked.getStatus());
  }
}
