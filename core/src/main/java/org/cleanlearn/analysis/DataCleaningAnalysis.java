/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.analysis;

import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.cleanlearn.config.AnalysisSettings;
import org.cleanlearn.dag.PipelineGraph;
import org.cleanlearn.patch.PlanVariant;

/**
 * What-if analysis: how would the quality metrics of a pipeline change if one column had been
 * cleaned of outliers before training?
 *
 * <p>The analysis moves through {@link Status#CREATED}, {@link Status#PLANS_GENERATED}, {@link
 * Status#RESULTS_AVAILABLE} and {@link Status#REPORT_GENERATED}, strictly in that order. A failure
 * moves it to {@link Status#FAILED}, which is final.
 */
@Log4j2
public class DataCleaningAnalysis implements WhatIfAnalysis {

  /** Analysis lifecycle status. */
  public enum Status {
    CREATED,
    PLANS_GENERATED,
    RESULTS_AVAILABLE,
    REPORT_GENERATED,
    FAILED
  }

  @Getter private final CleaningSpec spec;
  private final AnalysisContext context;
  private final PlanGenerator planGenerator;
  private final ResultAggregator resultAggregator;

  @Getter private volatile Status status;
  private List<ScoreColumn> scoreColumns;

  public DataCleaningAnalysis(
      CleaningSpec spec,
      AnalysisContext context,
      PlanGenerator planGenerator,
      ResultAggregator resultAggregator) {
    this.spec = spec;
    this.context = context;
    this.planGenerator = planGenerator;
    this.resultAggregator = resultAggregator;
    this.status = Status.CREATED;
  }

  public DataCleaningAnalysis(
      CleaningSpec spec, AnalysisContext context, AnalysisSettings settings) {
    this(spec, context, new PlanGenerator(context, settings), new ResultAggregator());
  }

  @Override
  public AnalysisId getAnalysisId() {
    return spec.getAnalysisId();
  }

  @Override
  public List<PlanVariant> generatePlansToTry(PipelineGraph graph) {
    checkStatus(Status.CREATED, "generate plans");
    try {
      List<PlanVariant> plans = planGenerator.generatePlans(graph, spec);
      scoreColumns =
          PlanValidator.findScoreNodeLines(graph).stream()
              .map(ScoreNodeLine::toScoreColumn)
              .collect(Collectors.toList());
      status = Status.PLANS_GENERATED;
      return plans;
    } catch (RuntimeException e) {
      fail(e);
      throw e;
    }
  }

  @Override
  public void resultsAvailable() {
    checkStatus(Status.PLANS_GENERATED, "accept results");
    status = Status.RESULTS_AVAILABLE;
  }

  @Override
  public Report generateFinalReport() {
    checkStatus(Status.RESULTS_AVAILABLE, "generate the report");
    try {
      Report report = resultAggregator.buildReport(scoreColumns, spec, context.getResults());
      status = Status.REPORT_GENERATED;
      return report;
    } catch (RuntimeException e) {
      fail(e);
      throw e;
    }
  }

  private void fail(RuntimeException e) {
    log.error("Data cleaning analysis {} failed: {}", getAnalysisId(), e.getMessage());
    status = Status.FAILED;
  }

  private void checkStatus(Status expected, String action) {
    if (status != expected) {
      throw new IllegalStateException(
          String.format("Cannot %s while the analysis is %s", action, status));
    }
  }
}
