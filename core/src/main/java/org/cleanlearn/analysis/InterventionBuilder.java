/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.cleanlearn.analysis.exception.UnknownCleaningMethodException;
import org.cleanlearn.config.AnalysisSettings;
import org.cleanlearn.dag.CodeLocation;
import org.cleanlearn.dag.DagQueries;
import org.cleanlearn.dag.OperatorNode;
import org.cleanlearn.dag.OperatorType;
import org.cleanlearn.dag.PipelineGraph;
import org.cleanlearn.data.transform.DropOutliers;
import org.cleanlearn.data.transform.ImputeOutliers;
import org.cleanlearn.data.transform.PageTransform;
import org.cleanlearn.patch.DataFiltering;
import org.cleanlearn.patch.DataProjection;
import org.cleanlearn.patch.PipelinePatch;

/**
 * Builds the synthetic cleaning operator for one cleaning method and the patch that splices it
 * into the pipeline. Node and patch ids come from the shared {@link AnalysisContext}.
 */
@Log4j2
@RequiredArgsConstructor
public class InterventionBuilder {

  private final AnalysisContext context;
  private final AnalysisSettings settings;

  /**
   * Builds the intervention patch for one cleaning method.
   *
   * @param graph the recorded pipeline, read only
   * @param spec the cleaning spec
   * @param method the cleaning method
   * @return a {@link DataFiltering} for {@link CleaningMethod#FILTER}, a {@link DataProjection}
   *     for {@link CleaningMethod#IMPUTE}
   * @throws UnknownCleaningMethodException if the method is missing
   */
  public PipelinePatch build(PipelineGraph graph, CleaningSpec spec, CleaningMethod method) {
    if (method == null) {
      throw new UnknownCleaningMethodException("Unknown cleaning: null");
    }
    return switch (method) {
      case FILTER -> buildFilter(graph, spec);
      case IMPUTE -> buildImpute(spec);
    };
  }

  private DataFiltering buildFilter(PipelineGraph graph, CleaningSpec spec) {
    String column = spec.getColumn();
    Set<String> featureColumns = DagQueries.getColumnsUsedAsFeature(graph);
    // A feature column is filtered together with all other feature columns.
    List<String> requiredColumns =
        featureColumns.contains(column) ? new ArrayList<>(featureColumns) : List.of(column);
    OperatorNode filterNode =
        cleaningNode(
            spec,
            CleaningMethod.FILTER,
            OperatorType.SELECTION,
            requiredColumns,
            new DropOutliers(column, spec.getOutlierPredicate()));
    log.debug("Filter on {} requires columns {}", column, requiredColumns);
    return new DataFiltering(
        context.getNextPatchId(),
        spec.getAnalysisId(),
        true,
        filterNode,
        settings.getFilterScope(),
        requiredColumns);
  }

  private DataProjection buildImpute(CleaningSpec spec) {
    String column = spec.getColumn();
    OperatorNode projectionNode =
        cleaningNode(
            spec,
            CleaningMethod.IMPUTE,
            OperatorType.PROJECTION_MODIFY,
            List.of(column),
            new ImputeOutliers(column, spec.getImputeConstant(), spec.getOutlierPredicate()));
    return new DataProjection(
        context.getNextPatchId(),
        spec.getAnalysisId(),
        true,
        projectionNode,
        settings.getImputeScope(),
        List.of(column),
        List.of(column));
  }

  private OperatorNode cleaningNode(
      CleaningSpec spec,
      CleaningMethod method,
      OperatorType operatorType,
      List<String> columns,
      PageTransform transform) {
    return new OperatorNode(
        context.getNextOpId(),
        CodeLocation.synthetic(settings.getCleaningCodeReference()),
        operatorType,
        "Clean " + spec.getColumn() + ": " + method.getValue(),
        columns,
        transform);
  }
}
