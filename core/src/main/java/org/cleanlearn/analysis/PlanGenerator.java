/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.analysis;

import java.util.ArrayList;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.cleanlearn.analysis.exception.UnknownCleaningMethodException;
import org.cleanlearn.config.AnalysisSettings;
import org.cleanlearn.dag.PipelineGraph;
import org.cleanlearn.patch.ExtractionPatchBuilder;
import org.cleanlearn.patch.PipelinePatch;
import org.cleanlearn.patch.PlanExplainer;
import org.cleanlearn.patch.PlanVariant;
import org.cleanlearn.patch.ScoreExtractionPatchBuilder;

/**
 * Generates one plan variant per requested cleaning method. Each variant extracts every score
 * operator under the method's label prefix and ends with the cleaning intervention.
 *
 * <p>Generation is all or nothing: a failing check or an unknown cleaning method propagates and no
 * variant is returned. The recorded graph is never modified.
 */
@Log4j2
public class PlanGenerator {

  private final PlanValidator validator;
  private final InterventionBuilder interventionBuilder;
  private final ExtractionPatchBuilder extractionPatchBuilder;
  private final PlanExplainer explainer = new PlanExplainer();

  public PlanGenerator(
      PlanValidator validator,
      InterventionBuilder interventionBuilder,
      ExtractionPatchBuilder extractionPatchBuilder) {
    this.validator = validator;
    this.interventionBuilder = interventionBuilder;
    this.extractionPatchBuilder = extractionPatchBuilder;
  }

  /** Wires the default collaborators on top of a shared context. */
  public PlanGenerator(AnalysisContext context, AnalysisSettings settings) {
    this(
        new PlanValidator(),
        new InterventionBuilder(context, settings),
        new ScoreExtractionPatchBuilder(context));
  }

  /**
   * Generates the plan variants.
   *
   * @param graph the recorded pipeline
   * @param spec the cleaning spec
   * @return one variant per entry of {@link CleaningSpec#getCleanings()}, in the same order
   */
  public List<PlanVariant> generatePlans(PipelineGraph graph, CleaningSpec spec) {
    List<ScoreNodeLine> scoreNodeLines = validator.validate(graph, spec);
    AnalysisId analysisId = spec.getAnalysisId();

    List<PlanVariant> variants = new ArrayList<>();
    for (CleaningMethod method : spec.getCleanings()) {
      if (method == null) {
        throw new UnknownCleaningMethodException("Unknown cleaning: null");
      }
      String labelPrefix = Labels.cleaningPrefix(spec.getColumn(), method);
      List<PipelinePatch> patches =
          new ArrayList<>(
              extractionPatchBuilder.buildExtractionPatches(
                  analysisId, labelPrefix, scoreNodeLines));
      patches.add(interventionBuilder.build(graph, spec, method));
      PlanVariant variant = new PlanVariant(method, patches);
      variants.add(variant);

      log.info("Generated plan variant {} with {} patches", labelPrefix, patches.size());
      if (log.isDebugEnabled()) {
        explainer.explain(variant).forEach(line -> log.debug("  {}", line));
      }
    }
    return variants;
  }
}
