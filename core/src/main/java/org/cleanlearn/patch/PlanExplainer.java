/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.patch;

import java.util.List;
import java.util.stream.Collectors;
import org.cleanlearn.dag.OperatorNode;

/** Renders a {@link PlanVariant} as one human-readable line per patch. */
public class PlanExplainer implements PatchVisitor<String, Void> {

  public List<String> explain(PlanVariant variant) {
    return variant.getPatches().stream()
        .map(patch -> patch.accept(this, null))
        .collect(Collectors.toList());
  }

  @Override
  public String visitDataFiltering(DataFiltering patch, Void context) {
    return String.format(
        "#%d filter [%s] %s, required columns %s",
        patch.getPatchId(),
        operator(patch.getFilterOperator()),
        branches(patch.getScope()),
        patch.getRequiredColumns());
  }

  @Override
  public String visitDataProjection(DataProjection patch, Void context) {
    return String.format(
        "#%d projection [%s] %s, reads %s, writes %s",
        patch.getPatchId(),
        operator(patch.getProjectionOperator()),
        branches(patch.getScope()),
        patch.getReadColumns(),
        patch.getWrittenColumns());
  }

  @Override
  public String visitExtraction(Extraction patch, Void context) {
    return String.format(
        "#%d extract [%s] as %s",
        patch.getPatchId(), operator(patch.getExtractionNode()), patch.getLabel());
  }

  private static String operator(OperatorNode node) {
    return node.getOperatorType().getShortName() + ": " + node.getDescription();
  }

  private static String branches(BranchScope scope) {
    return "on train=" + scope.isTrain() + ", test=" + scope.isTest();
  }
}
