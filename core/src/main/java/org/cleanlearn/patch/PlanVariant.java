/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.patch;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.cleanlearn.analysis.CleaningMethod;

/** One alternative run of the pipeline: an ordered patch sequence for one cleaning method. */
@Getter
@ToString
@EqualsAndHashCode
public class PlanVariant {

  private final CleaningMethod cleaningMethod;
  private final List<PipelinePatch> patches;

  public PlanVariant(CleaningMethod cleaningMethod, List<? extends PipelinePatch> patches) {
    this.cleaningMethod = cleaningMethod;
    this.patches = ImmutableList.copyOf(patches);
  }

  /** Returns the extraction patches, in plan order. */
  public List<Extraction> getExtractions() {
    return patches.stream()
        .filter(Extraction.class::isInstance)
        .map(Extraction.class::cast)
        .collect(Collectors.toList());
  }

  /** Returns the patches that change the data, in plan order. */
  public List<PipelinePatch> getInterventions() {
    return patches.stream()
        .filter(PipelinePatch::isChangesFollowingResults)
        .collect(Collectors.toList());
  }
}
