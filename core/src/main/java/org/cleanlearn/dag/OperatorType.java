/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.dag;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Kind of a recorded pipeline operator. */
@Getter
@RequiredArgsConstructor
public enum OperatorType {
  SOURCE("Data Source"),
  SELECTION("Selection"),
  PROJECTION("Projection"),
  PROJECTION_MODIFY("Projection (Modify)"),
  JOIN("Join"),
  TRAIN_TEST_SPLIT("Train Test Split"),
  TRANSFORMER("Transformer"),
  CONCATENATION("Concatenation"),
  TRAIN_DATA("Train Data"),
  TRAIN_LABELS("Train Labels"),
  TEST_DATA("Test Data"),
  TEST_LABELS("Test Labels"),
  ESTIMATOR_FIT("Estimator"),
  PREDICT("Predict"),
  SCORE("Score");

  private final String shortName;
}
