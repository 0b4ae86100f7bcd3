/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.analysis;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import lombok.Getter;
import lombok.ToString;

/**
 * What to clean and how: the target column, the error kind, the requested cleaning methods in
 * order, the outlier predicate over the column's values and the constant used by imputation.
 *
 * <p>The error kind and the cleaning methods are checked when plans are generated, not here.
 */
@Getter
@ToString(exclude = "outlierPredicate")
public class CleaningSpec {

  private final String column;
  private final ErrorType errorType;
  private final List<CleaningMethod> cleanings;
  private final Predicate<Object> outlierPredicate;
  private final Object imputeConstant;

  /**
   * Creates a cleaning spec.
   *
   * @param column the column to clean
   * @param errorType the error kind
   * @param cleanings the cleaning methods to try, in request order
   * @param outlierPredicate true for values of {@code column} that are outliers
   * @param imputeConstant the replacement value for imputation, may be null
   */
  public CleaningSpec(
      String column,
      ErrorType errorType,
      List<CleaningMethod> cleanings,
      Predicate<Object> outlierPredicate,
      Object imputeConstant) {
    Preconditions.checkArgument(
        !Strings.isNullOrEmpty(column), "Missing column. Column is a required parameter.");
    this.column = column;
    this.errorType = errorType;
    this.cleanings =
        Collections.unmodifiableList(
            new ArrayList<>(Objects.requireNonNull(cleanings, "cleanings")));
    this.outlierPredicate = Objects.requireNonNull(outlierPredicate, "outlierPredicate");
    this.imputeConstant = imputeConstant;
  }

  public AnalysisId getAnalysisId() {
    return new AnalysisId(column, errorType, imputeConstant, cleanings);
  }
}
