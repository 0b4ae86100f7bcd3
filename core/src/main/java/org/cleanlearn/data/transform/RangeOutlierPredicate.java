/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.data.transform;

import com.google.common.base.Preconditions;
import java.util.function.Predicate;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Marks a numeric value as an outlier when it lies strictly outside {@code [lower, upper]}. Nulls
 * and non-numeric values are never outliers.
 */
@Getter
@ToString
@EqualsAndHashCode
public class RangeOutlierPredicate implements Predicate<Object> {

  private final double lower;
  private final double upper;

  public RangeOutlierPredicate(double lower, double upper) {
    Preconditions.checkArgument(
        lower <= upper, "Lower bound %s is greater than upper bound %s", lower, upper);
    this.lower = lower;
    this.upper = upper;
  }

  @Override
  public boolean test(Object value) {
    if (!(value instanceof Number)) {
      return false;
    }
    double number = ((Number) value).doubleValue();
    return number < lower || number > upper;
  }
}
