/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.data.transform;

import java.util.function.Predicate;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.cleanlearn.data.page.Page;
import org.cleanlearn.data.page.PageBuilder;

/** Removes every row whose value in {@code column} is an outlier. Other rows are kept as-is. */
@Getter
@ToString(of = "column")
@RequiredArgsConstructor
public class DropOutliers implements PageTransform {

  private final String column;
  private final Predicate<Object> outlierPredicate;

  @Override
  public Page apply(Page input) {
    int channel = input.getChannel(column);
    PageBuilder builder = new PageBuilder(input.getColumnNames());
    for (int position = 0; position < input.getPositionCount(); position++) {
      if (!outlierPredicate.test(input.getValue(position, channel))) {
        builder.copyRow(input, position);
        builder.endRow();
      }
    }
    return builder.build();
  }
}
