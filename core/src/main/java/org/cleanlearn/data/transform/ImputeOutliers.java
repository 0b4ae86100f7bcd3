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

/**
 * Replaces outlier values of {@code column} with a constant. Row count, row ids and all other
 * cells are preserved.
 */
@Getter
@ToString(of = {"column", "constant"})
@RequiredArgsConstructor
public class ImputeOutliers implements PageTransform {

  private final String column;
  private final Object constant;
  private final Predicate<Object> outlierPredicate;

  @Override
  public Page apply(Page input) {
    int channel = input.getChannel(column);
    PageBuilder builder = new PageBuilder(input.getColumnNames());
    for (int position = 0; position < input.getPositionCount(); position++) {
      builder.copyRow(input, position);
      if (outlierPredicate.test(input.getValue(position, channel))) {
        builder.setValue(channel, constant);
      }
      builder.endRow();
    }
    return builder.build();
  }
}
