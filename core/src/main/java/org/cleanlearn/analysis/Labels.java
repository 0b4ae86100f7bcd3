/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.analysis;

import lombok.experimental.UtilityClass;

/** Result labels shared by the plan generator, the execution engine and the result aggregator. */
@UtilityClass
public class Labels {

  /** Label prefix of the results of the unmodified pipeline. */
  public static final String ORIGINAL_PREFIX = "original";

  /** Returns {@code data-cleaning-{column}-{method}}. */
  public String cleaningPrefix(String column, CleaningMethod method) {
    return "data-cleaning-" + column + "-" + method.getValue();
  }

  /** Returns {@code {prefix}_L{lineNumber}}. */
  public String forLine(String prefix, int lineNumber) {
    return prefix + "_L" + lineNumber;
  }

  /** Returns {@code original_L{lineNumber}}. */
  public String original(int lineNumber) {
    return forLine(ORIGINAL_PREFIX, lineNumber);
  }
}
