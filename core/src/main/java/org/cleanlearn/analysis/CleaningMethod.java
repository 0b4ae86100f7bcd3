/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.analysis;

import java.util.Arrays;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.cleanlearn.analysis.exception.UnknownCleaningMethodException;

/**
 * How the analysed column is cleaned. The value is part of every result label, so it must stay
 * stable.
 */
@Getter
@RequiredArgsConstructor
public enum CleaningMethod {
  FILTER("filter"),
  IMPUTE("impute");

  private final String value;

  /**
   * Resolves a cleaning method by its value.
   *
   * @throws UnknownCleaningMethodException if no cleaning method has this value
   */
  public static CleaningMethod fromValue(String value) {
    return Arrays.stream(values())
        .filter(method -> method.value.equals(value))
        .findFirst()
        .orElseThrow(() -> new UnknownCleaningMethodException("Unknown cleaning: " + value));
  }
}
