/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.analysis;

import java.util.Arrays;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.cleanlearn.analysis.exception.UnsupportedErrorKindException;

/** Data error kinds the cleaning analysis can model. */
@Getter
@RequiredArgsConstructor
public enum ErrorType {
  OUTLIER("outliers");

  private final String value;

  /**
   * Resolves an error kind by its value.
   *
   * @throws UnsupportedErrorKindException if no error kind has this value
   */
  public static ErrorType fromValue(String value) {
    return Arrays.stream(values())
        .filter(errorType -> errorType.value.equals(value))
        .findFirst()
        .orElseThrow(
            () -> new UnsupportedErrorKindException("Unsupported error kind: " + value));
  }
}
