/*
 * Copyright CleanLearn Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cleanlearn.dag;

import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Where an operator was called in the pipeline code. Synthetic operators added by an analysis only
 * carry a tag and no line number.
 */
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class CodeLocation {

  private final String codeReference;
  private final Integer lineNumber;

  /** Location of an operator that has no line in the pipeline code. */
  public static CodeLocation synthetic(String tag) {
    return new CodeLocation(tag, null);
  }

  public String getCodeReference() {
    return codeReference;
  }

  public Optional<Integer> getLineNumber() {
    return Optional.ofNullable(lineNumber);
  }
}
